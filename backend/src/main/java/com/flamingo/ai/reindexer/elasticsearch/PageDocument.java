package com.flamingo.ai.reindexer.elasticsearch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Default document built for a content node: its identity, type and canonical location.
 *
 * <p>Deployments that index richer fields register their own provider functions producing their
 * own {@link IndexDocument} type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageDocument implements IndexDocument {

  private String id;
  private String index;
  private String documentType;
  private String uri;
}
