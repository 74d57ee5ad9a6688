package com.flamingo.ai.reindexer.service.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/** A node of the content server's tree. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RepoNode {

  private String id;
  private String name;
  private String mimeType;
  private String uri;
  private boolean hidden;

  /** Open metadata bag defined by the content source. */
  @Builder.Default private Map<String, Object> data = new LinkedHashMap<>();

  /** Children keyed by node id. May contain cycles. */
  @ToString.Exclude
  @EqualsAndHashCode.Exclude
  @Builder.Default
  private Map<String, RepoNode> nodes = new LinkedHashMap<>();

  /** Child ids in display order; may be empty. */
  @Builder.Default private List<String> index = new ArrayList<>();
}
