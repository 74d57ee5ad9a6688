package com.flamingo.ai.reindexer.api.dto.response;

import com.flamingo.ai.reindexer.elasticsearch.PageDocument;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for one page of simple search results. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponseDto {
  private String index;
  private long total;
  private int page;
  private int perPage;
  private List<Hit> hits;

  /** A document with its rank and score. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Hit {
    private PageDocument document;
    private int rank;
    private double score;
  }
}
