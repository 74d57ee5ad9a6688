package com.flamingo.ai.reindexer.api.dto.response;

import com.flamingo.ai.reindexer.service.build.BuildReport;
import com.flamingo.ai.reindexer.service.build.IndexBuildResult;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for a finished build. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildReportResponse {
  private String revision;
  private String outcome;
  private boolean tainted;
  private boolean cancelled;
  private int documentsIndexed;
  private List<IndexResult> indices;
  private Instant startedAt;
  private Instant finishedAt;

  /** Per-index part of the report. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class IndexResult {
    private String index;
    private int selected;
    private int assembled;
    private int upserted;
    private int rejected;
    private String error;
  }

  public static BuildReportResponse from(BuildReport report) {
    return BuildReportResponse.builder()
        .revision(report.revisionId().value())
        .outcome(report.outcome().name())
        .tainted(report.tainted())
        .cancelled(report.cancelled())
        .documentsIndexed(report.documentsIndexed())
        .indices(report.indices().stream().map(BuildReportResponse::toIndexResult).toList())
        .startedAt(report.startedAt())
        .finishedAt(report.finishedAt())
        .build();
  }

  private static IndexResult toIndexResult(IndexBuildResult result) {
    return IndexResult.builder()
        .index(result.indexId().value())
        .selected(result.selected())
        .assembled(result.assembled())
        .upserted(result.upserted())
        .rejected(result.rejected())
        .error(result.error())
        .build();
  }
}
