package com.flamingo.ai.reindexer.service.build;

import com.flamingo.ai.reindexer.domain.enums.BuildOutcome;
import com.flamingo.ai.reindexer.domain.model.RevisionId;
import java.time.Instant;
import java.util.List;

/**
 * Summary of a finished build.
 *
 * @param revisionId the revision the build produced
 * @param outcome whether the revision was committed or reverted
 * @param tainted whether any index failed or the build was cancelled
 * @param cancelled whether the build stopped early on request
 * @param documentsIndexed documents written across all indices, committed or not
 * @param indices per-index results in processing order
 * @param startedAt when the build started
 * @param finishedAt when the revision reached its terminal state
 */
public record BuildReport(
    RevisionId revisionId,
    BuildOutcome outcome,
    boolean tainted,
    boolean cancelled,
    int documentsIndexed,
    List<IndexBuildResult> indices,
    Instant startedAt,
    Instant finishedAt) {

  public boolean isCommitted() {
    return outcome == BuildOutcome.COMMITTED;
  }
}
