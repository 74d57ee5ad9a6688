package com.flamingo.ai.reindexer.service.build;

import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.service.assembly.DocumentBatch;
import com.flamingo.ai.reindexer.service.revision.UpsertOutcome;

/**
 * What happened to one index during a build.
 *
 * @param indexId the index
 * @param selected documents selected from the content tree
 * @param assembled documents the providers produced
 * @param upserted documents written to the generation
 * @param rejected documents the backend rejected individually
 * @param error failure that tainted the build, null if the index went through
 */
public record IndexBuildResult(
    IndexId indexId, int selected, int assembled, int upserted, int rejected, String error) {

  static IndexBuildResult completed(IndexId indexId, DocumentBatch<?> batch, UpsertOutcome outcome) {
    return new IndexBuildResult(
        indexId, batch.size(), batch.provided(), outcome.succeeded(), outcome.failed(), null);
  }

  static IndexBuildResult failed(IndexId indexId, String error) {
    return new IndexBuildResult(indexId, 0, 0, 0, 0, error);
  }

  public boolean isFailed() {
    return error != null;
  }
}
