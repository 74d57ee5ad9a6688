package com.flamingo.ai.reindexer.service.build;

import com.flamingo.ai.reindexer.config.ReindexerConfig;
import com.flamingo.ai.reindexer.domain.enums.BuildOutcome;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.domain.model.RevisionId;
import com.flamingo.ai.reindexer.elasticsearch.IndexDocument;
import com.flamingo.ai.reindexer.exception.BuildInProgressException;
import com.flamingo.ai.reindexer.exception.RevisionStateException;
import com.flamingo.ai.reindexer.service.assembly.DocumentBatch;
import com.flamingo.ai.reindexer.service.assembly.DocumentProvider;
import com.flamingo.ai.reindexer.service.revision.RevisionManager;
import com.flamingo.ai.reindexer.service.revision.UpsertOutcome;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives one build: initialize a revision, fill every index, then commit or revert.
 *
 * <p>Indices are processed one after the other. A failing index taints the build but the remaining
 * indices are still attempted, so the logs show every problem of a run at once. A build that wrote
 * no document at all is reverted as well, since an empty result usually means an upstream outage
 * rather than an empty site.
 */
@Service
@Slf4j
public class BuildServiceImpl implements BuildService {

  private final RevisionManager revisionManager;
  private final DocumentProvider<? extends IndexDocument> documentProvider;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final boolean taintOnPartialFailure;

  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicBoolean cancelRequested = new AtomicBoolean();

  public BuildServiceImpl(
      RevisionManager revisionManager,
      DocumentProvider<? extends IndexDocument> documentProvider,
      ReindexerConfig reindexerConfig,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.revisionManager = revisionManager;
    this.documentProvider = documentProvider;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.taintOnPartialFailure = reindexerConfig.getBuild().isTaintOnPartialFailure();
  }

  @Override
  @Timed(value = "build.run", description = "Time to run a full build")
  public BuildReport run() {
    if (!running.compareAndSet(false, true)) {
      throw new BuildInProgressException();
    }
    cancelRequested.set(false);
    try {
      return runBuild();
    } finally {
      running.set(false);
    }
  }

  private BuildReport runBuild() {
    Instant startedAt = clock.instant();

    RevisionId revisionId = revisionManager.initialize();
    if (revisionId == null || revisionId.isEmpty()) {
      throw new RevisionStateException("Initialize returned no revision");
    }
    List<IndexId> indices = revisionManager.indices();
    log.info("Building revision {} for indices {}", revisionId, indices);

    boolean tainted = false;
    boolean cancelled = false;
    int documentsIndexed = 0;
    List<IndexBuildResult> results = new ArrayList<>(indices.size());

    for (IndexId indexId : indices) {
      if (isCancelled()) {
        log.warn("Build of revision {} cancelled before index {}", revisionId, indexId);
        tainted = true;
        cancelled = true;
        break;
      }

      DocumentBatch<? extends IndexDocument> batch;
      try {
        batch = documentProvider.provide(indexId);
      } catch (RuntimeException e) {
        log.error(
            "Failed to provide documents: index={}, revision={}: {}",
            indexId,
            revisionId,
            e.getMessage(),
            e);
        tainted = true;
        results.add(IndexBuildResult.failed(indexId, e.getMessage()));
        continue;
      }

      List<? extends IndexDocument> documents = batch.documents();
      try {
        UpsertOutcome outcome = revisionManager.upsertDocuments(revisionId, indexId, documents);
        documentsIndexed += outcome.succeeded();
        if (outcome.hasFailures() && taintOnPartialFailure) {
          log.warn(
              "{} documents rejected for index {}, tainting revision {}",
              outcome.failed(),
              indexId,
              revisionId);
          tainted = true;
        }
        results.add(IndexBuildResult.completed(indexId, batch, outcome));
      } catch (RuntimeException e) {
        log.error(
            "Failed to upsert documents: index={}, revision={}, documents={}: {}",
            indexId,
            revisionId,
            documents.size(),
            e.getMessage(),
            e);
        tainted = true;
        results.add(IndexBuildResult.failed(indexId, e.getMessage()));
      }
    }

    BuildOutcome outcome;
    if (!tainted && documentsIndexed > 0) {
      revisionManager.commitRevision(revisionId);
      outcome = BuildOutcome.COMMITTED;
    } else {
      if (tainted) {
        log.warn("Revision {} is tainted, reverting", revisionId);
      } else {
        log.warn("Revision {} indexed no documents, reverting", revisionId);
      }
      revisionManager.revertRevision(revisionId);
      outcome = BuildOutcome.REVERTED;
    }

    meterRegistry
        .counter("reindexer.build", "outcome", outcome.name().toLowerCase(Locale.ROOT))
        .increment();
    log.info(
        "Build finished: revision={}, outcome={}, documents={}",
        revisionId,
        outcome,
        documentsIndexed);
    return new BuildReport(
        revisionId,
        outcome,
        tainted,
        cancelled,
        documentsIndexed,
        List.copyOf(results),
        startedAt,
        clock.instant());
  }

  private boolean isCancelled() {
    return cancelRequested.get() || Thread.currentThread().isInterrupted();
  }

  @Override
  public void cancel() {
    if (running.get()) {
      log.info("Cancellation requested");
      cancelRequested.set(true);
    }
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }
}
