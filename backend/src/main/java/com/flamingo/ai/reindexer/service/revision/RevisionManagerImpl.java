package com.flamingo.ai.reindexer.service.revision;

import com.flamingo.ai.reindexer.domain.enums.RevisionState;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.domain.model.RevisionId;
import com.flamingo.ai.reindexer.elasticsearch.GenerationStore;
import com.flamingo.ai.reindexer.elasticsearch.ImportResult;
import com.flamingo.ai.reindexer.elasticsearch.IndexDocument;
import com.flamingo.ai.reindexer.exception.ConfigurationException;
import com.flamingo.ai.reindexer.exception.RevisionStateException;
import com.flamingo.ai.reindexer.service.revision.IndexCatalog.IndexDefinition;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Revision lifecycle on a {@link GenerationStore}.
 *
 * <p>For index {@code www-de} and revision {@code 2025-03-01-04-30} the generation is the index
 * {@code www-de-2025-03-01-04-30}, and the alias {@code www-de} is what consumers query. After a
 * commit the alias points at the new generation; the previous generation is retained as well and
 * anything older is deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RevisionManagerImpl implements RevisionManager {

  /** Superseded generations kept next to the current one. */
  static final int RETAINED_PREVIOUS_GENERATIONS = 1;

  private final GenerationStore generationStore;
  private final IndexCatalog indexCatalog;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final Map<RevisionId, RevisionState> revisions = new ConcurrentHashMap<>();
  private volatile RevisionId latestRevision;

  @Override
  @Timed(value = "revision.initialize", description = "Time to initialize a revision")
  public RevisionId initialize() {
    log.info("Initializing generations and aliases...");
    List<IndexId> indexIds = indices();

    generationStore.checkHealth();
    Map<String, String> aliases = generationStore.listAliases();
    reconcileAliases(indexIds, aliases);

    RevisionId revisionId = RevisionId.generate(clock);
    RevisionState known = revisions.get(revisionId);
    if (known != null) {
      throw new RevisionStateException(
          "Revision " + revisionId + " was already initialized (state: " + known + ")");
    }
    log.info("Generated new revision: {}", revisionId);

    List<IndexDefinition> missing = new ArrayList<>();
    for (IndexDefinition definition : indexCatalog.getIndices()) {
      String generation = RevisionNames.formatName(definition.id(), revisionId);
      if (!generationStore.generationExists(generation)) {
        missing.add(definition);
      } else if (generation.equals(aliases.get(definition.id().value()))) {
        throw new RevisionStateException(
            "Generation " + generation + " is live behind alias " + definition.id());
      } else {
        // left behind by a build of another process within the same minute
        log.warn("Generation {} already exists, reusing it", generation);
      }
    }
    for (IndexDefinition definition : missing) {
      generationStore.createGeneration(
          RevisionNames.formatName(definition.id(), revisionId), definition.schemaJson());
    }

    indexCatalog
        .getPreset()
        .ifPresent(preset -> generationStore.upsertSearchPreset(preset.name(), preset.json()));

    forgetSettledRevisions();
    revisions.put(revisionId, RevisionState.INITIALIZED);
    latestRevision = revisionId;
    log.info("Initialization completed: revision={}", revisionId);
    return revisionId;
  }

  private void reconcileAliases(List<IndexId> indexIds, Map<String, String> aliases) {
    for (IndexId indexId : indexIds) {
      String target = aliases.get(indexId.value());
      if (target == null) {
        log.info("Alias {} does not exist yet, it will be created on commit", indexId);
        continue;
      }
      Optional<RevisionId> revision = RevisionNames.extractRevisionId(target, indexId);
      if (revision.isEmpty()) {
        log.warn(
            "Alias {} points at unmanaged index {}, it will be repointed on commit",
            indexId,
            target);
      } else if (!generationStore.listGenerations(indexId.value() + "-").contains(target)) {
        log.warn(
            "Alias {} points at missing generation {}, it will be repointed on commit",
            indexId,
            target);
      } else {
        log.info("Alias {} serves revision {}", indexId, revision.get());
      }
    }
  }

  @Override
  public List<IndexId> indices() {
    List<IndexId> indexIds = indexCatalog.getIndexIds();
    if (indexIds.isEmpty()) {
      throw new ConfigurationException("No indices configured");
    }
    return indexIds;
  }

  @Override
  @Timed(value = "revision.upsert", description = "Time to upsert documents into a generation")
  public UpsertOutcome upsertDocuments(
      RevisionId revisionId, IndexId indexId, List<? extends IndexDocument> documents) {
    requireInitialized(revisionId);
    if (documents.isEmpty()) {
      log.warn("No documents provided for upsert: index={}", indexId);
      return UpsertOutcome.empty();
    }

    String generation = RevisionNames.formatName(indexId, revisionId);
    List<ImportResult> results = generationStore.importDocuments(generation, documents);

    int succeeded = 0;
    int failed = 0;
    for (ImportResult result : results) {
      if (result.success()) {
        succeeded++;
      } else {
        failed++;
        log.warn(
            "Document failed to upsert: generation={}, id={}, error={}",
            generation,
            result.id(),
            result.error());
      }
    }

    meterRegistry.counter("reindexer.documents.upserted").increment(succeeded);
    if (failed > 0) {
      meterRegistry.counter("reindexer.documents.failed").increment(failed);
    }
    log.info(
        "Bulk upsert completed: generation={}, successful_documents={}, failed_documents={}",
        generation,
        succeeded,
        failed);
    return new UpsertOutcome(documents.size(), succeeded, failed);
  }

  @Override
  @Timed(value = "revision.commit", description = "Time to commit a revision")
  public void commitRevision(RevisionId revisionId) {
    requireInitialized(revisionId);
    for (IndexId indexId : indices()) {
      String generation = RevisionNames.formatName(indexId, revisionId);

      generationStore.refreshGeneration(generation);
      generationStore.upsertAlias(indexId.value(), generation);
      log.info("Updated alias {} -> {}", indexId, generation);

      try {
        pruneOldGenerations(indexId, generation);
      } catch (RuntimeException e) {
        log.error("Failed to clean up old generations of {}: {}", indexId, e.getMessage(), e);
      }
    }
    transition(revisionId, RevisionState.COMMITTED);
    log.info("Committed revision {}", revisionId);
  }

  @Override
  @Timed(value = "revision.revert", description = "Time to revert a revision")
  public void revertRevision(RevisionId revisionId) {
    requireInitialized(revisionId);
    for (IndexId indexId : indices()) {
      String generation = RevisionNames.formatName(indexId, revisionId);
      generationStore.deleteGeneration(generation);
      log.info("Reverted and deleted generation {}", generation);
    }
    transition(revisionId, RevisionState.REVERTED);
    log.info("Reverted revision {}", revisionId);
  }

  /**
   * Deletes generations of an index older than the current one and the one before it.
   *
   * <p>Names that share the prefix but carry no valid revision belong to other indices and are
   * left alone. A failed deletion does not stop the remaining ones.
   */
  void pruneOldGenerations(IndexId indexId, String currentGeneration) {
    Set<String> generations = generationStore.listGenerations(indexId.value() + "-");
    List<String> superseded =
        generations.stream()
            .filter(name -> !name.equals(currentGeneration))
            .filter(name -> RevisionNames.extractRevisionId(name, indexId).isPresent())
            .sorted(Comparator.reverseOrder())
            .toList();

    if (superseded.size() <= RETAINED_PREVIOUS_GENERATIONS) {
      return;
    }
    for (String generation : superseded.subList(RETAINED_PREVIOUS_GENERATIONS, superseded.size())) {
      try {
        generationStore.deleteGeneration(generation);
        log.info("Deleted old generation {}", generation);
      } catch (RuntimeException e) {
        log.error("Failed to delete generation {}: {}", generation, e.getMessage(), e);
      }
    }
  }

  @Override
  public void healthz() {
    if (latestRevision == null) {
      throw new RevisionStateException("Revision not set");
    }
    generationStore.checkHealth();
  }

  @Override
  public Optional<RevisionId> latestRevision() {
    return Optional.ofNullable(latestRevision);
  }

  @Override
  public Optional<RevisionState> revisionState(RevisionId revisionId) {
    return Optional.ofNullable(revisions.get(revisionId));
  }

  /**
   * Drops committed and reverted revisions except the latest one. Revisions still INITIALIZED are
   * kept so they can be committed or reverted.
   */
  private void forgetSettledRevisions() {
    RevisionId latest = latestRevision;
    revisions
        .entrySet()
        .removeIf(
            entry ->
                entry.getValue() != RevisionState.INITIALIZED && !entry.getKey().equals(latest));
  }

  private void requireInitialized(RevisionId revisionId) {
    RevisionState state = revisions.get(revisionId);
    if (state != RevisionState.INITIALIZED) {
      throw new RevisionStateException(
          "Revision " + revisionId + " is not initialized (state: " + state + ")");
    }
  }

  private void transition(RevisionId revisionId, RevisionState target) {
    if (!revisions.replace(revisionId, RevisionState.INITIALIZED, target)) {
      throw new RevisionStateException(
          "Revision " + revisionId + " changed state concurrently, expected INITIALIZED");
    }
  }
}
