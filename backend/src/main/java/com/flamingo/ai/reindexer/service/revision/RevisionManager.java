package com.flamingo.ai.reindexer.service.revision;

import com.flamingo.ai.reindexer.domain.enums.RevisionState;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.domain.model.RevisionId;
import com.flamingo.ai.reindexer.elasticsearch.IndexDocument;
import com.flamingo.ai.reindexer.exception.BackingStoreException;
import com.flamingo.ai.reindexer.exception.ConfigurationException;
import com.flamingo.ai.reindexer.exception.RevisionStateException;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle of index generations: initialize a revision, fill it, then commit or revert it.
 *
 * <p>Consumers only ever query aliases, and an alias moves to the new generations on commit. Only
 * one build process may drive revisions for the same indices at a time.
 */
public interface RevisionManager {

  /**
   * Checks the backend, reconciles existing aliases and creates a new generation for every
   * configured index. Aliases are not touched.
   *
   * @return the new revision id
   * @throws BackingStoreException if the backend is unreachable or a generation or the search
   *     preset cannot be created
   * @throws ConfigurationException if no index is configured
   * @throws RevisionStateException if this minute's revision is already known to this process, or
   *     its generation of some index is already served by that index's alias
   */
  RevisionId initialize();

  /**
   * Lists the configured indices.
   *
   * @return the index ids, in configuration order
   * @throws ConfigurationException if no index is configured
   */
  List<IndexId> indices();

  /**
   * Writes documents into the generation of an index for a revision.
   *
   * <p>Documents rejected individually are logged and counted in the outcome, not raised.
   *
   * @param revisionId the initialized revision
   * @param indexId the index
   * @param documents the documents
   * @return counts of attempted, written and rejected documents
   * @throws BackingStoreException if the whole bulk call is rejected
   * @throws RevisionStateException if the revision is not initialized
   */
  UpsertOutcome upsertDocuments(
      RevisionId revisionId, IndexId indexId, List<? extends IndexDocument> documents);

  /**
   * Points every alias at the revision's generation and prunes older generations.
   *
   * <p>An alias failure aborts the remaining indices; aliases already moved stay moved. Pruning
   * failures are logged only.
   *
   * @param revisionId the initialized revision
   * @throws BackingStoreException if an alias cannot be updated
   * @throws RevisionStateException if the revision is not initialized
   */
  void commitRevision(RevisionId revisionId);

  /**
   * Deletes every generation of the revision. Aliases are not touched.
   *
   * @param revisionId the initialized revision
   * @throws BackingStoreException if a generation cannot be deleted
   * @throws RevisionStateException if the revision is not initialized
   */
  void revertRevision(RevisionId revisionId);

  /**
   * Verifies a revision has been initialized and the backend is reachable.
   *
   * @throws RevisionStateException if no revision has been initialized yet
   * @throws BackingStoreException if the backend is unreachable
   */
  void healthz();

  /** The most recently initialized revision, if any. */
  Optional<RevisionId> latestRevision();

  /** The state of a revision initialized by this process, if known. */
  Optional<RevisionState> revisionState(RevisionId revisionId);
}
