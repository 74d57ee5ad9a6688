package com.flamingo.ai.reindexer.service.revision;

import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.domain.model.RevisionId;
import java.util.Optional;

/** Naming of generations: {@code <index id>-<revision id>}. */
public final class RevisionNames {

  private static final String SEPARATOR = "-";

  private RevisionNames() {}

  public static String formatName(IndexId indexId, RevisionId revisionId) {
    return indexId.value() + SEPARATOR + revisionId.value();
  }

  /**
   * Extracts the revision id from a generation name.
   *
   * <p>Names of other indices that merely share a prefix (e.g. {@code www-de-at-...} for index
   * {@code www-de}) do not yield a revision, so they are never mistaken for own generations.
   *
   * @param name the generation name
   * @param indexId the index the name should belong to
   * @return the revision id, empty if the name is not a generation of the index
   */
  public static Optional<RevisionId> extractRevisionId(String name, IndexId indexId) {
    String prefix = indexId.value() + SEPARATOR;
    if (name == null || !name.startsWith(prefix)) {
      return Optional.empty();
    }
    String suffix = name.substring(prefix.length());
    if (suffix.length() != RevisionId.LENGTH) {
      return Optional.empty();
    }
    return Optional.of(new RevisionId(suffix));
  }
}
