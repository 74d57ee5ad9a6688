package com.flamingo.ai.reindexer.domain.model;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Generation label of one build attempt.
 *
 * <p>Minted from wall-clock time at minute granularity as {@code yyyy-MM-dd-HH-mm}. The format is
 * zero-padded and fixed-length, so lexicographic order equals chronological order.
 */
public record RevisionId(String value) implements Comparable<RevisionId> {

  /** Length of every valid revision id. */
  public static final int LENGTH = 16;

  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm").withZone(ZoneOffset.UTC);

  public RevisionId {
    Objects.requireNonNull(value, "revision id");
  }

  public static RevisionId generate(Clock clock) {
    return new RevisionId(FORMAT.format(clock.instant()));
  }

  public boolean isEmpty() {
    return value.isEmpty();
  }

  @Override
  public int compareTo(RevisionId other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
