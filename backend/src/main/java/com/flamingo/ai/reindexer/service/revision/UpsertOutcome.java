package com.flamingo.ai.reindexer.service.revision;

/**
 * Result of one bulk upsert.
 *
 * @param attempted documents sent
 * @param succeeded documents written
 * @param failed documents rejected individually by the backend
 */
public record UpsertOutcome(int attempted, int succeeded, int failed) {

  public static UpsertOutcome empty() {
    return new UpsertOutcome(0, 0, 0);
  }

  public boolean hasFailures() {
    return failed > 0;
  }
}
