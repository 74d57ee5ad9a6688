package com.flamingo.ai.reindexer.elasticsearch;

/**
 * Per-document result of a bulk import.
 *
 * @param id the document id
 * @param success whether the document was written
 * @param error the engine's failure reason, null on success
 */
public record ImportResult(String id, boolean success, String error) {

  public static ImportResult ok(String id) {
    return new ImportResult(id, true, null);
  }

  public static ImportResult failed(String id, String error) {
    return new ImportResult(id, false, error);
  }
}
