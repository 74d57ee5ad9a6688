package com.flamingo.ai.reindexer.exception;

import com.flamingo.ai.reindexer.domain.model.IndexId;

/** Exception thrown when a search names an index that is not configured. */
public class IndexNotFoundException extends RuntimeException {

  private final IndexId indexId;

  public IndexNotFoundException(IndexId indexId) {
    super("Index not found: " + indexId);
    this.indexId = indexId;
  }

  public IndexId getIndexId() {
    return indexId;
  }
}
