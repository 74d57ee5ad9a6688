package com.flamingo.ai.reindexer.exception;

/** Exception thrown when the content server has no root node for an index's dimension. */
public class DimensionNotFoundException extends ContentSourceException {

  public DimensionNotFoundException(String dimension) {
    super(dimension, "Content server dimension not found: " + dimension);
  }
}
