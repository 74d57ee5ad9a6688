package com.flamingo.ai.reindexer.exception;

/** Exception thrown when the content server cannot deliver a tree or resolve URIs. */
public class ContentSourceException extends RuntimeException {

  private final String dimension;

  public ContentSourceException(String dimension, String message) {
    super(message);
    this.dimension = dimension;
  }

  public ContentSourceException(String dimension, String message, Throwable cause) {
    super(message, cause);
    this.dimension = dimension;
  }

  public String getDimension() {
    return dimension;
  }
}
