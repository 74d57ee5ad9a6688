package com.flamingo.ai.reindexer.exception;

/** Exception thrown when a revision is used outside its lifecycle (e.g. committed twice). */
public class RevisionStateException extends RuntimeException {

  public RevisionStateException(String message) {
    super(message);
  }
}
