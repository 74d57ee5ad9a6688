package com.flamingo.ai.reindexer.exception;

/**
 * Exception thrown when the search backend is unreachable or rejects a call outright.
 *
 * <p>Fatal to the current revision phase; never retried by the revision lifecycle.
 */
public class BackingStoreException extends RuntimeException {

  private final String userMessage;

  public BackingStoreException(String message) {
    super(message);
    this.userMessage = "Search backend is temporarily unavailable. Please try again.";
  }

  public BackingStoreException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search backend is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
