package com.flamingo.ai.reindexer.exception;

/** Exception thrown when required configuration is missing or invalid. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
