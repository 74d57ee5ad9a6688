package com.flamingo.ai.reindexer.exception;

/** Exception thrown when a build is requested while another one runs in this process. */
public class BuildInProgressException extends RuntimeException {

  public BuildInProgressException() {
    super("A build is already running");
  }
}
