package com.flamingo.ai.reindexer.domain.enums;

/** Lifecycle of one build attempt. COMMITTED and REVERTED are terminal. */
public enum RevisionState {
  INITIALIZED,
  COMMITTED,
  REVERTED;

  public boolean isTerminal() {
    return this != INITIALIZED;
  }
}
