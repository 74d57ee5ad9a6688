package com.flamingo.ai.reindexer.domain.enums;

/** Terminal result of a build run. */
public enum BuildOutcome {
  COMMITTED,
  REVERTED
}
