package com.flamingo.ai.reindexer.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String BACKING_STORE_UNAVAILABLE = "STORE_001";
  public static final String CIRCUIT_OPEN = "STORE_002";
  public static final String CONTENT_SOURCE_ERROR = "CONTENT_001";
  public static final String DIMENSION_NOT_FOUND = "CONTENT_002";
  public static final String BUILD_IN_PROGRESS = "BUILD_001";
  public static final String INDEX_NOT_FOUND = "SEARCH_001";
  public static final String REVISION_STATE = "REVISION_001";
  public static final String CONFIGURATION_ERROR = "CONFIG_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
