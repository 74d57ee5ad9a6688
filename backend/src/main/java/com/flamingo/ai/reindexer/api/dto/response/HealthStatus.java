package com.flamingo.ai.reindexer.api.dto.response;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for the service health check. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthStatus {
  public static final String UP = "UP";
  public static final String DOWN = "DOWN";

  private String status;
  private String revision;
  private String revisionState;
  private boolean backingStoreReachable;
  private boolean buildRunning;
  private Instant timestamp;
}
