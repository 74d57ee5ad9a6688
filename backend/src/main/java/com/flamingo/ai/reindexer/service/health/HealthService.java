package com.flamingo.ai.reindexer.service.health;

import com.flamingo.ai.reindexer.api.dto.response.HealthStatus;

/** Service interface for health checks. */
public interface HealthService {

  /**
   * Reports backend reachability and the revision this process built last.
   *
   * @return the health status; DOWN when the backend cannot be reached
   */
  HealthStatus getHealth();
}
