package com.flamingo.ai.reindexer.api.rest;

import com.flamingo.ai.reindexer.api.dto.response.HealthStatus;
import com.flamingo.ai.reindexer.service.health.HealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final HealthService healthService;

  /** Returns 200 while the backing store is reachable, 503 otherwise. */
  @GetMapping
  public ResponseEntity<HealthStatus> health() {
    HealthStatus health = healthService.getHealth();
    HttpStatus status =
        health.isBackingStoreReachable() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
    return ResponseEntity.status(status).body(health);
  }
}
