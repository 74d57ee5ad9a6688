package com.flamingo.ai.reindexer.service.health;

import com.flamingo.ai.reindexer.api.dto.response.HealthStatus;
import com.flamingo.ai.reindexer.domain.model.RevisionId;
import com.flamingo.ai.reindexer.elasticsearch.GenerationStore;
import com.flamingo.ai.reindexer.exception.BackingStoreException;
import com.flamingo.ai.reindexer.service.build.BuildService;
import com.flamingo.ai.reindexer.service.revision.RevisionManager;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of HealthService on top of the revision manager and the generation store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private final RevisionManager revisionManager;
  private final GenerationStore generationStore;
  private final BuildService buildService;
  private final Clock clock;

  @Override
  @Timed(value = "health.check", description = "Time to check service health")
  public HealthStatus getHealth() {
    boolean reachable = true;
    try {
      generationStore.checkHealth();
    } catch (BackingStoreException e) {
      log.warn("Backing store unreachable: {}", e.getMessage());
      reachable = false;
    }

    Optional<RevisionId> revision = revisionManager.latestRevision();
    return HealthStatus.builder()
        .status(reachable ? HealthStatus.UP : HealthStatus.DOWN)
        .revision(revision.map(RevisionId::value).orElse(null))
        .revisionState(
            revision.flatMap(revisionManager::revisionState).map(Enum::name).orElse(null))
        .backingStoreReachable(reachable)
        .buildRunning(buildService.isRunning())
        .timestamp(clock.instant())
        .build();
  }
}
