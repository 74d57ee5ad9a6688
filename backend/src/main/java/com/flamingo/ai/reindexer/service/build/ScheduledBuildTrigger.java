package com.flamingo.ai.reindexer.service.build;

import com.flamingo.ai.reindexer.exception.BuildInProgressException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Starts builds on the {@code reindexer.build.cron} schedule; "-" turns it off. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduledBuildTrigger {

  private final BuildService buildService;

  @Scheduled(cron = "${reindexer.build.cron:-}", scheduler = "buildScheduler")
  public void trigger() {
    try {
      BuildReport report = buildService.run();
      log.info(
          "Scheduled build finished: revision={}, outcome={}",
          report.revisionId(),
          report.outcome());
    } catch (BuildInProgressException e) {
      log.warn("Skipping scheduled build: {}", e.getMessage());
    } catch (RuntimeException e) {
      log.error("Scheduled build failed: {}", e.getMessage(), e);
    }
  }
}
