package com.flamingo.ai.reindexer.config;

import com.flamingo.ai.reindexer.service.build.BuildReport;
import com.flamingo.ai.reindexer.service.build.BuildService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one build when the application starts.
 *
 * <p>Enabled with {@code reindexer.build.run-on-startup=true}. A failed build is logged and does
 * not stop the application; the previous generations stay live behind their aliases.
 */
@Component
@ConditionalOnProperty(prefix = "reindexer.build", name = "run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BuildStartupRunner implements CommandLineRunner {

  private final BuildService buildService;

  @Override
  public void run(String... args) {
    log.info("Running startup build...");
    try {
      BuildReport report = buildService.run();
      log.info(
          "Startup build finished: revision={}, outcome={}, documents={}",
          report.revisionId(),
          report.outcome(),
          report.documentsIndexed());
    } catch (RuntimeException e) {
      log.error("Startup build failed: {}", e.getMessage(), e);
    }
  }
}
