package com.flamingo.ai.reindexer.api.rest;

import com.flamingo.ai.reindexer.api.dto.response.BuildReportResponse;
import com.flamingo.ai.reindexer.service.build.BuildReport;
import com.flamingo.ai.reindexer.service.build.BuildService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for triggering and cancelling builds. */
@RestController
@RequestMapping("/builds")
@RequiredArgsConstructor
@Slf4j
public class BuildController {

  private final BuildService buildService;

  /** Runs a build synchronously and returns its report. */
  @PostMapping
  public ResponseEntity<BuildReportResponse> build() {
    log.info("Build requested");
    BuildReport report = buildService.run();
    return ResponseEntity.ok(BuildReportResponse.from(report));
  }

  @PostMapping("/cancel")
  public ResponseEntity<Void> cancel() {
    buildService.cancel();
    return ResponseEntity.accepted().build();
  }
}
