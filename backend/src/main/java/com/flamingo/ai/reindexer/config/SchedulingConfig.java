package com.flamingo.ai.reindexer.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/** Configuration for scheduled builds and the clock revisions are minted from. */
@Configuration
@EnableScheduling
public class SchedulingConfig {

  @Bean
  public ThreadPoolTaskScheduler buildScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    // Builds never overlap in-process; one thread is enough.
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("reindex-");
    scheduler.initialize();
    return scheduler;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
