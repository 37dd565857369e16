package com.ospicorp.migrationflow.config;

import com.ospicorp.migrationflow.flow.service.LocationSeriesAggregator;
import com.ospicorp.migrationflow.flow.service.MatchPolicy;
import com.ospicorp.migrationflow.period.BoundaryMode;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class MigrationFlowConfig {
  private static final Logger log = LoggerFactory.getLogger(MigrationFlowConfig.class);

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  RestTemplate restTemplate(RestTemplateBuilder builder,
      @Value("${migration.api.timeout:30s}") Duration timeout) {
    return builder
        .setConnectTimeout(timeout)
        .setReadTimeout(timeout)
        .build();
  }

  @Bean(destroyMethod = "shutdown")
  ExecutorService subQueryPool(@Value("${migration.query.parallelism:4}") int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("migration.query.parallelism must be at least 1");
    }
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threads = runnable -> {
      Thread thread = new Thread(runnable, "sub-query-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
    return Executors.newFixedThreadPool(parallelism, threads);
  }

  @Bean
  MdcPropagatingExecutor subQueryTaskExecutor(ExecutorService subQueryPool) {
    return new MdcPropagatingExecutor(subQueryPool);
  }

  @Bean
  LocationSeriesAggregator locationSeriesAggregator(
      @Value("${migration.matching.policy:case_insensitive}") String policy) {
    MatchPolicy matchPolicy = MatchPolicy.fromCode(policy);
    log.info("Matching upstream series to locations with policy {}", matchPolicy);
    return new LocationSeriesAggregator(matchPolicy);
  }

  @Bean
  BoundaryMode defaultBoundaryMode(
      @Value("${migration.window.default-boundary:exclusive_end}") String boundary) {
    return BoundaryMode.fromCode(boundary);
  }
}
