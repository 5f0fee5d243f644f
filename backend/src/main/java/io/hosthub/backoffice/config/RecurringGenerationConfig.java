package io.hosthub.backoffice.config;

import io.hosthub.backoffice.recurring.RecurringGenerationProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(RecurringGenerationProperties.class)
public class RecurringGenerationConfig {

  @Bean
  Clock clock(RecurringGenerationProperties properties) {
    return Clock.system(properties.zoneId());
  }

  /**
   * Worker pool for per-rule generation. Sized by {@code recurring.generation.parallelism}; queued
   * rules wait rather than being rejected.
   */
  @Bean(name = "recurringGenerationExecutor")
  ThreadPoolTaskExecutor recurringGenerationExecutor(RecurringGenerationProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.parallelism());
    executor.setMaxPoolSize(properties.parallelism());
    executor.setThreadNamePrefix("recurring-gen-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    return executor;
  }
}
