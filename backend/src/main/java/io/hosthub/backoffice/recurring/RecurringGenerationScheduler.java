package io.hosthub.backoffice.recurring;

import io.hosthub.backoffice.exception.EngineFaultException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cron trigger for {@link GenerationEngine}. Defaults to daily at 00:00 in the configured zone. A
 * failed run is logged and picked up again on the next fire; due rules stay due until generated.
 */
@Component
@ConditionalOnProperty(
    prefix = "recurring.generation",
    name = "scheduler-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RecurringGenerationScheduler {

  private static final Logger log = LoggerFactory.getLogger(RecurringGenerationScheduler.class);

  private final GenerationEngine generationEngine;
  private final Clock clock;

  public RecurringGenerationScheduler(GenerationEngine generationEngine, Clock clock) {
    this.generationEngine = generationEngine;
    this.clock = clock;
  }

  @Scheduled(
      cron = "${recurring.generation.cron:0 0 0 * * *}",
      zone = "${recurring.generation.zone:UTC}")
  public void generateDueTasks() {
    try {
      var result = generationEngine.runDueGenerations(clock.instant());
      if (result.hasErrors()) {
        log.warn(
            "Recurring generation for {} finished with {} failed rule(s)",
            result.runDate(),
            result.errors().size());
      }
    } catch (EngineFaultException e) {
      log.error("Recurring generation run failed: {}", e.getMessage(), e);
    }
  }
}
