package io.hosthub.backoffice.recurring;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for recurring task generation.
 *
 * @param cron cron expression of the built-in invocation trigger
 * @param zone time zone that defines "today" for due-date comparison (e.g. {@code UTC})
 * @param parallelism number of rules processed concurrently within one run
 * @param ruleTimeout how long a run waits for a single rule before recording it as failed; also
 *     the deadline of that rule's transaction, rounded up to whole seconds
 * @param schedulerEnabled whether the built-in cron trigger is registered
 */
@ConfigurationProperties(prefix = "recurring.generation")
public record RecurringGenerationProperties(
    String cron, String zone, int parallelism, Duration ruleTimeout, boolean schedulerEnabled) {

  public RecurringGenerationProperties {
    if (cron == null || cron.isBlank()) {
      cron = "0 0 0 * * *";
    }
    if (zone == null || zone.isBlank()) {
      zone = "UTC";
    }
    if (parallelism < 1) {
      parallelism = 1;
    }
    if (ruleTimeout == null || ruleTimeout.isZero() || ruleTimeout.isNegative()) {
      ruleTimeout = Duration.ofSeconds(30);
    }
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}
