package io.hosthub.backoffice.recurring;

import io.hosthub.backoffice.exception.EngineFaultException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Materializes every recurrence rule that is due. Each rule is handed to {@link
 * RuleGenerationService} on the generation executor, so rules are isolated from each other: a
 * failing or slow rule is recorded in the run result and the rest still generate. A rule recorded
 * as timed out has rolled back and stays due.
 *
 * <p>Overdue rules catch up one occurrence per run. Running twice for the same instant generates
 * nothing the second time.
 */
@Component
public class GenerationEngine {

  private static final Logger log = LoggerFactory.getLogger(GenerationEngine.class);

  private final RecurrenceRuleRepository ruleRepository;
  private final RuleGenerationService ruleGenerationService;
  private final TaskExecutor executor;
  private final ZoneId zone;
  private final Duration ruleTimeout;

  public GenerationEngine(
      RecurrenceRuleRepository ruleRepository,
      RuleGenerationService ruleGenerationService,
      @Qualifier("recurringGenerationExecutor") TaskExecutor executor,
      RecurringGenerationProperties properties) {
    this.ruleRepository = ruleRepository;
    this.ruleGenerationService = ruleGenerationService;
    this.executor = executor;
    this.zone = properties.zoneId();
    this.ruleTimeout = properties.ruleTimeout();
  }

  /**
   * Generates the due occurrence of every active rule whose next run date is on or before the
   * date of {@code now} in the configured zone.
   *
   * @throws EngineFaultException if the due rules cannot be read
   */
  public GenerationRunResult runDueGenerations(Instant now) {
    LocalDate today = now.atZone(zone).toLocalDate();
    List<RecurrenceRule> dueRules = findDueRules(today);

    log.info("Recurring generation started for {}: {} rule(s) due", today, dueRules.size());

    Map<UUID, GenerationAttempt> attempts = new LinkedHashMap<>();
    for (var rule : dueRules) {
      UUID ruleId = rule.getId();
      LocalDate expectedNextRunDate = rule.getNextRunDate();
      var lease = new GenerationLease();
      attempts.put(
          ruleId,
          new GenerationAttempt(
              lease,
              CompletableFuture.supplyAsync(
                  () ->
                      ruleGenerationService.generateForRule(
                          ruleId, expectedNextRunDate, now, lease),
                  executor)));
    }

    int processed = 0;
    int generated = 0;
    int deactivated = 0;
    int skipped = 0;
    List<RuleGenerationError> errors = new ArrayList<>();

    for (var entry : attempts.entrySet()) {
      UUID ruleId = entry.getKey();
      try {
        var outcome = awaitOutcome(entry.getValue());
        if (outcome.skipped()) {
          skipped++;
          continue;
        }
        processed++;
        generated += outcome.instancesCreated();
        if (outcome.deactivated()) {
          deactivated++;
        }
      } catch (TimeoutException e) {
        log.error(
            "Recurrence rule {} did not complete within {}; its attempt will roll back",
            ruleId,
            ruleTimeout);
        errors.add(new RuleGenerationError(ruleId, "Timed out after " + ruleTimeout));
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.error("Failed to generate recurrence rule {}: {}", ruleId, cause.getMessage(), cause);
        errors.add(new RuleGenerationError(ruleId, describe(cause)));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Recurring generation interrupted while waiting for rule {}", ruleId);
        errors.add(new RuleGenerationError(ruleId, "Interrupted"));
      }
    }

    log.info(
        "Recurring generation completed: {} rules processed, {} tasks created, {} deactivated,"
            + " {} skipped, {} errors",
        processed,
        generated,
        deactivated,
        skipped,
        errors.size());

    return new GenerationRunResult(
        now, today, dueRules.size(), processed, generated, deactivated, skipped, errors);
  }

  /**
   * Waits up to the rule timeout. An attempt still running then is abandoned and rolls back; one
   * that has already started committing is waited for so its outcome is counted.
   */
  private RuleGenerationOutcome awaitOutcome(GenerationAttempt attempt)
      throws ExecutionException, TimeoutException, InterruptedException {
    try {
      return attempt.future().get(ruleTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException | InterruptedException e) {
      if (attempt.lease().abandon()) {
        throw e;
      }
      try {
        return attempt.future().join();
      } catch (CompletionException failure) {
        throw new ExecutionException(failure.getCause());
      }
    }
  }

  private List<RecurrenceRule> findDueRules(LocalDate today) {
    try {
      return ruleRepository.findByActiveTrueAndNextRunDateLessThanEqualOrderByNextRunDateAsc(today);
    } catch (DataAccessException | TransactionException e) {
      throw new EngineFaultException("Could not load due recurrence rules for " + today, e);
    }
  }

  private record GenerationAttempt(
      GenerationLease lease, CompletableFuture<RuleGenerationOutcome> future) {}

  private static String describe(Throwable cause) {
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }
}
