package io.hosthub.backoffice.recurring;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Summary of one generation run.
 *
 * @param ranAt instant the run was invoked for
 * @param runDate {@code ranAt} as a date in the configured zone; rules due on or before it ran
 * @param rulesDue number of active rules found due
 * @param rulesProcessed rules whose occurrence was generated in this run
 * @param generatedCount task instances created across all rules
 * @param rulesDeactivated rules that reached their end date in this run
 * @param rulesSkipped due rules another invocation (or a concurrent edit) had already handled
 * @param errors per-rule failures; those rules are unchanged and retried on the next run
 */
public record GenerationRunResult(
    Instant ranAt,
    LocalDate runDate,
    int rulesDue,
    int rulesProcessed,
    int generatedCount,
    int rulesDeactivated,
    int rulesSkipped,
    List<RuleGenerationError> errors) {

  public GenerationRunResult {
    errors = List.copyOf(errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
