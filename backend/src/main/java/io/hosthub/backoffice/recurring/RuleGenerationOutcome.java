package io.hosthub.backoffice.recurring;

import java.util.UUID;

/** What happened to one rule within a generation run. */
public record RuleGenerationOutcome(
    UUID ruleId, int instancesCreated, boolean deactivated, boolean skipped) {

  public static RuleGenerationOutcome generated(UUID ruleId, int instancesCreated) {
    return new RuleGenerationOutcome(ruleId, instancesCreated, false, false);
  }

  public static RuleGenerationOutcome generatedAndDeactivated(UUID ruleId, int instancesCreated) {
    return new RuleGenerationOutcome(ruleId, instancesCreated, true, false);
  }

  public static RuleGenerationOutcome skipped(UUID ruleId) {
    return new RuleGenerationOutcome(ruleId, 0, false, true);
  }
}
