package io.hosthub.backoffice.exception;

import java.util.UUID;

/**
 * A single recurrence rule could not be materialized during a generation run. The run records it
 * against the rule and carries on; the rule's schedule is left untouched so the next run retries.
 */
public class GenerationException extends RuntimeException {

  private final UUID ruleId;

  public GenerationException(UUID ruleId, String detail) {
    super(detail);
    this.ruleId = ruleId;
  }

  public UUID getRuleId() {
    return ruleId;
  }
}
