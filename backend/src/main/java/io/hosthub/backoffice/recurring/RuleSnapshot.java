package io.hosthub.backoffice.recurring;

import io.hosthub.backoffice.task.TaskType;
import java.math.BigDecimal;
import java.util.UUID;

/** Immutable copy of the rule fields a {@link TaskSink} needs to build task instances. */
public record RuleSnapshot(
    UUID ruleId,
    TaskType taskType,
    String title,
    String description,
    UUID assigneeId,
    BigDecimal costEstimate) {

  public static RuleSnapshot of(RecurrenceRule rule) {
    return new RuleSnapshot(
        rule.getId(),
        rule.getTaskType(),
        rule.getTitle(),
        rule.getDescription(),
        rule.getAssigneeId(),
        rule.getCostEstimate());
  }
}
