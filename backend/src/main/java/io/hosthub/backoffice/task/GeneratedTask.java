package io.hosthub.backoffice.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A concrete, dated unit of work. Tasks created by the generation engine reference the recurrence
 * rule that produced them; manually created tasks leave {@code recurrenceRuleId} null.
 *
 * <p>The (recurrence_rule_id, property_id, scheduled_date) unique index on the table is the
 * idempotency key for generated tasks.
 */
@Entity
@Table(name = "tasks")
public class GeneratedTask {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "recurrence_rule_id")
  private UUID recurrenceRuleId;

  @Column(name = "property_id", nullable = false)
  private UUID propertyId;

  @Enumerated(EnumType.STRING)
  @Column(name = "task_type", nullable = false, length = 20)
  private TaskType taskType;

  @Column(name = "title", nullable = false, length = 300)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "assignee_id")
  private UUID assigneeId;

  @Column(name = "cost_estimate", precision = 12, scale = 2)
  private BigDecimal costEstimate;

  @Column(name = "scheduled_date", nullable = false)
  private LocalDate scheduledDate;

  @Column(name = "due_at", nullable = false)
  private Instant dueAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected GeneratedTask() {}

  public GeneratedTask(
      UUID recurrenceRuleId,
      UUID propertyId,
      TaskType taskType,
      String title,
      String description,
      UUID assigneeId,
      BigDecimal costEstimate,
      LocalDate scheduledDate,
      Instant dueAt) {
    this.recurrenceRuleId = recurrenceRuleId;
    this.propertyId = propertyId;
    this.taskType = taskType;
    this.title = title;
    this.description = description;
    this.assigneeId = assigneeId;
    this.costEstimate = costEstimate;
    this.scheduledDate = scheduledDate;
    this.dueAt = dueAt;
    this.status = TaskStatus.PENDING;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getRecurrenceRuleId() {
    return recurrenceRuleId;
  }

  public UUID getPropertyId() {
    return propertyId;
  }

  public TaskType getTaskType() {
    return taskType;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public UUID getAssigneeId() {
    return assigneeId;
  }

  public BigDecimal getCostEstimate() {
    return costEstimate;
  }

  public LocalDate getScheduledDate() {
    return scheduledDate;
  }

  public Instant getDueAt() {
    return dueAt;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
