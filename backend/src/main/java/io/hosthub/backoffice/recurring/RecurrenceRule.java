package io.hosthub.backoffice.recurring;

import io.hosthub.backoffice.task.TaskType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A standing instruction to produce tasks on a schedule. Exactly one of {@code propertyId} and
 * {@code ownerId} is set.
 *
 * <p>{@code nextRunDate} is never before {@code startDate} and never advanced past {@code
 * endDate}; a rule whose next occurrence would exceed the end date is deactivated instead.
 * Schedule advancement by the generation engine goes through {@link
 * RecurrenceRuleRepository#advanceSchedule}, not through this entity.
 */
@Entity
@Table(name = "recurrence_rules")
public class RecurrenceRule {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "property_id")
  private UUID propertyId;

  @Column(name = "owner_id")
  private UUID ownerId;

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

  @Enumerated(EnumType.STRING)
  @Column(name = "frequency", nullable = false, length = 20)
  private RecurrenceFrequency frequency;

  @Column(name = "recurrence_interval", nullable = false)
  private int interval;

  @Enumerated(EnumType.STRING)
  @Column(name = "day_of_week", length = 10)
  private DayOfWeek dayOfWeek;

  @Column(name = "day_of_month")
  private Integer dayOfMonth;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "next_run_date", nullable = false)
  private LocalDate nextRunDate;

  // Occurrence date of the most recent generation; equals nextRunDate once the rule hit its end
  @Column(name = "last_occurrence_date")
  private LocalDate lastOccurrenceDate;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "total_generated", nullable = false)
  private int totalGenerated;

  @Column(name = "last_generated_at")
  private Instant lastGeneratedAt;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  protected RecurrenceRule() {}

  public RecurrenceRule(
      UUID propertyId,
      UUID ownerId,
      TaskType taskType,
      String title,
      String description,
      UUID assigneeId,
      BigDecimal costEstimate,
      RecurrenceFrequency frequency,
      int interval,
      DayOfWeek dayOfWeek,
      Integer dayOfMonth,
      LocalDate startDate,
      LocalDate endDate,
      UUID createdBy) {
    this.propertyId = propertyId;
    this.ownerId = ownerId;
    this.taskType = taskType;
    this.title = title;
    this.description = description;
    this.assigneeId = assigneeId;
    this.costEstimate = costEstimate;
    this.frequency = frequency;
    this.interval = interval;
    this.dayOfWeek = dayOfWeek;
    this.dayOfMonth = dayOfMonth;
    this.startDate = startDate;
    this.endDate = endDate;
    this.active = true;
    this.totalGenerated = 0;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Replaces every user-editable field. Schedule state is left to the caller. */
  public void updateDefinition(
      UUID propertyId,
      UUID ownerId,
      TaskType taskType,
      String title,
      String description,
      UUID assigneeId,
      BigDecimal costEstimate,
      RecurrenceFrequency frequency,
      int interval,
      DayOfWeek dayOfWeek,
      Integer dayOfMonth,
      LocalDate startDate,
      LocalDate endDate) {
    this.propertyId = propertyId;
    this.ownerId = ownerId;
    this.taskType = taskType;
    this.title = title;
    this.description = description;
    this.assigneeId = assigneeId;
    this.costEstimate = costEstimate;
    this.frequency = frequency;
    this.interval = interval;
    this.dayOfWeek = dayOfWeek;
    this.dayOfMonth = dayOfMonth;
    this.startDate = startDate;
    this.endDate = endDate;
    this.updatedAt = Instant.now();
  }

  /** True if the given recurrence fields differ from this rule's. */
  public boolean recurrenceDiffers(
      RecurrenceFrequency frequency,
      int interval,
      DayOfWeek dayOfWeek,
      Integer dayOfMonth,
      LocalDate startDate) {
    return this.frequency != frequency
        || this.interval != interval
        || this.dayOfWeek != dayOfWeek
        || !Objects.equals(this.dayOfMonth, dayOfMonth)
        || !this.startDate.equals(startDate);
  }

  /**
   * Day of month that month-based occurrences land on: the configured day, or the start date's
   * day when none is set, so a rule started on the 31st keeps returning to month end. Null for
   * daily and weekly rules.
   */
  public Integer effectiveDayOfMonth() {
    if (dayOfMonth != null) {
      return dayOfMonth;
    }
    return frequency.isMonthBased() ? startDate.getDayOfMonth() : null;
  }

  public RuleTarget getTarget() {
    return propertyId != null
        ? new RuleTarget.PropertyTarget(propertyId)
        : new RuleTarget.OwnerTarget(ownerId);
  }

  public void setNextRunDate(LocalDate nextRunDate) {
    this.nextRunDate = nextRunDate;
    this.updatedAt = Instant.now();
  }

  public void activate() {
    this.active = true;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getPropertyId() {
    return propertyId;
  }

  public UUID getOwnerId() {
    return ownerId;
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

  public RecurrenceFrequency getFrequency() {
    return frequency;
  }

  public int getInterval() {
    return interval;
  }

  public DayOfWeek getDayOfWeek() {
    return dayOfWeek;
  }

  public Integer getDayOfMonth() {
    return dayOfMonth;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public LocalDate getNextRunDate() {
    return nextRunDate;
  }

  public LocalDate getLastOccurrenceDate() {
    return lastOccurrenceDate;
  }

  public boolean isActive() {
    return active;
  }

  public int getTotalGenerated() {
    return totalGenerated;
  }

  public Instant getLastGeneratedAt() {
    return lastGeneratedAt;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public int getVersion() {
    return version;
  }
}
