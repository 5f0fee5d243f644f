package io.hosthub.backoffice.recurring;

import io.hosthub.backoffice.exception.ResourceNotFoundException;
import io.hosthub.backoffice.exception.ValidationException;
import io.hosthub.backoffice.recurring.dto.CreateRecurrenceRuleRequest;
import io.hosthub.backoffice.recurring.dto.GeneratedTaskResponse;
import io.hosthub.backoffice.recurring.dto.RecurrenceRuleResponse;
import io.hosthub.backoffice.recurring.dto.UpdateRecurrenceRuleRequest;
import io.hosthub.backoffice.task.GeneratedTaskRepository;
import io.hosthub.backoffice.task.TaskType;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Create, edit, list and (de)activate recurrence rules. Owns validation of rule fields and the
 * initial and recomputed {@code nextRunDate}; advancing the schedule after generation is left to
 * {@link RuleGenerationService}.
 */
@Service
public class RecurrenceRuleService {

  private static final Logger log = LoggerFactory.getLogger(RecurrenceRuleService.class);

  private final RecurrenceRuleRepository ruleRepository;
  private final GeneratedTaskRepository taskRepository;
  private final RecurrenceCalculator calculator;
  private final Validator validator;
  private final Clock clock;

  public RecurrenceRuleService(
      RecurrenceRuleRepository ruleRepository,
      GeneratedTaskRepository taskRepository,
      RecurrenceCalculator calculator,
      Validator validator,
      Clock clock) {
    this.ruleRepository = ruleRepository;
    this.taskRepository = taskRepository;
    this.calculator = calculator;
    this.validator = validator;
    this.clock = clock;
  }

  @Transactional
  public RecurrenceRuleResponse create(CreateRecurrenceRuleRequest request, UUID createdBy) {
    var definition =
        validate(
            request,
            request.propertyId(),
            request.ownerId(),
            request.taskType(),
            request.frequency(),
            request.interval(),
            request.dayOfWeek(),
            request.startDate(),
            request.endDate());

    var rule =
        new RecurrenceRule(
            request.propertyId(),
            request.ownerId(),
            definition.taskType(),
            request.title().trim(),
            request.description(),
            request.assigneeId(),
            request.costEstimate(),
            definition.frequency(),
            definition.interval(),
            definition.dayOfWeek(),
            request.dayOfMonth(),
            request.startDate(),
            request.endDate(),
            createdBy);

    LocalDate nextRunDate =
        calculator.firstOccurrence(
            definition.frequency(),
            definition.interval(),
            definition.dayOfWeek(),
            request.dayOfMonth(),
            request.startDate());
    requireWithinWindow(nextRunDate, request.endDate());
    rule.setNextRunDate(nextRunDate);

    if (Boolean.FALSE.equals(request.active())) {
      rule.deactivate();
    }

    rule = ruleRepository.save(rule);

    log.info(
        "Created recurrence rule {} ({} every {}), next run {}",
        rule.getId(),
        rule.getFrequency(),
        rule.getInterval(),
        rule.getNextRunDate());

    return buildResponse(rule);
  }

  /**
   * Replaces the editable fields of a rule. When the recurrence itself changes (frequency,
   * interval, weekday, day-of-month or start date) the next run is recomputed from today rather
   * than kept from the old cadence.
   */
  @Transactional
  public RecurrenceRuleResponse update(UUID id, UpdateRecurrenceRuleRequest request) {
    var rule = findRule(id);

    var definition =
        validate(
            request,
            request.propertyId(),
            request.ownerId(),
            request.taskType(),
            request.frequency(),
            request.interval(),
            request.dayOfWeek(),
            request.startDate(),
            request.endDate());

    boolean reschedule =
        rule.recurrenceDiffers(
            definition.frequency(),
            definition.interval(),
            definition.dayOfWeek(),
            request.dayOfMonth(),
            request.startDate());

    rule.updateDefinition(
        request.propertyId(),
        request.ownerId(),
        definition.taskType(),
        request.title().trim(),
        request.description(),
        request.assigneeId(),
        request.costEstimate(),
        definition.frequency(),
        definition.interval(),
        definition.dayOfWeek(),
        request.dayOfMonth(),
        request.startDate(),
        request.endDate());

    if (reschedule) {
      LocalDate today = LocalDate.now(clock);
      LocalDate seed = request.startDate().isAfter(today) ? request.startDate() : today;
      LocalDate first =
          calculator.firstOccurrence(
              rule.getFrequency(),
              rule.getInterval(),
              rule.getDayOfWeek(),
              rule.effectiveDayOfMonth(),
              seed);
      rule.setNextRunDate(skipGeneratedOccurrences(rule, first));
    }
    requireWithinWindow(rule.getNextRunDate(), rule.getEndDate());

    rule = ruleRepository.save(rule);

    log.info(
        "Updated recurrence rule {}{}",
        id,
        reschedule ? ", rescheduled to " + rule.getNextRunDate() : "");

    return buildResponse(rule);
  }

  @Transactional(readOnly = true)
  public RecurrenceRuleResponse get(UUID id) {
    return buildResponse(findRule(id));
  }

  /**
   * Lists rules, optionally filtered. A property filter takes precedence over an owner filter.
   * Results are ordered by next run date, newest rules first within the same date.
   */
  @Transactional(readOnly = true)
  public List<RecurrenceRuleResponse> list(UUID propertyId, UUID ownerId, Boolean active) {
    List<RecurrenceRule> rules;

    if (propertyId != null && active != null) {
      rules =
          ruleRepository.findByPropertyIdAndActiveOrderByNextRunDateAscCreatedAtDesc(
              propertyId, active);
    } else if (propertyId != null) {
      rules = ruleRepository.findByPropertyIdOrderByNextRunDateAscCreatedAtDesc(propertyId);
    } else if (ownerId != null && active != null) {
      rules =
          ruleRepository.findByOwnerIdAndActiveOrderByNextRunDateAscCreatedAtDesc(
              ownerId, active);
    } else if (ownerId != null) {
      rules = ruleRepository.findByOwnerIdOrderByNextRunDateAscCreatedAtDesc(ownerId);
    } else if (active != null) {
      rules = ruleRepository.findByActiveOrderByNextRunDateAscCreatedAtDesc(active);
    } else {
      rules = ruleRepository.findAllByOrderByNextRunDateAscCreatedAtDesc();
    }

    return rules.stream().map(this::buildResponse).toList();
  }

  @Transactional
  public RecurrenceRuleResponse deactivate(UUID id) {
    var rule = findRule(id);
    if (!rule.isActive()) {
      return buildResponse(rule);
    }

    rule.deactivate();
    rule = ruleRepository.save(rule);

    log.info("Deactivated recurrence rule {}", id);

    return buildResponse(rule);
  }

  /**
   * Re-enables a rule. A rule that is overdue keeps its next run date and is caught up one
   * occurrence per generation run; an occurrence that was already generated is skipped. A rule
   * with no occurrence left before its end date cannot be re-activated.
   */
  @Transactional
  public RecurrenceRuleResponse activate(UUID id) {
    var rule = findRule(id);
    if (rule.isActive()) {
      return buildResponse(rule);
    }

    LocalDate nextRunDate = skipGeneratedOccurrences(rule, rule.getNextRunDate());
    if (rule.getEndDate() != null && nextRunDate.isAfter(rule.getEndDate())) {
      throw new ValidationException(
          "Recurrence rule has ended",
          "Rule has no occurrence left before its end date " + rule.getEndDate());
    }

    rule.setNextRunDate(nextRunDate);
    rule.activate();
    rule = ruleRepository.save(rule);

    log.info("Activated recurrence rule {}, next run {}", id, nextRunDate);

    return buildResponse(rule);
  }

  /** Removes a rule. Tasks it already generated are kept and still reference its id. */
  @Transactional
  public void delete(UUID id) {
    var rule = findRule(id);

    ruleRepository.delete(rule);

    log.info("Deleted recurrence rule {} ({} task(s) generated)", id, rule.getTotalGenerated());
  }

  /** Returns the tasks a rule has produced, latest occurrence first. */
  @Transactional(readOnly = true)
  public List<GeneratedTaskResponse> listGeneratedTasks(UUID ruleId) {
    findRule(ruleId);

    var tasks = taskRepository.findByRecurrenceRuleIdOrderByScheduledDateDescCreatedAtDesc(ruleId);
    return tasks.stream()
        .map(
            t ->
                new GeneratedTaskResponse(
                    t.getId(),
                    t.getPropertyId(),
                    t.getTaskType().name(),
                    t.getTitle(),
                    t.getAssigneeId(),
                    t.getScheduledDate(),
                    t.getDueAt(),
                    t.getStatus().name(),
                    t.getCreatedAt()))
        .toList();
  }

  // --- Validation ---

  private record RuleDefinition(
      TaskType taskType,
      RecurrenceFrequency frequency,
      int interval,
      DayOfWeek dayOfWeek) {}

  private RuleDefinition validate(
      Object request,
      UUID propertyId,
      UUID ownerId,
      String taskType,
      String frequency,
      Integer interval,
      String dayOfWeek,
      LocalDate startDate,
      LocalDate endDate) {
    Set<ConstraintViolation<Object>> violations = validator.validate(request);
    if (!violations.isEmpty()) {
      throw new ValidationException(
          "Invalid recurrence rule",
          violations.stream()
              .map(ConstraintViolation::getMessage)
              .distinct()
              .sorted()
              .collect(Collectors.joining("; ")));
    }
    if (propertyId == null && ownerId == null) {
      throw new ValidationException(
          "Missing rule target", "Either propertyId or ownerId is required");
    }
    if (propertyId != null && ownerId != null) {
      throw new ValidationException(
          "Ambiguous rule target", "A rule applies to a property or to an owner, not both");
    }
    if (endDate != null && endDate.isBefore(startDate)) {
      throw new ValidationException("Invalid date range", "End date must not be before start date");
    }

    return new RuleDefinition(
        taskType == null ? TaskType.OTHER : TaskType.valueOf(taskType),
        RecurrenceFrequency.valueOf(frequency),
        interval == null ? 1 : interval,
        dayOfWeek == null ? null : DayOfWeek.valueOf(dayOfWeek));
  }

  private static void requireWithinWindow(LocalDate nextRunDate, LocalDate endDate) {
    if (endDate != null && nextRunDate.isAfter(endDate)) {
      throw new ValidationException(
          "No occurrence in date range",
          "First occurrence " + nextRunDate + " falls after end date " + endDate);
    }
  }

  /** Moves {@code date} past the last occurrence this rule already generated tasks for. */
  private LocalDate skipGeneratedOccurrences(RecurrenceRule rule, LocalDate date) {
    LocalDate lastOccurrence = rule.getLastOccurrenceDate();
    LocalDate next = date;
    while (lastOccurrence != null && !next.isAfter(lastOccurrence)) {
      next =
          calculator.nextOccurrence(
              rule.getFrequency(),
              rule.getInterval(),
              rule.getDayOfWeek(),
              rule.effectiveDayOfMonth(),
              next);
    }
    return next;
  }

  private RecurrenceRule findRule(UUID id) {
    return ruleRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("RecurrenceRule", id));
  }

  private RecurrenceRuleResponse buildResponse(RecurrenceRule rule) {
    return new RecurrenceRuleResponse(
        rule.getId(),
        rule.getPropertyId(),
        rule.getOwnerId(),
        rule.getTaskType().name(),
        rule.getTitle(),
        rule.getDescription(),
        rule.getAssigneeId(),
        rule.getCostEstimate(),
        rule.getFrequency().name(),
        rule.getInterval(),
        rule.getDayOfWeek(),
        rule.getDayOfMonth(),
        rule.getStartDate(),
        rule.getEndDate(),
        rule.getNextRunDate(),
        rule.isActive(),
        rule.getTotalGenerated(),
        rule.getLastGeneratedAt(),
        rule.getCreatedBy(),
        rule.getCreatedAt(),
        rule.getUpdatedAt());
  }
}
