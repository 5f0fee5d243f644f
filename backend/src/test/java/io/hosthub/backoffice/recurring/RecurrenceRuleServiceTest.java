package io.hosthub.backoffice.recurring;

import static io.hosthub.backoffice.recurring.RuleFixtures.propertyRule;
import static io.hosthub.backoffice.recurring.RuleFixtures.setField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.hosthub.backoffice.exception.ResourceNotFoundException;
import io.hosthub.backoffice.exception.ValidationException;
import io.hosthub.backoffice.recurring.dto.CreateRecurrenceRuleRequest;
import io.hosthub.backoffice.recurring.dto.UpdateRecurrenceRuleRequest;
import io.hosthub.backoffice.task.GeneratedTaskRepository;
import jakarta.validation.Validation;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RecurrenceRuleServiceTest {

  private static final UUID PROPERTY_ID = UUID.randomUUID();
  private static final UUID OWNER_ID = UUID.randomUUID();
  private static final UUID USER_ID = UUID.randomUUID();
  private static final LocalDate TODAY = LocalDate.of(2024, 3, 10);

  @Mock private RecurrenceRuleRepository ruleRepository;
  @Mock private GeneratedTaskRepository taskRepository;

  private RecurrenceRuleService service;

  @BeforeEach
  void setUp() {
    var clock = Clock.fixed(Instant.parse("2024-03-10T09:00:00Z"), ZoneOffset.UTC);
    service =
        new RecurrenceRuleService(
            ruleRepository,
            taskRepository,
            new RecurrenceCalculator(),
            Validation.buildDefaultValidatorFactory().getValidator(),
            clock);
  }

  // ---- create ----

  @Test
  void create_rejectsMissingTitle() {
    var request = createRequest(PROPERTY_ID, null, " ", "WEEKLY", null, null, null);

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Title, frequency, and start date are required")
        .extracting(e -> ((ValidationException) e).getDetail())
        .isEqualTo("Title, frequency, and start date are required");
    verify(ruleRepository, never()).save(any());
  }

  @Test
  void create_rejectsMissingTarget() {
    var request = createRequest(null, null, "Clean", "WEEKLY", null, null, null);

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Either propertyId or ownerId is required");
  }

  @Test
  void create_rejectsBothTargets() {
    var request = createRequest(PROPERTY_ID, OWNER_ID, "Clean", "WEEKLY", null, null, null);

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("not both");
  }

  @Test
  void create_rejectsUnknownFrequency() {
    var request = createRequest(PROPERTY_ID, null, "Clean", "FORTNIGHTLY", null, null, null);

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Invalid frequency")
        .extracting(e -> ((ValidationException) e).getTitle())
        .isEqualTo("Invalid recurrence rule");
  }

  @Test
  void create_reportsEveryInvalidField() {
    var request =
        new CreateRecurrenceRuleRequest(
            PROPERTY_ID, null, "GARDENING", "Clean", null, null, null, "HOURLY", 0, null, 0,
            LocalDate.of(2024, 1, 3), null, null);

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessage(
            "Day of month must be between 1 and 31; Interval must be at least 1;"
                + " Invalid frequency; Invalid task type");
    verify(ruleRepository, never()).save(any());
  }

  @Test
  void create_rejectsTitleOverThreeHundredCharacters() {
    var request = createRequest(PROPERTY_ID, null, "x".repeat(301), "DAILY", null, null, null);

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Title must be at most 300 characters");
  }

  @Test
  void create_rejectsUnknownDayOfWeek() {
    var request = createRequest(PROPERTY_ID, null, "Clean", "WEEKLY", "FUNDAY", null, null);

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Invalid day of week");
  }

  @Test
  void create_rejectsDayOfMonthOutOfRange() {
    var request = createRequest(PROPERTY_ID, null, "Clean", "MONTHLY", null, 32, null);

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Day of month must be between 1 and 31");
  }

  @Test
  void create_rejectsIntervalBelowOne() {
    var request =
        new CreateRecurrenceRuleRequest(
            PROPERTY_ID, null, null, "Clean", null, null, null, "DAILY", 0, null, null,
            LocalDate.of(2024, 1, 3), null, null);

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Interval must be at least 1");
  }

  @Test
  void create_rejectsNegativeCostEstimate() {
    var request =
        new CreateRecurrenceRuleRequest(
            PROPERTY_ID, null, null, "Clean", null, null, new BigDecimal("-1.00"), "DAILY", null,
            null, null, LocalDate.of(2024, 1, 3), null, null);

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Cost estimate");
  }

  @Test
  void create_rejectsEndDateBeforeStartDate() {
    var request =
        createRequest(PROPERTY_ID, null, "Clean", "DAILY", null, null, LocalDate.of(2024, 1, 1));

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessage("End date must not be before start date");
  }

  @Test
  void create_rejectsRuleWithNoOccurrenceBeforeEndDate() {
    // Wednesday start, Monday weekday, window closes on Friday
    var request =
        createRequest(
            PROPERTY_ID, null, "Clean", "WEEKLY", "MONDAY", null, LocalDate.of(2024, 1, 5));

    assertThatThrownBy(() -> service.create(request, USER_ID))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("falls after end date");
  }

  @Test
  void create_seedsNextRunDateFromFirstWeeklyOccurrence() {
    when(ruleRepository.save(any(RecurrenceRule.class))).thenAnswer(i -> i.getArgument(0));
    var request = createRequest(PROPERTY_ID, null, "Clean", "WEEKLY", "MONDAY", null, null);

    var response = service.create(request, USER_ID);

    assertThat(response.nextRunDate()).isEqualTo(LocalDate.of(2024, 1, 8));
    assertThat(response.interval()).isEqualTo(1);
    assertThat(response.taskType()).isEqualTo("OTHER");
    assertThat(response.dayOfWeek()).isEqualTo(DayOfWeek.MONDAY);
    assertThat(response.active()).isTrue();
    assertThat(response.totalGenerated()).isZero();
    assertThat(response.createdBy()).isEqualTo(USER_ID);
  }

  @Test
  void create_honoursInactiveFlag() {
    when(ruleRepository.save(any(RecurrenceRule.class))).thenAnswer(i -> i.getArgument(0));
    var request =
        new CreateRecurrenceRuleRequest(
            null, OWNER_ID, "REPAIR", "Check boiler", null, null, null, "YEARLY", null, null,
            null, LocalDate.of(2024, 6, 1), null, false);

    var response = service.create(request, USER_ID);

    assertThat(response.active()).isFalse();
    assertThat(response.ownerId()).isEqualTo(OWNER_ID);
    assertThat(response.nextRunDate()).isEqualTo(LocalDate.of(2024, 6, 1));
  }

  // ---- update ----

  @Test
  void update_unknownRuleThrowsNotFound() {
    var id = UUID.randomUUID();
    when(ruleRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.update(id, updateRequest("DAILY", 1, null)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void update_keepsNextRunDateWhenRecurrenceUnchanged() {
    var id = UUID.randomUUID();
    var rule =
        propertyRule(
            id, PROPERTY_ID, RecurrenceFrequency.DAILY, 1, null, null,
            LocalDate.of(2024, 1, 1), null, LocalDate.of(2024, 3, 15));
    when(ruleRepository.findById(id)).thenReturn(Optional.of(rule));
    when(ruleRepository.save(any(RecurrenceRule.class))).thenAnswer(i -> i.getArgument(0));

    var response = service.update(id, updateRequest("DAILY", 1, null));

    assertThat(response.title()).isEqualTo("Deep clean");
    assertThat(response.nextRunDate()).isEqualTo(LocalDate.of(2024, 3, 15));
  }

  @Test
  void update_recomputesNextRunDateFromTodayWhenRecurrenceChanges() {
    var id = UUID.randomUUID();
    var rule =
        propertyRule(
            id, PROPERTY_ID, RecurrenceFrequency.DAILY, 1, null, null,
            LocalDate.of(2024, 1, 1), null, LocalDate.of(2024, 3, 15));
    when(ruleRepository.findById(id)).thenReturn(Optional.of(rule));
    when(ruleRepository.save(any(RecurrenceRule.class))).thenAnswer(i -> i.getArgument(0));

    // today is Sunday 2024-03-10
    var response = service.update(id, updateRequest("WEEKLY", 1, "MONDAY"));

    assertThat(response.nextRunDate()).isEqualTo(LocalDate.of(2024, 3, 11));
  }

  @Test
  void update_rescheduleSkipsOccurrenceAlreadyGenerated() {
    var id = UUID.randomUUID();
    var rule =
        propertyRule(
            id, PROPERTY_ID, RecurrenceFrequency.DAILY, 1, null, null,
            LocalDate.of(2024, 1, 1), null, LocalDate.of(2024, 3, 11));
    setField(rule, "lastOccurrenceDate", TODAY);
    when(ruleRepository.findById(id)).thenReturn(Optional.of(rule));
    when(ruleRepository.save(any(RecurrenceRule.class))).thenAnswer(i -> i.getArgument(0));

    var response = service.update(id, updateRequest("DAILY", 2, null));

    assertThat(response.nextRunDate()).isEqualTo(LocalDate.of(2024, 3, 12));
  }

  @Test
  void update_rescheduledMonthlyRuleStaysOnItsStartDay() {
    var id = UUID.randomUUID();
    var rule =
        propertyRule(
            id, PROPERTY_ID, RecurrenceFrequency.MONTHLY, 1, null, null,
            LocalDate.of(2024, 1, 31), null, LocalDate.of(2024, 3, 31));
    when(ruleRepository.findById(id)).thenReturn(Optional.of(rule));
    when(ruleRepository.save(any(RecurrenceRule.class))).thenAnswer(i -> i.getArgument(0));
    var request =
        new UpdateRecurrenceRuleRequest(
            PROPERTY_ID, null, "CLEANING", "Deep clean", null, null, null, "MONTHLY", 2, null,
            null, LocalDate.of(2024, 1, 31), null);

    var response = service.update(id, request);

    // seeded from today, 2024-03-10, but kept on the 31st
    assertThat(response.nextRunDate()).isEqualTo(LocalDate.of(2024, 3, 31));
  }

  // ---- activate / deactivate ----

  @Test
  void activate_refusesRuleThatReachedEndDate() {
    var id = UUID.randomUUID();
    var rule =
        propertyRule(
            id, PROPERTY_ID, RecurrenceFrequency.MONTHLY, 1, null, null,
            LocalDate.of(2024, 1, 20), LocalDate.of(2024, 3, 1), LocalDate.of(2024, 2, 20));
    setField(rule, "lastOccurrenceDate", LocalDate.of(2024, 2, 20));
    rule.deactivate();
    when(ruleRepository.findById(id)).thenReturn(Optional.of(rule));

    assertThatThrownBy(() -> service.activate(id))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("end date");
    verify(ruleRepository, never()).save(any());
  }

  @Test
  void activate_keepsOverdueNextRunDate() {
    var id = UUID.randomUUID();
    var rule =
        propertyRule(
            id, PROPERTY_ID, RecurrenceFrequency.MONTHLY, 1, null, null,
            LocalDate.of(2023, 12, 1), null, LocalDate.of(2024, 2, 1));
    setField(rule, "lastOccurrenceDate", LocalDate.of(2024, 1, 1));
    rule.deactivate();
    when(ruleRepository.findById(id)).thenReturn(Optional.of(rule));
    when(ruleRepository.save(any(RecurrenceRule.class))).thenAnswer(i -> i.getArgument(0));

    var response = service.activate(id);

    assertThat(response.active()).isTrue();
    assertThat(response.nextRunDate()).isEqualTo(LocalDate.of(2024, 2, 1));
  }

  @Test
  void deactivate_isIdempotent() {
    var id = UUID.randomUUID();
    var rule =
        propertyRule(
            id, PROPERTY_ID, RecurrenceFrequency.DAILY, 1, null, null,
            LocalDate.of(2024, 1, 1), null, LocalDate.of(2024, 3, 11));
    rule.deactivate();
    when(ruleRepository.findById(id)).thenReturn(Optional.of(rule));

    var response = service.deactivate(id);

    assertThat(response.active()).isFalse();
    verify(ruleRepository, never()).save(any());
  }

  // ---- list / delete / history ----

  @Test
  void list_propertyFilterTakesPrecedenceOverOwner() {
    when(ruleRepository.findByPropertyIdAndActiveOrderByNextRunDateAscCreatedAtDesc(
            PROPERTY_ID, true))
        .thenReturn(List.of());

    var rules = service.list(PROPERTY_ID, OWNER_ID, true);

    assertThat(rules).isEmpty();
    verify(ruleRepository, never())
        .findByOwnerIdAndActiveOrderByNextRunDateAscCreatedAtDesc(any(), anyBoolean());
  }

  @Test
  void delete_unknownRuleThrowsNotFound() {
    var id = UUID.randomUUID();
    when(ruleRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.delete(id))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessageContaining(id.toString());
  }

  @Test
  void listGeneratedTasks_unknownRuleThrowsNotFound() {
    var id = UUID.randomUUID();
    when(ruleRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.listGeneratedTasks(id))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(taskRepository, never())
        .findByRecurrenceRuleIdOrderByScheduledDateDescCreatedAtDesc(any());
  }

  private static CreateRecurrenceRuleRequest createRequest(
      UUID propertyId,
      UUID ownerId,
      String title,
      String frequency,
      String dayOfWeek,
      Integer dayOfMonth,
      LocalDate endDate) {
    // Start on Wednesday 2024-01-03
    return new CreateRecurrenceRuleRequest(
        propertyId, ownerId, null, title, null, null, null, frequency, null, dayOfWeek,
        dayOfMonth, LocalDate.of(2024, 1, 3), endDate, null);
  }

  private static UpdateRecurrenceRuleRequest updateRequest(
      String frequency, int interval, String dayOfWeek) {
    return new UpdateRecurrenceRuleRequest(
        PROPERTY_ID, null, "CLEANING", "Deep clean", null, null, null, frequency, interval,
        dayOfWeek, null, LocalDate.of(2024, 1, 1), null);
  }
}
