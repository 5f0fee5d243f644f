package io.hosthub.backoffice.recurring.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Fields of a new recurrence rule. {@code interval} defaults to 1, {@code taskType} to OTHER and
 * {@code active} to true when null.
 */
public record CreateRecurrenceRuleRequest(
    UUID propertyId,
    UUID ownerId,
    @Pattern(regexp = "CLEANING|REPAIR|INSPECTION|OTHER", message = "Invalid task type")
        String taskType,
    @NotBlank(message = "Title, frequency, and start date are required")
        @Size(max = 300, message = "Title must be at most 300 characters")
        String title,
    String description,
    UUID assigneeId,
    @PositiveOrZero(message = "Cost estimate must not be negative") BigDecimal costEstimate,
    @NotNull(message = "Title, frequency, and start date are required")
        @Pattern(regexp = "DAILY|WEEKLY|MONTHLY|QUARTERLY|YEARLY", message = "Invalid frequency")
        String frequency,
    @Min(value = 1, message = "Interval must be at least 1") Integer interval,
    @Pattern(
            regexp = "MONDAY|TUESDAY|WEDNESDAY|THURSDAY|FRIDAY|SATURDAY|SUNDAY",
            message = "Invalid day of week")
        String dayOfWeek,
    @Min(value = 1, message = "Day of month must be between 1 and 31")
        @Max(value = 31, message = "Day of month must be between 1 and 31")
        Integer dayOfMonth,
    @NotNull(message = "Title, frequency, and start date are required") LocalDate startDate,
    LocalDate endDate,
    Boolean active) {}
