package io.hosthub.backoffice.recurring.dto;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record RecurrenceRuleResponse(
    UUID id,
    UUID propertyId,
    UUID ownerId,
    String taskType,
    String title,
    String description,
    UUID assigneeId,
    BigDecimal costEstimate,
    String frequency,
    int interval,
    DayOfWeek dayOfWeek,
    Integer dayOfMonth,
    LocalDate startDate,
    LocalDate endDate,
    LocalDate nextRunDate,
    boolean active,
    int totalGenerated,
    Instant lastGeneratedAt,
    UUID createdBy,
    Instant createdAt,
    Instant updatedAt) {}
