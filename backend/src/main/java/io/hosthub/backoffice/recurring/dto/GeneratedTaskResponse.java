package io.hosthub.backoffice.recurring.dto;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record GeneratedTaskResponse(
    UUID id,
    UUID propertyId,
    String taskType,
    String title,
    UUID assigneeId,
    LocalDate scheduledDate,
    Instant dueAt,
    String status,
    Instant createdAt) {}
