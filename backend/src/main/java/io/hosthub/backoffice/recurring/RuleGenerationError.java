package io.hosthub.backoffice.recurring;

import java.util.UUID;

public record RuleGenerationError(UUID ruleId, String message) {}
