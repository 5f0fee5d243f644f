package io.hosthub.backoffice.recurring;

import java.util.UUID;

/**
 * What a recurrence rule applies to: a single property, or every property of an owner. Owner
 * targets are resolved to concrete properties only when tasks are generated.
 */
public sealed interface RuleTarget permits RuleTarget.PropertyTarget, RuleTarget.OwnerTarget {

  record PropertyTarget(UUID propertyId) implements RuleTarget {}

  record OwnerTarget(UUID ownerId) implements RuleTarget {}
}
