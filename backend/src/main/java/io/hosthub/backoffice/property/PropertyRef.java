package io.hosthub.backoffice.property;

import java.util.UUID;

/** Lightweight reference to a property that a generated task is attached to. */
public record PropertyRef(UUID id, UUID ownerId, String name) {

  public static PropertyRef from(Property property) {
    return new PropertyRef(property.getId(), property.getOwnerId(), property.getName());
  }
}
