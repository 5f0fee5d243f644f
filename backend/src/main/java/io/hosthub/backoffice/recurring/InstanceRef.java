package io.hosthub.backoffice.recurring;

import java.util.UUID;

/** Reference to a task instance created by a {@link TaskSink}. */
public record InstanceRef(UUID taskId, UUID propertyId) {}
