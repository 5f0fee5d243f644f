package io.hosthub.backoffice.recurring;

import io.hosthub.backoffice.property.PropertyRef;
import java.time.LocalDate;
import java.util.List;

/**
 * Materializes a due occurrence of a recurrence rule into concrete task records. Owned by the
 * surrounding application; the generation engine only calls it.
 *
 * <p>Implementations run inside the generation engine's per-rule transaction. Throwing rolls back
 * the schedule advancement for that rule, so the occurrence is retried on the next run.
 */
public interface TaskSink {

  /**
   * Creates one task per property for the occurrence {@code dueDate}.
   *
   * @return one reference per created task, in the order of {@code properties}
   */
  List<InstanceRef> createTaskInstances(
      RuleSnapshot rule, LocalDate dueDate, List<PropertyRef> properties);
}
