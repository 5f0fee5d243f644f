package io.hosthub.backoffice.task;

import io.hosthub.backoffice.exception.ResourceNotFoundException;
import io.hosthub.backoffice.property.PropertyRef;
import io.hosthub.backoffice.property.PropertyRepository;
import io.hosthub.backoffice.recurring.InstanceRef;
import io.hosthub.backoffice.recurring.RecurringGenerationProperties;
import io.hosthub.backoffice.recurring.RuleSnapshot;
import io.hosthub.backoffice.recurring.TaskSink;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link TaskSink} that writes generated tasks to the {@code tasks} table. Participates in the
 * caller's transaction so task rows and the rule's schedule advancement commit or roll back
 * together.
 */
@Component
public class JpaTaskSink implements TaskSink {

  private static final Logger log = LoggerFactory.getLogger(JpaTaskSink.class);

  private final GeneratedTaskRepository taskRepository;
  private final PropertyRepository propertyRepository;
  private final ZoneId zone;

  public JpaTaskSink(
      GeneratedTaskRepository taskRepository,
      PropertyRepository propertyRepository,
      RecurringGenerationProperties generationProperties) {
    this.taskRepository = taskRepository;
    this.propertyRepository = propertyRepository;
    this.zone = generationProperties.zoneId();
  }

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public List<InstanceRef> createTaskInstances(
      RuleSnapshot rule, LocalDate dueDate, List<PropertyRef> properties) {
    Instant dueAt = endOfDay(dueDate);
    var tasks = new ArrayList<GeneratedTask>(properties.size());
    for (var property : properties) {
      if (!propertyRepository.existsById(property.id())) {
        throw new ResourceNotFoundException("Property", property.id());
      }
      tasks.add(
          new GeneratedTask(
              rule.ruleId(),
              property.id(),
              rule.taskType(),
              rule.title(),
              rule.description(),
              rule.assigneeId(),
              rule.costEstimate(),
              dueDate,
              dueAt));
    }

    var saved = taskRepository.saveAllAndFlush(tasks);
    log.debug(
        "Created {} task(s) for recurrence rule {} due {}", saved.size(), rule.ruleId(), dueDate);
    return saved.stream().map(t -> new InstanceRef(t.getId(), t.getPropertyId())).toList();
  }

  private Instant endOfDay(LocalDate date) {
    return date.plusDays(1).atStartOfDay(zone).minusSeconds(1).toInstant();
  }
}
