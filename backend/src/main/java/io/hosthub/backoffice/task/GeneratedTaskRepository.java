package io.hosthub.backoffice.task;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GeneratedTaskRepository extends JpaRepository<GeneratedTask, UUID> {
  List<GeneratedTask> findByRecurrenceRuleIdOrderByScheduledDateDescCreatedAtDesc(
      UUID recurrenceRuleId);

  long countByRecurrenceRuleId(UUID recurrenceRuleId);
}
