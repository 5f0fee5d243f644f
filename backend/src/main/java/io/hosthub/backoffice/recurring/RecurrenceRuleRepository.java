package io.hosthub.backoffice.recurring;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RecurrenceRuleRepository extends JpaRepository<RecurrenceRule, UUID> {
  List<RecurrenceRule> findByActiveTrueAndNextRunDateLessThanEqualOrderByNextRunDateAsc(
      LocalDate date);

  List<RecurrenceRule> findAllByOrderByNextRunDateAscCreatedAtDesc();

  List<RecurrenceRule> findByActiveOrderByNextRunDateAscCreatedAtDesc(boolean active);

  List<RecurrenceRule> findByPropertyIdOrderByNextRunDateAscCreatedAtDesc(UUID propertyId);

  List<RecurrenceRule> findByPropertyIdAndActiveOrderByNextRunDateAscCreatedAtDesc(
      UUID propertyId, boolean active);

  List<RecurrenceRule> findByOwnerIdOrderByNextRunDateAscCreatedAtDesc(UUID ownerId);

  List<RecurrenceRule> findByOwnerIdAndActiveOrderByNextRunDateAscCreatedAtDesc(
      UUID ownerId, boolean active);

  /**
   * Claims the occurrence {@code expectedNextRunDate} for generation. Only succeeds while the
   * rule is still active and still due on that date, so two invocations racing on the same rule
   * cannot both advance it: the loser blocks on the row lock and then matches zero rows.
   *
   * @return 1 if this caller claimed the occurrence, 0 otherwise
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE RecurrenceRule r
         SET r.nextRunDate = :nextRunDate,
             r.lastOccurrenceDate = :expectedNextRunDate,
             r.active = :active,
             r.totalGenerated = r.totalGenerated + :generated,
             r.lastGeneratedAt = :generatedAt,
             r.updatedAt = :generatedAt,
             r.version = r.version + 1
       WHERE r.id = :id
         AND r.nextRunDate = :expectedNextRunDate
         AND r.active = true
      """)
  int advanceSchedule(
      @Param("id") UUID id,
      @Param("expectedNextRunDate") LocalDate expectedNextRunDate,
      @Param("nextRunDate") LocalDate nextRunDate,
      @Param("active") boolean active,
      @Param("generated") int generated,
      @Param("generatedAt") Instant generatedAt);
}
