package io.hosthub.backoffice.recurring;

import io.hosthub.backoffice.exception.GenerationException;
import io.hosthub.backoffice.exception.ResourceNotFoundException;
import io.hosthub.backoffice.property.PropertyRef;
import io.hosthub.backoffice.property.PropertyRepository;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Generates the due occurrence of a single recurrence rule. Each call runs in its own {@code
 * REQUIRES_NEW} transaction: the schedule claim and the task rows commit or roll back together,
 * and a failing rule never affects another.
 *
 * <p>The transaction carries the configured rule timeout as its deadline, so an attempt the run
 * has stopped waiting for cannot hold the rule's row lock indefinitely.
 */
@Service
public class RuleGenerationService {

  private static final Logger log = LoggerFactory.getLogger(RuleGenerationService.class);

  private final RecurrenceRuleRepository ruleRepository;
  private final PropertyRepository propertyRepository;
  private final RecurrenceCalculator calculator;
  private final TaskSink taskSink;
  private final TransactionTemplate txTemplate;

  public RuleGenerationService(
      RecurrenceRuleRepository ruleRepository,
      PropertyRepository propertyRepository,
      RecurrenceCalculator calculator,
      TaskSink taskSink,
      PlatformTransactionManager txManager,
      RecurringGenerationProperties properties) {
    this.ruleRepository = ruleRepository;
    this.propertyRepository = propertyRepository;
    this.calculator = calculator;
    this.taskSink = taskSink;
    this.txTemplate = new TransactionTemplate(txManager);
    this.txTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.txTemplate.setTimeout(timeoutSeconds(properties.ruleTimeout()));
  }

  /**
   * Generates the occurrence {@code expectedNextRunDate} of a rule and advances its schedule by
   * one step.
   *
   * @param ruleId the rule to generate
   * @param expectedNextRunDate the next run date read when the rule was selected as due
   * @param now the run's invocation instant, recorded as {@code lastGeneratedAt}
   * @param lease completed just before commit; an attempt whose lease was abandoned rolls back
   * @return the outcome; {@code skipped} when the rule was paused, edited or already generated by
   *     a concurrent invocation since it was selected, or the run abandoned the attempt before it
   *     started
   * @throws GenerationException if an owner rule has no active properties, the sink returned an
   *     unexpected number of instances or the run abandoned the attempt
   * @throws ResourceNotFoundException if the rule's property no longer exists
   */
  public RuleGenerationOutcome generateForRule(
      UUID ruleId, LocalDate expectedNextRunDate, Instant now, GenerationLease lease) {
    if (lease.isAbandoned()) {
      log.warn("Skipping recurrence rule {}: abandoned before it started", ruleId);
      return RuleGenerationOutcome.skipped(ruleId);
    }
    return txTemplate.execute(status -> generate(ruleId, expectedNextRunDate, now, lease));
  }

  private RuleGenerationOutcome generate(
      UUID ruleId, LocalDate expectedNextRunDate, Instant now, GenerationLease lease) {
    var rule = ruleRepository.findById(ruleId).orElse(null);
    if (rule == null
        || !rule.isActive()
        || !expectedNextRunDate.equals(rule.getNextRunDate())) {
      log.warn("Skipping recurrence rule {}: no longer due on {}", ruleId, expectedNextRunDate);
      return RuleGenerationOutcome.skipped(ruleId);
    }

    List<PropertyRef> targets = resolveTargets(rule);
    var snapshot = RuleSnapshot.of(rule);

    LocalDate next =
        calculator.nextOccurrence(
            rule.getFrequency(),
            rule.getInterval(),
            rule.getDayOfWeek(),
            rule.effectiveDayOfMonth(),
            expectedNextRunDate);
    boolean reachesEnd = rule.getEndDate() != null && next.isAfter(rule.getEndDate());
    LocalDate newNextRunDate = reachesEnd ? expectedNextRunDate : next;

    int claimed =
        ruleRepository.advanceSchedule(
            ruleId, expectedNextRunDate, newNextRunDate, !reachesEnd, targets.size(), now);
    if (claimed == 0) {
      log.warn(
          "Skipping recurrence rule {}: occurrence {} already claimed",
          ruleId,
          expectedNextRunDate);
      return RuleGenerationOutcome.skipped(ruleId);
    }

    var instances = taskSink.createTaskInstances(snapshot, expectedNextRunDate, targets);
    if (instances.size() != targets.size()) {
      throw new GenerationException(
          ruleId,
          "Task sink created " + instances.size() + " of " + targets.size() + " task instance(s)");
    }
    if (!lease.complete()) {
      throw new GenerationException(
          ruleId, "Abandoned after the run stopped waiting; occurrence rolled back");
    }

    if (reachesEnd) {
      log.info(
          "Recurrence rule {} generated its last occurrence {} and was deactivated",
          ruleId,
          expectedNextRunDate);
      return RuleGenerationOutcome.generatedAndDeactivated(ruleId, instances.size());
    }

    log.debug(
        "Recurrence rule {} generated {} task(s) for {}, next run {}",
        ruleId,
        instances.size(),
        expectedNextRunDate,
        newNextRunDate);
    return RuleGenerationOutcome.generated(ruleId, instances.size());
  }

  private List<PropertyRef> resolveTargets(RecurrenceRule rule) {
    if (rule.getTarget() instanceof RuleTarget.PropertyTarget target) {
      return List.of(
          propertyRepository
              .findById(target.propertyId())
              .map(PropertyRef::from)
              .orElseThrow(() -> new ResourceNotFoundException("Property", target.propertyId())));
    }

    var ownerId = ((RuleTarget.OwnerTarget) rule.getTarget()).ownerId();
    var properties =
        propertyRepository.findByOwnerIdAndActiveTrueOrderByNameAsc(ownerId).stream()
            .map(PropertyRef::from)
            .toList();
    if (properties.isEmpty()) {
      throw new GenerationException(
          rule.getId(), "No active properties found for owner " + ownerId);
    }
    return properties;
  }

  /** Transaction timeouts are whole seconds; rounds up so the deadline is never shorter. */
  private static int timeoutSeconds(Duration ruleTimeout) {
    long seconds = ruleTimeout.getSeconds() + (ruleTimeout.getNano() > 0 ? 1 : 0);
    return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
  }
}
