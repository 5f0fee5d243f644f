package io.hosthub.backoffice.recurring;

import java.time.DayOfWeek;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/**
 * Calendar arithmetic for recurrence rules. Pure and stateless: every method maps its arguments
 * to a date and nothing else.
 *
 * <p>Month-based frequencies clamp to the last day of a shorter month instead of rolling over, so
 * a rule on the 31st lands on Feb 29 (or 28), never on Mar 1/2.
 */
@Component
public class RecurrenceCalculator {

  /**
   * Returns the occurrence that follows {@code fromDate}. The result is always strictly after
   * {@code fromDate}.
   *
   * @param frequency recurrence unit
   * @param interval number of units between occurrences, at least 1
   * @param dayOfWeek target weekday, only used for {@link RecurrenceFrequency#WEEKLY}; nullable
   * @param dayOfMonth target day (1-31), only used for month-based frequencies; nullable
   * @param fromDate the current occurrence
   * @throws IllegalArgumentException if frequency or fromDate is null or interval is below 1
   */
  public LocalDate nextOccurrence(
      RecurrenceFrequency frequency,
      int interval,
      DayOfWeek dayOfWeek,
      Integer dayOfMonth,
      LocalDate fromDate) {
    requireArguments(frequency, interval, fromDate);
    return switch (frequency) {
      case DAILY -> fromDate.plusDays(interval);
      case WEEKLY -> nextWeekly(interval, dayOfWeek, fromDate);
      case MONTHLY, QUARTERLY, YEARLY -> nextMonthBased(frequency, interval, dayOfMonth, fromDate);
    };
  }

  /**
   * Returns the first occurrence of a rule starting on {@code startDate}. Used to seed a rule's
   * schedule when it is created or its recurrence changes.
   *
   * <ul>
   *   <li>WEEKLY with a weekday: the next matching weekday strictly after {@code startDate}; a
   *       start date that already is the weekday moves to the following week.
   *   <li>Month-based with a day-of-month: that day (clamped) in the start month, or the next
   *       occurrence if it falls before {@code startDate}.
   *   <li>Anything else: {@code startDate} itself.
   * </ul>
   */
  public LocalDate firstOccurrence(
      RecurrenceFrequency frequency,
      int interval,
      DayOfWeek dayOfWeek,
      Integer dayOfMonth,
      LocalDate startDate) {
    requireArguments(frequency, interval, startDate);
    if (frequency == RecurrenceFrequency.WEEKLY && dayOfWeek != null) {
      int daysToAdd = daysUntil(startDate.getDayOfWeek(), dayOfWeek);
      return startDate.plusDays(daysToAdd == 0 ? 7 : daysToAdd);
    }
    if (frequency.isMonthBased() && dayOfMonth != null) {
      LocalDate candidate = clampToMonth(startDate, dayOfMonth);
      return candidate.isBefore(startDate)
          ? nextOccurrence(frequency, interval, null, dayOfMonth, candidate)
          : candidate;
    }
    return startDate;
  }

  private LocalDate nextWeekly(int interval, DayOfWeek dayOfWeek, LocalDate fromDate) {
    if (dayOfWeek == null) {
      return fromDate.plusWeeks(interval);
    }
    int daysToAdd = daysUntil(fromDate.getDayOfWeek(), dayOfWeek);
    // Already on the target weekday: a full interval forward
    return daysToAdd == 0 ? fromDate.plusWeeks(interval) : fromDate.plusDays(daysToAdd);
  }

  private LocalDate nextMonthBased(
      RecurrenceFrequency frequency, int interval, Integer dayOfMonth, LocalDate fromDate) {
    // plusMonths already clamps the kept day-of-month to the target month's length
    LocalDate target = fromDate.plusMonths((long) interval * frequency.monthsPerUnit());
    return dayOfMonth != null ? clampToMonth(target, dayOfMonth) : target;
  }

  private static int daysUntil(DayOfWeek current, DayOfWeek target) {
    return Math.floorMod(target.getValue() - current.getValue(), 7);
  }

  private static LocalDate clampToMonth(LocalDate dateInMonth, int dayOfMonth) {
    return dateInMonth.withDayOfMonth(Math.min(dayOfMonth, dateInMonth.lengthOfMonth()));
  }

  private static void requireArguments(
      RecurrenceFrequency frequency, int interval, LocalDate date) {
    if (frequency == null) {
      throw new IllegalArgumentException("Frequency must not be null");
    }
    if (interval < 1) {
      throw new IllegalArgumentException("Interval must be >= 1, got: " + interval);
    }
    if (date == null) {
      throw new IllegalArgumentException("Anchor date must not be null");
    }
  }
}
