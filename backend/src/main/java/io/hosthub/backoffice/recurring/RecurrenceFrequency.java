package io.hosthub.backoffice.recurring;

/**
 * Unit of a recurrence rule's interval. Month-based frequencies advance by whole months so that a
 * day-of-month can be kept or clamped.
 */
public enum RecurrenceFrequency {
  DAILY(0),
  WEEKLY(0),
  MONTHLY(1),
  QUARTERLY(3),
  YEARLY(12);

  private final int monthsPerUnit;

  RecurrenceFrequency(int monthsPerUnit) {
    this.monthsPerUnit = monthsPerUnit;
  }

  /** Number of calendar months in one interval unit; 0 for day-based frequencies. */
  public int monthsPerUnit() {
    return monthsPerUnit;
  }

  public boolean isMonthBased() {
    return monthsPerUnit > 0;
  }
}
