package io.hosthub.backoffice.task;

/** Task lifecycle status. Generated tasks always start out {@link #PENDING}. */
public enum TaskStatus {
  PENDING,
  IN_PROGRESS,
  COMPLETED,
  CANCELLED
}
