package io.hosthub.backoffice.task;

/** Work category shared by recurrence rules and the tasks they produce. */
public enum TaskType {
  CLEANING,
  REPAIR,
  INSPECTION,
  OTHER
}
