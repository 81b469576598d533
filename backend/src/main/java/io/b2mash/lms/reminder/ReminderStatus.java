package io.b2mash.lms.reminder;

public enum ReminderStatus {
  PENDING,
  QUEUED,
  SENT,
  FAILED,
  CANCELLED
}
