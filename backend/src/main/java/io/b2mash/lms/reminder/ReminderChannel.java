package io.b2mash.lms.reminder;

public enum ReminderChannel {
  EMAIL,
  SMS,
  INAPP
}
