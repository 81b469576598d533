package io.b2mash.lms.session;

public enum SessionStatus {
  SCHEDULED,
  COMPLETED,
  CANCELLED
}
