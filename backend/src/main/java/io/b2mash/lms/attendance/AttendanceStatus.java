package io.b2mash.lms.attendance;

public enum AttendanceStatus {
  PENDING,
  PRESENT,
  ABSENT,
  LATE
}
