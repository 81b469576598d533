package io.b2mash.lms.attendance.dto;

import io.b2mash.lms.attendance.AttendanceStatus;
import io.b2mash.lms.attendance.SessionAttendance;
import java.time.Instant;
import java.util.UUID;

public record AttendanceResponse(
    UUID id,
    UUID sessionId,
    UUID userId,
    AttendanceStatus status,
    Instant checkInAt,
    Instant checkOutAt,
    String notes,
    Instant createdAt,
    Instant updatedAt) {

  public static AttendanceResponse from(SessionAttendance attendance) {
    return new AttendanceResponse(
        attendance.getId(),
        attendance.getSessionId(),
        attendance.getUserId(),
        attendance.getStatus(),
        attendance.getCheckInAt(),
        attendance.getCheckOutAt(),
        attendance.getNotes(),
        attendance.getCreatedAt(),
        attendance.getUpdatedAt());
  }
}
