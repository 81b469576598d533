package io.b2mash.lms.session.dto;

import io.b2mash.lms.reminder.ReminderChannel;
import io.b2mash.lms.reminder.ReminderStatus;
import io.b2mash.lms.session.CourseSession;
import io.b2mash.lms.session.SessionStatus;
import io.b2mash.lms.session.SessionType;
import java.time.Instant;
import java.util.UUID;

public record SessionResponse(
    UUID id,
    UUID courseId,
    UUID moduleId,
    UUID userId,
    String title,
    Instant sessionDate,
    Integer durationMinutes,
    SessionStatus status,
    String notes,
    SessionType sessionType,
    String resourceUrl,
    boolean attendanceRequired,
    String attendanceCode,
    Integer attendanceWindowMinutes,
    boolean reminderEnabled,
    Integer reminderLeadMinutes,
    ReminderChannel reminderChannel,
    ReminderStatus reminderStatus,
    Instant lastReminderSentAt,
    int attendeeCount,
    int absenceCount,
    Instant createdAt,
    Instant updatedAt) {

  public static SessionResponse from(CourseSession session) {
    return new SessionResponse(
        session.getId(),
        session.getCourseId(),
        session.getModuleId(),
        session.getInstructorId(),
        session.getTitle(),
        session.getSessionDate(),
        session.getDurationMinutes(),
        session.getStatus(),
        session.getNotes(),
        session.getSessionType(),
        session.getResourceUrl(),
        session.isAttendanceRequired(),
        session.getAttendanceCode(),
        session.getAttendanceWindowMinutes(),
        session.isReminderEnabled(),
        session.getReminderLeadMinutes(),
        session.getReminderChannel(),
        session.getReminderStatus(),
        session.getLastReminderSentAt(),
        session.getAttendeeCount(),
        session.getAbsenceCount(),
        session.getCreatedAt(),
        session.getUpdatedAt());
  }
}
