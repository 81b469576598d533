package io.b2mash.lms.session;

import io.b2mash.lms.reminder.ReminderChannel;
import io.b2mash.lms.reminder.ReminderStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A scheduled teaching session of a course. Reminder and attendance counters are maintained by the
 * reminder and attendance services, never by clients.
 */
@Entity
@Table(name = "course_sessions")
public class CourseSession {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "course_id", nullable = false)
  private UUID courseId;

  @Column(name = "module_id")
  private UUID moduleId;

  @Column(name = "instructor_id", nullable = false)
  private UUID instructorId;

  @Column(name = "title", length = 300)
  private String title;

  @Column(name = "session_date", nullable = false)
  private Instant sessionDate;

  @Column(name = "duration_minutes")
  private Integer durationMinutes;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private SessionStatus status;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Enumerated(EnumType.STRING)
  @Column(name = "session_type", nullable = false, length = 20)
  private SessionType sessionType;

  @Column(name = "resource_url", length = 1000)
  private String resourceUrl;

  @Column(name = "attendance_required", nullable = false)
  private boolean attendanceRequired;

  @Column(name = "attendance_code", length = 50)
  private String attendanceCode;

  @Column(name = "attendance_window_minutes")
  private Integer attendanceWindowMinutes;

  @Column(name = "reminder_enabled", nullable = false)
  private boolean reminderEnabled;

  @Column(name = "reminder_lead_minutes")
  private Integer reminderLeadMinutes;

  @Enumerated(EnumType.STRING)
  @Column(name = "reminder_channel", length = 20)
  private ReminderChannel reminderChannel;

  @Enumerated(EnumType.STRING)
  @Column(name = "reminder_status", length = 20)
  private ReminderStatus reminderStatus;

  @Column(name = "last_reminder_sent_at")
  private Instant lastReminderSentAt;

  @Column(name = "attendee_count", nullable = false)
  private int attendeeCount;

  @Column(name = "absence_count", nullable = false)
  private int absenceCount;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CourseSession() {}

  public CourseSession(UUID courseId, UUID instructorId, Instant sessionDate) {
    this.courseId = courseId;
    this.instructorId = instructorId;
    this.sessionDate = sessionDate;
    this.status = SessionStatus.SCHEDULED;
    this.sessionType = SessionType.LIVE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateSchedule(
      UUID moduleId,
      UUID instructorId,
      String title,
      Instant sessionDate,
      Integer durationMinutes,
      SessionStatus status,
      String notes) {
    this.moduleId = moduleId;
    this.instructorId = instructorId;
    this.title = title;
    this.sessionDate = sessionDate;
    this.durationMinutes = durationMinutes;
    this.status = status;
    this.notes = notes;
    this.updatedAt = Instant.now();
  }

  public void updateDelivery(SessionType sessionType, String resourceUrl) {
    this.sessionType = sessionType;
    this.resourceUrl = resourceUrl;
    this.updatedAt = Instant.now();
  }

  public void updateAttendancePolicy(
      boolean attendanceRequired, String attendanceCode, Integer attendanceWindowMinutes) {
    this.attendanceRequired = attendanceRequired;
    this.attendanceCode = attendanceCode;
    this.attendanceWindowMinutes = attendanceWindowMinutes;
    this.updatedAt = Instant.now();
  }

  public void configureReminder(
      boolean reminderEnabled, Integer reminderLeadMinutes, ReminderChannel reminderChannel) {
    this.reminderEnabled = reminderEnabled;
    this.reminderLeadMinutes = reminderLeadMinutes;
    this.reminderChannel = reminderChannel;
    this.updatedAt = Instant.now();
  }

  public void markReminderScheduled(ReminderChannel channel, int leadMinutes) {
    this.reminderEnabled = true;
    this.reminderChannel = channel;
    this.reminderLeadMinutes = leadMinutes;
    this.reminderStatus = ReminderStatus.PENDING;
    this.updatedAt = Instant.now();
  }

  public void recordReminderStatus(ReminderStatus status, Instant sentAt) {
    this.reminderStatus = status;
    if (sentAt != null) {
      this.lastReminderSentAt = sentAt;
    }
    this.updatedAt = Instant.now();
  }

  public void clearReminder() {
    this.reminderEnabled = false;
    this.reminderLeadMinutes = null;
    this.reminderChannel = null;
    this.reminderStatus = null;
    this.updatedAt = Instant.now();
  }

  public void updateAttendanceCounts(int attendeeCount, int absenceCount) {
    this.attendeeCount = attendeeCount;
    this.absenceCount = absenceCount;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getCourseId() {
    return courseId;
  }

  public UUID getModuleId() {
    return moduleId;
  }

  public UUID getInstructorId() {
    return instructorId;
  }

  public String getTitle() {
    return title;
  }

  public Instant getSessionDate() {
    return sessionDate;
  }

  public Integer getDurationMinutes() {
    return durationMinutes;
  }

  public SessionStatus getStatus() {
    return status;
  }

  public String getNotes() {
    return notes;
  }

  public SessionType getSessionType() {
    return sessionType;
  }

  public String getResourceUrl() {
    return resourceUrl;
  }

  public boolean isAttendanceRequired() {
    return attendanceRequired;
  }

  public String getAttendanceCode() {
    return attendanceCode;
  }

  public Integer getAttendanceWindowMinutes() {
    return attendanceWindowMinutes;
  }

  public boolean isReminderEnabled() {
    return reminderEnabled;
  }

  public Integer getReminderLeadMinutes() {
    return reminderLeadMinutes;
  }

  public ReminderChannel getReminderChannel() {
    return reminderChannel;
  }

  public ReminderStatus getReminderStatus() {
    return reminderStatus;
  }

  public Instant getLastReminderSentAt() {
    return lastReminderSentAt;
  }

  public int getAttendeeCount() {
    return attendeeCount;
  }

  public int getAbsenceCount() {
    return absenceCount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
