package io.b2mash.lms.attendance;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "session_attendance",
    uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "user_id"}))
public class SessionAttendance {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "session_id", nullable = false)
  private UUID sessionId;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private AttendanceStatus status;

  @Column(name = "check_in_at")
  private Instant checkInAt;

  @Column(name = "check_out_at")
  private Instant checkOutAt;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SessionAttendance() {}

  public SessionAttendance(UUID sessionId, UUID userId) {
    this.sessionId = sessionId;
    this.userId = userId;
    this.status = AttendanceStatus.PENDING;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void record(
      AttendanceStatus status, Instant checkInAt, Instant checkOutAt, String notes) {
    this.status = status;
    this.checkInAt = checkInAt;
    this.checkOutAt = checkOutAt;
    this.notes = notes;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getSessionId() {
    return sessionId;
  }

  public UUID getUserId() {
    return userId;
  }

  public AttendanceStatus getStatus() {
    return status;
  }

  public Instant getCheckInAt() {
    return checkInAt;
  }

  public Instant getCheckOutAt() {
    return checkOutAt;
  }

  public String getNotes() {
    return notes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
