package io.b2mash.lms.reminder;

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

/** A scheduled reminder for a session. Delivery happens elsewhere; this row only tracks state. */
@Entity
@Table(name = "session_reminders")
public class SessionReminder {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "session_id", nullable = false)
  private UUID sessionId;

  @Enumerated(EnumType.STRING)
  @Column(name = "channel", nullable = false, length = 20)
  private ReminderChannel channel;

  @Column(name = "send_at", nullable = false)
  private Instant sendAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ReminderStatus status;

  @Column(name = "attempt_count", nullable = false)
  private int attemptCount;

  @Column(name = "last_attempt_at")
  private Instant lastAttemptAt;

  @Column(name = "last_error", columnDefinition = "TEXT")
  private String lastError;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SessionReminder() {}

  public SessionReminder(UUID sessionId, ReminderChannel channel, Instant sendAt) {
    this.sessionId = sessionId;
    this.channel = channel;
    this.sendAt = sendAt;
    this.status = ReminderStatus.PENDING;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void recordAttempt(
      ReminderStatus status, int attemptCount, Instant lastAttemptAt, String lastError) {
    this.status = status;
    this.attemptCount = attemptCount;
    this.lastAttemptAt = lastAttemptAt;
    this.lastError = lastError;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getSessionId() {
    return sessionId;
  }

  public ReminderChannel getChannel() {
    return channel;
  }

  public Instant getSendAt() {
    return sendAt;
  }

  public ReminderStatus getStatus() {
    return status;
  }

  public int getAttemptCount() {
    return attemptCount;
  }

  public Instant getLastAttemptAt() {
    return lastAttemptAt;
  }

  public String getLastError() {
    return lastError;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
