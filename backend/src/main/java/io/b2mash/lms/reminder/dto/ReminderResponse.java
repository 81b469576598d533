package io.b2mash.lms.reminder.dto;

import io.b2mash.lms.reminder.ReminderChannel;
import io.b2mash.lms.reminder.ReminderStatus;
import io.b2mash.lms.reminder.SessionReminder;
import java.time.Instant;
import java.util.UUID;

public record ReminderResponse(
    UUID id,
    UUID sessionId,
    ReminderChannel channel,
    Instant sendAt,
    ReminderStatus status,
    int attemptCount,
    Instant lastAttemptAt,
    String lastError,
    Instant createdAt,
    Instant updatedAt) {

  public static ReminderResponse from(SessionReminder reminder) {
    return new ReminderResponse(
        reminder.getId(),
        reminder.getSessionId(),
        reminder.getChannel(),
        reminder.getSendAt(),
        reminder.getStatus(),
        reminder.getAttemptCount(),
        reminder.getLastAttemptAt(),
        reminder.getLastError(),
        reminder.getCreatedAt(),
        reminder.getUpdatedAt());
  }
}
