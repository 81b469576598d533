package io.b2mash.lms.reminder.dto;

import io.b2mash.lms.reminder.ReminderStatus;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Instant;

public record UpdateReminderRequest(
    ReminderStatus status,
    @PositiveOrZero Integer attemptCount,
    Instant lastAttemptAt,
    String lastError) {}
