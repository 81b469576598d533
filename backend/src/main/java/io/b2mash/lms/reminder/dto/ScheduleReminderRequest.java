package io.b2mash.lms.reminder.dto;

import io.b2mash.lms.reminder.ReminderChannel;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record ScheduleReminderRequest(
    ReminderChannel channel, @NotNull(message = "sendAt is required") Instant sendAt) {}
