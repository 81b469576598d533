package io.b2mash.lms.session.dto;

import io.b2mash.lms.reminder.ReminderChannel;
import io.b2mash.lms.session.SessionStatus;
import io.b2mash.lms.session.SessionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;

public record CreateSessionRequest(
    @NotNull(message = "userId is required") UUID userId,
    UUID moduleId,
    @Size(max = 300) String title,
    @NotNull(message = "sessionDate is required") Instant sessionDate,
    @PositiveOrZero Integer durationMinutes,
    SessionStatus status,
    String notes,
    SessionType sessionType,
    @Size(max = 1000) String resourceUrl,
    Boolean attendanceRequired,
    @Size(max = 50) String attendanceCode,
    @PositiveOrZero Integer attendanceWindowMinutes,
    Boolean reminderEnabled,
    @PositiveOrZero Integer reminderLeadMinutes,
    ReminderChannel reminderChannel) {}
