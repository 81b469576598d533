package io.b2mash.lms.attendance.dto;

import io.b2mash.lms.attendance.AttendanceStatus;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

public record RecordAttendanceRequest(
    @NotNull(message = "userId is required") UUID userId,
    AttendanceStatus status,
    Instant checkInAt,
    Instant checkOutAt,
    String notes) {}
