package io.b2mash.lms.course.dto;

import io.b2mash.lms.course.CourseStatus;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/** Partial update: null fields keep their current value. */
public record UpdateCourseRequest(
    @Size(min = 1, max = 300) String title,
    String description,
    @Size(max = 100) String category,
    @Size(max = 50) String level,
    @Size(max = 50) String language,
    @Size(max = 500) String thumbnailUrl,
    @PositiveOrZero BigDecimal price,
    @PositiveOrZero BigDecimal salePrice,
    @Size(min = 3, max = 3) String currency,
    CourseStatus status,
    LocalDate startDate,
    LocalDate endDate,
    UUID instructorId) {}
