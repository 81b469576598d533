package io.b2mash.lms.course.dto;

import io.b2mash.lms.course.Course;
import io.b2mash.lms.course.CourseStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record CourseResponse(
    UUID id,
    String tenantId,
    String title,
    String description,
    String category,
    String level,
    String language,
    String thumbnailUrl,
    BigDecimal price,
    BigDecimal salePrice,
    String currency,
    BigDecimal platformFee,
    CourseStatus status,
    LocalDate startDate,
    LocalDate endDate,
    UUID instructorId,
    UUID createdBy,
    Instant createdAt,
    Instant updatedAt) {

  public static CourseResponse from(Course course) {
    return new CourseResponse(
        course.getId(),
        course.getTenantId(),
        course.getTitle(),
        course.getDescription(),
        course.getCategory(),
        course.getLevel(),
        course.getLanguage(),
        course.getThumbnailUrl(),
        course.getPrice(),
        course.getSalePrice(),
        course.getCurrency(),
        course.getPlatformFee(),
        course.getStatus(),
        course.getStartDate(),
        course.getEndDate(),
        course.getInstructorId(),
        course.getCreatedBy(),
        course.getCreatedAt(),
        course.getUpdatedAt());
  }
}
