package io.b2mash.lms.coursemodule.dto;

import io.b2mash.lms.coursemodule.CourseModule;
import java.time.Instant;
import java.util.UUID;

public record ModuleResponse(
    UUID id,
    UUID courseId,
    String title,
    String description,
    int ordering,
    Instant createdAt,
    Instant updatedAt) {

  public static ModuleResponse from(CourseModule module) {
    return new ModuleResponse(
        module.getId(),
        module.getCourseId(),
        module.getTitle(),
        module.getDescription(),
        module.getOrdering(),
        module.getCreatedAt(),
        module.getUpdatedAt());
  }
}
