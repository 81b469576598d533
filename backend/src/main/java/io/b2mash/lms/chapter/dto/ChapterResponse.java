package io.b2mash.lms.chapter.dto;

import io.b2mash.lms.chapter.Chapter;
import io.b2mash.lms.chapter.ChapterContentType;
import java.time.Instant;
import java.util.UUID;

public record ChapterResponse(
    UUID id,
    UUID moduleId,
    String title,
    String description,
    ChapterContentType contentType,
    String contentUrl,
    Integer durationMinutes,
    int ordering,
    Instant createdAt,
    Instant updatedAt) {

  public static ChapterResponse from(Chapter chapter) {
    return new ChapterResponse(
        chapter.getId(),
        chapter.getModuleId(),
        chapter.getTitle(),
        chapter.getDescription(),
        chapter.getContentType(),
        chapter.getContentUrl(),
        chapter.getDurationMinutes(),
        chapter.getOrdering(),
        chapter.getCreatedAt(),
        chapter.getUpdatedAt());
  }
}
