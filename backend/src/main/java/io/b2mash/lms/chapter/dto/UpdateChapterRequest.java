package io.b2mash.lms.chapter.dto;

import io.b2mash.lms.chapter.ChapterContentType;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record UpdateChapterRequest(
    @Size(min = 1, max = 300) String title,
    String description,
    ChapterContentType contentType,
    @Size(max = 1000) String contentUrl,
    @PositiveOrZero(message = "durationMinutes must not be negative") Integer durationMinutes,
    @PositiveOrZero Integer ordering) {}
