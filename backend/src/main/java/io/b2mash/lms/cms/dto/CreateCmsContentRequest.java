package io.b2mash.lms.cms.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CreateCmsContentRequest(
    @NotBlank(message = "section is required") @Size(max = 100) String section,
    @NotBlank(message = "blockType is required") @Size(max = 100) String blockType,
    @Size(max = 200) String slug,
    @Size(max = 20) String locale,
    @Size(max = 300) String title,
    String body,
    @Size(max = 1000) String imageUrl,
    String excerpt,
    List<String> tags,
    @PositiveOrZero Integer ordering,
    Map<String, Object> metadata,
    @Size(max = 300) String seoTitle,
    String seoDescription,
    Instant publishAt,
    Instant unpublishAt,
    Boolean isPublic) {}
