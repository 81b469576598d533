package io.b2mash.lms.cms.dto;

import io.b2mash.lms.cms.CmsContent;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Visitor view of published content. Editorial fields stay private. */
public record PublicCmsContentResponse(
    UUID id,
    String section,
    String blockType,
    String slug,
    String locale,
    String title,
    String body,
    String imageUrl,
    String excerpt,
    List<String> tags,
    int ordering,
    Map<String, Object> metadata,
    String seoTitle,
    String seoDescription,
    Instant publishedAt,
    Instant updatedAt) {

  public static PublicCmsContentResponse from(CmsContent content) {
    return new PublicCmsContentResponse(
        content.getId(),
        content.getSection(),
        content.getBlockType(),
        content.getSlug(),
        content.getLocale(),
        content.getTitle(),
        content.getBody(),
        content.getImageUrl(),
        content.getExcerpt(),
        content.getTags() != null ? List.copyOf(content.getTags()) : List.of(),
        content.getOrdering(),
        content.getMetadata() != null ? content.getMetadata() : Map.of(),
        content.getSeoTitle(),
        content.getSeoDescription(),
        content.getPublishedAt(),
        content.getUpdatedAt());
  }
}
