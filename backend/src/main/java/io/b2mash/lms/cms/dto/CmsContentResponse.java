package io.b2mash.lms.cms.dto;

import io.b2mash.lms.cms.CmsContent;
import io.b2mash.lms.cms.CmsStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record CmsContentResponse(
    UUID id,
    String tenantId,
    String section,
    String blockType,
    String slug,
    String locale,
    CmsStatus status,
    String title,
    String body,
    String imageUrl,
    String excerpt,
    List<String> tags,
    int ordering,
    Map<String, Object> metadata,
    String seoTitle,
    String seoDescription,
    Instant publishAt,
    Instant unpublishAt,
    Instant publishedAt,
    UUID publishedBy,
    int version,
    boolean isPublic,
    String previewToken,
    Instant createdAt,
    Instant updatedAt) {

  public static CmsContentResponse from(CmsContent content) {
    return new CmsContentResponse(
        content.getId(),
        content.getTenantId(),
        content.getSection(),
        content.getBlockType(),
        content.getSlug(),
        content.getLocale(),
        content.getStatus(),
        content.getTitle(),
        content.getBody(),
        content.getImageUrl(),
        content.getExcerpt(),
        content.getTags() != null ? List.copyOf(content.getTags()) : List.of(),
        content.getOrdering(),
        content.getMetadata() != null ? content.getMetadata() : Map.of(),
        content.getSeoTitle(),
        content.getSeoDescription(),
        content.getPublishAt(),
        content.getUnpublishAt(),
        content.getPublishedAt(),
        content.getPublishedBy(),
        content.getVersion(),
        content.isPublic(),
        content.getPreviewToken(),
        content.getCreatedAt(),
        content.getUpdatedAt());
  }
}
