package io.b2mash.lms.cms;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** A block of tenant-site content. {@code version} counts edits and is not a lock column. */
@Entity
@Table(name = "cms_contents")
public class CmsContent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", length = 100)
  private String tenantId;

  @Column(name = "section", nullable = false, length = 100)
  private String section;

  @Column(name = "block_type", nullable = false, length = 100)
  private String blockType;

  @Column(name = "slug", length = 200)
  private String slug;

  @Column(name = "locale", nullable = false, length = 20)
  private String locale;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private CmsStatus status;

  @Column(name = "title", length = 300)
  private String title;

  @Column(name = "body", columnDefinition = "TEXT")
  private String body;

  @Column(name = "image_url", length = 1000)
  private String imageUrl;

  @Column(name = "excerpt", columnDefinition = "TEXT")
  private String excerpt;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tags", columnDefinition = "jsonb")
  private List<String> tags = new ArrayList<>();

  @Column(name = "ordering", nullable = false)
  private int ordering;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb")
  private Map<String, Object> metadata = new HashMap<>();

  @Column(name = "seo_title", length = 300)
  private String seoTitle;

  @Column(name = "seo_description", columnDefinition = "TEXT")
  private String seoDescription;

  @Column(name = "publish_at")
  private Instant publishAt;

  @Column(name = "unpublish_at")
  private Instant unpublishAt;

  @Column(name = "published_at")
  private Instant publishedAt;

  @Column(name = "published_by")
  private UUID publishedBy;

  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "is_public", nullable = false)
  private boolean isPublic;

  @Column(name = "preview_token", length = 64)
  private String previewToken;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CmsContent() {}

  public CmsContent(String tenantId, String section, String blockType, String locale) {
    this.tenantId = tenantId;
    this.section = section;
    this.blockType = blockType;
    this.locale = locale;
    this.status = CmsStatus.DRAFT;
    this.version = 1;
    this.isPublic = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateContent(
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
      Map<String, Object> metadata) {
    this.section = section;
    this.blockType = blockType;
    this.slug = slug;
    this.locale = locale;
    this.title = title;
    this.body = body;
    this.imageUrl = imageUrl;
    this.excerpt = excerpt;
    this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    this.ordering = ordering;
    this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
    this.updatedAt = Instant.now();
  }

  public void updatePresentation(
      String seoTitle,
      String seoDescription,
      Instant publishAt,
      Instant unpublishAt,
      boolean isPublic) {
    this.seoTitle = seoTitle;
    this.seoDescription = seoDescription;
    this.publishAt = publishAt;
    this.unpublishAt = unpublishAt;
    this.isPublic = isPublic;
    this.updatedAt = Instant.now();
  }

  public void incrementVersion() {
    this.version++;
    this.updatedAt = Instant.now();
  }

  /** Scheduled when {@code publishAt} is still ahead of {@code now}, otherwise live immediately. */
  public void publish(UUID actorId, Instant publishAt, Instant now) {
    if (publishAt != null && publishAt.isAfter(now)) {
      this.status = CmsStatus.SCHEDULED;
      this.publishAt = publishAt;
      this.publishedAt = null;
    } else {
      this.status = CmsStatus.PUBLISHED;
      this.publishAt = publishAt;
      this.publishedAt = now;
    }
    this.publishedBy = actorId;
    this.updatedAt = Instant.now();
  }

  public void unpublish() {
    this.status = CmsStatus.DRAFT;
    this.publishAt = null;
    this.unpublishAt = null;
    this.publishedAt = null;
    this.updatedAt = Instant.now();
  }

  public void archive() {
    this.status = CmsStatus.ARCHIVED;
    this.updatedAt = Instant.now();
  }

  public void assignPreviewToken(String previewToken) {
    this.previewToken = previewToken;
    this.updatedAt = Instant.now();
  }

  public boolean isArchived() {
    return status == CmsStatus.ARCHIVED;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getSection() {
    return section;
  }

  public String getBlockType() {
    return blockType;
  }

  public String getSlug() {
    return slug;
  }

  public String getLocale() {
    return locale;
  }

  public CmsStatus getStatus() {
    return status;
  }

  public String getTitle() {
    return title;
  }

  public String getBody() {
    return body;
  }

  public String getImageUrl() {
    return imageUrl;
  }

  public String getExcerpt() {
    return excerpt;
  }

  public List<String> getTags() {
    return tags;
  }

  public int getOrdering() {
    return ordering;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public String getSeoTitle() {
    return seoTitle;
  }

  public String getSeoDescription() {
    return seoDescription;
  }

  public Instant getPublishAt() {
    return publishAt;
  }

  public Instant getUnpublishAt() {
    return unpublishAt;
  }

  public Instant getPublishedAt() {
    return publishedAt;
  }

  public UUID getPublishedBy() {
    return publishedBy;
  }

  public int getVersion() {
    return version;
  }

  public boolean isPublic() {
    return isPublic;
  }

  public String getPreviewToken() {
    return previewToken;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
