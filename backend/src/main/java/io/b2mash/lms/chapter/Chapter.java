package io.b2mash.lms.chapter;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "chapters")
public class Chapter {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "module_id", nullable = false)
  private UUID moduleId;

  @Column(name = "title", nullable = false, length = 300)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "content_type", nullable = false, length = 20)
  private ChapterContentType contentType;

  @Column(name = "content_url", length = 1000)
  private String contentUrl;

  @Column(name = "duration_minutes")
  private Integer durationMinutes;

  @Column(name = "ordering", nullable = false)
  private int ordering;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Chapter() {}

  public Chapter(UUID moduleId, String title) {
    this.moduleId = moduleId;
    this.title = title;
    this.contentType = ChapterContentType.RECORDED;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(
      String title,
      String description,
      ChapterContentType contentType,
      String contentUrl,
      Integer durationMinutes,
      int ordering) {
    this.title = title;
    this.description = description;
    this.contentType = contentType;
    this.contentUrl = contentUrl;
    this.durationMinutes = durationMinutes;
    this.ordering = ordering;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getModuleId() {
    return moduleId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public ChapterContentType getContentType() {
    return contentType;
  }

  public String getContentUrl() {
    return contentUrl;
  }

  public Integer getDurationMinutes() {
    return durationMinutes;
  }

  public int getOrdering() {
    return ordering;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
