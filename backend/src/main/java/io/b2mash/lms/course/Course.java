package io.b2mash.lms.course;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** Root of the ownership chain: modules, chapters and sessions inherit this course's tenant. */
@Entity
@Table(name = "courses")
public class Course {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", length = 100)
  private String tenantId;

  @Column(name = "title", nullable = false, length = 300)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "category", length = 100)
  private String category;

  @Column(name = "level", length = 50)
  private String level;

  @Column(name = "language", length = 50)
  private String language;

  @Column(name = "thumbnail_url", length = 500)
  private String thumbnailUrl;

  @Column(name = "price", precision = 12, scale = 2)
  private BigDecimal price;

  @Column(name = "sale_price", precision = 12, scale = 2)
  private BigDecimal salePrice;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "platform_fee", precision = 12, scale = 2)
  private BigDecimal platformFee;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private CourseStatus status;

  @Column(name = "start_date")
  private LocalDate startDate;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "instructor_id")
  private UUID instructorId;

  @Column(name = "created_by", nullable = false)
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Course() {}

  public Course(String tenantId, String title, UUID createdBy) {
    this.tenantId = tenantId;
    this.title = title;
    this.createdBy = createdBy;
    this.status = CourseStatus.DRAFT;
    this.currency = "USD";
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateDetails(
      String title,
      String description,
      String category,
      String level,
      String language,
      String thumbnailUrl) {
    this.title = title;
    this.description = description;
    this.category = category;
    this.level = level;
    this.language = language;
    this.thumbnailUrl = thumbnailUrl;
    this.updatedAt = Instant.now();
  }

  /** Updates pricing and recomputes the platform fee from the new amounts. */
  public void updatePricing(BigDecimal price, BigDecimal salePrice, String currency) {
    this.price = price;
    this.salePrice = salePrice;
    this.currency = currency;
    this.platformFee = PlatformFeeCalculator.feeFor(price, salePrice);
    this.updatedAt = Instant.now();
  }

  public void schedule(LocalDate startDate, LocalDate endDate) {
    this.startDate = startDate;
    this.endDate = endDate;
    this.updatedAt = Instant.now();
  }

  public void changeStatus(CourseStatus status) {
    this.status = status;
    this.updatedAt = Instant.now();
  }

  public void assignInstructor(UUID instructorId) {
    this.instructorId = instructorId;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public String getCategory() {
    return category;
  }

  public String getLevel() {
    return level;
  }

  public String getLanguage() {
    return language;
  }

  public String getThumbnailUrl() {
    return thumbnailUrl;
  }

  public BigDecimal getPrice() {
    return price;
  }

  public BigDecimal getSalePrice() {
    return salePrice;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getPlatformFee() {
    return platformFee;
  }

  public CourseStatus getStatus() {
    return status;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public UUID getInstructorId() {
    return instructorId;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
