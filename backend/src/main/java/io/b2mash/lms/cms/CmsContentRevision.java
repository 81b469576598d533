package io.b2mash.lms.cms;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "cms_content_revisions")
public class CmsContentRevision {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "cms_content_id", nullable = false)
  private UUID cmsContentId;

  @Column(name = "tenant_id", length = 100)
  private String tenantId;

  @Column(name = "version", nullable = false)
  private int version;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "snapshot", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> snapshot;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CmsContentRevision() {}

  public CmsContentRevision(
      UUID cmsContentId,
      String tenantId,
      int version,
      Map<String, Object> snapshot,
      UUID createdBy) {
    this.cmsContentId = cmsContentId;
    this.tenantId = tenantId;
    this.version = version;
    this.snapshot = snapshot;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getCmsContentId() {
    return cmsContentId;
  }

  public String getTenantId() {
    return tenantId;
  }

  public int getVersion() {
    return version;
  }

  public Map<String, Object> getSnapshot() {
    return snapshot;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
