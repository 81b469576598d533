package io.b2mash.lms.cms;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CmsContentRepository extends JpaRepository<CmsContent, UUID> {

  @Query(
      """
      SELECT c FROM CmsContent c
      WHERE c.tenantId = :tenantId
        AND (:section IS NULL OR c.section = :section)
        AND (:status IS NULL OR c.status = :status)
        AND (:locale IS NULL OR c.locale = :locale)
      ORDER BY c.ordering ASC, c.updatedAt DESC
      """)
  List<CmsContent> findByTenant(
      @Param("tenantId") String tenantId,
      @Param("section") String section,
      @Param("status") CmsStatus status,
      @Param("locale") String locale);

  boolean existsByTenantIdAndSlugAndLocale(String tenantId, String slug, String locale);

  boolean existsByTenantIdAndSlugAndLocaleAndIdNot(
      String tenantId, String slug, String locale, UUID id);

  /** Content a public visitor may see at {@code now}. */
  @Query(
      """
      SELECT c FROM CmsContent c
      WHERE c.tenantId = :tenantId
        AND c.status = io.b2mash.lms.cms.CmsStatus.PUBLISHED
        AND c.isPublic = true
        AND (c.publishAt IS NULL OR c.publishAt <= :now)
        AND (c.unpublishAt IS NULL OR c.unpublishAt > :now)
        AND (:section IS NULL OR c.section = :section)
        AND (:locale IS NULL OR c.locale = :locale)
      ORDER BY c.ordering ASC, c.createdAt DESC
      """)
  List<CmsContent> findVisible(
      @Param("tenantId") String tenantId,
      @Param("now") Instant now,
      @Param("section") String section,
      @Param("locale") String locale);

  @Query(
      """
      SELECT c FROM CmsContent c
      WHERE c.tenantId = :tenantId
        AND c.slug = :slug
        AND c.locale = :locale
        AND c.status = io.b2mash.lms.cms.CmsStatus.PUBLISHED
        AND c.isPublic = true
        AND (c.publishAt IS NULL OR c.publishAt <= :now)
        AND (c.unpublishAt IS NULL OR c.unpublishAt > :now)
      """)
  Optional<CmsContent> findVisibleBySlug(
      @Param("tenantId") String tenantId,
      @Param("slug") String slug,
      @Param("locale") String locale,
      @Param("now") Instant now);
}
