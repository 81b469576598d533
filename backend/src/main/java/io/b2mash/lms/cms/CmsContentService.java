package io.b2mash.lms.cms;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.lms.cms.dto.CmsContentResponse;
import io.b2mash.lms.cms.dto.CmsRevisionResponse;
import io.b2mash.lms.cms.dto.CreateCmsContentRequest;
import io.b2mash.lms.cms.dto.PublicCmsContentResponse;
import io.b2mash.lms.cms.dto.UpdateCmsContentRequest;
import io.b2mash.lms.exception.InvalidStateException;
import io.b2mash.lms.exception.ResourceNotFoundException;
import io.b2mash.lms.multitenancy.TenantContext;
import io.b2mash.lms.ownership.TenantOwnershipGuard;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CmsContentService {

  private static final Logger log = LoggerFactory.getLogger(CmsContentService.class);

  static final String DEFAULT_LOCALE = "en";
  private static final int PREVIEW_TOKEN_BYTES = 12;
  private static final TypeReference<Map<String, Object>> SNAPSHOT_TYPE = new TypeReference<>() {};

  private final CmsContentRepository contentRepository;
  private final CmsContentRevisionRepository revisionRepository;
  private final TenantOwnershipGuard ownershipGuard;
  private final ObjectMapper objectMapper;
  private final SecureRandom secureRandom = new SecureRandom();

  public CmsContentService(
      CmsContentRepository contentRepository,
      CmsContentRevisionRepository revisionRepository,
      TenantOwnershipGuard ownershipGuard,
      ObjectMapper objectMapper) {
    this.contentRepository = contentRepository;
    this.revisionRepository = revisionRepository;
    this.ownershipGuard = ownershipGuard;
    this.objectMapper = objectMapper;
  }

  @Transactional
  public CmsContentResponse create(CreateCmsContentRequest request, UUID actorId) {
    String tenantId = TenantContext.requireTenantId();
    String locale = normalizeLocale(request.locale());
    String slug = normalizeSlug(request.slug());
    ensureSlugAvailable(tenantId, slug, locale, null);

    var content =
        new CmsContent(tenantId, request.section().trim(), request.blockType().trim(), locale);
    content.updateContent(
        request.section().trim(),
        request.blockType().trim(),
        slug,
        locale,
        request.title(),
        request.body(),
        request.imageUrl(),
        request.excerpt(),
        cleanTags(request.tags()),
        request.ordering() != null ? request.ordering() : 0,
        request.metadata());
    content.updatePresentation(
        request.seoTitle(),
        request.seoDescription(),
        request.publishAt(),
        request.unpublishAt(),
        request.isPublic() == null || request.isPublic());
    content.assignPreviewToken(newPreviewToken());
    content = contentRepository.save(content);
    saveRevision(content, actorId);

    log.info(
        "Created CMS content: id={}, section={}, slug={}",
        content.getId(),
        content.getSection(),
        content.getSlug());
    return CmsContentResponse.from(content);
  }

  @Transactional(readOnly = true)
  public List<CmsContentResponse> list(String section, CmsStatus status, String locale) {
    return contentRepository
        .findByTenant(TenantContext.requireTenantId(), section, status, locale)
        .stream()
        .map(CmsContentResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public CmsContentResponse get(UUID contentId) {
    return CmsContentResponse.from(requireContent(contentId));
  }

  @Transactional
  public CmsContentResponse update(UUID contentId, UpdateCmsContentRequest request, UUID actorId) {
    var content = requireContent(contentId);

    String locale =
        request.locale() != null ? normalizeLocale(request.locale()) : content.getLocale();
    String slug = request.slug() != null ? normalizeSlug(request.slug()) : content.getSlug();
    if (request.slug() != null || request.locale() != null) {
      ensureSlugAvailable(content.getTenantId(), slug, locale, contentId);
    }

    content.updateContent(
        request.section() != null ? request.section().trim() : content.getSection(),
        request.blockType() != null ? request.blockType().trim() : content.getBlockType(),
        slug,
        locale,
        request.title() != null ? request.title() : content.getTitle(),
        request.body() != null ? request.body() : content.getBody(),
        request.imageUrl() != null ? request.imageUrl() : content.getImageUrl(),
        request.excerpt() != null ? request.excerpt() : content.getExcerpt(),
        request.tags() != null ? cleanTags(request.tags()) : content.getTags(),
        request.ordering() != null ? request.ordering() : content.getOrdering(),
        request.metadata() != null ? request.metadata() : content.getMetadata());
    content.updatePresentation(
        request.seoTitle() != null ? request.seoTitle() : content.getSeoTitle(),
        request.seoDescription() != null ? request.seoDescription() : content.getSeoDescription(),
        request.publishAt() != null ? request.publishAt() : content.getPublishAt(),
        request.unpublishAt() != null ? request.unpublishAt() : content.getUnpublishAt(),
        request.isPublic() != null ? request.isPublic() : content.isPublic());
    content.incrementVersion();
    content = contentRepository.save(content);
    saveRevision(content, actorId);

    log.info("Updated CMS content: id={}, version={}", content.getId(), content.getVersion());
    return CmsContentResponse.from(content);
  }

  @Transactional
  public CmsContentResponse publish(UUID contentId, Instant publishAt, UUID actorId) {
    var content = requireContent(contentId);
    if (content.isArchived()) {
      throw new InvalidStateException(
          "Cannot publish content", "Archived content cannot be published");
    }
    content.publish(actorId, publishAt, Instant.now());
    content = contentRepository.save(content);
    saveRevision(content, actorId);

    log.info("Published CMS content: id={}, status={}", content.getId(), content.getStatus());
    return CmsContentResponse.from(content);
  }

  /** Returns archived content unchanged. */
  @Transactional
  public CmsContentResponse unpublish(UUID contentId, UUID actorId) {
    var content = requireContent(contentId);
    if (content.isArchived()) {
      return CmsContentResponse.from(content);
    }
    content.unpublish();
    content = contentRepository.save(content);
    saveRevision(content, actorId);

    log.info("Unpublished CMS content: id={}", content.getId());
    return CmsContentResponse.from(content);
  }

  @Transactional
  public void archive(UUID contentId, UUID actorId) {
    var content = requireContent(contentId);
    if (content.isArchived()) {
      return;
    }
    content.archive();
    content = contentRepository.save(content);
    saveRevision(content, actorId);

    log.info("Archived CMS content: id={}", content.getId());
  }

  @Transactional
  public String regeneratePreviewToken(UUID contentId) {
    var content = requireContent(contentId);
    String token = newPreviewToken();
    content.assignPreviewToken(token);
    contentRepository.save(content);
    log.info("Regenerated preview token: contentId={}", contentId);
    return token;
  }

  @Transactional(readOnly = true)
  public List<CmsRevisionResponse> revisions(UUID contentId) {
    requireContent(contentId);
    return revisionRepository.findByCmsContentIdOrderByVersionDescCreatedAtDesc(contentId).stream()
        .map(CmsRevisionResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public List<PublicCmsContentResponse> listPublished(String section, String locale) {
    return contentRepository
        .findVisible(TenantContext.requireTenantId(), Instant.now(), section, locale)
        .stream()
        .map(PublicCmsContentResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public PublicCmsContentResponse getPublishedBySlug(String slug, String locale) {
    String normalizedSlug = normalizeSlug(slug);
    String normalizedLocale = normalizeLocale(locale);
    return contentRepository
        .findVisibleBySlug(
            TenantContext.requireTenantId(), normalizedSlug, normalizedLocale, Instant.now())
        .map(PublicCmsContentResponse::from)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Content not found", "No published content found with slug " + slug));
  }

  static String normalizeSlug(String slug) {
    if (slug == null || slug.isBlank()) {
      return null;
    }
    return slug.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
  }

  static List<String> cleanTags(List<String> tags) {
    if (tags == null) {
      return List.of();
    }
    return tags.stream()
        .filter(tag -> tag != null && !tag.isBlank())
        .map(String::trim)
        .toList();
  }

  private static String normalizeLocale(String locale) {
    return locale == null || locale.isBlank() ? DEFAULT_LOCALE : locale.trim();
  }

  private CmsContent requireContent(UUID contentId) {
    var content =
        contentRepository
            .findById(contentId)
            .orElseThrow(() -> new ResourceNotFoundException("Content", contentId));
    ownershipGuard.requireTenant("CmsContent", contentId, content.getTenantId());
    return content;
  }

  private void ensureSlugAvailable(String tenantId, String slug, String locale, UUID excludeId) {
    if (slug == null) {
      return;
    }
    boolean inUse =
        excludeId == null
            ? contentRepository.existsByTenantIdAndSlugAndLocale(tenantId, slug, locale)
            : contentRepository.existsByTenantIdAndSlugAndLocaleAndIdNot(
                tenantId, slug, locale, excludeId);
    if (inUse) {
      throw new InvalidStateException(
          "Slug already in use", "Slug '" + slug + "' is already in use for locale " + locale);
    }
  }

  private void saveRevision(CmsContent content, UUID actorId) {
    Map<String, Object> snapshot =
        objectMapper.convertValue(CmsContentResponse.from(content), SNAPSHOT_TYPE);
    snapshot.remove("id");
    var revision =
        revisionRepository.save(
            new CmsContentRevision(
                content.getId(), content.getTenantId(), content.getVersion(), snapshot, actorId));
    log.debug(
        "Saved CMS revision: contentId={}, version={}", content.getId(), revision.getVersion());
  }

  private String newPreviewToken() {
    byte[] bytes = new byte[PREVIEW_TOKEN_BYTES];
    secureRandom.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}
