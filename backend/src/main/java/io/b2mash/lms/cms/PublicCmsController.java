package io.b2mash.lms.cms;

import io.b2mash.lms.cms.dto.PublicCmsContentResponse;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated reads of published content. The tenant path segment is resolved and bound by
 * the tenant filter before this controller runs.
 */
@RestController
@RequestMapping("/api/public/tenants/{tenantId}/cms")
public class PublicCmsController {

  private final CmsContentService contentService;

  public PublicCmsController(CmsContentService contentService) {
    this.contentService = contentService;
  }

  @GetMapping
  public ResponseEntity<List<PublicCmsContentResponse>> list(
      @PathVariable String tenantId,
      @RequestParam(required = false) String section,
      @RequestParam(required = false) String locale) {
    return ResponseEntity.ok(contentService.listPublished(section, locale));
  }

  @GetMapping("/{slug}")
  public ResponseEntity<PublicCmsContentResponse> getBySlug(
      @PathVariable String tenantId,
      @PathVariable String slug,
      @RequestParam(defaultValue = "en") String locale) {
    return ResponseEntity.ok(contentService.getPublishedBySlug(slug, locale));
  }
}
