package io.b2mash.lms.cms;

import io.b2mash.lms.cms.dto.CmsContentResponse;
import io.b2mash.lms.cms.dto.CmsRevisionResponse;
import io.b2mash.lms.cms.dto.CreateCmsContentRequest;
import io.b2mash.lms.cms.dto.PreviewTokenResponse;
import io.b2mash.lms.cms.dto.PublishCmsContentRequest;
import io.b2mash.lms.cms.dto.UpdateCmsContentRequest;
import io.b2mash.lms.security.CurrentUser;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenant/cms/contents")
@PreAuthorize("@rbac.allows(authentication, 'TENANT_ADMIN')")
public class CmsContentController {

  private final CmsContentService contentService;

  public CmsContentController(CmsContentService contentService) {
    this.contentService = contentService;
  }

  @PostMapping
  public ResponseEntity<CmsContentResponse> create(
      @Valid @RequestBody CreateCmsContentRequest request) {
    var response = contentService.create(request, CurrentUser.require().userId());
    return ResponseEntity.created(URI.create("/api/tenant/cms/contents/" + response.id()))
        .body(response);
  }

  @GetMapping
  public ResponseEntity<List<CmsContentResponse>> list(
      @RequestParam(required = false) String section,
      @RequestParam(required = false) CmsStatus status,
      @RequestParam(required = false) String locale) {
    return ResponseEntity.ok(contentService.list(section, status, locale));
  }

  @GetMapping("/{id}")
  public ResponseEntity<CmsContentResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(contentService.get(id));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<CmsContentResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateCmsContentRequest request) {
    return ResponseEntity.ok(contentService.update(id, request, CurrentUser.require().userId()));
  }

  @PostMapping("/{id}/publish")
  public ResponseEntity<CmsContentResponse> publish(
      @PathVariable UUID id, @RequestBody(required = false) PublishCmsContentRequest request) {
    var publishAt = request != null ? request.publishAt() : null;
    return ResponseEntity.ok(
        contentService.publish(id, publishAt, CurrentUser.require().userId()));
  }

  @PostMapping("/{id}/unpublish")
  public ResponseEntity<CmsContentResponse> unpublish(@PathVariable UUID id) {
    return ResponseEntity.ok(contentService.unpublish(id, CurrentUser.require().userId()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> archive(@PathVariable UUID id) {
    contentService.archive(id, CurrentUser.require().userId());
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/preview-token")
  public ResponseEntity<PreviewTokenResponse> previewToken(@PathVariable UUID id) {
    return ResponseEntity.ok(new PreviewTokenResponse(contentService.regeneratePreviewToken(id)));
  }

  @GetMapping("/{id}/revisions")
  public ResponseEntity<List<CmsRevisionResponse>> revisions(@PathVariable UUID id) {
    return ResponseEntity.ok(contentService.revisions(id));
  }
}
