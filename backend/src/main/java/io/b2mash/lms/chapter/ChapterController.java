package io.b2mash.lms.chapter;

import io.b2mash.lms.chapter.dto.ChapterResponse;
import io.b2mash.lms.chapter.dto.CreateChapterRequest;
import io.b2mash.lms.chapter.dto.UpdateChapterRequest;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenant/modules/{moduleId}/chapters")
@PreAuthorize("@rbac.allows(authentication, 'INSTRUCTOR')")
public class ChapterController {

  private final ChapterService chapterService;

  public ChapterController(ChapterService chapterService) {
    this.chapterService = chapterService;
  }

  @PostMapping
  public ResponseEntity<ChapterResponse> create(
      @PathVariable UUID moduleId, @Valid @RequestBody CreateChapterRequest request) {
    var response = chapterService.create(moduleId, request);
    return ResponseEntity.created(
            URI.create("/api/tenant/modules/" + moduleId + "/chapters/" + response.id()))
        .body(response);
  }

  @GetMapping
  public ResponseEntity<List<ChapterResponse>> list(@PathVariable UUID moduleId) {
    return ResponseEntity.ok(chapterService.list(moduleId));
  }

  @GetMapping("/{chapterId}")
  public ResponseEntity<ChapterResponse> get(
      @PathVariable UUID moduleId, @PathVariable UUID chapterId) {
    return ResponseEntity.ok(chapterService.get(moduleId, chapterId));
  }

  @PatchMapping("/{chapterId}")
  public ResponseEntity<ChapterResponse> update(
      @PathVariable UUID moduleId,
      @PathVariable UUID chapterId,
      @Valid @RequestBody UpdateChapterRequest request) {
    return ResponseEntity.ok(chapterService.update(moduleId, chapterId, request));
  }

  @DeleteMapping("/{chapterId}")
  public ResponseEntity<Void> delete(@PathVariable UUID moduleId, @PathVariable UUID chapterId) {
    chapterService.delete(moduleId, chapterId);
    return ResponseEntity.noContent().build();
  }
}
