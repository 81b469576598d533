package io.b2mash.lms.coursemodule;

import io.b2mash.lms.coursemodule.dto.CreateModuleRequest;
import io.b2mash.lms.coursemodule.dto.ModuleResponse;
import io.b2mash.lms.coursemodule.dto.UpdateModuleRequest;
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
@RequestMapping("/api/tenant/courses/{courseId}/modules")
@PreAuthorize("@rbac.allows(authentication, 'INSTRUCTOR')")
public class CourseModuleController {

  private final CourseModuleService moduleService;

  public CourseModuleController(CourseModuleService moduleService) {
    this.moduleService = moduleService;
  }

  @PostMapping
  public ResponseEntity<ModuleResponse> create(
      @PathVariable UUID courseId, @Valid @RequestBody CreateModuleRequest request) {
    var response = moduleService.create(courseId, request);
    return ResponseEntity.created(
            URI.create("/api/tenant/courses/" + courseId + "/modules/" + response.id()))
        .body(response);
  }

  @GetMapping
  public ResponseEntity<List<ModuleResponse>> list(@PathVariable UUID courseId) {
    return ResponseEntity.ok(moduleService.list(courseId));
  }

  @GetMapping("/{moduleId}")
  public ResponseEntity<ModuleResponse> get(
      @PathVariable UUID courseId, @PathVariable UUID moduleId) {
    return ResponseEntity.ok(moduleService.get(courseId, moduleId));
  }

  @PatchMapping("/{moduleId}")
  public ResponseEntity<ModuleResponse> update(
      @PathVariable UUID courseId,
      @PathVariable UUID moduleId,
      @Valid @RequestBody UpdateModuleRequest request) {
    return ResponseEntity.ok(moduleService.update(courseId, moduleId, request));
  }

  @DeleteMapping("/{moduleId}")
  public ResponseEntity<Void> delete(@PathVariable UUID courseId, @PathVariable UUID moduleId) {
    moduleService.delete(courseId, moduleId);
    return ResponseEntity.noContent().build();
  }
}
