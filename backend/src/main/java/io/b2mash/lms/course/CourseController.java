package io.b2mash.lms.course;

import io.b2mash.lms.course.dto.CourseResponse;
import io.b2mash.lms.course.dto.CreateCourseRequest;
import io.b2mash.lms.course.dto.UpdateCourseRequest;
import io.b2mash.lms.security.CurrentUser;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenant/courses")
@PreAuthorize("@rbac.allows(authentication, 'TENANT_ADMIN')")
public class CourseController {

  private final CourseService courseService;

  public CourseController(CourseService courseService) {
    this.courseService = courseService;
  }

  @PostMapping
  public ResponseEntity<CourseResponse> create(@Valid @RequestBody CreateCourseRequest request) {
    var response = courseService.create(request, CurrentUser.require());
    return ResponseEntity.created(URI.create("/api/tenant/courses/" + response.id()))
        .body(response);
  }

  @GetMapping
  public ResponseEntity<List<CourseResponse>> list(
      @RequestParam(required = false) CourseStatus status) {
    return ResponseEntity.ok(courseService.list(status));
  }

  @GetMapping("/{courseId}")
  public ResponseEntity<CourseResponse> get(@PathVariable UUID courseId) {
    return ResponseEntity.ok(courseService.get(courseId));
  }

  @PatchMapping("/{courseId}")
  public ResponseEntity<CourseResponse> update(
      @PathVariable UUID courseId, @Valid @RequestBody UpdateCourseRequest request) {
    return ResponseEntity.ok(courseService.update(courseId, request));
  }
}
