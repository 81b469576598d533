package io.b2mash.lms.session;

import io.b2mash.lms.session.dto.CreateSessionRequest;
import io.b2mash.lms.session.dto.SessionResponse;
import io.b2mash.lms.session.dto.UpdateSessionRequest;
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
@RequestMapping("/api/tenant/courses/{courseId}/sessions")
@PreAuthorize("@rbac.allows(authentication, 'INSTRUCTOR')")
public class CourseSessionController {

  private final CourseSessionService sessionService;

  public CourseSessionController(CourseSessionService sessionService) {
    this.sessionService = sessionService;
  }

  @PostMapping
  public ResponseEntity<SessionResponse> create(
      @PathVariable UUID courseId, @Valid @RequestBody CreateSessionRequest request) {
    var response = sessionService.create(courseId, request);
    return ResponseEntity.created(
            URI.create("/api/tenant/courses/" + courseId + "/sessions/" + response.id()))
        .body(response);
  }

  @GetMapping
  public ResponseEntity<List<SessionResponse>> list(
      @PathVariable UUID courseId,
      @RequestParam(required = false) SessionStatus status,
      @RequestParam(required = false) SessionType sessionType) {
    return ResponseEntity.ok(sessionService.list(courseId, status, sessionType));
  }

  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> get(
      @PathVariable UUID courseId, @PathVariable UUID sessionId) {
    return ResponseEntity.ok(sessionService.get(courseId, sessionId));
  }

  @PatchMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> update(
      @PathVariable UUID courseId,
      @PathVariable UUID sessionId,
      @Valid @RequestBody UpdateSessionRequest request) {
    return ResponseEntity.ok(sessionService.update(courseId, sessionId, request));
  }

  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> delete(@PathVariable UUID courseId, @PathVariable UUID sessionId) {
    sessionService.delete(courseId, sessionId);
    return ResponseEntity.noContent().build();
  }
}
