package io.b2mash.lms.attendance;

import io.b2mash.lms.attendance.dto.AttendanceResponse;
import io.b2mash.lms.attendance.dto.RecordAttendanceRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenant/sessions/{sessionId}/attendance")
@PreAuthorize("@rbac.allows(authentication, 'INSTRUCTOR')")
public class SessionAttendanceController {

  private final SessionAttendanceService attendanceService;

  public SessionAttendanceController(SessionAttendanceService attendanceService) {
    this.attendanceService = attendanceService;
  }

  @PostMapping
  public ResponseEntity<AttendanceResponse> record(
      @PathVariable UUID sessionId, @Valid @RequestBody RecordAttendanceRequest request) {
    var response = attendanceService.record(sessionId, request);
    return ResponseEntity.created(
            URI.create("/api/tenant/sessions/" + sessionId + "/attendance/" + response.id()))
        .body(response);
  }

  @GetMapping
  public ResponseEntity<List<AttendanceResponse>> list(
      @PathVariable UUID sessionId, @RequestParam(required = false) AttendanceStatus status) {
    return ResponseEntity.ok(attendanceService.list(sessionId, status));
  }

  @DeleteMapping("/{attendanceId}")
  public ResponseEntity<Void> delete(
      @PathVariable UUID sessionId, @PathVariable UUID attendanceId) {
    attendanceService.delete(sessionId, attendanceId);
    return ResponseEntity.noContent().build();
  }
}
