package io.b2mash.lms.reminder;

import io.b2mash.lms.reminder.dto.ReminderResponse;
import io.b2mash.lms.reminder.dto.ScheduleReminderRequest;
import io.b2mash.lms.reminder.dto.UpdateReminderRequest;
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
@RequestMapping("/api/tenant/sessions/{sessionId}/reminders")
@PreAuthorize("@rbac.allows(authentication, 'INSTRUCTOR')")
public class SessionReminderController {

  private final SessionReminderService reminderService;

  public SessionReminderController(SessionReminderService reminderService) {
    this.reminderService = reminderService;
  }

  @PostMapping
  public ResponseEntity<ReminderResponse> schedule(
      @PathVariable UUID sessionId, @Valid @RequestBody ScheduleReminderRequest request) {
    var response = reminderService.schedule(sessionId, request);
    return ResponseEntity.created(
            URI.create("/api/tenant/sessions/" + sessionId + "/reminders/" + response.id()))
        .body(response);
  }

  @GetMapping
  public ResponseEntity<List<ReminderResponse>> list(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(reminderService.list(sessionId));
  }

  @PatchMapping("/{reminderId}")
  public ResponseEntity<ReminderResponse> update(
      @PathVariable UUID sessionId,
      @PathVariable UUID reminderId,
      @Valid @RequestBody UpdateReminderRequest request) {
    return ResponseEntity.ok(reminderService.update(sessionId, reminderId, request));
  }

  @DeleteMapping("/{reminderId}")
  public ResponseEntity<Void> cancel(@PathVariable UUID sessionId, @PathVariable UUID reminderId) {
    reminderService.cancel(sessionId, reminderId);
    return ResponseEntity.noContent().build();
  }
}
