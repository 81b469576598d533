package io.b2mash.lms.reminder;

import io.b2mash.lms.exception.ForbiddenException;
import io.b2mash.lms.exception.InvalidStateException;
import io.b2mash.lms.exception.ResourceNotFoundException;
import io.b2mash.lms.ownership.TenantOwnershipGuard;
import io.b2mash.lms.reminder.dto.ReminderResponse;
import io.b2mash.lms.reminder.dto.ScheduleReminderRequest;
import io.b2mash.lms.reminder.dto.UpdateReminderRequest;
import io.b2mash.lms.session.CourseSession;
import io.b2mash.lms.session.CourseSessionRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SessionReminderService {

  private static final Logger log = LoggerFactory.getLogger(SessionReminderService.class);

  private final SessionReminderRepository reminderRepository;
  private final CourseSessionRepository sessionRepository;
  private final TenantOwnershipGuard ownershipGuard;

  public SessionReminderService(
      SessionReminderRepository reminderRepository,
      CourseSessionRepository sessionRepository,
      TenantOwnershipGuard ownershipGuard) {
    this.reminderRepository = reminderRepository;
    this.sessionRepository = sessionRepository;
    this.ownershipGuard = ownershipGuard;
  }

  @Transactional
  public ReminderResponse schedule(UUID sessionId, ScheduleReminderRequest request) {
    var session = ownershipGuard.requireSession(sessionId);
    if (request.sendAt().isAfter(session.getSessionDate())) {
      throw new InvalidStateException(
          "Invalid reminder time", "sendAt must not be after the session date");
    }

    ReminderChannel channel =
        request.channel() != null ? request.channel() : ReminderChannel.EMAIL;
    int leadMinutes = leadMinutes(session.getSessionDate(), request.sendAt());
    var reminder = reminderRepository.save(new SessionReminder(sessionId, channel, request.sendAt()));

    session.markReminderScheduled(channel, leadMinutes);
    sessionRepository.save(session);

    log.info(
        "Scheduled reminder: id={}, sessionId={}, channel={}, sendAt={}",
        reminder.getId(),
        sessionId,
        channel,
        reminder.getSendAt());
    return ReminderResponse.from(reminder);
  }

  @Transactional(readOnly = true)
  public List<ReminderResponse> list(UUID sessionId) {
    ownershipGuard.requireSession(sessionId);
    return reminderRepository.findBySessionIdOrderBySendAtAsc(sessionId).stream()
        .map(ReminderResponse::from)
        .toList();
  }

  @Transactional
  public ReminderResponse update(UUID sessionId, UUID reminderId, UpdateReminderRequest request) {
    var session = ownershipGuard.requireSession(sessionId);
    var reminder = requireReminder(sessionId, reminderId);

    ReminderStatus status = request.status() != null ? request.status() : reminder.getStatus();
    reminder.recordAttempt(
        status,
        request.attemptCount() != null ? request.attemptCount() : reminder.getAttemptCount(),
        request.lastAttemptAt() != null ? request.lastAttemptAt() : reminder.getLastAttemptAt(),
        request.lastError() != null ? request.lastError() : reminder.getLastError());
    reminder = reminderRepository.save(reminder);

    Instant sentAt = null;
    if (status == ReminderStatus.SENT) {
      sentAt = reminder.getLastAttemptAt() != null ? reminder.getLastAttemptAt() : Instant.now();
    }
    session.recordReminderStatus(status, sentAt);
    sessionRepository.save(session);

    log.info("Updated reminder: id={}, status={}", reminder.getId(), status);
    return ReminderResponse.from(reminder);
  }

  @Transactional
  public void cancel(UUID sessionId, UUID reminderId) {
    CourseSession session = ownershipGuard.requireSession(sessionId);
    var reminder = requireReminder(sessionId, reminderId);
    reminderRepository.delete(reminder);
    reminderRepository.flush();

    if (reminderRepository.countBySessionId(sessionId) == 0) {
      session.clearReminder();
      sessionRepository.save(session);
    }
    log.info("Cancelled reminder: id={}, sessionId={}", reminderId, sessionId);
  }

  /** Minutes between {@code sendAt} and the session, rounded half up. */
  static int leadMinutes(Instant sessionDate, Instant sendAt) {
    long minutes = Duration.between(sendAt, sessionDate).plusSeconds(30).toMinutes();
    if (minutes > Integer.MAX_VALUE) {
      throw new InvalidStateException(
          "Invalid reminder time", "sendAt is too far before the session date");
    }
    return (int) minutes;
  }

  private SessionReminder requireReminder(UUID sessionId, UUID reminderId) {
    var reminder =
        reminderRepository
            .findById(reminderId)
            .orElseThrow(() -> new ResourceNotFoundException("Reminder", reminderId));
    if (!reminder.getSessionId().equals(sessionId)) {
      log.warn(
          "Reminder does not belong to session: reminderId={}, sessionId={}",
          reminderId,
          sessionId);
      throw ForbiddenException.foreignParent("Reminder", reminderId, "session");
    }
    return reminder;
  }
}
