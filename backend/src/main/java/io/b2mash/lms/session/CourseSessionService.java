package io.b2mash.lms.session;

import io.b2mash.lms.exception.InvalidStateException;
import io.b2mash.lms.ownership.TenantOwnershipGuard;
import io.b2mash.lms.session.dto.CreateSessionRequest;
import io.b2mash.lms.session.dto.SessionResponse;
import io.b2mash.lms.session.dto.UpdateSessionRequest;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CourseSessionService {

  private static final Logger log = LoggerFactory.getLogger(CourseSessionService.class);

  private final CourseSessionRepository sessionRepository;
  private final TenantOwnershipGuard ownershipGuard;

  public CourseSessionService(
      CourseSessionRepository sessionRepository, TenantOwnershipGuard ownershipGuard) {
    this.sessionRepository = sessionRepository;
    this.ownershipGuard = ownershipGuard;
  }

  @Transactional
  public SessionResponse create(UUID courseId, CreateSessionRequest request) {
    ownershipGuard.requireCourse(courseId);
    ownershipGuard.requireInstructor(request.userId());
    if (request.moduleId() != null) {
      ownershipGuard.requireModule(courseId, request.moduleId());
    }

    SessionType sessionType =
        request.sessionType() != null ? request.sessionType() : SessionType.LIVE;
    requireResourceForRecorded(sessionType, request.resourceUrl());

    var session = new CourseSession(courseId, request.userId(), request.sessionDate());
    session.updateSchedule(
        request.moduleId(),
        request.userId(),
        request.title(),
        request.sessionDate(),
        request.durationMinutes(),
        request.status() != null ? request.status() : SessionStatus.SCHEDULED,
        request.notes());
    session.updateDelivery(sessionType, request.resourceUrl());
    session.updateAttendancePolicy(
        Boolean.TRUE.equals(request.attendanceRequired()),
        request.attendanceCode(),
        request.attendanceWindowMinutes());
    session.configureReminder(
        Boolean.TRUE.equals(request.reminderEnabled()),
        request.reminderLeadMinutes(),
        request.reminderChannel());
    session = sessionRepository.save(session);

    log.info(
        "Created session: id={}, courseId={}, sessionDate={}",
        session.getId(),
        courseId,
        session.getSessionDate());
    return SessionResponse.from(session);
  }

  @Transactional(readOnly = true)
  public List<SessionResponse> list(UUID courseId, SessionStatus status, SessionType sessionType) {
    ownershipGuard.requireCourse(courseId);
    return sessionRepository.findByCourse(courseId, status, sessionType).stream()
        .map(SessionResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public SessionResponse get(UUID courseId, UUID sessionId) {
    return SessionResponse.from(ownershipGuard.requireSession(courseId, sessionId));
  }

  @Transactional
  public SessionResponse update(UUID courseId, UUID sessionId, UpdateSessionRequest request) {
    var session = ownershipGuard.requireSession(courseId, sessionId);

    if (request.userId() != null) {
      ownershipGuard.requireInstructor(request.userId());
    }
    if (request.moduleId() != null) {
      ownershipGuard.requireModule(courseId, request.moduleId());
    }

    SessionType sessionType =
        request.sessionType() != null ? request.sessionType() : session.getSessionType();
    String resourceUrl =
        request.resourceUrl() != null ? request.resourceUrl() : session.getResourceUrl();
    requireResourceForRecorded(sessionType, resourceUrl);

    session.updateSchedule(
        request.moduleId() != null ? request.moduleId() : session.getModuleId(),
        request.userId() != null ? request.userId() : session.getInstructorId(),
        request.title() != null ? request.title() : session.getTitle(),
        request.sessionDate() != null ? request.sessionDate() : session.getSessionDate(),
        request.durationMinutes() != null
            ? request.durationMinutes()
            : session.getDurationMinutes(),
        request.status() != null ? request.status() : session.getStatus(),
        request.notes() != null ? request.notes() : session.getNotes());
    session.updateDelivery(sessionType, resourceUrl);
    session.updateAttendancePolicy(
        request.attendanceRequired() != null
            ? request.attendanceRequired()
            : session.isAttendanceRequired(),
        request.attendanceCode() != null
            ? request.attendanceCode()
            : session.getAttendanceCode(),
        request.attendanceWindowMinutes() != null
            ? request.attendanceWindowMinutes()
            : session.getAttendanceWindowMinutes());
    session.configureReminder(
        request.reminderEnabled() != null
            ? request.reminderEnabled()
            : session.isReminderEnabled(),
        request.reminderLeadMinutes() != null
            ? request.reminderLeadMinutes()
            : session.getReminderLeadMinutes(),
        request.reminderChannel() != null
            ? request.reminderChannel()
            : session.getReminderChannel());
    session = sessionRepository.save(session);

    log.info("Updated session: id={}, status={}", session.getId(), session.getStatus());
    return SessionResponse.from(session);
  }

  @Transactional
  public void delete(UUID courseId, UUID sessionId) {
    var session = ownershipGuard.requireSession(courseId, sessionId);
    sessionRepository.delete(session);
    log.info("Deleted session: id={}, courseId={}", sessionId, courseId);
  }

  private static void requireResourceForRecorded(SessionType sessionType, String resourceUrl) {
    if (sessionType == SessionType.RECORDED && (resourceUrl == null || resourceUrl.isBlank())) {
      throw new InvalidStateException(
          "Missing resource", "resourceUrl is required for recorded sessions");
    }
  }
}
