package io.b2mash.lms.attendance;

import io.b2mash.lms.attendance.dto.AttendanceResponse;
import io.b2mash.lms.attendance.dto.RecordAttendanceRequest;
import io.b2mash.lms.exception.ForbiddenException;
import io.b2mash.lms.exception.ResourceNotFoundException;
import io.b2mash.lms.ownership.TenantOwnershipGuard;
import io.b2mash.lms.session.CourseSession;
import io.b2mash.lms.session.CourseSessionRepository;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SessionAttendanceService {

  private static final Logger log = LoggerFactory.getLogger(SessionAttendanceService.class);

  private static final List<AttendanceStatus> ATTENDED =
      List.of(AttendanceStatus.PRESENT, AttendanceStatus.LATE);
  private static final List<AttendanceStatus> ABSENT = List.of(AttendanceStatus.ABSENT);

  private final SessionAttendanceRepository attendanceRepository;
  private final CourseSessionRepository sessionRepository;
  private final TenantOwnershipGuard ownershipGuard;

  public SessionAttendanceService(
      SessionAttendanceRepository attendanceRepository,
      CourseSessionRepository sessionRepository,
      TenantOwnershipGuard ownershipGuard) {
    this.attendanceRepository = attendanceRepository;
    this.sessionRepository = sessionRepository;
    this.ownershipGuard = ownershipGuard;
  }

  /** Creates or replaces the record for the session and user. */
  @Transactional
  public AttendanceResponse record(UUID sessionId, RecordAttendanceRequest request) {
    var session = ownershipGuard.requireSession(sessionId);
    ownershipGuard.requireTenantUser(request.userId());

    var attendance =
        attendanceRepository
            .findBySessionIdAndUserId(sessionId, request.userId())
            .orElseGet(() -> new SessionAttendance(sessionId, request.userId()));
    attendance.record(
        request.status() != null ? request.status() : AttendanceStatus.PENDING,
        request.checkInAt(),
        request.checkOutAt(),
        request.notes());
    attendance = attendanceRepository.saveAndFlush(attendance);

    recomputeCounts(session);
    log.info(
        "Recorded attendance: id={}, sessionId={}, userId={}, status={}",
        attendance.getId(),
        sessionId,
        attendance.getUserId(),
        attendance.getStatus());
    return AttendanceResponse.from(attendance);
  }

  @Transactional(readOnly = true)
  public List<AttendanceResponse> list(UUID sessionId, AttendanceStatus status) {
    ownershipGuard.requireSession(sessionId);
    var records =
        status != null
            ? attendanceRepository.findBySessionIdAndStatusOrderByCreatedAtAsc(sessionId, status)
            : attendanceRepository.findBySessionIdOrderByCreatedAtAsc(sessionId);
    return records.stream().map(AttendanceResponse::from).toList();
  }

  @Transactional
  public void delete(UUID sessionId, UUID attendanceId) {
    var session = ownershipGuard.requireSession(sessionId);
    var attendance =
        attendanceRepository
            .findById(attendanceId)
            .orElseThrow(() -> new ResourceNotFoundException("Attendance", attendanceId));
    if (!attendance.getSessionId().equals(sessionId)) {
      log.warn(
          "Attendance does not belong to session: attendanceId={}, sessionId={}",
          attendanceId,
          sessionId);
      throw ForbiddenException.foreignParent("Attendance", attendanceId, "session");
    }
    attendanceRepository.delete(attendance);
    attendanceRepository.flush();

    recomputeCounts(session);
    log.info("Deleted attendance: id={}, sessionId={}", attendanceId, sessionId);
  }

  private void recomputeCounts(CourseSession session) {
    int attendees =
        (int) attendanceRepository.countBySessionIdAndStatusIn(session.getId(), ATTENDED);
    int absences = (int) attendanceRepository.countBySessionIdAndStatusIn(session.getId(), ABSENT);
    session.updateAttendanceCounts(attendees, absences);
    sessionRepository.save(session);
  }
}
