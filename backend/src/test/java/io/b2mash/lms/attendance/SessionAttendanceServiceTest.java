package io.b2mash.lms.attendance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.lms.attendance.dto.RecordAttendanceRequest;
import io.b2mash.lms.exception.ForbiddenException;
import io.b2mash.lms.ownership.TenantOwnershipGuard;
import io.b2mash.lms.session.CourseSession;
import io.b2mash.lms.session.CourseSessionRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.AdditionalAnswers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionAttendanceServiceTest {

  private static final UUID SESSION_ID = UUID.randomUUID();
  private static final UUID STUDENT_ID = UUID.randomUUID();

  @Mock private SessionAttendanceRepository attendanceRepository;
  @Mock private CourseSessionRepository sessionRepository;
  @Mock private TenantOwnershipGuard ownershipGuard;

  private SessionAttendanceService service;
  private CourseSession session;

  @BeforeEach
  void setUp() {
    service = new SessionAttendanceService(attendanceRepository, sessionRepository, ownershipGuard);
    session =
        new CourseSession(
            UUID.randomUUID(), UUID.randomUUID(), Instant.parse("2026-03-10T15:00:00Z"));
  }

  @Test
  void record_newEntry_recomputesSessionCounts() {
    when(ownershipGuard.requireSession(SESSION_ID)).thenReturn(session);
    when(attendanceRepository.findBySessionIdAndUserId(SESSION_ID, STUDENT_ID))
        .thenReturn(Optional.empty());
    when(attendanceRepository.saveAndFlush(any(SessionAttendance.class)))
        .then(AdditionalAnswers.returnsFirstArg());
    when(attendanceRepository.countBySessionIdAndStatusIn(
            any(), eq(List.of(AttendanceStatus.PRESENT, AttendanceStatus.LATE))))
        .thenReturn(3L);
    when(attendanceRepository.countBySessionIdAndStatusIn(
            any(), eq(List.of(AttendanceStatus.ABSENT))))
        .thenReturn(1L);

    var response =
        service.record(
            SESSION_ID,
            new RecordAttendanceRequest(STUDENT_ID, AttendanceStatus.LATE, null, null, "traffic"));

    assertThat(response.status()).isEqualTo(AttendanceStatus.LATE);
    assertThat(response.notes()).isEqualTo("traffic");
    assertThat(session.getAttendeeCount()).isEqualTo(3);
    assertThat(session.getAbsenceCount()).isEqualTo(1);
    verify(ownershipGuard).requireTenantUser(STUDENT_ID);
    verify(sessionRepository).save(session);
  }

  @Test
  void record_existingEntry_isReplaced() {
    var existing = new SessionAttendance(SESSION_ID, STUDENT_ID);
    existing.record(AttendanceStatus.ABSENT, null, null, "sick");
    when(ownershipGuard.requireSession(SESSION_ID)).thenReturn(session);
    when(attendanceRepository.findBySessionIdAndUserId(SESSION_ID, STUDENT_ID))
        .thenReturn(Optional.of(existing));
    when(attendanceRepository.saveAndFlush(existing)).thenReturn(existing);

    var response =
        service.record(SESSION_ID, new RecordAttendanceRequest(STUDENT_ID, null, null, null, null));

    assertThat(response.status()).isEqualTo(AttendanceStatus.PENDING);
    assertThat(response.notes()).isNull();
  }

  @Test
  void delete_entryOfOtherSession_throwsForbidden() {
    UUID attendanceId = UUID.randomUUID();
    when(ownershipGuard.requireSession(SESSION_ID)).thenReturn(session);
    when(attendanceRepository.findById(attendanceId))
        .thenReturn(Optional.of(new SessionAttendance(UUID.randomUUID(), STUDENT_ID)));

    assertThatThrownBy(() -> service.delete(SESSION_ID, attendanceId))
        .isInstanceOf(ForbiddenException.class);
    verify(attendanceRepository, never()).delete(any());
  }
}
