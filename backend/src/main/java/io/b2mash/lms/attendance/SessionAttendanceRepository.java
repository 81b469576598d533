package io.b2mash.lms.attendance;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SessionAttendanceRepository extends JpaRepository<SessionAttendance, UUID> {

  Optional<SessionAttendance> findBySessionIdAndUserId(UUID sessionId, UUID userId);

  List<SessionAttendance> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);

  List<SessionAttendance> findBySessionIdAndStatusOrderByCreatedAtAsc(
      UUID sessionId, AttendanceStatus status);

  long countBySessionIdAndStatusIn(UUID sessionId, List<AttendanceStatus> statuses);
}
