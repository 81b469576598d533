package io.b2mash.lms.reminder;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SessionReminderRepository extends JpaRepository<SessionReminder, UUID> {

  List<SessionReminder> findBySessionIdOrderBySendAtAsc(UUID sessionId);

  long countBySessionId(UUID sessionId);
}
