package io.b2mash.lms.session;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CourseSessionRepository extends JpaRepository<CourseSession, UUID> {

  @Query(
      """
      SELECT s FROM CourseSession s
      WHERE s.courseId = :courseId
        AND (:status IS NULL OR s.status = :status)
        AND (:sessionType IS NULL OR s.sessionType = :sessionType)
      ORDER BY s.sessionDate ASC
      """)
  List<CourseSession> findByCourse(
      @Param("courseId") UUID courseId,
      @Param("status") SessionStatus status,
      @Param("sessionType") SessionType sessionType);
}
