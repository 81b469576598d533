package io.b2mash.lms.coursemodule;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CourseModuleRepository extends JpaRepository<CourseModule, UUID> {

  @Query(
      "SELECT m FROM CourseModule m WHERE m.courseId = :courseId"
          + " ORDER BY m.ordering ASC, m.createdAt ASC")
  List<CourseModule> findByCourseIdOrdered(@Param("courseId") UUID courseId);
}
