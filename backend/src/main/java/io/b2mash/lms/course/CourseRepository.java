package io.b2mash.lms.course;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CourseRepository extends JpaRepository<Course, UUID> {

  @Query("SELECT c FROM Course c WHERE c.tenantId = :tenantId ORDER BY c.createdAt DESC")
  List<Course> findByTenant(@Param("tenantId") String tenantId);

  @Query(
      "SELECT c FROM Course c WHERE c.tenantId = :tenantId AND c.status = :status"
          + " ORDER BY c.createdAt DESC")
  List<Course> findByTenantAndStatus(
      @Param("tenantId") String tenantId, @Param("status") CourseStatus status);
}
