package io.b2mash.lms.chapter;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChapterRepository extends JpaRepository<Chapter, UUID> {

  @Query(
      "SELECT c FROM Chapter c WHERE c.moduleId = :moduleId"
          + " ORDER BY c.ordering ASC, c.createdAt ASC")
  List<Chapter> findByModuleIdOrdered(@Param("moduleId") UUID moduleId);
}
