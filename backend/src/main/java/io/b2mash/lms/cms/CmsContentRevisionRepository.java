package io.b2mash.lms.cms;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CmsContentRevisionRepository extends JpaRepository<CmsContentRevision, UUID> {

  List<CmsContentRevision> findByCmsContentIdOrderByVersionDescCreatedAtDesc(UUID cmsContentId);
}
