package io.b2mash.lms.cms.dto;

import io.b2mash.lms.cms.CmsContentRevision;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record CmsRevisionResponse(
    UUID id,
    UUID cmsContentId,
    int version,
    Map<String, Object> snapshot,
    UUID createdBy,
    Instant createdAt) {

  public static CmsRevisionResponse from(CmsContentRevision revision) {
    return new CmsRevisionResponse(
        revision.getId(),
        revision.getCmsContentId(),
        revision.getVersion(),
        revision.getSnapshot(),
        revision.getCreatedBy(),
        revision.getCreatedAt());
  }
}
