package io.b2mash.lms.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/**
 * A persisted record is missing the tenant linkage its ownership chain depends on. Reported as
 * HTTP 400 but logged at error level, since it points to bad data rather than a bad request.
 */
public class TenantLinkageException extends ErrorResponseException {

  private final String resourceType;
  private final Object resourceId;

  public TenantLinkageException(String resourceType, Object resourceId) {
    super(
        HttpStatus.BAD_REQUEST,
        Problems.forResource(
            HttpStatus.BAD_REQUEST,
            "Missing tenant context",
            resourceType + " record is missing tenant context",
            resourceType),
        null);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public Object getResourceId() {
    return resourceId;
  }
}
