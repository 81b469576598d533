package io.b2mash.lms.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, Problems.of(HttpStatus.FORBIDDEN, title, detail), null);
  }

  private ForbiddenException(String resourceType, Object resourceId, String owner) {
    super(
        HttpStatus.FORBIDDEN,
        Problems.forResource(
            HttpStatus.FORBIDDEN,
            "Access denied",
            resourceType + " " + resourceId + " belongs to a different " + owner,
            resourceType),
        null);
  }

  /** The record exists but its tenant is not the request tenant. */
  public static ForbiddenException crossTenant(String resourceType, Object resourceId) {
    return new ForbiddenException(resourceType, resourceId, "tenant");
  }

  /** The record exists but hangs off a different parent than the one in the path. */
  public static ForbiddenException foreignParent(
      String resourceType, Object resourceId, String parentType) {
    return new ForbiddenException(resourceType, resourceId, parentType);
  }
}
