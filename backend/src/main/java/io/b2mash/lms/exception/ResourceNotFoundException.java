package io.b2mash.lms.exception;

import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    this(
        Problems.forResource(
            HttpStatus.NOT_FOUND,
            resourceType + " not found",
            "No " + resourceType.toLowerCase(Locale.ROOT) + " found with id " + id,
            resourceType));
  }

  private ResourceNotFoundException(ProblemDetail problem) {
    super(HttpStatus.NOT_FOUND, problem, null);
  }

  /** For lookups by something other than id, such as a CMS slug. */
  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(Problems.of(HttpStatus.NOT_FOUND, title, detail));
  }
}
