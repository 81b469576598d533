package io.b2mash.lms.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/** RFC 7807 bodies shared by the typed exceptions in this package. */
final class Problems {

  static final String RESOURCE_PROPERTY = "resource";

  private Problems() {}

  static ProblemDetail of(HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }

  static ProblemDetail forResource(
      HttpStatus status, String title, String detail, String resourceType) {
    var problem = of(status, title, detail);
    problem.setProperty(RESOURCE_PROPERTY, resourceType);
    return problem;
  }
}
