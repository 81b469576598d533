package io.b2mash.lms.security;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown for any token that fails verification. The message is the same whatever check failed;
 * the specific reason only goes to the debug log.
 */
public class InvalidTokenException extends ErrorResponseException {

  public static final String MESSAGE = "Invalid or expired token";

  public InvalidTokenException() {
    super(HttpStatus.UNAUTHORIZED, createProblem(), null);
  }

  @Override
  public String getMessage() {
    return MESSAGE;
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Authentication failed");
    problem.setDetail(MESSAGE);
    return problem;
  }
}
