package io.b2mash.lms.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Request is well-formed but conflicts with a business rule. Rendered as 400. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, Problems.of(HttpStatus.BAD_REQUEST, title, detail), null);
  }
}
