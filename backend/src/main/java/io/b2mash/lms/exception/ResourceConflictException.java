package io.b2mash.lms.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, Problems.of(HttpStatus.CONFLICT, title, detail), null);
  }
}
