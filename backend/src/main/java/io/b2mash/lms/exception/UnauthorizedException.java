package io.b2mash.lms.exception;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Credentials missing or wrong. Carries a Bearer challenge like the filter-level rejections. */
public class UnauthorizedException extends ErrorResponseException {

  public UnauthorizedException(String title, String detail) {
    super(HttpStatus.UNAUTHORIZED, Problems.of(HttpStatus.UNAUTHORIZED, title, detail), null);
    getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
  }
}
