package io.b2mash.lms.security;

import io.b2mash.lms.multitenancy.RequestCorrelation;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/** Logs requests that reach a protected route without an authenticated identity, then sends 401. */
@Component
public class AuthFailureEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(AuthFailureEntryPoint.class);

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    log.warn(
        "security.auth_failed: path={}, method={}, reason={}, correlation_id={}, remote_addr={}",
        request.getRequestURI(),
        request.getMethod(),
        authException.getMessage(),
        RequestCorrelation.correlationId(request),
        request.getRemoteAddr());
    response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Authentication required");
  }
}
