package io.b2mash.lms.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Outermost filter. Puts the caller's correlation id into MDC so every log line of the request
 * carries it, and writes one summary line per request once the response status is known.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    long start = System.nanoTime();
    String correlationId = RequestCorrelation.correlationId(request);
    if (correlationId != null) {
      MDC.put(RequestCorrelation.MDC_CORRELATION_ID, correlationId);
    }
    try {
      filterChain.doFilter(request, response);
    } finally {
      logCompletion(request, response, (System.nanoTime() - start) / 1_000_000);
      MDC.remove(RequestCorrelation.MDC_CORRELATION_ID);
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private void logCompletion(
      HttpServletRequest request, HttpServletResponse response, long durationMs) {
    int status = response.getStatus();
    String header = request.getHeader(TenantResolver.TENANT_HEADER);
    String tenant = TenantResolver.isValid(header) ? TenantResolver.sanitize(header) : "-";
    String format =
        "request.completed: method={}, path={}, status={}, durationMs={}, tenant={},"
            + " remote_addr={}, user_agent={}";
    Object[] args = {
      request.getMethod(),
      request.getRequestURI(),
      status,
      durationMs,
      tenant,
      request.getRemoteAddr(),
      request.getHeader("User-Agent")
    };
    if (status >= 500) {
      log.error(format, args);
    } else if (status >= 400) {
      log.warn(format, args);
    } else {
      log.info(format, args);
    }
  }
}
