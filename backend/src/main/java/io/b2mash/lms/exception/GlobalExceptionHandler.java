package io.b2mash.lms.exception;

import io.b2mash.lms.multitenancy.RequestContextNotBoundException;
import io.b2mash.lms.multitenancy.RequestCorrelation;
import io.b2mash.lms.multitenancy.TenantConnectionException;
import io.b2mash.lms.multitenancy.TenantContext;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, correlation_id={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod(),
        RequestCorrelation.correlationId(request));

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    log.warn(
        "Forbidden: path={}, method={}, correlation_id={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        RequestCorrelation.correlationId(request),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(TenantLinkageException.class)
  public ResponseEntity<ProblemDetail> handleTenantLinkage(
      TenantLinkageException ex, HttpServletRequest request) {
    log.error(
        "Tenant linkage missing: resource={}, id={}, tenant={}, path={}, method={},"
            + " correlation_id={}",
        ex.getResourceType(),
        ex.getResourceId(),
        TenantContext.getTenantId(),
        request.getRequestURI(),
        request.getMethod(),
        RequestCorrelation.correlationId(request),
        ex);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.getBody());
  }

  @ExceptionHandler(RequestContextNotBoundException.class)
  public ResponseEntity<ProblemDetail> handleRequestContextNotBound(
      RequestContextNotBoundException ex, HttpServletRequest request) {
    log.error(
        "Request context invariant violation: path={}, method={}, correlation_id={}",
        request.getRequestURI(),
        request.getMethod(),
        RequestCorrelation.correlationId(request),
        ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Request context not available");
    problem.setDetail("Unable to resolve tenant or identity for request");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @ExceptionHandler({TenantConnectionException.class, CannotCreateTransactionException.class})
  public ResponseEntity<ProblemDetail> handleTenantUnavailable(
      RuntimeException ex, HttpServletRequest request) {
    log.error(
        "Tenant database unavailable: tenant={}, path={}, correlation_id={}",
        TenantContext.getTenantId(),
        request.getRequestURI(),
        RequestCorrelation.correlationId(request),
        ex);
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Tenant database unavailable");
    problem.setDetail("The tenant data store could not be reached. Please retry.");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrity(
      DataIntegrityViolationException ex, HttpServletRequest request) {
    log.warn(
        "Data integrity violation: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getMostSpecificCause().getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Conflicting write");
    problem.setDetail("The request conflicts with existing data. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
