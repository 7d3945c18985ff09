package io.b2mash.toil.exception;

import io.b2mash.toil.audit.AuditEventBuilder;
import io.b2mash.toil.audit.AuditService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final AuditService auditService;

  public GlobalExceptionHandler(AuditService auditService) {
    this.auditService = auditService;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());

    auditAccessDenied(request, "insufficient_role");

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    problem.setProperty("code", "ACCESS_DENIED");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    log.warn(
        "Forbidden: path={}, method={}, code={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getCode());

    auditAccessDenied(request, ex.getCode());

    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(InfrastructureException.class)
  public ResponseEntity<ProblemDetail> handleInfrastructure(InfrastructureException ex) {
    log.error("Infrastructure failure: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ex.getBody());
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Resource was modified concurrently. Please retry.");
    problem.setProperty("code", "CONCURRENT_MODIFICATION");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler(PessimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handlePessimisticLock(
      PessimisticLockingFailureException ex) {
    log.warn("Lock acquisition failed: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Temporarily unavailable");
    problem.setDetail("Another TOIL operation for this employee is in progress. Please retry.");
    problem.setProperty("code", "LOCK_TIMEOUT");
    problem.setProperty("retryable", true);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }

  private void auditAccessDenied(HttpServletRequest request, String reason) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("security.access_denied")
            .entityType("security")
            .entityId(UUID.randomUUID())
            .details(
                Map.of(
                    "path", request.getRequestURI(),
                    "method", request.getMethod(),
                    "reason", reason != null ? reason : "forbidden"))
            .build());
  }
}
