package io.hmis.backend.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(DataStoreException.class)
  public ResponseEntity<ProblemDetail> handleDataStore(
      DataStoreException ex, HttpServletRequest request) {
    log.error(
        "Data store failure: path={}, method={}",
        request.getRequestURI(),
        request.getMethod(),
        ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ex.getBody());
  }

  @ExceptionHandler(InvalidTenantSchemaException.class)
  public ResponseEntity<ProblemDetail> handleInvalidSchema(
      InvalidTenantSchemaException ex, HttpServletRequest request) {
    log.error(
        "Tenant schema binding failed: path={}, detail={}",
        request.getRequestURI(),
        ex.getBody().getDetail(),
        ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ex.getBody());
  }

  @ExceptionHandler(ResourceConflictException.class)
  public ResponseEntity<ProblemDetail> handleConflict(ResourceConflictException ex) {
    log.warn("Conflict: {}", ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ex.getBody());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Bad request: {}", ex.getMessage());
    var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setTitle("Invalid request");
    return ResponseEntity.badRequest().body(problem);
  }
}
