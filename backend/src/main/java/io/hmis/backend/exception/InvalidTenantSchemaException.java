package io.hmis.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The tenant's schema is malformed or missing; the request must not fall through to another. */
public class InvalidTenantSchemaException extends ErrorResponseException {

  public InvalidTenantSchemaException(String schemaName, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(schemaName), cause);
  }

  private static ProblemDetail createProblem(String schemaName) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Tenant schema unavailable");
    problem.setDetail("Unable to bind session to schema " + schemaName);
    return problem;
  }
}
