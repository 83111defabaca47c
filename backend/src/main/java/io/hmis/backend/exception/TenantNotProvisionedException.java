package io.hmis.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class TenantNotProvisionedException extends ErrorResponseException {

  public TenantNotProvisionedException(String tenantId) {
    super(HttpStatus.FORBIDDEN, createProblem(tenantId), null);
  }

  private static ProblemDetail createProblem(String tenantId) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Tenant not provisioned");
    problem.setDetail("No active tenant registered with id " + tenantId);
    return problem;
  }
}
