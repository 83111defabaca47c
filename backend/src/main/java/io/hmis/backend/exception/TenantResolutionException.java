package io.hmis.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class TenantResolutionException extends ErrorResponseException {

  public TenantResolutionException(String headerName) {
    super(HttpStatus.BAD_REQUEST, createProblem(headerName), null);
  }

  private static ProblemDetail createProblem(String headerName) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Tenant could not be resolved");
    problem.setDetail(
        "Identify the tenant with the "
            + headerName
            + " header or call the API through the tenant subdomain"
            + " (e.g. hospital1.hmis.example.com)");
    return problem;
  }
}
