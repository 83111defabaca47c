package io.hmis.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Primary or replica store failure that is not a constraint violation. */
public class DataStoreException extends ErrorResponseException {

  public DataStoreException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Data store unavailable");
    problem.setDetail(detail);
    return problem;
  }
}
