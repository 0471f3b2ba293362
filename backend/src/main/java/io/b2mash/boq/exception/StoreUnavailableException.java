package io.b2mash.boq.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class StoreUnavailableException extends ErrorResponseException {

  public StoreUnavailableException(String title, String detail) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
