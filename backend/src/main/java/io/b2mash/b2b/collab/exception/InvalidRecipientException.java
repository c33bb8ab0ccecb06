package io.b2mash.b2b.collab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidRecipientException extends ErrorResponseException {

  public InvalidRecipientException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid recipient");
    problem.setDetail(detail);
    problem.setProperty("kind", "InvalidRecipient");
    return problem;
  }
}
