package io.b2mash.b2b.collab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    this("Conflict", title, detail);
  }

  protected ResourceConflictException(String kind, String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(kind, title, detail), null);
  }

  private static ProblemDetail createProblem(String kind, String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("kind", kind);
    return problem;
  }
}
