package io.b2mash.b2b.collab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidRoleException extends ErrorResponseException {

  public InvalidRoleException(String role) {
    super(HttpStatus.BAD_REQUEST, createProblem(role), null);
  }

  private static ProblemDetail createProblem(String role) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid role");
    problem.setDetail("Role must be one of viewer, contributor or admin; got '" + role + "'");
    problem.setProperty("kind", "InvalidInput");
    return problem;
  }
}
