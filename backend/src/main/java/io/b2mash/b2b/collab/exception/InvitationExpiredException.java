package io.b2mash.b2b.collab.exception;

import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvitationExpiredException extends ErrorResponseException {

  public InvitationExpiredException(Instant expiredAt) {
    super(HttpStatus.GONE, createProblem(expiredAt), null);
  }

  private static ProblemDetail createProblem(Instant expiredAt) {
    var problem = ProblemDetail.forStatus(HttpStatus.GONE);
    problem.setTitle("Invitation expired");
    problem.setDetail("This invitation expired at " + expiredAt);
    problem.setProperty("kind", "Expired");
    problem.setProperty("expiredAt", expiredAt.toString());
    return problem;
  }
}
