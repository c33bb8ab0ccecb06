package io.b2mash.b2b.collab.member;

import io.b2mash.b2b.collab.context.RequestScopes;
import io.b2mash.b2b.collab.member.UserDirectory.DirectoryUser;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/members")
public class MemberController {

  static final int MIN_QUERY_LENGTH = 2;
  static final int MAX_RESULTS = 10;

  private final UserDirectory userDirectory;

  public MemberController(UserDirectory userDirectory) {
    this.userDirectory = userDirectory;
  }

  /** Finds people to invite. Queries shorter than two characters return nothing. */
  @GetMapping("/search")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<List<MemberResponse>> search(@RequestParam(defaultValue = "") String q) {
    UUID memberId = RequestScopes.requireMemberId();
    if (q.trim().length() < MIN_QUERY_LENGTH) {
      return ResponseEntity.ok(List.of());
    }
    var results =
        userDirectory.search(q, memberId, MAX_RESULTS).stream().map(MemberResponse::from).toList();
    return ResponseEntity.ok(results);
  }

  public record MemberResponse(UUID id, String name, String email) {

    public static MemberResponse from(DirectoryUser user) {
      return new MemberResponse(user.id(), user.name(), user.email());
    }
  }
}
