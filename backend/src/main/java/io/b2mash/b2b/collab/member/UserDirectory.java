package io.b2mash.b2b.collab.member;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lookup of users by id or email. The collaboration core only ever refers to users by id; profile
 * data stays with the directory.
 */
public interface UserDirectory {

  /** Whether {@code memberId} denotes an authenticated user. A null id is never authenticated. */
  boolean isAuthenticated(UUID memberId);

  Optional<DirectoryUser> findById(UUID memberId);

  /** Matches the email case-insensitively. */
  Optional<DirectoryUser> findByEmail(String email);

  /**
   * Users whose email or name contains {@code query}, ignoring case. Never returns {@code
   * excludeId}.
   */
  List<DirectoryUser> search(String query, UUID excludeId, int limit);

  record DirectoryUser(UUID id, String email, String name) {

    static DirectoryUser from(Member member) {
      return new DirectoryUser(member.getId(), member.getEmail(), member.getName());
    }
  }
}
