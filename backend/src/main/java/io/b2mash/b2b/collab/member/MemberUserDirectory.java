package io.b2mash.b2b.collab.member;

import io.b2mash.b2b.collab.context.RequestScopes;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link UserDirectory} backed by the members table. A member is authenticated when it is the
 * member bound to the current request.
 */
@Service
public class MemberUserDirectory implements UserDirectory {

  private final MemberRepository memberRepository;

  public MemberUserDirectory(MemberRepository memberRepository) {
    this.memberRepository = memberRepository;
  }

  @Override
  public boolean isAuthenticated(UUID memberId) {
    return memberId != null && memberId.equals(RequestScopes.getMemberIdOrNull());
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<DirectoryUser> findById(UUID memberId) {
    return memberRepository.findById(memberId).map(DirectoryUser::from);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<DirectoryUser> findByEmail(String email) {
    if (email == null || email.isBlank()) {
      return Optional.empty();
    }
    return memberRepository.findByEmail(Member.normalizeEmail(email)).map(DirectoryUser::from);
  }

  @Override
  @Transactional(readOnly = true)
  public List<DirectoryUser> search(String query, UUID excludeId, int limit) {
    return memberRepository.search(query.trim(), excludeId, PageRequest.of(0, limit)).stream()
        .map(DirectoryUser::from)
        .toList();
  }
}
