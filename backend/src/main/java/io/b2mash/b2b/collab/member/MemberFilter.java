package io.b2mash.b2b.collab.member;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.collab.context.RequestScopes;
import io.b2mash.b2b.collab.context.ScopedFilterChain;
import io.b2mash.b2b.collab.security.JwtClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the JWT subject to a {@link Member}, creating the row on first sight, and binds its id
 * to {@link RequestScopes#MEMBER_ID} for the rest of the request.
 */
@Component
public class MemberFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(MemberFilter.class);

  private final MemberRepository memberRepository;
  private final Cache<String, UUID> memberCache =
      Caffeine.newBuilder().maximumSize(50_000).expireAfterWrite(Duration.ofHours(1)).build();

  public MemberFilter(MemberRepository memberRepository) {
    this.memberRepository = memberRepository;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    UUID memberId = resolveMember();
    if (memberId != null) {
      ScopedFilterChain.runScoped(
          RequestScopes.MEMBER_ID, memberId, filterChain, request, response);
      return;
    }

    // Anonymous or resolution failed; continue unbound
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private UUID resolveMember() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return null;
    }

    Jwt jwt = jwtAuth.getToken();
    String subject = jwt.getSubject();
    if (subject == null) {
      return null;
    }

    try {
      return memberCache.get(subject, k -> resolveOrCreateMember(jwt));
    } catch (RuntimeException e) {
      log.warn("Failed to resolve/create member for user {}: {}", subject, e.getMessage());
      return null;
    }
  }

  private UUID resolveOrCreateMember(Jwt jwt) {
    String email = JwtClaims.email(jwt);
    String name = JwtClaims.name(jwt);
    return memberRepository
        .findBySubject(jwt.getSubject())
        .map(member -> refreshProfile(member, email, name))
        .orElseGet(() -> lazyCreateMember(jwt.getSubject(), email, name));
  }

  private UUID refreshProfile(Member member, String email, String name) {
    String targetEmail = email;
    if (email != null && isTakenByOther(email, member.getSubject())) {
      log.warn(
          "Member {} reports email already held by another member; keeping {}",
          member.getId(),
          member.getEmail());
      targetEmail = member.getEmail();
    }
    if (targetEmail != null && member.updateProfile(targetEmail, name)) {
      memberRepository.save(member);
      log.debug("Refreshed profile of member {}", member.getId());
    }
    return member.getId();
  }

  private UUID lazyCreateMember(String subject, String email, String name) {
    String memberEmail = email;
    if (memberEmail == null || isTakenByOther(memberEmail, subject)) {
      if (memberEmail != null) {
        log.warn("Email of user {} is already held by another member; not claiming it", subject);
      }
      memberEmail = placeholderEmail(subject);
    }
    try {
      return createMember(subject, memberEmail, name);
    } catch (DataIntegrityViolationException e) {
      // Race condition: another request created this member, or claimed the email first
      var existing = memberRepository.findBySubject(subject);
      if (existing.isPresent()) {
        return existing.get().getId();
      }
      log.warn("Email of user {} was claimed concurrently; not claiming it", subject);
      return createMember(subject, placeholderEmail(subject), name);
    }
  }

  private UUID createMember(String subject, String email, String name) {
    var member = memberRepository.save(new Member(subject, email, name));
    log.info("Lazy-created member {} for user {}", member.getId(), subject);
    return member.getId();
  }

  private boolean isTakenByOther(String email, String subject) {
    return memberRepository
        .findByEmail(Member.normalizeEmail(email))
        .filter(holder -> !holder.getSubject().equals(subject))
        .isPresent();
  }

  static String placeholderEmail(String subject) {
    return subject + "@placeholder.internal";
  }
}
