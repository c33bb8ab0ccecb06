package io.b2mash.b2b.collab.context;

import java.util.UUID;

/**
 * Request-scoped identity values. Bound by servlet filters, read by controllers, services and the
 * audit builder.
 */
public final class RequestScopes {

  /** Current member's UUID. Bound by MemberFilter. */
  public static final RequestValue<UUID> MEMBER_ID = RequestValue.named("MEMBER_ID");

  /** Correlation id for log lines of the current request. Bound by RequestLoggingFilter. */
  public static final RequestValue<String> REQUEST_ID = RequestValue.named("REQUEST_ID");

  /** Returns the current member's UUID. Throws if not bound by filter chain. */
  public static UUID requireMemberId() {
    if (!MEMBER_ID.isBound()) {
      throw new MemberContextNotBoundException();
    }
    return MEMBER_ID.get();
  }

  /** Returns the current member's UUID, or null for anonymous and system calls. */
  public static UUID getMemberIdOrNull() {
    return MEMBER_ID.orElse(null);
  }

  private RequestScopes() {}
}
