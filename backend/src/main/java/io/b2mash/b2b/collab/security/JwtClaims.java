package io.b2mash.b2b.collab.security;

import org.springframework.security.oauth2.jwt.Jwt;

/** Reads the standard OpenID Connect profile claims from an access token. */
public final class JwtClaims {

  private static final String EMAIL_CLAIM = "email";
  private static final String NAME_CLAIM = "name";

  /** Returns the {@code email} claim, or null if absent or blank. */
  public static String email(Jwt jwt) {
    return nonBlank(jwt.getClaimAsString(EMAIL_CLAIM));
  }

  /** Returns the {@code name} claim, or null if absent or blank. */
  public static String name(Jwt jwt) {
    return nonBlank(jwt.getClaimAsString(NAME_CLAIM));
  }

  private static String nonBlank(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  private JwtClaims() {}
}
