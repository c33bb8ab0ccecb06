package io.b2mash.b2b.collab.security;

/** Spring Security authorities granted to API callers. */
public final class Roles {

  public static final String AUTHORITY_USER = "ROLE_USER";

  private Roles() {}
}
