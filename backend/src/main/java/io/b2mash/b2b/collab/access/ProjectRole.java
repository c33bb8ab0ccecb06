package io.b2mash.b2b.collab.access;

import java.util.Locale;

/** The effective relationship between a caller and a project. */
public enum ProjectRole {
  OWNER,
  ADMIN,
  CONTRIBUTOR,
  VIEWER,
  NONE;

  /** Lower-case wire value, e.g. {@code "contributor"}. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
