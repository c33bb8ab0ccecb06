package io.b2mash.b2b.collab.invitation;

import java.util.Locale;

/** PENDING is the only non-terminal status; an invitation leaves it at most once. */
public enum InvitationStatus {
  PENDING,
  ACCEPTED,
  DECLINED,
  /** Timed out: found past its expiry when someone tried to accept it. */
  EXPIRED,
  /** Withdrawn by the inviter or a project manager. */
  CANCELLED;

  public boolean isTerminal() {
    return this != PENDING;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
