package io.b2mash.b2b.collab.invitation;

import java.util.List;

/**
 * A successful create or resend. {@code warnings} lists recovered notification failures; the
 * invitation is persisted either way.
 */
public record InvitationResult(Invitation invitation, List<String> warnings) {

  public InvitationResult {
    warnings = List.copyOf(warnings);
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
