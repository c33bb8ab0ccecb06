package io.b2mash.b2b.collab.exception;

public class DuplicatePendingInvitationException extends ResourceConflictException {

  public DuplicatePendingInvitationException(String recipient) {
    super(
        "DuplicatePending",
        "Invitation already pending",
        "A pending invitation already exists for " + recipient + " on this project");
  }
}
