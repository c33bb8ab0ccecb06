package io.b2mash.b2b.collab.exception;

import java.util.UUID;

public class DuplicateCollaboratorException extends ResourceConflictException {

  public DuplicateCollaboratorException(UUID memberId) {
    super(
        "DuplicateCollaborator",
        "Collaborator already exists",
        "Member " + memberId + " is already a collaborator on this project");
  }
}
