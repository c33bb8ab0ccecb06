package io.b2mash.b2b.collab.exception;

public class AlreadyCollaboratorException extends ResourceConflictException {

  public AlreadyCollaboratorException(String recipient) {
    super(
        "AlreadyCollaborator",
        "Already a collaborator",
        recipient + " already collaborates on this project");
  }
}
