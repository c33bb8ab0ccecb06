package io.b2mash.b2b.collab.exception;

public class DuplicateProjectNameException extends ResourceConflictException {

  public DuplicateProjectNameException(String name) {
    super(
        "DuplicateProjectName",
        "Project name already in use",
        "You already own a project named '" + name + "'");
  }
}
