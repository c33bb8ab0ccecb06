package io.b2mash.b2b.collab.exception;

public class OwnerConflictException extends ResourceConflictException {

  public OwnerConflictException(String detail) {
    super("OwnerConflict", "Project owner", detail);
  }
}
