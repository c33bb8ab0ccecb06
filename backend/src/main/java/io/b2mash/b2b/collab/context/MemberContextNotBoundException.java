package io.b2mash.b2b.collab.context;

public class MemberContextNotBoundException extends RuntimeException {

  public MemberContextNotBoundException() {
    super("Member context not available: MEMBER_ID not bound by filter chain");
  }
}
