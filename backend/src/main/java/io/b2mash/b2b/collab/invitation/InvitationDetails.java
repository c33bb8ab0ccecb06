package io.b2mash.b2b.collab.invitation;

/** An invitation with the display names a recipient or manager needs to read it. */
public record InvitationDetails(Invitation invitation, String projectName, String inviterName) {}
