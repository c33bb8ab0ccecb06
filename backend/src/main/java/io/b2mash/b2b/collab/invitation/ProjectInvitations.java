package io.b2mash.b2b.collab.invitation;

import java.util.List;

/** A project's invitations, newest first, with summary counts for the membership screen. */
public record ProjectInvitations(
    List<InvitationDetails> invitations,
    long pendingCount,
    long acceptedCount,
    boolean canManage) {}
