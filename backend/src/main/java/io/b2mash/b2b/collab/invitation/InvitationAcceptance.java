package io.b2mash.b2b.collab.invitation;

import io.b2mash.b2b.collab.collaborator.Collaborator;

public record InvitationAcceptance(Invitation invitation, Collaborator collaborator) {}
