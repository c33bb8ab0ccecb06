package io.b2mash.b2b.collab.collaborator;

import java.time.Instant;
import java.util.UUID;

public record CollaboratorInfo(
    UUID id,
    UUID projectId,
    UUID memberId,
    String name,
    String email,
    CollaboratorRole role,
    UUID addedBy,
    Instant addedAt) {}
