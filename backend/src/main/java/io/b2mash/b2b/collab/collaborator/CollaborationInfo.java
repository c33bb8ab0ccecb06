package io.b2mash.b2b.collab.collaborator;

import java.time.Instant;
import java.util.UUID;

/** One of the caller's collaborator rows, with the project it grants access to. */
public record CollaborationInfo(
    UUID id,
    UUID projectId,
    String projectName,
    boolean projectActive,
    CollaboratorRole role,
    Instant addedAt) {}
