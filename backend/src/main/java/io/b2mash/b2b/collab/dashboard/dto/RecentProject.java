package io.b2mash.b2b.collab.dashboard.dto;

import io.b2mash.b2b.collab.project.Project;
import java.time.Instant;
import java.util.UUID;

public record RecentProject(
    UUID id, String name, String deploymentStatus, String deploymentUrl, Instant createdAt) {

  public static RecentProject from(Project project) {
    return new RecentProject(
        project.getId(),
        project.getName(),
        project.getDeploymentStatus().value(),
        project.getDeploymentUrl(),
        project.getCreatedAt());
  }
}
