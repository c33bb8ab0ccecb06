package io.b2mash.b2b.collab.project;

import io.b2mash.b2b.collab.access.ProjectRole;
import io.b2mash.b2b.collab.collaborator.CollaboratorRole;

public record ProjectWithRole(Project project, ProjectRole role) {

  /** Used by JPQL constructor expressions over collaborator rows. */
  public ProjectWithRole(Project project, CollaboratorRole collaboratorRole) {
    this(project, collaboratorRole.toProjectRole());
  }
}
