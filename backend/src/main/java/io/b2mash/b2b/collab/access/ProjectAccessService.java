package io.b2mash.b2b.collab.access;

import io.b2mash.b2b.collab.collaborator.Collaborator;
import io.b2mash.b2b.collab.collaborator.CollaboratorRepository;
import io.b2mash.b2b.collab.exception.ForbiddenException;
import io.b2mash.b2b.collab.exception.ResourceNotFoundException;
import io.b2mash.b2b.collab.member.UserDirectory;
import io.b2mash.b2b.collab.project.Project;
import io.b2mash.b2b.collab.project.ProjectRepository;
import io.b2mash.b2b.collab.project.ProjectWithRole;
import java.util.Locale;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves a caller's {@link ProjectRole} from project ownership and collaborator rows, and gates
 * actions through {@link PermissionPolicy}. Reads the store on every call.
 */
@Service
public class ProjectAccessService {

  private final CollaboratorRepository collaboratorRepository;
  private final ProjectRepository projectRepository;
  private final UserDirectory userDirectory;

  public ProjectAccessService(
      CollaboratorRepository collaboratorRepository,
      ProjectRepository projectRepository,
      UserDirectory userDirectory) {
    this.collaboratorRepository = collaboratorRepository;
    this.projectRepository = projectRepository;
    this.userDirectory = userDirectory;
  }

  @Transactional(readOnly = true)
  public ProjectRole resolveRole(Project project, UUID memberId) {
    if (!userDirectory.isAuthenticated(memberId)) {
      return ProjectRole.NONE;
    }
    if (project.isOwnedBy(memberId)) {
      return ProjectRole.OWNER;
    }
    return collaboratorRepository
        .findByProjectIdAndMemberId(project.getId(), memberId)
        .map(Collaborator::projectRole)
        .orElse(ProjectRole.NONE);
  }

  @Transactional(readOnly = true)
  public ProjectAccess checkAccess(UUID projectId, UUID memberId) {
    return projectRepository
        .findById(projectId)
        .map(project -> ProjectAccess.of(resolveRole(project, memberId)))
        .orElse(ProjectAccess.DENIED);
  }

  /**
   * Loads the project and verifies the caller may perform {@code action} on it. Callers who cannot
   * even view the project get a 404, so its existence is not revealed; visible projects with an
   * insufficient role get a 403.
   */
  @Transactional(readOnly = true)
  public ProjectWithRole requireAccess(UUID projectId, UUID memberId, ProjectAction action) {
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    var role = resolveRole(project, memberId);
    if (!PermissionPolicy.can(role, ProjectAction.VIEW)) {
      throw new ResourceNotFoundException("Project", projectId);
    }
    if (!PermissionPolicy.can(role, action)) {
      throw new ForbiddenException(
          "Insufficient project role",
          "Role "
              + role.value()
              + " may not "
              + action.name().toLowerCase(Locale.ROOT).replace('_', ' ')
              + " on project "
              + projectId);
    }
    return new ProjectWithRole(project, role);
  }

  @Transactional(readOnly = true)
  public ProjectWithRole requireViewAccess(UUID projectId, UUID memberId) {
    return requireAccess(projectId, memberId, ProjectAction.VIEW);
  }
}
