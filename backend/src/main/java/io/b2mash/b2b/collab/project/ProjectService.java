package io.b2mash.b2b.collab.project;

import io.b2mash.b2b.collab.access.ProjectAccessService;
import io.b2mash.b2b.collab.access.ProjectAction;
import io.b2mash.b2b.collab.access.ProjectRole;
import io.b2mash.b2b.collab.audit.AuditEventBuilder;
import io.b2mash.b2b.collab.audit.AuditService;
import io.b2mash.b2b.collab.exception.DuplicateProjectNameException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository repository;
  private final ProjectAccessService projectAccessService;
  private final AuditService auditService;

  public ProjectService(
      ProjectRepository repository,
      ProjectAccessService projectAccessService,
      AuditService auditService) {
    this.repository = repository;
    this.projectAccessService = projectAccessService;
    this.auditService = auditService;
  }

  /** Projects the member owns or collaborates on, newest first. */
  @Transactional(readOnly = true)
  public List<ProjectWithRole> listProjects(UUID memberId) {
    var result = new ArrayList<ProjectWithRole>();
    for (Project owned : repository.findByOwnerIdOrderByCreatedAtDesc(memberId)) {
      result.add(new ProjectWithRole(owned, ProjectRole.OWNER));
    }
    result.addAll(repository.findCollaboratingProjects(memberId));
    result.sort(
        Comparator.comparing((ProjectWithRole pwr) -> pwr.project().getCreatedAt()).reversed());
    return result;
  }

  @Transactional(readOnly = true)
  public ProjectWithRole getProject(UUID id, UUID memberId) {
    return projectAccessService.requireViewAccess(id, memberId);
  }

  /** Project names are unique per owner; the database constraint backs this check. */
  @Transactional
  public Project createProject(
      String name, String description, DeploymentSettings settings, UUID ownerId) {
    if (repository.existsByOwnerIdAndName(ownerId, name)) {
      throw new DuplicateProjectNameException(name);
    }
    var project = new Project(name, description, ownerId);
    project.updateDeployment(settings, DeploymentStatus.PENDING);
    project = repository.save(project);
    log.info("Created project {} owned by member {}", project.getId(), ownerId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("project.created")
            .entityType("project")
            .entityId(project.getId())
            .projectId(project.getId())
            .details(Map.of("name", project.getName()))
            .build());
    return project;
  }

  /**
   * Replaces name, description and deployment settings. A {@code null} active flag or status keeps
   * the current value.
   */
  @Transactional
  public ProjectWithRole updateProject(
      UUID id,
      String name,
      String description,
      Boolean active,
      DeploymentSettings settings,
      DeploymentStatus status,
      UUID memberId) {
    var access = projectAccessService.requireAccess(id, memberId, ProjectAction.EDIT);
    var project = access.project();

    String oldName = project.getName();
    String oldDescription = project.getDescription();
    boolean oldActive = project.isActive();
    DeploymentSettings oldSettings = project.getDeploymentSettings();
    DeploymentStatus oldStatus = project.getDeploymentStatus();

    if (!oldName.equals(name)
        && repository.existsByOwnerIdAndNameAndIdNot(project.getOwnerId(), name, id)) {
      throw new DuplicateProjectNameException(name);
    }

    project.updateDeployment(settings, status != null ? status : oldStatus);
    project.update(name, description, active != null ? active : oldActive);
    project = repository.save(project);

    var details = new LinkedHashMap<String, Object>();
    if (!Objects.equals(oldName, name)) {
      details.put("name", Map.of("from", oldName, "to", name));
    }
    if (!Objects.equals(oldDescription, description)) {
      details.put("description", "changed");
    }
    if (oldActive != project.isActive()) {
      details.put("active", Map.of("from", oldActive, "to", project.isActive()));
    }
    if (!oldSettings.equals(project.getDeploymentSettings())) {
      details.put("deployment", "changed");
    }
    if (oldStatus != project.getDeploymentStatus()) {
      details.put(
          "deployment_status",
          Map.of("from", oldStatus.value(), "to", project.getDeploymentStatus().value()));
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("project.updated")
            .entityType("project")
            .entityId(project.getId())
            .projectId(project.getId())
            .details(details)
            .build());

    log.info("Updated project {}", project.getId());
    return new ProjectWithRole(project, access.role());
  }

  /** Deletes the project; collaborators and invitations go with it (ON DELETE CASCADE). */
  @Transactional
  public void deleteProject(UUID id, UUID memberId) {
    var project = projectAccessService.requireAccess(id, memberId, ProjectAction.DELETE).project();
    repository.delete(project);
    repository.flush();

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("project.deleted")
            .entityType("project")
            .entityId(id)
            .projectId(id)
            .details(Map.of("name", project.getName()))
            .build());
    log.info("Deleted project {}", id);
  }
}
