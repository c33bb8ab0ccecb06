package io.b2mash.b2b.collab.collaborator;

import io.b2mash.b2b.collab.access.ProjectAccessService;
import io.b2mash.b2b.collab.access.ProjectAction;
import io.b2mash.b2b.collab.audit.AuditEventBuilder;
import io.b2mash.b2b.collab.audit.AuditService;
import io.b2mash.b2b.collab.exception.DuplicateCollaboratorException;
import io.b2mash.b2b.collab.exception.OwnerConflictException;
import io.b2mash.b2b.collab.exception.ResourceNotFoundException;
import io.b2mash.b2b.collab.member.UserDirectory;
import io.b2mash.b2b.collab.project.Project;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CollaboratorService {

  private static final Logger log = LoggerFactory.getLogger(CollaboratorService.class);

  private final CollaboratorRepository collaboratorRepository;
  private final ProjectAccessService projectAccessService;
  private final UserDirectory userDirectory;
  private final AuditService auditService;

  public CollaboratorService(
      CollaboratorRepository collaboratorRepository,
      ProjectAccessService projectAccessService,
      UserDirectory userDirectory,
      AuditService auditService) {
    this.collaboratorRepository = collaboratorRepository;
    this.projectAccessService = projectAccessService;
    this.userDirectory = userDirectory;
    this.auditService = auditService;
  }

  /** Most recently added first. Owner and every collaborator may list. */
  @Transactional(readOnly = true)
  public List<CollaboratorInfo> listCollaborators(UUID projectId, UUID memberId) {
    projectAccessService.requireAccess(projectId, memberId, ProjectAction.VIEW_MEMBERS);
    return collaboratorRepository.findCollaboratorsWithDetails(projectId);
  }

  /** Direct grant by someone holding {@link ProjectAction#MANAGE_MEMBERS}. */
  @Transactional
  public Collaborator addCollaborator(
      UUID projectId, UUID targetMemberId, CollaboratorRole role, UUID actingMemberId) {
    var project =
        projectAccessService
            .requireAccess(projectId, actingMemberId, ProjectAction.MANAGE_MEMBERS)
            .project();
    if (userDirectory.findById(targetMemberId).isEmpty()) {
      throw new ResourceNotFoundException("Member", targetMemberId);
    }
    return grantAccess(project, targetMemberId, role, actingMemberId);
  }

  /**
   * Inserts the collaborator row. The caller has already authorized the grant. A concurrent insert
   * for the same (project, member) surfaces as {@link DuplicateCollaboratorException} through the
   * unique constraint.
   */
  @Transactional
  public Collaborator grantAccess(
      Project project, UUID memberId, CollaboratorRole role, UUID addedBy) {
    if (project.isOwnedBy(memberId)) {
      throw new OwnerConflictException("The project owner cannot be added as a collaborator");
    }
    if (collaboratorRepository.existsByProjectIdAndMemberId(project.getId(), memberId)) {
      throw new DuplicateCollaboratorException(memberId);
    }

    Collaborator collaborator;
    try {
      collaborator =
          collaboratorRepository.saveAndFlush(
              new Collaborator(project.getId(), memberId, role, addedBy));
    } catch (DataIntegrityViolationException e) {
      log.debug("Collaborator insert lost a race: {}", e.getMostSpecificCause().getMessage());
      throw new DuplicateCollaboratorException(memberId);
    }
    log.info("Added member {} to project {} as {}", memberId, project.getId(), role.value());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("collaborator.added")
            .entityType("collaborator")
            .entityId(collaborator.getId())
            .projectId(project.getId())
            .details(
                Map.of(
                    "member_id", memberId.toString(),
                    "role", role.value(),
                    "added_by", addedBy != null ? addedBy.toString() : "system"))
            .build());
    return collaborator;
  }

  @Transactional
  public Collaborator updateRole(
      UUID projectId, UUID collaboratorId, CollaboratorRole newRole, UUID actingMemberId) {
    var project =
        projectAccessService
            .requireAccess(projectId, actingMemberId, ProjectAction.MANAGE_MEMBERS)
            .project();
    var collaborator = findInProject(projectId, collaboratorId);
    if (project.isOwnedBy(collaborator.getMemberId())) {
      throw new OwnerConflictException("The project owner's role cannot be changed");
    }

    var oldRole = collaborator.getRole();
    collaborator.changeRole(newRole);
    collaborator = collaboratorRepository.save(collaborator);
    log.info(
        "Changed role of member {} on project {} from {} to {}",
        collaborator.getMemberId(),
        projectId,
        oldRole.value(),
        newRole.value());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("collaborator.role_changed")
            .entityType("collaborator")
            .entityId(collaborator.getId())
            .projectId(projectId)
            .details(
                Map.of(
                    "member_id", collaborator.getMemberId().toString(),
                    "role", Map.of("from", oldRole.value(), "to", newRole.value())))
            .build());
    return collaborator;
  }

  @Transactional
  public void removeCollaborator(UUID projectId, UUID collaboratorId, UUID actingMemberId) {
    var project =
        projectAccessService
            .requireAccess(projectId, actingMemberId, ProjectAction.MANAGE_MEMBERS)
            .project();
    var collaborator = findInProject(projectId, collaboratorId);
    if (project.isOwnedBy(collaborator.getMemberId())) {
      throw new OwnerConflictException("The project owner cannot be removed");
    }

    collaboratorRepository.delete(collaborator);
    log.info("Removed member {} from project {}", collaborator.getMemberId(), projectId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("collaborator.removed")
            .entityType("collaborator")
            .entityId(collaborator.getId())
            .projectId(projectId)
            .details(
                Map.of(
                    "member_id", collaborator.getMemberId().toString(),
                    "role", collaborator.getRole().value()))
            .build());
  }

  @Transactional(readOnly = true)
  public List<CollaborationInfo> listMyCollaborations(UUID memberId) {
    return collaboratorRepository.findCollaborationsForMember(memberId);
  }

  @Transactional(readOnly = true)
  public boolean isCollaborator(UUID projectId, UUID memberId) {
    return collaboratorRepository.existsByProjectIdAndMemberId(projectId, memberId);
  }

  private Collaborator findInProject(UUID projectId, UUID collaboratorId) {
    return collaboratorRepository
        .findByIdAndProjectId(collaboratorId, projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Collaborator", collaboratorId));
  }
}
