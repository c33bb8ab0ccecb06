package io.b2mash.b2b.collab.invitation;

import io.b2mash.b2b.collab.access.PermissionPolicy;
import io.b2mash.b2b.collab.access.ProjectAccessService;
import io.b2mash.b2b.collab.access.ProjectAction;
import io.b2mash.b2b.collab.audit.AuditEventBuilder;
import io.b2mash.b2b.collab.audit.AuditService;
import io.b2mash.b2b.collab.collaborator.CollaboratorRole;
import io.b2mash.b2b.collab.collaborator.CollaboratorService;
import io.b2mash.b2b.collab.config.CollabProperties;
import io.b2mash.b2b.collab.exception.AlreadyCollaboratorException;
import io.b2mash.b2b.collab.exception.DuplicatePendingInvitationException;
import io.b2mash.b2b.collab.exception.ForbiddenException;
import io.b2mash.b2b.collab.exception.InvalidRecipientException;
import io.b2mash.b2b.collab.exception.InvalidStateException;
import io.b2mash.b2b.collab.exception.InvitationExpiredException;
import io.b2mash.b2b.collab.exception.OwnerConflictException;
import io.b2mash.b2b.collab.exception.ResourceNotFoundException;
import io.b2mash.b2b.collab.member.Member;
import io.b2mash.b2b.collab.member.UserDirectory;
import io.b2mash.b2b.collab.member.UserDirectory.DirectoryUser;
import io.b2mash.b2b.collab.notification.InvitationNotifier;
import io.b2mash.b2b.collab.project.Project;
import io.b2mash.b2b.collab.project.ProjectRepository;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The invitation lifecycle: {@code PENDING} moves once to ACCEPTED, DECLINED, EXPIRED or
 * CANCELLED. Acceptance turns the invitation into a viewer {@code Collaborator} in the same
 * transaction. Notification failures never roll anything back; they come back as warnings.
 */
@Service
public class InvitationService {

  private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

  private static final int TOKEN_BYTES = 32;

  private final InvitationRepository invitationRepository;
  private final ProjectRepository projectRepository;
  private final ProjectAccessService projectAccessService;
  private final CollaboratorService collaboratorService;
  private final UserDirectory userDirectory;
  private final InvitationNotifier invitationNotifier;
  private final AuditService auditService;
  private final CollabProperties properties;
  private final SecureRandom secureRandom;

  public InvitationService(
      InvitationRepository invitationRepository,
      ProjectRepository projectRepository,
      ProjectAccessService projectAccessService,
      CollaboratorService collaboratorService,
      UserDirectory userDirectory,
      InvitationNotifier invitationNotifier,
      AuditService auditService,
      CollabProperties properties) {
    this.invitationRepository = invitationRepository;
    this.projectRepository = projectRepository;
    this.projectAccessService = projectAccessService;
    this.collaboratorService = collaboratorService;
    this.userDirectory = userDirectory;
    this.invitationNotifier = invitationNotifier;
    this.auditService = auditService;
    this.properties = properties;
    this.secureRandom = new SecureRandom();
  }

  /**
   * Invites a member (by id) or a bare email address to the project.
   *
   * @param inviteeId recipient member; exactly one of this and {@code email} must be given
   * @param email recipient address; matched case-insensitively
   * @param expiresAt optional deadline; defaults to now plus the configured expiry days
   */
  @Transactional
  public InvitationResult createInvitation(
      UUID projectId, UUID inviteeId, String email, Instant expiresAt, UUID inviterId) {
    // 1. Caller must be able to manage membership
    var project =
        projectAccessService
            .requireAccess(projectId, inviterId, ProjectAction.MANAGE_MEMBERS)
            .project();
    if (!project.isActive()) {
      throw new InvalidStateException(
          "Project inactive", "Project " + projectId + " does not accept new invitations");
    }

    // 2. Exactly one recipient form
    String normalizedEmail = email == null || email.isBlank() ? null : Member.normalizeEmail(email);
    if ((inviteeId == null) == (normalizedEmail == null)) {
      throw new InvalidRecipientException(
          "Provide exactly one of inviteeId or email as the invitation recipient");
    }

    // 3. Resolve the person behind the recipient, if the directory knows them
    Optional<DirectoryUser> target;
    String recipientLabel;
    if (inviteeId != null) {
      target =
          Optional.of(
              userDirectory
                  .findById(inviteeId)
                  .orElseThrow(() -> new ResourceNotFoundException("Member", inviteeId)));
      recipientLabel = "member " + inviteeId;
    } else {
      target = userDirectory.findByEmail(normalizedEmail);
      recipientLabel = normalizedEmail;
    }

    // 4. Owner and existing collaborators cannot be invited
    if (target.isPresent()) {
      UUID targetId = target.get().id();
      if (project.isOwnedBy(targetId)) {
        throw new OwnerConflictException(
            "The project owner cannot be invited to their own project");
      }
      if (collaboratorService.isCollaborator(projectId, targetId)) {
        throw new AlreadyCollaboratorException(recipientLabel);
      }
    }

    // 5. One pending invitation per person, whichever recipient form reached them first;
    // the unique constraints are the backstop
    boolean pendingExists =
        inviteeId != null
            ? invitationRepository.existsByProjectIdAndPendingInviteeId(projectId, inviteeId)
            : invitationRepository.existsByProjectIdAndPendingEmail(projectId, normalizedEmail);
    if (!pendingExists && target.isPresent()) {
      pendingExists = hasPendingInOtherForm(projectId, inviteeId != null, target.get());
    }
    if (pendingExists) {
      throw new DuplicatePendingInvitationException(recipientLabel);
    }

    // 6. Persist
    Instant effectiveExpiresAt = expiresAt != null ? expiresAt : defaultExpiry();
    var invitation =
        new Invitation(
            projectId, inviterId, inviteeId, normalizedEmail, generateToken(), effectiveExpiresAt);
    try {
      invitation = invitationRepository.saveAndFlush(invitation);
    } catch (DataIntegrityViolationException e) {
      log.debug("Invitation insert lost a race: {}", e.getMostSpecificCause().getMessage());
      throw new DuplicatePendingInvitationException(recipientLabel);
    }
    log.info(
        "Created invitation {} for {} on project {} (expires {})",
        invitation.getId(),
        recipientLabel,
        projectId,
        effectiveExpiresAt);

    var details = new HashMap<String, Object>();
    details.put("recipient", recipientLabel);
    details.put("expires_at", effectiveExpiresAt.toString());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invitation.created")
            .entityType("invitation")
            .entityId(invitation.getId())
            .projectId(projectId)
            .details(details)
            .build());

    // 7. Notify; failures become warnings
    var warnings = notifyRecipient(invitation, project, target);
    return new InvitationResult(invitation, warnings);
  }

  /**
   * Accepts the invitation behind {@code token} on behalf of {@code memberId}. An invitation found
   * past its deadline is flipped to EXPIRED and that change is committed before {@link
   * InvitationExpiredException} reaches the caller.
   */
  @Transactional(noRollbackFor = InvitationExpiredException.class)
  public InvitationAcceptance acceptInvitation(String token, UUID memberId) {
    requireAuthenticated(memberId);
    var invitation = findByToken(token);
    invitation.requirePending("accept");

    if (invitation.isExpired()) {
      expire(invitation);
      throw new InvitationExpiredException(invitation.getExpiresAt());
    }
    if (!invitation.isAddressedTo(memberId)) {
      throw new ForbiddenException(
          "Invitation addressed to another member",
          "Only the invited member can accept invitation " + invitation.getId());
    }

    var project = requireProject(invitation.getProjectId());
    if (project.isOwnedBy(memberId)) {
      throw new OwnerConflictException("The project owner cannot accept an invitation to it");
    }

    var collaborator =
        collaboratorService.grantAccess(
            project, memberId, CollaboratorRole.VIEWER, invitation.getInviterId());
    invitation.markAccepted(memberId);
    invitation = invitationRepository.saveAndFlush(invitation);
    log.info(
        "Member {} accepted invitation {} to project {}",
        memberId,
        invitation.getId(),
        project.getId());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invitation.accepted")
            .entityType("invitation")
            .entityId(invitation.getId())
            .projectId(project.getId())
            .details(
                Map.of(
                    "member_id", memberId.toString(),
                    "collaborator_id", collaborator.getId().toString()))
            .build());
    return new InvitationAcceptance(invitation, collaborator);
  }

  @Transactional
  public Invitation declineInvitation(String token, UUID memberId) {
    requireAuthenticated(memberId);
    var invitation = findByToken(token);
    invitation.requirePending("decline");
    if (!invitation.isAddressedTo(memberId)) {
      throw new ForbiddenException(
          "Invitation addressed to another member",
          "Only the invited member can decline invitation " + invitation.getId());
    }

    invitation.markDeclined();
    invitation = invitationRepository.save(invitation);
    log.info("Member {} declined invitation {}", memberId, invitation.getId());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invitation.declined")
            .entityType("invitation")
            .entityId(invitation.getId())
            .projectId(invitation.getProjectId())
            .details(Map.of("member_id", memberId.toString()))
            .build());
    return invitation;
  }

  /** Allowed for the original inviter and for anyone who may manage the project's members. */
  @Transactional
  public Invitation cancelInvitation(UUID invitationId, UUID memberId) {
    var invitation = findById(invitationId);
    requireInviterOrManager(invitation, memberId, "cancel");
    invitation.requirePending("cancel");

    invitation.markCancelled(memberId);
    invitation = invitationRepository.save(invitation);
    log.info("Member {} cancelled invitation {}", memberId, invitationId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invitation.cancelled")
            .entityType("invitation")
            .entityId(invitation.getId())
            .projectId(invitation.getProjectId())
            .details(Map.of("cancelled_by", memberId.toString()))
            .build());
    return invitation;
  }

  /**
   * Extends a pending invitation by the configured expiry period and notifies the recipient again.
   * An invitation already past its deadline cannot be revived.
   */
  @Transactional
  public InvitationResult resendInvitation(UUID invitationId, UUID memberId) {
    var invitation = findById(invitationId);
    var project = requireInviterOrManager(invitation, memberId, "resend");
    invitation.requirePending("resend");
    if (invitation.isExpired()) {
      throw new InvitationExpiredException(invitation.getExpiresAt());
    }

    Instant previousExpiry = invitation.getExpiresAt();
    invitation.resetExpiry(defaultExpiry());
    invitation = invitationRepository.save(invitation);
    log.info(
        "Resent invitation {} (expiry {} -> {})",
        invitationId,
        previousExpiry,
        invitation.getExpiresAt());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invitation.resent")
            .entityType("invitation")
            .entityId(invitation.getId())
            .projectId(invitation.getProjectId())
            .details(
                Map.of(
                    "expires_at",
                    Map.of(
                        "from", previousExpiry.toString(),
                        "to", invitation.getExpiresAt().toString()),
                    "resend_count",
                    invitation.getResendCount()))
            .build());

    Optional<DirectoryUser> target =
        invitation.getInviteeId() != null
            ? userDirectory.findById(invitation.getInviteeId())
            : Optional.empty();
    var warnings = notifyRecipient(invitation, project, target);
    return new InvitationResult(invitation, warnings);
  }

  /** Owner and collaborators may list; {@code canManage} reflects the caller's role. */
  @Transactional(readOnly = true)
  public ProjectInvitations listProjectInvitations(UUID projectId, UUID memberId) {
    var access =
        projectAccessService.requireAccess(projectId, memberId, ProjectAction.VIEW_MEMBERS);
    var invitations = invitationRepository.findByProjectIdOrderByCreatedAtDesc(projectId);
    var details = withDetails(invitations);
    return new ProjectInvitations(
        details,
        invitationRepository.countByProjectIdAndStatus(projectId, InvitationStatus.PENDING),
        invitationRepository.countByProjectIdAndStatus(projectId, InvitationStatus.ACCEPTED),
        PermissionPolicy.can(access.role(), ProjectAction.MANAGE_MEMBERS));
  }

  /** The token is the capability: any signed-in holder of the link may read the invitation. */
  @Transactional(readOnly = true)
  public InvitationDetails getByToken(String token, UUID memberId) {
    requireAuthenticated(memberId);
    return withDetails(List.of(findByToken(token))).get(0);
  }

  /** Pending invitations addressed to the member by id or by their current email address. */
  @Transactional(readOnly = true)
  public List<InvitationDetails> listMyInvitations(UUID memberId) {
    String email = userDirectory.findById(memberId).map(DirectoryUser::email).orElse(null);
    return withDetails(invitationRepository.findPendingForRecipient(memberId, email));
  }

  // --- Helpers ---

  private void expire(Invitation invitation) {
    invitation.markExpired();
    invitationRepository.save(invitation);
    log.info("Invitation {} expired at {}", invitation.getId(), invitation.getExpiresAt());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invitation.expired")
            .entityType("invitation")
            .entityId(invitation.getId())
            .projectId(invitation.getProjectId())
            .details(Map.of("expires_at", invitation.getExpiresAt().toString()))
            .build());
  }

  private boolean hasPendingInOtherForm(UUID projectId, boolean byId, DirectoryUser target) {
    if (byId) {
      return target.email() != null
          && invitationRepository.existsByProjectIdAndPendingEmail(
              projectId, Member.normalizeEmail(target.email()));
    }
    return invitationRepository.existsByProjectIdAndPendingInviteeId(projectId, target.id());
  }

  private Project requireInviterOrManager(Invitation invitation, UUID memberId, String action) {
    var project = requireProject(invitation.getProjectId());
    boolean isInviter = invitation.getInviterId().equals(memberId);
    var role = projectAccessService.resolveRole(project, memberId);
    if (!isInviter && !PermissionPolicy.can(role, ProjectAction.MANAGE_MEMBERS)) {
      throw new ForbiddenException(
          "Cannot " + action + " invitation",
          "Only the inviter or a project owner or admin can "
              + action
              + " invitation "
              + invitation.getId());
    }
    return project;
  }

  private List<String> notifyRecipient(
      Invitation invitation, Project project, Optional<DirectoryUser> target) {
    String recipientEmail =
        invitation.getEmail() != null
            ? invitation.getEmail()
            : target.map(DirectoryUser::email).orElse(null);
    if (recipientEmail == null) {
      log.warn("No email address for recipient of invitation {}", invitation.getId());
      return List.of("No email address is known for the invitation recipient");
    }

    String inviteUrl = properties.invitations().inviteUrl(invitation.getToken());
    try {
      var result = invitationNotifier.sendInvitation(recipientEmail, project, inviteUrl);
      if (result.success()) {
        invitation.recordSent();
        return List.of();
      }
      log.warn(
          "Failed to send invitation {} to {}: {}",
          invitation.getId(),
          recipientEmail,
          result.errorMessage());
      return List.of(notifyWarning(recipientEmail, result.errorMessage()));
    } catch (RuntimeException e) {
      log.warn(
          "Failed to send invitation {} to {}: {}",
          invitation.getId(),
          recipientEmail,
          e.getMessage());
      return List.of(notifyWarning(recipientEmail, e.getMessage()));
    }
  }

  private static String notifyWarning(String recipientEmail, String reason) {
    return "Invitation email to "
        + recipientEmail
        + " could not be sent"
        + (reason != null ? ": " + reason : "");
  }

  private List<InvitationDetails> withDetails(List<Invitation> invitations) {
    var projectIds = invitations.stream().map(Invitation::getProjectId).distinct().toList();
    Map<UUID, Project> projects =
        projectRepository.findAllById(projectIds).stream()
            .collect(Collectors.toMap(Project::getId, Function.identity()));
    var inviterNames = new HashMap<UUID, String>();
    return invitations.stream()
        .map(
            invitation -> {
              var project = projects.get(invitation.getProjectId());
              String inviterName =
                  inviterNames.computeIfAbsent(invitation.getInviterId(), this::displayName);
              return new InvitationDetails(
                  invitation, project != null ? project.getName() : null, inviterName);
            })
        .toList();
  }

  private String displayName(UUID memberId) {
    return userDirectory
        .findById(memberId)
        .map(user -> user.name() != null ? user.name() : user.email())
        .orElse("Unknown");
  }

  private void requireAuthenticated(UUID memberId) {
    if (!userDirectory.isAuthenticated(memberId)) {
      throw new ForbiddenException("Authentication required", "Sign in to respond to invitations");
    }
  }

  private Invitation findByToken(String token) {
    return invitationRepository
        .findByToken(token)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Invitation not found", "No invitation matches the given token"));
  }

  private Invitation findById(UUID invitationId) {
    return invitationRepository
        .findById(invitationId)
        .orElseThrow(() -> new ResourceNotFoundException("Invitation", invitationId));
  }

  private Project requireProject(UUID projectId) {
    return projectRepository
        .findById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  private Instant defaultExpiry() {
    return Instant.now().plus(properties.invitations().expiryDays(), ChronoUnit.DAYS);
  }

  private String generateToken() {
    byte[] bytes = new byte[TOKEN_BYTES];
    secureRandom.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }
}
