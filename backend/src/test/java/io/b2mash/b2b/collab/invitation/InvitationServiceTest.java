package io.b2mash.b2b.collab.invitation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.collab.access.ProjectAccessService;
import io.b2mash.b2b.collab.access.ProjectAction;
import io.b2mash.b2b.collab.access.ProjectRole;
import io.b2mash.b2b.collab.audit.AuditService;
import io.b2mash.b2b.collab.collaborator.Collaborator;
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
import io.b2mash.b2b.collab.integration.email.SendResult;
import io.b2mash.b2b.collab.member.UserDirectory;
import io.b2mash.b2b.collab.member.UserDirectory.DirectoryUser;
import io.b2mash.b2b.collab.notification.InvitationNotifier;
import io.b2mash.b2b.collab.project.Project;
import io.b2mash.b2b.collab.project.ProjectRepository;
import io.b2mash.b2b.collab.project.ProjectWithRole;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class InvitationServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID OWNER_ID = UUID.randomUUID();
  private static final UUID BOB_ID = UUID.randomUUID();
  private static final UUID CAROL_ID = UUID.randomUUID();
  private static final String BOB_EMAIL = "bob@example.com";

  @Mock private InvitationRepository invitationRepository;
  @Mock private ProjectRepository projectRepository;
  @Mock private ProjectAccessService projectAccessService;
  @Mock private CollaboratorService collaboratorService;
  @Mock private UserDirectory userDirectory;
  @Mock private InvitationNotifier invitationNotifier;
  @Mock private AuditService auditService;

  private InvitationService service;
  private Project project;

  @BeforeEach
  void setUp() {
    var properties =
        new CollabProperties(
            new CollabProperties.Invitations(30, "http://localhost:3000"),
            new CollabProperties.Email("noreply@collab.test"));
    service =
        new InvitationService(
            invitationRepository,
            projectRepository,
            projectAccessService,
            collaboratorService,
            userDirectory,
            invitationNotifier,
            auditService,
            properties);
    project = new Project("Apollo", "Moon landing", OWNER_ID);
    ReflectionTestUtils.setField(project, "id", PROJECT_ID);
  }

  private void ownerMayManage() {
    when(projectAccessService.requireAccess(PROJECT_ID, OWNER_ID, ProjectAction.MANAGE_MEMBERS))
        .thenReturn(new ProjectWithRole(project, ProjectRole.OWNER));
  }

  private void saveReturnsArgument() {
    when(invitationRepository.saveAndFlush(any(Invitation.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
  }

  private Invitation pendingEmailInvitation(Instant expiresAt) {
    var invitation = new Invitation(PROJECT_ID, OWNER_ID, null, BOB_EMAIL, "tok-bob", expiresAt);
    ReflectionTestUtils.setField(invitation, "id", UUID.randomUUID());
    return invitation;
  }

  private Invitation pendingMemberInvitation(UUID inviteeId) {
    var invitation =
        new Invitation(
            PROJECT_ID,
            OWNER_ID,
            inviteeId,
            null,
            "tok-member",
            Instant.now().plus(7, ChronoUnit.DAYS));
    ReflectionTestUtils.setField(invitation, "id", UUID.randomUUID());
    return invitation;
  }

  // --- create ---

  @Test
  void createInvitation_byEmailUsesDefaultExpiryAndNotifies() {
    ownerMayManage();
    saveReturnsArgument();
    when(userDirectory.findByEmail(BOB_EMAIL)).thenReturn(Optional.empty());
    when(invitationRepository.existsByProjectIdAndPendingEmail(PROJECT_ID, BOB_EMAIL))
        .thenReturn(false);
    when(invitationNotifier.sendInvitation(eq(BOB_EMAIL), eq(project), anyString()))
        .thenReturn(new SendResult(true, "msg-1", null));

    var result = service.createInvitation(PROJECT_ID, null, "Bob@Example.com", null, OWNER_ID);

    var invitation = result.invitation();
    assertThat(result.warnings()).isEmpty();
    assertThat(invitation.getEmail()).isEqualTo(BOB_EMAIL);
    assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.PENDING);
    assertThat(invitation.getInviterId()).isEqualTo(OWNER_ID);
    assertThat(invitation.getToken()).hasSize(43);
    assertThat(invitation.getExpiresAt())
        .isCloseTo(Instant.now().plus(30, ChronoUnit.DAYS), within(1, ChronoUnit.SECONDS));
    assertThat(invitation.getLastSentAt()).isNotNull();
    verify(invitationNotifier)
        .sendInvitation(
            BOB_EMAIL, project, "http://localhost:3000/invitations/" + invitation.getToken());
    verify(auditService).log(any());
  }

  @Test
  void createInvitation_keepsExplicitExpiry() {
    ownerMayManage();
    saveReturnsArgument();
    var expiresAt = Instant.now().plus(3, ChronoUnit.DAYS);
    when(userDirectory.findByEmail(BOB_EMAIL)).thenReturn(Optional.empty());
    when(invitationNotifier.sendInvitation(eq(BOB_EMAIL), eq(project), anyString()))
        .thenReturn(new SendResult(true, "msg-1", null));

    var result = service.createInvitation(PROJECT_ID, null, BOB_EMAIL, expiresAt, OWNER_ID);

    assertThat(result.invitation().getExpiresAt()).isEqualTo(expiresAt);
  }

  @Test
  void createInvitation_notifierFailureBecomesWarning() {
    ownerMayManage();
    saveReturnsArgument();
    when(userDirectory.findByEmail(BOB_EMAIL)).thenReturn(Optional.empty());
    when(invitationNotifier.sendInvitation(eq(BOB_EMAIL), eq(project), anyString()))
        .thenReturn(SendResult.failed("SMTP unavailable"));

    var result = service.createInvitation(PROJECT_ID, null, BOB_EMAIL, null, OWNER_ID);

    assertThat(result.hasWarnings()).isTrue();
    assertThat(result.warnings()).singleElement().asString().contains("SMTP unavailable");
    assertThat(result.invitation().getStatus()).isEqualTo(InvitationStatus.PENDING);
    assertThat(result.invitation().getLastSentAt()).isNull();
  }

  @Test
  void createInvitation_notifierExceptionBecomesWarning() {
    ownerMayManage();
    saveReturnsArgument();
    when(userDirectory.findByEmail(BOB_EMAIL)).thenReturn(Optional.empty());
    when(invitationNotifier.sendInvitation(eq(BOB_EMAIL), eq(project), anyString()))
        .thenThrow(new IllegalStateException("template missing"));

    var result = service.createInvitation(PROJECT_ID, null, BOB_EMAIL, null, OWNER_ID);

    assertThat(result.warnings()).singleElement().asString().contains("template missing");
  }

  @Test
  void createInvitation_byInviteeNotifiesTheirAddress() {
    ownerMayManage();
    saveReturnsArgument();
    when(userDirectory.findById(BOB_ID))
        .thenReturn(Optional.of(new DirectoryUser(BOB_ID, BOB_EMAIL, "Bob")));
    when(collaboratorService.isCollaborator(PROJECT_ID, BOB_ID)).thenReturn(false);
    when(invitationRepository.existsByProjectIdAndPendingInviteeId(PROJECT_ID, BOB_ID))
        .thenReturn(false);
    when(invitationNotifier.sendInvitation(eq(BOB_EMAIL), eq(project), anyString()))
        .thenReturn(new SendResult(true, "msg-2", null));

    var result = service.createInvitation(PROJECT_ID, BOB_ID, null, null, OWNER_ID);

    assertThat(result.invitation().getInviteeId()).isEqualTo(BOB_ID);
    assertThat(result.invitation().getEmail()).isNull();
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  void createInvitation_rejectsMissingRecipient() {
    ownerMayManage();

    assertThatThrownBy(() -> service.createInvitation(PROJECT_ID, null, "  ", null, OWNER_ID))
        .isInstanceOf(InvalidRecipientException.class);
  }

  @Test
  void createInvitation_rejectsBothRecipientForms() {
    ownerMayManage();

    assertThatThrownBy(
            () -> service.createInvitation(PROJECT_ID, BOB_ID, BOB_EMAIL, null, OWNER_ID))
        .isInstanceOf(InvalidRecipientException.class);
    verify(invitationRepository, never()).saveAndFlush(any());
  }

  @Test
  void createInvitation_unknownInviteeIsNotFound() {
    ownerMayManage();
    when(userDirectory.findById(BOB_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.createInvitation(PROJECT_ID, BOB_ID, null, null, OWNER_ID))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void createInvitation_rejectsExistingCollaboratorById() {
    ownerMayManage();
    when(userDirectory.findById(BOB_ID))
        .thenReturn(Optional.of(new DirectoryUser(BOB_ID, BOB_EMAIL, "Bob")));
    when(collaboratorService.isCollaborator(PROJECT_ID, BOB_ID)).thenReturn(true);

    assertThatThrownBy(
            () -> service.createInvitation(PROJECT_ID, BOB_ID, null, null, OWNER_ID))
        .isInstanceOf(AlreadyCollaboratorException.class);
  }

  @Test
  void createInvitation_rejectsExistingCollaboratorByEmail() {
    ownerMayManage();
    when(userDirectory.findByEmail(BOB_EMAIL))
        .thenReturn(Optional.of(new DirectoryUser(BOB_ID, BOB_EMAIL, "Bob")));
    when(collaboratorService.isCollaborator(PROJECT_ID, BOB_ID)).thenReturn(true);

    assertThatThrownBy(
            () -> service.createInvitation(PROJECT_ID, null, BOB_EMAIL, null, OWNER_ID))
        .isInstanceOf(AlreadyCollaboratorException.class);
  }

  @Test
  void createInvitation_rejectsTheOwner() {
    ownerMayManage();
    when(userDirectory.findByEmail("alice@example.com"))
        .thenReturn(Optional.of(new DirectoryUser(OWNER_ID, "alice@example.com", "Alice")));

    assertThatThrownBy(
            () ->
                service.createInvitation(PROJECT_ID, null, "alice@example.com", null, OWNER_ID))
        .isInstanceOf(OwnerConflictException.class);
  }

  @Test
  void createInvitation_rejectsSecondPendingInvitation() {
    ownerMayManage();
    when(userDirectory.findById(BOB_ID))
        .thenReturn(Optional.of(new DirectoryUser(BOB_ID, BOB_EMAIL, "Bob")));
    when(collaboratorService.isCollaborator(PROJECT_ID, BOB_ID)).thenReturn(false);
    when(invitationRepository.existsByProjectIdAndPendingInviteeId(PROJECT_ID, BOB_ID))
        .thenReturn(true);

    assertThatThrownBy(
            () -> service.createInvitation(PROJECT_ID, BOB_ID, null, null, OWNER_ID))
        .isInstanceOf(DuplicatePendingInvitationException.class);
  }

  @Test
  void createInvitation_byIdRejectsPendingInvitationToTheirEmail() {
    ownerMayManage();
    when(userDirectory.findById(BOB_ID))
        .thenReturn(Optional.of(new DirectoryUser(BOB_ID, BOB_EMAIL, "Bob")));
    when(collaboratorService.isCollaborator(PROJECT_ID, BOB_ID)).thenReturn(false);
    when(invitationRepository.existsByProjectIdAndPendingInviteeId(PROJECT_ID, BOB_ID))
        .thenReturn(false);
    when(invitationRepository.existsByProjectIdAndPendingEmail(PROJECT_ID, BOB_EMAIL))
        .thenReturn(true);

    assertThatThrownBy(
            () -> service.createInvitation(PROJECT_ID, BOB_ID, null, null, OWNER_ID))
        .isInstanceOf(DuplicatePendingInvitationException.class);
    verify(invitationRepository, never()).saveAndFlush(any());
  }

  @Test
  void createInvitation_byEmailRejectsPendingInvitationToTheMember() {
    ownerMayManage();
    when(userDirectory.findByEmail(BOB_EMAIL))
        .thenReturn(Optional.of(new DirectoryUser(BOB_ID, BOB_EMAIL, "Bob")));
    when(collaboratorService.isCollaborator(PROJECT_ID, BOB_ID)).thenReturn(false);
    when(invitationRepository.existsByProjectIdAndPendingEmail(PROJECT_ID, BOB_EMAIL))
        .thenReturn(false);
    when(invitationRepository.existsByProjectIdAndPendingInviteeId(PROJECT_ID, BOB_ID))
        .thenReturn(true);

    assertThatThrownBy(
            () -> service.createInvitation(PROJECT_ID, null, BOB_EMAIL, null, OWNER_ID))
        .isInstanceOf(DuplicatePendingInvitationException.class);
    verify(invitationRepository, never()).saveAndFlush(any());
  }

  @Test
  void createInvitation_lostInsertRaceIsDuplicate() {
    ownerMayManage();
    when(userDirectory.findByEmail(BOB_EMAIL)).thenReturn(Optional.empty());
    when(invitationRepository.saveAndFlush(any(Invitation.class)))
        .thenThrow(new DataIntegrityViolationException("uq_invitations_pending_email"));

    assertThatThrownBy(
            () -> service.createInvitation(PROJECT_ID, null, BOB_EMAIL, null, OWNER_ID))
        .isInstanceOf(DuplicatePendingInvitationException.class);
    verify(invitationNotifier, never()).sendInvitation(anyString(), any(), anyString());
  }

  @Test
  void createInvitation_inactiveProjectRejectsInvitations() {
    project.update("Apollo", "Moon landing", false);
    ownerMayManage();

    assertThatThrownBy(
            () -> service.createInvitation(PROJECT_ID, null, BOB_EMAIL, null, OWNER_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  // --- accept ---

  @Test
  void acceptInvitation_createsViewerCollaboratorAndBindsInvitee() {
    var invitation = pendingEmailInvitation(Instant.now().plus(7, ChronoUnit.DAYS));
    var collaborator = new Collaborator(PROJECT_ID, BOB_ID, CollaboratorRole.VIEWER, OWNER_ID);
    ReflectionTestUtils.setField(collaborator, "id", UUID.randomUUID());
    when(userDirectory.isAuthenticated(BOB_ID)).thenReturn(true);
    when(invitationRepository.findByToken("tok-bob")).thenReturn(Optional.of(invitation));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(collaboratorService.grantAccess(project, BOB_ID, CollaboratorRole.VIEWER, OWNER_ID))
        .thenReturn(collaborator);
    saveReturnsArgument();

    var acceptance = service.acceptInvitation("tok-bob", BOB_ID);

    assertThat(acceptance.invitation().getStatus()).isEqualTo(InvitationStatus.ACCEPTED);
    assertThat(acceptance.invitation().getInviteeId()).isEqualTo(BOB_ID);
    assertThat(acceptance.invitation().getAcceptedAt()).isNotNull();
    assertThat(acceptance.collaborator()).isSameAs(collaborator);
    verify(auditService).log(any());
  }

  @Test
  void acceptInvitation_expiredFlipsStatusAndFails() {
    var invitation = pendingEmailInvitation(Instant.now().minus(1, ChronoUnit.DAYS));
    when(userDirectory.isAuthenticated(BOB_ID)).thenReturn(true);
    when(invitationRepository.findByToken("tok-bob")).thenReturn(Optional.of(invitation));

    assertThatThrownBy(() -> service.acceptInvitation("tok-bob", BOB_ID))
        .isInstanceOf(InvitationExpiredException.class);
    assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.EXPIRED);
    verify(invitationRepository).save(invitation);
    verify(collaboratorService, never()).grantAccess(any(), any(), any(), any());
  }

  @Test
  void acceptInvitation_requiresAuthenticatedCaller() {
    when(userDirectory.isAuthenticated(null)).thenReturn(false);

    assertThatThrownBy(() -> service.acceptInvitation("tok-bob", null))
        .isInstanceOf(ForbiddenException.class);
    verify(invitationRepository, never()).findByToken(anyString());
  }

  @Test
  void acceptInvitation_unknownTokenIsNotFound() {
    when(userDirectory.isAuthenticated(BOB_ID)).thenReturn(true);
    when(invitationRepository.findByToken("nope")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.acceptInvitation("nope", BOB_ID))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void acceptInvitation_terminalInvitationIsInvalidState() {
    var invitation = pendingEmailInvitation(Instant.now().plus(7, ChronoUnit.DAYS));
    invitation.markAccepted(BOB_ID);
    when(userDirectory.isAuthenticated(CAROL_ID)).thenReturn(true);
    when(invitationRepository.findByToken("tok-bob")).thenReturn(Optional.of(invitation));

    assertThatThrownBy(() -> service.acceptInvitation("tok-bob", CAROL_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void acceptInvitation_invitationForSomeoneElseIsForbidden() {
    var invitation = pendingMemberInvitation(BOB_ID);
    when(userDirectory.isAuthenticated(CAROL_ID)).thenReturn(true);
    when(invitationRepository.findByToken("tok-member")).thenReturn(Optional.of(invitation));

    assertThatThrownBy(() -> service.acceptInvitation("tok-member", CAROL_ID))
        .isInstanceOf(ForbiddenException.class);
    assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.PENDING);
  }

  @Test
  void acceptInvitation_ownerCannotAccept() {
    var invitation = pendingEmailInvitation(Instant.now().plus(7, ChronoUnit.DAYS));
    when(userDirectory.isAuthenticated(OWNER_ID)).thenReturn(true);
    when(invitationRepository.findByToken("tok-bob")).thenReturn(Optional.of(invitation));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));

    assertThatThrownBy(() -> service.acceptInvitation("tok-bob", OWNER_ID))
        .isInstanceOf(OwnerConflictException.class);
  }

  // --- decline ---

  @Test
  void declineInvitation_marksDeclined() {
    var invitation = pendingMemberInvitation(BOB_ID);
    when(userDirectory.isAuthenticated(BOB_ID)).thenReturn(true);
    when(invitationRepository.findByToken("tok-member")).thenReturn(Optional.of(invitation));
    when(invitationRepository.save(invitation)).thenReturn(invitation);

    var declined = service.declineInvitation("tok-member", BOB_ID);

    assertThat(declined.getStatus()).isEqualTo(InvitationStatus.DECLINED);
    assertThat(declined.getDeclinedAt()).isNotNull();
  }

  @Test
  void declineInvitation_invitationForSomeoneElseIsForbidden() {
    var invitation = pendingMemberInvitation(BOB_ID);
    when(userDirectory.isAuthenticated(CAROL_ID)).thenReturn(true);
    when(invitationRepository.findByToken("tok-member")).thenReturn(Optional.of(invitation));

    assertThatThrownBy(() -> service.declineInvitation("tok-member", CAROL_ID))
        .isInstanceOf(ForbiddenException.class);
  }

  // --- cancel ---

  @Test
  void cancelInvitation_byInviter() {
    var invitation = pendingMemberInvitation(BOB_ID);
    when(invitationRepository.findById(invitation.getId())).thenReturn(Optional.of(invitation));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(projectAccessService.resolveRole(project, OWNER_ID)).thenReturn(ProjectRole.OWNER);
    when(invitationRepository.save(invitation)).thenReturn(invitation);

    var cancelled = service.cancelInvitation(invitation.getId(), OWNER_ID);

    assertThat(cancelled.getStatus()).isEqualTo(InvitationStatus.CANCELLED);
    assertThat(cancelled.getCancelledBy()).isEqualTo(OWNER_ID);
  }

  @Test
  void cancelInvitation_viewerWhoDidNotInviteIsForbidden() {
    var invitation = pendingMemberInvitation(BOB_ID);
    when(invitationRepository.findById(invitation.getId())).thenReturn(Optional.of(invitation));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(projectAccessService.resolveRole(project, CAROL_ID)).thenReturn(ProjectRole.VIEWER);

    assertThatThrownBy(() -> service.cancelInvitation(invitation.getId(), CAROL_ID))
        .isInstanceOf(ForbiddenException.class);
    assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.PENDING);
  }

  @Test
  void cancelInvitation_acceptedInvitationIsInvalidState() {
    var invitation = pendingMemberInvitation(BOB_ID);
    invitation.markAccepted(BOB_ID);
    when(invitationRepository.findById(invitation.getId())).thenReturn(Optional.of(invitation));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(projectAccessService.resolveRole(project, OWNER_ID)).thenReturn(ProjectRole.OWNER);

    assertThatThrownBy(() -> service.cancelInvitation(invitation.getId(), OWNER_ID))
        .isInstanceOf(InvalidStateException.class);
    assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.ACCEPTED);
  }

  // --- resend ---

  @Test
  void resendInvitation_extendsExpiryAndNotifiesAgain() {
    var invitation = pendingEmailInvitation(Instant.now().plus(1, ChronoUnit.DAYS));
    when(invitationRepository.findById(invitation.getId())).thenReturn(Optional.of(invitation));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(projectAccessService.resolveRole(project, OWNER_ID)).thenReturn(ProjectRole.OWNER);
    when(invitationRepository.save(invitation)).thenReturn(invitation);
    when(invitationNotifier.sendInvitation(eq(BOB_EMAIL), eq(project), anyString()))
        .thenReturn(new SendResult(true, "msg-3", null));

    var result = service.resendInvitation(invitation.getId(), OWNER_ID);

    assertThat(result.warnings()).isEmpty();
    assertThat(result.invitation().getResendCount()).isEqualTo(1);
    assertThat(result.invitation().getExpiresAt())
        .isCloseTo(Instant.now().plus(30, ChronoUnit.DAYS), within(1, ChronoUnit.SECONDS));
  }

  @Test
  void resendInvitation_pastDeadlineIsExpiredAndLeftPending() {
    var invitation = pendingEmailInvitation(Instant.now().minus(1, ChronoUnit.HOURS));
    when(invitationRepository.findById(invitation.getId())).thenReturn(Optional.of(invitation));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(projectAccessService.resolveRole(project, OWNER_ID)).thenReturn(ProjectRole.OWNER);

    assertThatThrownBy(() -> service.resendInvitation(invitation.getId(), OWNER_ID))
        .isInstanceOf(InvitationExpiredException.class);
    assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.PENDING);
    assertThat(invitation.getResendCount()).isZero();
  }

  // --- listing ---

  @Test
  void listProjectInvitations_viewerSeesCountsButCannotManage() {
    var invitation = pendingEmailInvitation(Instant.now().plus(7, ChronoUnit.DAYS));
    when(projectAccessService.requireAccess(PROJECT_ID, CAROL_ID, ProjectAction.VIEW_MEMBERS))
        .thenReturn(new ProjectWithRole(project, ProjectRole.VIEWER));
    when(invitationRepository.findByProjectIdOrderByCreatedAtDesc(PROJECT_ID))
        .thenReturn(List.of(invitation));
    when(projectRepository.findAllById(List.of(PROJECT_ID))).thenReturn(List.of(project));
    when(userDirectory.findById(OWNER_ID))
        .thenReturn(Optional.of(new DirectoryUser(OWNER_ID, "alice@example.com", "Alice")));
    when(invitationRepository.countByProjectIdAndStatus(PROJECT_ID, InvitationStatus.PENDING))
        .thenReturn(1L);
    when(invitationRepository.countByProjectIdAndStatus(PROJECT_ID, InvitationStatus.ACCEPTED))
        .thenReturn(0L);

    var result = service.listProjectInvitations(PROJECT_ID, CAROL_ID);

    assertThat(result.canManage()).isFalse();
    assertThat(result.pendingCount()).isEqualTo(1);
    assertThat(result.acceptedCount()).isZero();
    assertThat(result.invitations()).hasSize(1);
    var details = result.invitations().get(0);
    assertThat(details.projectName()).isEqualTo("Apollo");
    assertThat(details.inviterName()).isEqualTo("Alice");
  }

  @Test
  void listMyInvitations_matchesByIdOrEmail() {
    var invitation = pendingEmailInvitation(Instant.now().plus(7, ChronoUnit.DAYS));
    when(userDirectory.findById(BOB_ID))
        .thenReturn(Optional.of(new DirectoryUser(BOB_ID, BOB_EMAIL, "Bob")));
    when(invitationRepository.findPendingForRecipient(BOB_ID, BOB_EMAIL))
        .thenReturn(List.of(invitation));
    when(projectRepository.findAllById(List.of(PROJECT_ID))).thenReturn(List.of(project));
    when(userDirectory.findById(OWNER_ID))
        .thenReturn(Optional.of(new DirectoryUser(OWNER_ID, "alice@example.com", null)));

    var result = service.listMyInvitations(BOB_ID);

    assertThat(result).hasSize(1);
    assertThat(result.get(0).inviterName()).isEqualTo("alice@example.com");
  }
}
