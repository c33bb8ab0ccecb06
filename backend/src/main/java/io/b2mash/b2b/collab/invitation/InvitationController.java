package io.b2mash.b2b.collab.invitation;

import io.b2mash.b2b.collab.config.CollabProperties;
import io.b2mash.b2b.collab.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Future;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class InvitationController {

  private final InvitationService invitationService;
  private final CollabProperties properties;

  public InvitationController(InvitationService invitationService, CollabProperties properties) {
    this.invitationService = invitationService;
    this.properties = properties;
  }

  @GetMapping("/api/projects/{projectId}/invitations")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<ProjectInvitationsResponse> listProjectInvitations(
      @PathVariable UUID projectId) {
    UUID memberId = RequestScopes.requireMemberId();
    var result = invitationService.listProjectInvitations(projectId, memberId);
    return ResponseEntity.ok(ProjectInvitationsResponse.from(result));
  }

  @PostMapping("/api/projects/{projectId}/invitations")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<InvitationResultResponse> createInvitation(
      @PathVariable UUID projectId, @Valid @RequestBody CreateInvitationRequest request) {
    UUID memberId = RequestScopes.requireMemberId();
    var result =
        invitationService.createInvitation(
            projectId, request.inviteeId(), request.email(), request.expiresAt(), memberId);
    var invitation = result.invitation();
    return ResponseEntity.created(URI.create("/api/invitations/" + invitation.getId()))
        .body(toResultResponse(result));
  }

  @PostMapping("/api/invitations/{invitationId}/cancel")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<InvitationResponse> cancelInvitation(@PathVariable UUID invitationId) {
    UUID memberId = RequestScopes.requireMemberId();
    var invitation = invitationService.cancelInvitation(invitationId, memberId);
    return ResponseEntity.ok(InvitationResponse.from(invitation));
  }

  @PostMapping("/api/invitations/{invitationId}/resend")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<InvitationResultResponse> resendInvitation(
      @PathVariable UUID invitationId) {
    UUID memberId = RequestScopes.requireMemberId();
    var result = invitationService.resendInvitation(invitationId, memberId);
    return ResponseEntity.ok(toResultResponse(result));
  }

  @GetMapping("/api/invitations/token/{token}")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<InvitationResponse> getByToken(@PathVariable String token) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(
        InvitationResponse.from(invitationService.getByToken(token, memberId)));
  }

  @PostMapping("/api/invitations/token/{token}/accept")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<AcceptInvitationResponse> acceptInvitation(@PathVariable String token) {
    UUID memberId = RequestScopes.requireMemberId();
    var acceptance = invitationService.acceptInvitation(token, memberId);
    return ResponseEntity.ok(
        new AcceptInvitationResponse(
            InvitationResponse.from(acceptance.invitation()),
            acceptance.collaborator().getId(),
            acceptance.collaborator().getRole().value()));
  }

  @PostMapping("/api/invitations/token/{token}/decline")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<InvitationResponse> declineInvitation(@PathVariable String token) {
    UUID memberId = RequestScopes.requireMemberId();
    var invitation = invitationService.declineInvitation(token, memberId);
    return ResponseEntity.ok(InvitationResponse.from(invitation));
  }

  private InvitationResultResponse toResultResponse(InvitationResult result) {
    var invitation = result.invitation();
    return new InvitationResultResponse(
        InvitationResponse.from(invitation),
        properties.invitations().inviteUrl(invitation.getToken()),
        result.warnings());
  }

  // --- DTOs ---

  public record CreateInvitationRequest(
      UUID inviteeId,
      @Email(message = "email must be a valid address") String email,
      @Future(message = "expiresAt must be in the future") Instant expiresAt) {}

  public record InvitationResponse(
      UUID id,
      UUID projectId,
      String projectName,
      UUID inviterId,
      String inviterName,
      UUID inviteeId,
      String email,
      String status,
      boolean expired,
      Instant createdAt,
      Instant expiresAt,
      Instant acceptedAt,
      int resendCount) {

    public static InvitationResponse from(Invitation invitation) {
      return from(new InvitationDetails(invitation, null, null));
    }

    public static InvitationResponse from(InvitationDetails details) {
      var invitation = details.invitation();
      return new InvitationResponse(
          invitation.getId(),
          invitation.getProjectId(),
          details.projectName(),
          invitation.getInviterId(),
          details.inviterName(),
          invitation.getInviteeId(),
          invitation.getEmail(),
          invitation.getStatus().value(),
          invitation.isPending() && invitation.isExpired(),
          invitation.getCreatedAt(),
          invitation.getExpiresAt(),
          invitation.getAcceptedAt(),
          invitation.getResendCount());
    }
  }

  public record InvitationResultResponse(
      InvitationResponse invitation, String inviteUrl, List<String> warnings) {}

  public record AcceptInvitationResponse(
      InvitationResponse invitation, UUID collaboratorId, String role) {}

  public record ProjectInvitationsResponse(
      List<InvitationResponse> invitations,
      long pendingCount,
      long acceptedCount,
      boolean canManage) {

    public static ProjectInvitationsResponse from(ProjectInvitations result) {
      return new ProjectInvitationsResponse(
          result.invitations().stream().map(InvitationResponse::from).toList(),
          result.pendingCount(),
          result.acceptedCount(),
          result.canManage());
    }
  }
}
