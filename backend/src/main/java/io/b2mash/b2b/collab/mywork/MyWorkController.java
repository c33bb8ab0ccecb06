package io.b2mash.b2b.collab.mywork;

import io.b2mash.b2b.collab.collaborator.CollaborationInfo;
import io.b2mash.b2b.collab.collaborator.CollaboratorService;
import io.b2mash.b2b.collab.context.RequestScopes;
import io.b2mash.b2b.collab.invitation.InvitationController.InvitationResponse;
import io.b2mash.b2b.collab.invitation.InvitationService;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** The caller's own invitations and collaborations across projects. */
@RestController
@RequestMapping("/api/me")
public class MyWorkController {

  private final InvitationService invitationService;
  private final CollaboratorService collaboratorService;

  public MyWorkController(
      InvitationService invitationService, CollaboratorService collaboratorService) {
    this.invitationService = invitationService;
    this.collaboratorService = collaboratorService;
  }

  @GetMapping("/invitations")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<List<InvitationResponse>> getMyInvitations() {
    UUID memberId = RequestScopes.requireMemberId();
    var invitations =
        invitationService.listMyInvitations(memberId).stream()
            .map(InvitationResponse::from)
            .toList();
    return ResponseEntity.ok(invitations);
  }

  @GetMapping("/collaborations")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<List<CollaborationResponse>> getMyCollaborations() {
    UUID memberId = RequestScopes.requireMemberId();
    var collaborations =
        collaboratorService.listMyCollaborations(memberId).stream()
            .map(CollaborationResponse::from)
            .toList();
    return ResponseEntity.ok(collaborations);
  }

  public record CollaborationResponse(
      UUID id,
      UUID projectId,
      String projectName,
      boolean projectActive,
      String role,
      Instant addedAt) {

    public static CollaborationResponse from(CollaborationInfo info) {
      return new CollaborationResponse(
          info.id(),
          info.projectId(),
          info.projectName(),
          info.projectActive(),
          info.role().value(),
          info.addedAt());
    }
  }
}
