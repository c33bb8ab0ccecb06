package io.b2mash.b2b.collab.collaborator;

import io.b2mash.b2b.collab.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects/{projectId}/collaborators")
public class CollaboratorController {

  private final CollaboratorService collaboratorService;

  public CollaboratorController(CollaboratorService collaboratorService) {
    this.collaboratorService = collaboratorService;
  }

  @GetMapping
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<List<CollaboratorResponse>> listCollaborators(
      @PathVariable UUID projectId) {
    UUID memberId = RequestScopes.requireMemberId();
    var collaborators =
        collaboratorService.listCollaborators(projectId, memberId).stream()
            .map(CollaboratorResponse::from)
            .toList();
    return ResponseEntity.ok(collaborators);
  }

  @PostMapping
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<CollaboratorResponse> addCollaborator(
      @PathVariable UUID projectId, @Valid @RequestBody AddCollaboratorRequest request) {
    UUID memberId = RequestScopes.requireMemberId();
    var role =
        request.role() != null ? CollaboratorRole.parse(request.role()) : CollaboratorRole.VIEWER;
    var collaborator =
        collaboratorService.addCollaborator(projectId, request.memberId(), role, memberId);
    return ResponseEntity.created(
            URI.create("/api/projects/" + projectId + "/collaborators/" + collaborator.getId()))
        .body(CollaboratorResponse.from(collaborator));
  }

  @PutMapping("/{collaboratorId}/role")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<CollaboratorResponse> updateRole(
      @PathVariable UUID projectId,
      @PathVariable UUID collaboratorId,
      @Valid @RequestBody UpdateRoleRequest request) {
    UUID memberId = RequestScopes.requireMemberId();
    var role = CollaboratorRole.parse(request.role());
    var collaborator = collaboratorService.updateRole(projectId, collaboratorId, role, memberId);
    return ResponseEntity.ok(CollaboratorResponse.from(collaborator));
  }

  @DeleteMapping("/{collaboratorId}")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<Void> removeCollaborator(
      @PathVariable UUID projectId, @PathVariable UUID collaboratorId) {
    UUID memberId = RequestScopes.requireMemberId();
    collaboratorService.removeCollaborator(projectId, collaboratorId, memberId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record AddCollaboratorRequest(
      @NotNull(message = "memberId is required") UUID memberId, String role) {}

  public record UpdateRoleRequest(@NotBlank(message = "role is required") String role) {}

  public record CollaboratorResponse(
      UUID id,
      UUID projectId,
      UUID memberId,
      String name,
      String email,
      String role,
      UUID addedBy,
      Instant addedAt) {

    public static CollaboratorResponse from(CollaboratorInfo info) {
      return new CollaboratorResponse(
          info.id(),
          info.projectId(),
          info.memberId(),
          info.name(),
          info.email(),
          info.role().value(),
          info.addedBy(),
          info.addedAt());
    }

    public static CollaboratorResponse from(Collaborator collaborator) {
      return new CollaboratorResponse(
          collaborator.getId(),
          collaborator.getProjectId(),
          collaborator.getMemberId(),
          null,
          null,
          collaborator.getRole().value(),
          collaborator.getAddedBy(),
          collaborator.getAddedAt());
    }
  }
}
