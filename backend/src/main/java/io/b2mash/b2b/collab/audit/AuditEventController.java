package io.b2mash.b2b.collab.audit;

import io.b2mash.b2b.collab.access.ProjectAccessService;
import io.b2mash.b2b.collab.access.ProjectAction;
import io.b2mash.b2b.collab.context.RequestScopes;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditEventController {

  private final AuditService auditService;
  private final ProjectAccessService projectAccessService;

  public AuditEventController(
      AuditService auditService, ProjectAccessService projectAccessService) {
    this.auditService = auditService;
    this.projectAccessService = projectAccessService;
  }

  /** Membership and project history; restricted to those who may manage members. */
  @GetMapping("/api/projects/{projectId}/audit-events")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<Page<AuditEventResponse>> listProjectEvents(
      @PathVariable UUID projectId,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    UUID memberId = RequestScopes.requireMemberId();
    projectAccessService.requireAccess(projectId, memberId, ProjectAction.MANAGE_MEMBERS);

    var pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 200));
    var events = auditService.findProjectEvents(projectId, pageable);
    return ResponseEntity.ok(events.map(AuditEventResponse::from));
  }

  // --- DTO ---

  public record AuditEventResponse(
      UUID id,
      String eventType,
      String entityType,
      UUID entityId,
      UUID actorId,
      String actorType,
      String source,
      Map<String, Object> details,
      Instant occurredAt) {

    public static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getEventType(),
          event.getEntityType(),
          event.getEntityId(),
          event.getActorId(),
          event.getActorType(),
          event.getSource(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
