package io.b2mash.b2b.collab.audit;

import io.b2mash.b2b.collab.context.RequestScopes;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates actor, source, IP address and
 * user agent from the current request when available.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("invitation.created")
 *     .entityType("invitation")
 *     .entityId(invitation.getId())
 *     .projectId(invitation.getProjectId())
 *     .details(Map.of("email", invitation.getEmail()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID projectId;
  private UUID actorId;
  private Map<String, Object> details;

  private boolean actorIdExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder projectId(UUID projectId) {
    this.projectId = projectId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record. {@code actorId} defaults to {@link RequestScopes#MEMBER_ID} when bound, the
   * actor type is USER whenever an actor is known, and the source is API inside an HTTP request.
   */
  public AuditEventRecord build() {
    if (eventType == null || entityType == null || entityId == null) {
      throw new IllegalStateException("eventType, entityType and entityId are required");
    }

    UUID resolvedActorId = this.actorId;
    if (!actorIdExplicitlySet) {
      resolvedActorId = RequestScopes.getMemberIdOrNull();
    }
    String actorType = resolvedActorId != null ? "USER" : "SYSTEM";

    HttpServletRequest request = resolveHttpRequest();
    String source = request != null ? "API" : "INTERNAL";

    String ipAddress = null;
    String userAgent = null;
    if (request != null) {
      ipAddress = request.getRemoteAddr();
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      userAgent = ua;
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        projectId,
        resolvedActorId,
        actorType,
        source,
        ipAddress,
        userAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
