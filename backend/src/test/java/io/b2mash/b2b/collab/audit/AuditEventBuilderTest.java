package io.b2mash.b2b.collab.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.collab.context.RequestScopes;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

class AuditEventBuilderTest {

  private static final UUID ENTITY_ID = UUID.randomUUID();

  @AfterEach
  void clearRequest() {
    RequestContextHolder.resetRequestAttributes();
  }

  @Test
  void outsideRequestIsSystemInternal() {
    var record =
        AuditEventBuilder.builder()
            .eventType("invitation.expired")
            .entityType("invitation")
            .entityId(ENTITY_ID)
            .build();

    assertThat(record.actorId()).isNull();
    assertThat(record.actorType()).isEqualTo("SYSTEM");
    assertThat(record.source()).isEqualTo("INTERNAL");
    assertThat(record.ipAddress()).isNull();
    assertThat(record.userAgent()).isNull();
  }

  @Test
  void boundMemberBecomesActor() {
    var memberId = UUID.randomUUID();
    var request = new MockHttpServletRequest();
    request.setRemoteAddr("10.0.0.7");
    request.addHeader("User-Agent", "x".repeat(600));
    RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

    var record =
        RequestScopes.MEMBER_ID.callWhere(
            memberId,
            () ->
                AuditEventBuilder.builder()
                    .eventType("collaborator.added")
                    .entityType("collaborator")
                    .entityId(ENTITY_ID)
                    .projectId(UUID.randomUUID())
                    .details(Map.of("role", "viewer"))
                    .build());

    assertThat(record.actorId()).isEqualTo(memberId);
    assertThat(record.actorType()).isEqualTo("USER");
    assertThat(record.source()).isEqualTo("API");
    assertThat(record.ipAddress()).isEqualTo("10.0.0.7");
    assertThat(record.userAgent()).hasSize(500);
    assertThat(record.details()).containsEntry("role", "viewer");
  }

  @Test
  void explicitActorWinsOverBoundMember() {
    var explicit = UUID.randomUUID();

    var record =
        RequestScopes.MEMBER_ID.callWhere(
            UUID.randomUUID(),
            () ->
                AuditEventBuilder.builder()
                    .eventType("project.updated")
                    .entityType("project")
                    .entityId(ENTITY_ID)
                    .actorId(explicit)
                    .build());

    assertThat(record.actorId()).isEqualTo(explicit);
  }

  @Test
  void requiredFieldsAreEnforced() {
    assertThatThrownBy(() -> AuditEventBuilder.builder().eventType("project.created").build())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void detailsSurviveJsonColumn() {
    var converter = new AuditDetailsConverter();

    String json =
        converter.convertToDatabaseColumn(
            Map.of("expires_at", Map.of("from", "a", "to", "b"), "resend_count", 2));
    var restored = converter.convertToEntityAttribute(json);

    assertThat(restored).containsEntry("resend_count", 2);
    assertThat(restored.get("expires_at")).isEqualTo(Map.of("from", "a", "to", "b"));
    assertThat(converter.convertToEntityAttribute(" ")).isNull();
    assertThat(converter.convertToDatabaseColumn(null)).isNull();
  }
}
