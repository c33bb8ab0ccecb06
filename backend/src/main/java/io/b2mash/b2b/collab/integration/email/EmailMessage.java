package io.b2mash.b2b.collab.integration.email;

import java.util.Map;
import java.util.Objects;

/** Provider-agnostic email payload. */
public record EmailMessage(
    String to,
    String subject,
    String htmlBody,
    String plainTextBody,
    String replyTo,
    Map<String, String> metadata) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
  }

  /** Builds a message tagged with the entity it was sent for. */
  public static EmailMessage withReference(
      String to, RenderedEmail rendered, String replyTo, String referenceType, String referenceId) {
    Objects.requireNonNull(referenceType, "referenceType");
    Objects.requireNonNull(referenceId, "referenceId");
    return new EmailMessage(
        to,
        rendered.subject(),
        rendered.htmlBody(),
        rendered.plainTextBody(),
        replyTo,
        Map.of("referenceType", referenceType, "referenceId", referenceId));
  }
}
