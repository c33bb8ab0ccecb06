package io.b2mash.b2b.collab.integration.email;

/** Port for sending emails via an external provider (SMTP, or a no-op in development). */
public interface EmailProvider {

  /** Provider identifier (e.g. "smtp", "noop"). */
  String providerId();

  /** Sends the message. Delivery failures are reported in the result, not thrown. */
  SendResult sendEmail(EmailMessage message);
}
