package io.b2mash.b2b.collab.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Application settings under the {@code collab} prefix.
 *
 * <pre>
 * collab:
 *   invitations:
 *     expiry-days: 30
 *     base-url: http://localhost:3000
 *   email:
 *     sender-address: noreply@collab.local
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "collab")
public record CollabProperties(
    @DefaultValue Invitations invitations, @DefaultValue Email email) {

  public record Invitations(
      @DefaultValue("30") @Min(1) int expiryDays,
      @DefaultValue("http://localhost:3000") @NotBlank String baseUrl) {

    /** Link the recipient follows to accept or decline. */
    public String inviteUrl(String token) {
      String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
      return base + "/invitations/" + token;
    }
  }

  public record Email(@DefaultValue("noreply@collab.local") @NotBlank String senderAddress) {}
}
