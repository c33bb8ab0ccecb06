package io.b2mash.b2b.collab.integration.email;

/**
 * Outcome of a send attempt.
 *
 * @param success whether the provider accepted the message
 * @param providerMessageId provider-assigned id; null on failure
 * @param errorMessage failure reason; null on success
 */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {

  public static SendResult failed(String errorMessage) {
    return new SendResult(false, null, errorMessage);
  }
}
