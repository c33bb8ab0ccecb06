package io.b2mash.b2b.collab.project;

import io.b2mash.b2b.collab.exception.InvalidProjectSettingsException;

/**
 * Deployment metadata attached to a project. Every field is optional; format rules are enforced on
 * the request DTOs, the cross-field rule here.
 */
public record DeploymentSettings(
    String githubUsername, String databaseName, String domainName, String githubLink) {

  public DeploymentSettings {
    githubUsername = blankToNull(githubUsername);
    databaseName = blankToNull(databaseName);
    domainName = blankToNull(domainName);
    githubLink = blankToNull(githubLink);
  }

  /** A repository link must sit under the configured GitHub account. */
  public void validate() {
    if (githubLink == null) {
      return;
    }
    if (githubUsername == null) {
      throw new InvalidProjectSettingsException(
          "githubLink requires githubUsername to be set");
    }
    String expectedPrefix = "https://github.com/" + githubUsername + "/";
    if (!githubLink.startsWith(expectedPrefix)) {
      throw new InvalidProjectSettingsException(
          "GitHub link must belong to user " + githubUsername);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
