package io.b2mash.b2b.collab.project;

import io.b2mash.b2b.collab.exception.InvalidProjectSettingsException;
import java.util.Arrays;
import java.util.Locale;

/** Where a project's deployment stands. New projects start out {@link #PENDING}. */
public enum DeploymentStatus {
  PENDING,
  IN_PROGRESS,
  DEPLOYED,
  FAILED,
  MAINTENANCE;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static DeploymentStatus parse(String value) {
    return Arrays.stream(values())
        .filter(status -> value != null && status.value().equals(value.trim()))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidProjectSettingsException(
                    "deploymentStatus must be one of pending, in_progress, deployed, failed"
                        + " or maintenance; got '"
                        + value
                        + "'"));
  }
}
