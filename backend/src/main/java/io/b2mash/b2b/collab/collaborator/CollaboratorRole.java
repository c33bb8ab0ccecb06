package io.b2mash.b2b.collab.collaborator;

import io.b2mash.b2b.collab.access.ProjectRole;
import io.b2mash.b2b.collab.exception.InvalidRoleException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Roles a collaborator row may carry. The owner is never a collaborator. */
public enum CollaboratorRole {
  VIEWER(ProjectRole.VIEWER),
  CONTRIBUTOR(ProjectRole.CONTRIBUTOR),
  ADMIN(ProjectRole.ADMIN);

  private final ProjectRole projectRole;

  CollaboratorRole(ProjectRole projectRole) {
    this.projectRole = projectRole;
  }

  public ProjectRole toProjectRole() {
    return projectRole;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<CollaboratorRole> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(role -> role.value().equals(value.trim())).findFirst();
  }

  /** Parses a wire value, rejecting anything but viewer, contributor or admin. */
  public static CollaboratorRole parse(String value) {
    return fromValue(value).orElseThrow(() -> new InvalidRoleException(value));
  }
}
