package io.b2mash.b2b.collab.access;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The single table deciding which {@link ProjectRole} may perform which {@link ProjectAction}.
 * Every permission check in the application goes through {@link #can}.
 *
 * <pre>
 * action          owner  admin  contributor  viewer  none
 * VIEW            yes    yes    yes          yes     no
 * EDIT            yes    yes    yes          no      no
 * DELETE          yes    yes    no           no      no
 * VIEW_MEMBERS    yes    yes    yes          yes     no
 * MANAGE_MEMBERS  yes    yes    no           no      no
 * </pre>
 */
public final class PermissionPolicy {

  private static final Map<ProjectRole, Set<ProjectAction>> GRANTS =
      new EnumMap<>(ProjectRole.class);

  static {
    GRANTS.put(ProjectRole.OWNER, EnumSet.allOf(ProjectAction.class));
    GRANTS.put(ProjectRole.ADMIN, EnumSet.allOf(ProjectAction.class));
    GRANTS.put(
        ProjectRole.CONTRIBUTOR,
        EnumSet.of(ProjectAction.VIEW, ProjectAction.EDIT, ProjectAction.VIEW_MEMBERS));
    GRANTS.put(ProjectRole.VIEWER, EnumSet.of(ProjectAction.VIEW, ProjectAction.VIEW_MEMBERS));
    GRANTS.put(ProjectRole.NONE, EnumSet.noneOf(ProjectAction.class));
  }

  public static boolean can(ProjectRole role, ProjectAction action) {
    if (role == null || action == null) {
      return false;
    }
    return GRANTS.get(role).contains(action);
  }

  /** Returns an unmodifiable view of the actions granted to {@code role}. */
  public static Set<ProjectAction> allowedActions(ProjectRole role) {
    return Set.copyOf(GRANTS.get(role == null ? ProjectRole.NONE : role));
  }

  private PermissionPolicy() {}
}
