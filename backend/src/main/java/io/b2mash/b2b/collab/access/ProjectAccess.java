package io.b2mash.b2b.collab.access;

public record ProjectAccess(
    ProjectRole role,
    boolean canView,
    boolean canEdit,
    boolean canDelete,
    boolean canViewMembers,
    boolean canManageMembers) {

  public static final ProjectAccess DENIED = of(ProjectRole.NONE);

  public static ProjectAccess of(ProjectRole role) {
    return new ProjectAccess(
        role,
        PermissionPolicy.can(role, ProjectAction.VIEW),
        PermissionPolicy.can(role, ProjectAction.EDIT),
        PermissionPolicy.can(role, ProjectAction.DELETE),
        PermissionPolicy.can(role, ProjectAction.VIEW_MEMBERS),
        PermissionPolicy.can(role, ProjectAction.MANAGE_MEMBERS));
  }
}
