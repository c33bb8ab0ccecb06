package io.b2mash.b2b.collab.access;

public enum ProjectAction {
  VIEW,
  EDIT,
  DELETE,
  VIEW_MEMBERS,
  /** Invite, change roles, remove collaborators. */
  MANAGE_MEMBERS
}
