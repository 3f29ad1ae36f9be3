package kanban.auth;

import kanban.model.Role;

/**
 * Board-scoped actions and the minimum role each requires.
 */
public enum Action {
  READ_BOARD(Role.MEMBER, true),

  CREATE_LIST(Role.MEMBER, false),
  RENAME_LIST(Role.MEMBER, false),
  MOVE_LIST(Role.MEMBER, false),
  ARCHIVE_LIST(Role.MEMBER, false),
  CREATE_CARD(Role.MEMBER, false),
  RENAME_CARD(Role.MEMBER, false),
  EDIT_CARD(Role.MEMBER, false),
  MOVE_CARD(Role.MEMBER, false),
  ARCHIVE_CARD(Role.MEMBER, false),
  DELETE_CARD(Role.MEMBER, false),
  COMMENT(Role.MEMBER, false),
  ATTACH_LABEL(Role.MEMBER, false),

  RENAME_BOARD(Role.ADMIN, false),
  ARCHIVE_BOARD(Role.ADMIN, false),
  DELETE_LIST(Role.ADMIN, false),
  MANAGE_MEMBERS(Role.ADMIN, false),
  MANAGE_LABELS(Role.ADMIN, false),

  DELETE_BOARD(Role.OWNER, false),
  TRANSFER_OWNERSHIP(Role.OWNER, false),
  GRANT_OWNER(Role.OWNER, false);

  private final Role minimumRole;
  private final boolean readOnly;

  Action(Role minimumRole, boolean readOnly) {
    this.minimumRole = minimumRole;
    this.readOnly = readOnly;
  }

  public Role minimumRole() {
    return minimumRole;
  }

  public boolean isReadOnly() {
    return readOnly;
  }
}
