package io.gridsync.desktop.app;

/** Which invite control the toolbar carries, when it carries one at all. */
public enum InviteControl {
  /** Menu offering both "Enter Invite Code..." and "Create Invite Code...". */
  INVITES_MENU,
  /** Single "Enter Code" action. */
  ENTER_CODE
}
