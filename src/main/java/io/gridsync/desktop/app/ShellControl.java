package io.gridsync.desktop.app;

/** Interactive toolbar controls whose enablement follows the current gateway's status. */
public enum ShellControl {
  ADD_FOLDER,
  INVITES,
  HISTORY,
  RECOVERY,
  FOLDERS_PANEL,
  QUOTA_PANEL,
  GRID_SELECTOR
}
