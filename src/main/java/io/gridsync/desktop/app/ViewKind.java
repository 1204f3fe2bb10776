package io.gridsync.desktop.app;

/** The panels a gateway can show in the main window. */
public enum ViewKind {
  FOLDERS,
  HISTORY,
  QUOTA
}
