package io.gridsync.desktop.model;

/** Sync state reported by the folder sync engine for a single magic folder. */
public enum FolderStatus {
  /** No status has been reported yet. */
  UNKNOWN,
  LOADING,
  SYNCING,
  SYNCED,
  ERROR
}
