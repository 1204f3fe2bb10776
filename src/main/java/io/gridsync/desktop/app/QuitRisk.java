package io.gridsync.desktop.app;

/** How risky quitting is right now, in priority order. */
public enum QuitRisk {
  /** At least one folder has not reported a status or completed a sync yet. */
  LOADING,
  /** At least one folder is syncing. */
  SYNCING,
  IDLE
}
