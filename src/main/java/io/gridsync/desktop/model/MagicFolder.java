package io.gridsync.desktop.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of one magic folder as reported by its gateway.
 *
 * @param name folder name (never null, may be empty)
 * @param status last reported sync status; {@link FolderStatus#UNKNOWN} when none was reported
 * @param lastSyncTime time of the last completed sync, or {@code null} if the folder never synced
 */
public record MagicFolder(String name, FolderStatus status, Instant lastSyncTime) {

  public MagicFolder {
    name = Objects.toString(name, "").trim();
    status = status == null ? FolderStatus.UNKNOWN : status;
  }

  public static MagicFolder loading(String name) {
    return new MagicFolder(name, FolderStatus.UNKNOWN, null);
  }

  /**
   * True while the folder has neither a reported status nor a completed sync.
   *
   * <p>An explicit {@link FolderStatus#LOADING} report counts as "no status" here.
   */
  public boolean isLoading() {
    boolean statusUnset = status == FolderStatus.UNKNOWN || status == FolderStatus.LOADING;
    return statusUnset && lastSyncTime == null;
  }

  public boolean isSyncing() {
    return status == FolderStatus.SYNCING;
  }
}
