package io.gridsync.desktop.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class MagicFolderTest {

  @Test
  void folderWithoutStatusOrSyncTimeIsLoading() {
    assertTrue(MagicFolder.loading("Documents").isLoading());
    assertTrue(new MagicFolder("Documents", null, null).isLoading());
    assertTrue(new MagicFolder("Documents", FolderStatus.LOADING, null).isLoading());
  }

  @Test
  void recordedSyncTimeEndsLoadingEvenWithoutStatus() {
    MagicFolder folder = new MagicFolder("Documents", FolderStatus.UNKNOWN, Instant.EPOCH);

    assertFalse(folder.isLoading());
    assertFalse(folder.isSyncing());
  }

  @Test
  void reportedStatusEndsLoading() {
    MagicFolder syncing = new MagicFolder("Photos", FolderStatus.SYNCING, null);

    assertFalse(syncing.isLoading());
    assertTrue(syncing.isSyncing());
    assertFalse(new MagicFolder("Photos", FolderStatus.ERROR, null).isLoading());
  }

  @Test
  void constructorNormalizesNameAndStatus() {
    MagicFolder folder = new MagicFolder("  Music ", null, null);

    assertEquals("Music", folder.name());
    assertEquals(FolderStatus.UNKNOWN, folder.status());
    assertEquals("", new MagicFolder(null, FolderStatus.SYNCED, null).name());
  }
}
