package io.gridsync.desktop.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.gridsync.desktop.model.FolderStatus;
import io.gridsync.desktop.model.MagicFolder;
import io.gridsync.desktop.model.StubGateway;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class QuitGuardTest {

  private static final Instant SYNCED_AT = Instant.parse("2026-01-01T00:00:00Z");

  @Test
  void noGatewaysIsIdle() {
    QuitAssessment assessment = new QuitGuard(new GatewayRegistry(), "Gridsync").classify();

    assertThat(assessment.risk()).isEqualTo(QuitRisk.IDLE);
    assertThat(assessment.severity()).isEqualTo(QuitAssessment.Severity.QUESTION);
    assertThat(assessment.informativeText())
        .isEqualTo(
            "If you quit, Gridsync will stop synchronizing your folders until you launch it again.");
  }

  @Test
  void loadingWinsOverSyncingAcrossGateways() {
    GatewayRegistry registry = new GatewayRegistry();
    registry.register(
        StubGateway.open("first")
            .withFolders(new MagicFolder("Photos", FolderStatus.SYNCING, SYNCED_AT)));
    registry.register(
        StubGateway.open("second")
            .withFolders(
                new MagicFolder("Music", FolderStatus.SYNCED, SYNCED_AT),
                MagicFolder.loading("New")));

    QuitAssessment assessment = new QuitGuard(registry, "Gridsync").classify();

    assertThat(assessment.risk()).isEqualTo(QuitRisk.LOADING);
    assertThat(assessment.severity()).isEqualTo(QuitAssessment.Severity.WARNING);
    assertThat(assessment.informativeText())
        .startsWith("One or more folders have not finished loading.");
  }

  @Test
  void loadingWinsWhenSyncingFolderComesFirstInTheSameGateway() {
    GatewayRegistry registry = new GatewayRegistry();
    registry.register(
        StubGateway.open("grid")
            .withFolders(
                new MagicFolder("Photos", FolderStatus.SYNCING, null),
                MagicFolder.loading("New")));

    assertThat(new QuitGuard(registry, "Gridsync").classify().risk()).isEqualTo(QuitRisk.LOADING);
  }

  @Test
  void syncingFolderWithoutLoadingFoldersIsSyncing() {
    GatewayRegistry registry = new GatewayRegistry();
    registry.register(
        StubGateway.open("grid")
            .withFolders(
                new MagicFolder("Music", FolderStatus.SYNCED, SYNCED_AT),
                new MagicFolder("Photos", FolderStatus.SYNCING, SYNCED_AT)));

    QuitAssessment assessment = new QuitGuard(registry, "Tahoe Desktop").classify();

    assertThat(assessment.risk()).isEqualTo(QuitRisk.SYNCING);
    assertThat(assessment.informativeText())
        .isEqualTo(
            "One or more folders are currently syncing. If you quit, any pending upload or "
                + "download operations will be cancelled until you launch Tahoe Desktop again.");
  }

  @Test
  void unknownStatusWithPreviousSyncIsIdle() {
    GatewayRegistry registry = new GatewayRegistry();
    registry.register(
        StubGateway.open("grid")
            .withFolders(
                new MagicFolder("Docs", FolderStatus.UNKNOWN, SYNCED_AT),
                new MagicFolder("Broken", FolderStatus.ERROR, null)));

    assertThat(new QuitGuard(registry, "Gridsync").classify().risk()).isEqualTo(QuitRisk.IDLE);
  }

  @Test
  void everyAssessmentOffersYesAndNoDefaultingToNo() {
    QuitAssessment assessment = new QuitGuard(new GatewayRegistry(), "Gridsync").classify();

    assertThat(assessment.responses()).containsExactly(QuitResponse.YES, QuitResponse.NO);
    assertThat(assessment.defaultResponse()).isEqualTo(QuitResponse.NO);
  }
}
