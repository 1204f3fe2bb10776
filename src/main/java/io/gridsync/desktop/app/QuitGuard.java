package io.gridsync.desktop.app;

import io.gridsync.desktop.config.GridsyncDesktopProperties;
import io.gridsync.desktop.model.Gateway;
import io.gridsync.desktop.model.MagicFolder;
import java.util.List;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Classifies a quit request from the folder states of every registered gateway. */
@Component
@ApplicationLayer
public class QuitGuard {

  private static final List<QuitResponse> RESPONSES = List.of(QuitResponse.YES, QuitResponse.NO);

  private final GatewayRegistry registry;
  private final String appName;

  @Autowired
  public QuitGuard(GatewayRegistry registry, GridsyncDesktopProperties props) {
    this(registry, props.appName());
  }

  public QuitGuard(GatewayRegistry registry, String appName) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.appName = Objects.requireNonNull(appName, "appName");
  }

  public QuitAssessment classify() {
    QuitRisk risk = scan(registry.gateways());
    return switch (risk) {
      case LOADING ->
          assessment(
              risk,
              QuitAssessment.Severity.WARNING,
              "One or more folders have not finished loading. If these folders were recently "
                  + "added, you may need to add them again.");
      case SYNCING ->
          assessment(
              risk,
              QuitAssessment.Severity.WARNING,
              "One or more folders are currently syncing. If you quit, any pending upload or "
                  + "download operations will be cancelled until you launch "
                  + appName
                  + " again.");
      case IDLE ->
          assessment(
              risk,
              QuitAssessment.Severity.QUESTION,
              "If you quit, " + appName + " will stop synchronizing your folders until you "
                  + "launch it again.");
    };
  }

  /** A loading folder anywhere decides the result; syncing only counts once none is loading. */
  static QuitRisk scan(List<Gateway> gateways) {
    boolean syncing = false;
    for (Gateway gateway : gateways) {
      List<MagicFolder> folders = gateway.magicFolders();
      if (folders == null) continue;
      for (MagicFolder folder : folders) {
        if (folder == null) continue;
        if (folder.isLoading()) return QuitRisk.LOADING;
        if (folder.isSyncing()) syncing = true;
      }
    }
    return syncing ? QuitRisk.SYNCING : QuitRisk.IDLE;
  }

  private static QuitAssessment assessment(
      QuitRisk risk, QuitAssessment.Severity severity, String text) {
    return new QuitAssessment(risk, severity, text, RESPONSES, QuitResponse.NO);
  }
}
