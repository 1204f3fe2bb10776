package io.gridsync.desktop.app;

import org.jmolecules.architecture.layered.ApplicationLayer;

/** App-owned handle on the system tray icon. */
@ApplicationLayer
public interface TrayPresencePort {

  void hideTray();
}
