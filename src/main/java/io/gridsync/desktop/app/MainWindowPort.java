package io.gridsync.desktop.app;

import org.jmolecules.architecture.layered.ApplicationLayer;

/** App-owned view of the main window's visibility. */
@ApplicationLayer
public interface MainWindowPort {

  boolean isWindowVisible();
}
