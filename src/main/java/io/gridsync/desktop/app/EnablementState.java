package io.gridsync.desktop.app;

import java.util.Set;

/**
 * Which controls are usable for a gateway, derived from its status.
 *
 * @param mode {@link Mode#FULL} or {@link Mode#RESTRICTED} (storage-time exhausted)
 * @param enabledControls controls that accept input
 * @param forcedView view that must be shown regardless of the user's choice, or {@code null}
 */
public record EnablementState(Mode mode, Set<ShellControl> enabledControls, ViewKind forcedView) {

  public enum Mode {
    FULL,
    RESTRICTED
  }

  public EnablementState {
    mode = mode == null ? Mode.FULL : mode;
    enabledControls = enabledControls == null ? Set.of() : Set.copyOf(enabledControls);
  }

  public boolean isEnabled(ShellControl control) {
    return control != null && enabledControls.contains(control);
  }

  public boolean isRestricted() {
    return mode == Mode.RESTRICTED;
  }
}
