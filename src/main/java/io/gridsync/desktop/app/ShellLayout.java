package io.gridsync.desktop.app;

import io.gridsync.desktop.config.FeatureFlags;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Toolbar composition fixed at startup by the feature flags.
 *
 * @param inviteControl the invite control, if any
 * @param multipleGrids whether the grid selector is shown and the window title names the gateway
 */
public record ShellLayout(Optional<InviteControl> inviteControl, boolean multipleGrids) {

  public ShellLayout {
    inviteControl = inviteControl == null ? Optional.empty() : inviteControl;
  }

  public static ShellLayout from(FeatureFlags flags) {
    FeatureFlags f = flags == null ? FeatureFlags.allEnabled() : flags;
    Optional<InviteControl> invite;
    if (f.gridInvitesEnabled()) {
      invite = Optional.of(InviteControl.INVITES_MENU);
    } else if (f.invitesEnabled()) {
      invite = Optional.of(InviteControl.ENTER_CODE);
    } else {
      invite = Optional.empty();
    }
    return new ShellLayout(invite, f.multipleGridsEnabled());
  }

  /**
   * Controls present on the toolbar. {@link ShellControl#INVITES} only with an invite control,
   * {@link ShellControl#GRID_SELECTOR} only with multiple grids.
   */
  public Set<ShellControl> availableControls() {
    EnumSet<ShellControl> controls = EnumSet.allOf(ShellControl.class);
    if (inviteControl.isEmpty()) controls.remove(ShellControl.INVITES);
    if (!multipleGrids) controls.remove(ShellControl.GRID_SELECTOR);
    return controls;
  }
}
