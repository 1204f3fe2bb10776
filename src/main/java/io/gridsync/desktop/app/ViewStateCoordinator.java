package io.gridsync.desktop.app;

import io.gridsync.desktop.config.FeatureFlags;
import io.gridsync.desktop.config.GridsyncDesktopProperties;
import io.gridsync.desktop.model.Gateway;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides which panel the main window shows and which toolbar controls are usable.
 *
 * <p>Each gateway keeps its own last-active {@link ViewKind}. Enablement is never stored; it is
 * recomputed from the gateway's status on every call. Confined to the UI thread.
 */
@Component
@ApplicationLayer
public class ViewStateCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ViewStateCoordinator.class);

  private final GatewayRegistry registry;
  private final ShellLayout layout;
  private final String appName;

  private final Map<Gateway, Set<ViewKind>> panelsByGateway = new IdentityHashMap<>();
  private final Map<Gateway, ViewKind> activeViewByGateway = new IdentityHashMap<>();
  private String windowTitle;

  @Autowired
  public ViewStateCoordinator(
      GatewayRegistry registry, FeatureFlags featureFlags, GridsyncDesktopProperties props) {
    this(registry, ShellLayout.from(featureFlags), props.appName());
  }

  public ViewStateCoordinator(GatewayRegistry registry, ShellLayout layout, String appName) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.layout = Objects.requireNonNull(layout, "layout");
    this.appName = Objects.requireNonNull(appName, "appName");
    this.windowTitle = appName;
  }

  /**
   * Pure enablement rule.
   *
   * <p>A gateway that requires storage-time and has none left gets every control disabled except
   * the quota panel; with no folders it is also forced onto the quota view. Any other gateway
   * (including {@code null}) gets every available control.
   */
  public static EnablementState computeEnablement(
      Gateway gateway, Set<ShellControl> availableControls) {
    Set<ShellControl> available =
        availableControls == null || availableControls.isEmpty()
            ? EnumSet.noneOf(ShellControl.class)
            : EnumSet.copyOf(availableControls);

    if (gateway == null || !gateway.quotaExhausted()) {
      return new EnablementState(EnablementState.Mode.FULL, available, null);
    }

    Set<ShellControl> enabled = EnumSet.noneOf(ShellControl.class);
    if (available.contains(ShellControl.QUOTA_PANEL)) enabled.add(ShellControl.QUOTA_PANEL);
    boolean noFolders = gateway.magicFolders() == null || gateway.magicFolders().isEmpty();
    return new EnablementState(
        EnablementState.Mode.RESTRICTED, enabled, noFolders ? ViewKind.QUOTA : null);
  }

  public EnablementState computeEnablement(Gateway gateway) {
    return computeEnablement(gateway, layout.availableControls());
  }

  public ShellLayout layout() {
    return layout;
  }

  /**
   * Creates the folders, history and quota panel bindings for a gateway.
   *
   * @return false if the gateway already had panels
   */
  public boolean registerGateway(Gateway gateway) {
    if (gateway == null || panelsByGateway.containsKey(gateway)) return false;
    panelsByGateway.put(gateway, EnumSet.allOf(ViewKind.class));
    activeViewByGateway.put(gateway, ViewKind.FOLDERS);
    return true;
  }

  public boolean hasPanels(Gateway gateway) {
    return gateway != null && panelsByGateway.containsKey(gateway);
  }

  /** Shows {@code kind} for the current gateway. */
  public ViewSelection selectView(ViewKind kind) {
    Gateway gateway = registry.current().orElse(null);
    Set<ViewKind> panels = gateway == null ? null : panelsByGateway.get(gateway);
    if (kind == null || panels == null || !panels.contains(kind)) {
      log.debug("[gridsync] No {} panel registered for gateway {}", kind, nameOf(gateway));
      return ViewSelection.rejected(ViewSelection.Outcome.NO_SUCH_VIEW);
    }
    activeViewByGateway.put(gateway, kind);
    return ViewSelection.applied(stateFor(gateway));
  }

  /**
   * Switches the main window to another gateway, restoring that gateway's own last view.
   *
   * <p>The window title names the gateway only when multiple grids are enabled.
   */
  public ViewSelection onGatewaySelected(Gateway gateway) {
    if (!registry.select(gateway)) {
      log.warn("[gridsync] Ignoring selection of unregistered gateway {}", nameOf(gateway));
      return ViewSelection.rejected(ViewSelection.Outcome.UNKNOWN_GATEWAY);
    }
    log.debug("[gridsync] Selected gateway '{}'", gateway.name());
    if (layout.multipleGrids()) {
      windowTitle = appName + " - " + gateway.name();
    }
    return ViewSelection.applied(stateFor(gateway));
  }

  /** Recomputes the state of the current gateway, e.g. after a quota or folder change. */
  public Optional<ViewState> currentState() {
    return registry.current().map(this::stateFor);
  }

  public Optional<ViewKind> activeView(Gateway gateway) {
    if (gateway == null) return Optional.empty();
    return Optional.ofNullable(activeViewByGateway.get(gateway));
  }

  public String windowTitle() {
    return windowTitle;
  }

  private ViewState stateFor(Gateway gateway) {
    EnablementState enablement = computeEnablement(gateway);
    ViewKind forced = enablement.forcedView();
    if (forced != null && panelsByGateway.getOrDefault(gateway, Set.of()).contains(forced)) {
      activeViewByGateway.put(gateway, forced);
    }
    ViewKind active = activeViewByGateway.getOrDefault(gateway, ViewKind.FOLDERS);
    return new ViewState(gateway, enablement, active, windowTitle);
  }

  private static String nameOf(Gateway gateway) {
    return gateway == null ? "<none>" : "'" + gateway.name() + "'";
  }
}
