package io.gridsync.desktop.app;

import io.gridsync.desktop.config.ShellConfig;
import io.gridsync.desktop.model.Gateway;
import io.gridsync.desktop.model.NewscapEvent;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Binds gateways handed over by the gateway subsystem into the main window's state.
 *
 * <p>Newscap events are observed on the UI scheduler so that registry, view and notification state
 * stay confined to one thread.
 */
@Component
@ApplicationLayer
public class GatewayShellCoordinator {
  private static final Logger log = LoggerFactory.getLogger(GatewayShellCoordinator.class);

  private final GatewayRegistry registry;
  private final ViewStateCoordinator viewState;
  private final NotificationQueue notifications;
  private final NotificationDisplayPort display;
  private final Scheduler uiScheduler;
  private final CompositeDisposable subscriptions = new CompositeDisposable();

  public GatewayShellCoordinator(
      GatewayRegistry registry,
      ViewStateCoordinator viewState,
      NotificationQueue notifications,
      NotificationDisplayPort display,
      @Qualifier(ShellConfig.UI_SCHEDULER) Scheduler uiScheduler) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.viewState = Objects.requireNonNull(viewState, "viewState");
    this.notifications = Objects.requireNonNull(notifications, "notifications");
    this.display = Objects.requireNonNull(display, "display");
    this.uiScheduler = Objects.requireNonNull(uiScheduler, "uiScheduler");
  }

  /**
   * Adds every gateway not seen before. Each new gateway becomes the current one, gets its panels
   * and has its newscap stream routed into the notification queue.
   *
   * <p>The current gateway then goes through the normal selection path, so the returned state
   * carries its window title.
   *
   * @return the state to render for the current gateway, empty when {@code gateways} was empty
   */
  public Optional<ViewState> populate(List<Gateway> gateways) {
    if (gateways == null || gateways.isEmpty()) return Optional.empty();
    for (Gateway gateway : gateways) {
      if (gateway == null || !registry.register(gateway)) continue;
      viewState.registerGateway(gateway);
      subscriptions.add(
          gateway
              .newscapEvents()
              .observeOn(uiScheduler)
              .subscribe(
                  event -> onNewscapEvent(gateway, event),
                  err ->
                      log.warn(
                          "[gridsync] newscap stream failed for gateway '{}'",
                          gateway.name(),
                          err)));
    }
    return registry.current().flatMap(current -> viewState.onGatewaySelected(current).state());
  }

  /** Re-evaluates the current gateway after a quota or folder status change. */
  public Optional<ViewState> refresh() {
    Optional<ViewState> state = viewState.currentState();
    if (state.isPresent()) {
      display.updateUnreadIndicator(notifications.unreadCount());
    }
    return state;
  }

  void onNewscapEvent(Gateway gateway, NewscapEvent event) {
    if (event == null) return;
    switch (event.kind()) {
      case MESSAGE -> notifications.enqueueMessage(gateway, event.body());
      case UPGRADE_REQUIRED -> notifications.enqueueUpgradeRequired(gateway);
    }
  }

  @PreDestroy
  void shutdown() {
    subscriptions.dispose();
  }
}
