package io.gridsync.desktop.app;

import io.gridsync.desktop.config.GridsyncDesktopProperties;
import io.gridsync.desktop.config.ShellConfig;
import io.gridsync.desktop.model.Gateway;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Holds newscap messages until the main window can show them.
 *
 * <p>Every message goes on the unread list. While the window is hidden only the most recent message
 * is kept for display on the next show; older hidden arrivals stay unread but are not popped up.
 * Confined to the UI thread.
 */
@Component
@ApplicationLayer
public class NotificationQueue {
  private static final Logger log = LoggerFactory.getLogger(NotificationQueue.class);

  public enum EnqueueOutcome {
    DISPLAYED,
    PENDING,
    UNKNOWN_GATEWAY
  }

  private final GatewayRegistry registry;
  private final MainWindowPort mainWindow;
  private final NotificationDisplayPort display;
  private final Scheduler uiScheduler;
  private final String appName;

  private final List<PendingNotification> unread = new ArrayList<>();
  private PendingNotification pending;

  @Autowired
  public NotificationQueue(
      GatewayRegistry registry,
      MainWindowPort mainWindow,
      NotificationDisplayPort display,
      @Qualifier(ShellConfig.UI_SCHEDULER) Scheduler uiScheduler,
      GridsyncDesktopProperties props) {
    this(registry, mainWindow, display, uiScheduler, props.appName());
  }

  public NotificationQueue(
      GatewayRegistry registry,
      MainWindowPort mainWindow,
      NotificationDisplayPort display,
      Scheduler uiScheduler,
      String appName) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.mainWindow = Objects.requireNonNull(mainWindow, "mainWindow");
    this.display = Objects.requireNonNull(display, "display");
    this.uiScheduler = Objects.requireNonNull(uiScheduler, "uiScheduler");
    this.appName = Objects.requireNonNull(appName, "appName");
  }

  /**
   * Records a message as unread and shows it now if the window is visible; otherwise it replaces
   * whatever was waiting for the next show.
   */
  public EnqueueOutcome enqueue(Gateway gateway, String title, String body) {
    if (!registry.contains(gateway)) {
      log.warn("[gridsync] Dropping notification '{}' from unregistered gateway", title);
      return EnqueueOutcome.UNKNOWN_GATEWAY;
    }
    PendingNotification n = new PendingNotification(gateway, title, body);
    unread.add(n);
    display.updateUnreadIndicator(unread.size());

    if (mainWindow.isWindowVisible()) {
      display.showNotification(n);
      return EnqueueOutcome.DISPLAYED;
    }
    if (pending != null) {
      log.debug("[gridsync] Replacing pending notification '{}' with '{}'", pending.title(), title);
    }
    pending = n;
    return EnqueueOutcome.PENDING;
  }

  /** Handles a plain newscap message: tray toast first, then the normal enqueue path. */
  public EnqueueOutcome enqueueMessage(Gateway gateway, String body) {
    if (gateway == null) return EnqueueOutcome.UNKNOWN_GATEWAY;
    String title = "New message from " + gateway.name();
    if (registry.contains(gateway)) {
      display.showTrayMessage(title, NewscapText.toPlainText(body));
    }
    return enqueue(gateway, title, body);
  }

  /** Handles a newscap message the client could not decode. */
  public EnqueueOutcome enqueueUpgradeRequired(Gateway gateway) {
    if (gateway == null) return EnqueueOutcome.UNKNOWN_GATEWAY;
    return enqueue(gateway, "Upgrade required", upgradeRequiredMessage(gateway.name()));
  }

  String upgradeRequiredMessage(String gatewayName) {
    return "A message was received from "
        + gatewayName
        + " in an unsupported format. This suggests that you are running an out-of-date version of "
        + appName
        + ".\n\nTo avoid seeing this warning, please upgrade to the latest version.";
  }

  /**
   * Called after the main window became visible. A waiting message is shown on the next UI tick,
   * never from within the show handler itself.
   *
   * @return true if a display was scheduled
   */
  public boolean onShown() {
    PendingNotification n = pending;
    if (n == null) return false;
    pending = null;
    uiScheduler.scheduleDirect(() -> display.showNotification(n));
    return true;
  }

  /**
   * Marks a message as read.
   *
   * @return false if it was not on the unread list (already read); nothing changes then
   */
  public boolean onDisplayed(Gateway gateway, String title, String body) {
    if (gateway == null) return false;
    if (!unread.remove(new PendingNotification(gateway, title, body))) return false;
    display.updateUnreadIndicator(unread.size());
    return true;
  }

  public List<PendingNotification> unreadMessages() {
    return List.copyOf(unread);
  }

  public int unreadCount() {
    return unread.size();
  }

  public Optional<PendingNotification> pendingNotification() {
    return Optional.ofNullable(pending);
  }
}
