package io.gridsync.desktop.app;

import org.jmolecules.architecture.layered.ApplicationLayer;

/** App-owned contract for surfacing newscap messages to the user. */
@ApplicationLayer
public interface NotificationDisplayPort {

  /**
   * Shows one message in a window-modal box. Once the user has dismissed it, the implementation
   * must call {@link NotificationQueue#onDisplayed} so the message leaves the unread list.
   */
  void showNotification(PendingNotification notification);

  /** Shows a plain-text toast from the system tray. */
  void showTrayMessage(String title, String body);

  /** Refreshes the unread badge/tray indicator. */
  void updateUnreadIndicator(int unreadCount);
}
