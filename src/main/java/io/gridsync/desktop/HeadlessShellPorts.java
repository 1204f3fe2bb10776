package io.gridsync.desktop;

import io.gridsync.desktop.app.MainWindowPort;
import io.gridsync.desktop.app.NotificationDisplayPort;
import io.gridsync.desktop.app.NotificationQueue;
import io.gridsync.desktop.app.PendingNotification;
import io.gridsync.desktop.app.TrayPresencePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback ports used until a presentation layer contributes its own beans.
 *
 * <p>The window counts as hidden, so messages wait in the notification queue. A message that does
 * reach the display is logged and then marked as read.
 */
@Configuration(proxyBeanMethods = false)
public class HeadlessShellPorts {
  private static final Logger log = LoggerFactory.getLogger(HeadlessShellPorts.class);

  @Bean
  @ConditionalOnMissingBean
  public MainWindowPort mainWindowPort() {
    return () -> false;
  }

  @Bean
  @ConditionalOnMissingBean
  public NotificationDisplayPort notificationDisplayPort(
      ObjectProvider<NotificationQueue> notificationQueue) {
    return new NotificationDisplayPort() {
      @Override
      public void showNotification(PendingNotification notification) {
        log.info("[gridsync] {}: {}", notification.title(), notification.body());
        notificationQueue.ifAvailable(
            queue ->
                queue.onDisplayed(
                    notification.gateway(), notification.title(), notification.body()));
      }

      @Override
      public void showTrayMessage(String title, String body) {
        log.info("[gridsync] {}: {}", title, body);
      }

      @Override
      public void updateUnreadIndicator(int unreadCount) {
        log.debug("[gridsync] {} unread message(s)", unreadCount);
      }
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public TrayPresencePort trayPresencePort() {
    return () -> {};
  }
}
