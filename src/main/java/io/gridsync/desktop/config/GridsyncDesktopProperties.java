package io.gridsync.desktop.config;

import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Desktop shell configuration.
 *
 * @param appName display name used in window titles and user-facing messages
 * @param configDir directory holding {@code preferences.ini}
 */
@ConfigurationProperties(prefix = "gridsync")
public record GridsyncDesktopProperties(String appName, String configDir) {

  public static final String DEFAULT_APP_NAME = "Gridsync";

  public GridsyncDesktopProperties {
    appName = Objects.toString(appName, "").trim();
    if (appName.isEmpty()) appName = DEFAULT_APP_NAME;
    configDir = Objects.toString(configDir, "").trim();
    if (configDir.isEmpty()) {
      configDir = System.getProperty("user.home") + "/.config/gridsync";
    }
  }
}
