package io.gridsync.desktop;

import io.gridsync.desktop.config.FeatureFlags;
import io.gridsync.desktop.config.GridsyncDesktopProperties;
import io.gridsync.desktop.config.PreferenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "Gridsync",
    sharedModules = {"config", "model"})
@EnableConfigurationProperties(GridsyncDesktopProperties.class)
public class GridsyncDesktopApp {
  private static final Logger log = LoggerFactory.getLogger(GridsyncDesktopApp.class);

  public static void main(String[] args) {
    new SpringApplicationBuilder(GridsyncDesktopApp.class).headless(false).run(args);
  }

  @Bean
  public ApplicationRunner logStartup(
      GridsyncDesktopProperties props, PreferenceStore preferences, FeatureFlags flags) {
    return args ->
        log.info(
            "[gridsync] {} shell started (preferences: '{}', grid invites: {}, invites: {}, "
                + "multiple grids: {})",
            props.appName(),
            preferences.preferencesPath(),
            flags.gridInvitesEnabled(),
            flags.invitesEnabled(),
            flags.multipleGridsEnabled());
  }
}
