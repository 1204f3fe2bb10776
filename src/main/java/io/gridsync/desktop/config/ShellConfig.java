package io.gridsync.desktop.config;

import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import javax.swing.SwingUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Startup-resolved collaborators shared by the desktop shell. */
@Configuration
public class ShellConfig {
  private static final Logger log = LoggerFactory.getLogger(ShellConfig.class);

  public static final String UI_SCHEDULER = "uiScheduler";

  /** Feature flags are read once; changing them requires a restart. */
  @Bean
  public FeatureFlags featureFlags(PreferenceStore preferences) {
    FeatureFlags flags = FeatureFlags.from(preferences);
    log.debug("[gridsync] Feature flags from '{}': {}", preferences.preferencesPath(), flags);
    return flags;
  }

  /** Runs work on a later iteration of the Swing event loop. */
  @Bean(name = UI_SCHEDULER)
  public Scheduler uiScheduler() {
    return Schedulers.from(SwingUtilities::invokeLater);
  }
}
