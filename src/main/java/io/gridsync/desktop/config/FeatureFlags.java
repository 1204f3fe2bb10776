package io.gridsync.desktop.config;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Feature toggles read from the {@code [features]} section of {@code preferences.ini}.
 *
 * <p>Only the literal {@code false} (any case) turns a feature off.
 */
public record FeatureFlags(
    boolean gridInvitesEnabled, boolean invitesEnabled, boolean multipleGridsEnabled) {

  public static final String SECTION = "features";
  public static final String GRID_INVITES = "grid_invites";
  public static final String INVITES = "invites";
  public static final String MULTIPLE_GRIDS = "multiple_grids";

  public static FeatureFlags allEnabled() {
    return new FeatureFlags(true, true, true);
  }

  public static FeatureFlags from(PreferenceStore preferences) {
    if (preferences == null) return allEnabled();
    return fromSection(preferences.section(SECTION));
  }

  static FeatureFlags fromSection(Map<String, String> features) {
    if (features == null || features.isEmpty()) return allEnabled();
    return new FeatureFlags(
        enabled(features.get(GRID_INVITES)),
        enabled(features.get(INVITES)),
        enabled(features.get(MULTIPLE_GRIDS)));
  }

  private static boolean enabled(String raw) {
    String v = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    return !"false".equals(v);
  }
}
