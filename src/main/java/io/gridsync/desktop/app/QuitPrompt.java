package io.gridsync.desktop.app;

import java.util.Locale;
import java.util.Objects;

/**
 * Platform phrasing of a {@link QuitAssessment}.
 *
 * @param windowTitle dialog title; empty on macOS where sheets have none
 * @param text main text
 * @param informativeText secondary text; empty where it is folded into {@code text}
 */
public record QuitPrompt(String windowTitle, String text, String informativeText) {

  private static final String QUESTION = "Are you sure you wish to quit?";

  public static QuitPrompt forPlatform(QuitAssessment assessment, String appName, String osName) {
    Objects.requireNonNull(assessment, "assessment");
    String os = Objects.toString(osName, "").toLowerCase(Locale.ROOT);
    if (os.contains("mac") || os.contains("darwin")) {
      return new QuitPrompt("", QUESTION, assessment.informativeText());
    }
    return new QuitPrompt(
        "Exit " + appName + "?", QUESTION + " " + assessment.informativeText(), "");
  }
}
