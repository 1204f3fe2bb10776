package io.gridsync.desktop.app;

import java.util.List;

/**
 * Classification of a quit request, ready to be phrased by the confirmation dialog.
 *
 * @param risk the classification
 * @param severity {@link Severity#WARNING} unless idle
 * @param informativeText explanation matching {@code risk}
 * @param responses offered answers
 * @param defaultResponse pre-selected answer
 */
public record QuitAssessment(
    QuitRisk risk,
    Severity severity,
    String informativeText,
    List<QuitResponse> responses,
    QuitResponse defaultResponse) {

  public enum Severity {
    WARNING,
    QUESTION
  }

  public QuitAssessment {
    responses = responses == null ? List.of() : List.copyOf(responses);
  }
}
