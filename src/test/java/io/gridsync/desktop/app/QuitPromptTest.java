package io.gridsync.desktop.app;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class QuitPromptTest {

  private static final QuitAssessment IDLE =
      new QuitAssessment(
          QuitRisk.IDLE,
          QuitAssessment.Severity.QUESTION,
          "If you quit, Gridsync will stop synchronizing your folders until you launch it again.",
          List.of(QuitResponse.YES, QuitResponse.NO),
          QuitResponse.NO);

  @Test
  void macOsSplitsQuestionAndExplanation() {
    QuitPrompt prompt = QuitPrompt.forPlatform(IDLE, "Gridsync", "Mac OS X");

    assertThat(prompt.windowTitle()).isEmpty();
    assertThat(prompt.text()).isEqualTo("Are you sure you wish to quit?");
    assertThat(prompt.informativeText()).isEqualTo(IDLE.informativeText());
  }

  @Test
  void otherPlatformsUseTitledDialogWithCombinedText() {
    QuitPrompt prompt = QuitPrompt.forPlatform(IDLE, "Gridsync", "Linux");

    assertThat(prompt.windowTitle()).isEqualTo("Exit Gridsync?");
    assertThat(prompt.text())
        .isEqualTo("Are you sure you wish to quit? " + IDLE.informativeText());
    assertThat(prompt.informativeText()).isEmpty();
  }
}
