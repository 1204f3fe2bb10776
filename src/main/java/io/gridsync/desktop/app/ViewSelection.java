package io.gridsync.desktop.app;

import java.util.Optional;

/**
 * Result of a view or gateway selection request.
 *
 * @param outcome what happened
 * @param state the state to render; present only when {@link Outcome#APPLIED}
 */
public record ViewSelection(Outcome outcome, Optional<ViewState> state) {

  public enum Outcome {
    APPLIED,
    /** No panel of the requested kind is registered for the current gateway. */
    NO_SUCH_VIEW,
    /** The gateway is not in the registry. */
    UNKNOWN_GATEWAY
  }

  static ViewSelection applied(ViewState state) {
    return new ViewSelection(Outcome.APPLIED, Optional.of(state));
  }

  static ViewSelection rejected(Outcome outcome) {
    return new ViewSelection(outcome, Optional.empty());
  }

  public boolean isApplied() {
    return outcome == Outcome.APPLIED;
  }
}
