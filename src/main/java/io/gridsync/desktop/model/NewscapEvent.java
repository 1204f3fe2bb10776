package io.gridsync.desktop.model;

import java.util.Objects;

/**
 * Event emitted by a gateway's newscap checker.
 *
 * @param kind what arrived
 * @param body message body (HTML allowed); empty for {@link Kind#UPGRADE_REQUIRED}
 */
public record NewscapEvent(Kind kind, String body) {

  public enum Kind {
    MESSAGE,
    UPGRADE_REQUIRED
  }

  public NewscapEvent {
    kind = Objects.requireNonNull(kind, "kind");
    body = Objects.toString(body, "");
  }

  public static NewscapEvent message(String body) {
    return new NewscapEvent(Kind.MESSAGE, body);
  }

  public static NewscapEvent upgradeRequired() {
    return new NewscapEvent(Kind.UPGRADE_REQUIRED, "");
  }
}
