package io.gridsync.desktop.app;

import io.gridsync.desktop.model.Gateway;
import java.util.Objects;

/** A newscap message waiting to be read. Equality is by gateway, title and body. */
public record PendingNotification(Gateway gateway, String title, String body) {

  public PendingNotification {
    Objects.requireNonNull(gateway, "gateway");
    title = Objects.toString(title, "");
    body = Objects.toString(body, "");
  }
}
