package io.gridsync.desktop.app;

public enum QuitResponse {
  YES,
  NO
}
