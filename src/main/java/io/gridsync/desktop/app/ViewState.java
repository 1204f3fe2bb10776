package io.gridsync.desktop.app;

import io.gridsync.desktop.model.Gateway;

/**
 * Everything the presentation layer needs to render the main window for one gateway.
 *
 * @param gateway the gateway being shown
 * @param enablement control enablement for that gateway
 * @param activeView panel to show
 * @param windowTitle main window title
 */
public record ViewState(
    Gateway gateway, EnablementState enablement, ViewKind activeView, String windowTitle) {}
