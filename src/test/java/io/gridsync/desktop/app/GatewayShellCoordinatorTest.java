package io.gridsync.desktop.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.gridsync.desktop.config.FeatureFlags;
import io.gridsync.desktop.model.Gateway;
import io.gridsync.desktop.model.NewscapEvent;
import io.gridsync.desktop.model.StubGateway;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GatewayShellCoordinatorTest {

  private GatewayRegistry registry;
  private ViewStateCoordinator viewState;
  private NotificationQueue notifications;
  private NotificationDisplayPort display;
  private TestScheduler scheduler;
  private GatewayShellCoordinator shell;

  @BeforeEach
  void setUp() {
    registry = new GatewayRegistry();
    viewState =
        new ViewStateCoordinator(registry, ShellLayout.from(FeatureFlags.allEnabled()), "Gridsync");
    display = mock(NotificationDisplayPort.class);
    scheduler = new TestScheduler();
    notifications = new NotificationQueue(registry, () -> false, display, scheduler, "Gridsync");
    shell = new GatewayShellCoordinator(registry, viewState, notifications, display, scheduler);
  }

  @Test
  void populateRegistersNewGatewaysOnceAndSelectsTheLastAdded() {
    StubGateway a = StubGateway.open("A");
    StubGateway b = StubGateway.exhausted("B");

    ViewState state = shell.populate(List.of(a, b)).orElseThrow();
    shell.populate(List.of(a));

    assertThat(registry.gateways()).containsExactly(a, b);
    assertThat(viewState.hasPanels(a)).isTrue();
    assertThat(viewState.hasPanels(b)).isTrue();
    assertThat(state.gateway()).isSameAs(b);
    assertThat(state.activeView()).isEqualTo(ViewKind.QUOTA);
    assertThat(state.windowTitle()).isEqualTo("Gridsync - B");
    assertThat(viewState.windowTitle()).isEqualTo("Gridsync - B");
  }

  @Test
  void populateKeepsThePlainTitleWithoutMultipleGrids() {
    GatewayRegistry singleRegistry = new GatewayRegistry();
    ViewStateCoordinator single =
        new ViewStateCoordinator(
            singleRegistry, ShellLayout.from(new FeatureFlags(true, true, false)), "Gridsync");
    GatewayShellCoordinator singleShell =
        new GatewayShellCoordinator(
            singleRegistry,
            single,
            new NotificationQueue(singleRegistry, () -> false, display, scheduler, "Gridsync"),
            display,
            scheduler);

    ViewState state = singleShell.populate(List.<Gateway>of(StubGateway.open("A"))).orElseThrow();

    assertThat(state.windowTitle()).isEqualTo("Gridsync");
  }

  @Test
  void populateWithNothingReturnsEmpty() {
    assertThat(shell.populate(List.of())).isEmpty();
    assertThat(shell.populate(null)).isEmpty();
  }

  @Test
  void newscapEventsAreRoutedOnTheUiScheduler() {
    StubGateway grid = StubGateway.open("Grid");
    shell.populate(List.<Gateway>of(grid));

    grid.emit(NewscapEvent.message("hello"));
    assertThat(notifications.unreadCount()).isZero();

    scheduler.triggerActions();
    assertThat(notifications.unreadMessages())
        .containsExactly(new PendingNotification(grid, "New message from Grid", "hello"));

    grid.emit(NewscapEvent.upgradeRequired());
    scheduler.triggerActions();
    assertThat(notifications.pendingNotification().orElseThrow().title())
        .isEqualTo("Upgrade required");
  }

  @Test
  void populatingTheSameGatewayAgainDoesNotDuplicateSubscriptions() {
    StubGateway grid = StubGateway.open("Grid");
    shell.populate(List.<Gateway>of(grid));
    shell.populate(List.<Gateway>of(grid));

    grid.emit(NewscapEvent.message("once"));
    scheduler.triggerActions();

    assertThat(notifications.unreadCount()).isEqualTo(1);
  }

  @Test
  void failedNewscapStreamIsLoggedAndOtherGatewaysKeepWorking() {
    StubGateway broken = StubGateway.open("Broken");
    StubGateway healthy = StubGateway.open("Healthy");
    shell.populate(List.<Gateway>of(broken, healthy));

    broken.failNewscap(new IllegalStateException("checker crashed"));
    healthy.emit(NewscapEvent.message("still here"));
    scheduler.triggerActions();

    assertThat(notifications.unreadMessages())
        .extracting(PendingNotification::gateway)
        .containsExactly(healthy);
  }

  @Test
  void shutdownStopsRoutingEvents() {
    StubGateway grid = StubGateway.open("Grid");
    shell.populate(List.<Gateway>of(grid));

    shell.shutdown();
    grid.emit(NewscapEvent.message("late"));
    scheduler.triggerActions();

    assertThat(notifications.unreadCount()).isZero();
  }

  @Test
  void refreshRecomputesCurrentGatewayAndUpdatesIndicator() {
    StubGateway grid = StubGateway.open("Grid").withZkaps(true, 5);
    shell.populate(List.<Gateway>of(grid));

    grid.withZkaps(true, 0);
    ViewState state = shell.refresh().orElseThrow();

    assertThat(state.enablement().isRestricted()).isTrue();
    assertThat(state.activeView()).isEqualTo(ViewKind.QUOTA);
    verify(display).updateUnreadIndicator(0);
  }

  @Test
  void refreshWithoutGatewaysDoesNothing() {
    assertThat(shell.refresh()).isEmpty();
    verify(display, never()).updateUnreadIndicator(anyInt());
    verify(display, never()).showNotification(any());
  }
}
