package io.gridsync.desktop;

import io.gridsync.desktop.app.QuitResponse;
import io.gridsync.desktop.app.TrayPresencePort;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.support.AbstractApplicationContext;
import org.springframework.stereotype.Component;

/** Carries out a confirmed quit: tray first (on Windows), then the Spring context, then the JVM. */
@Component
public class ApplicationShutdownCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ApplicationShutdownCoordinator.class);

  // Hard-stop fallback so a hung context close never leaves a windowless process behind.
  static final long SHUTDOWN_WATCHDOG_MS = 8000L;

  private final ConfigurableApplicationContext applicationContext;
  private final TrayPresencePort tray;
  private final String osName;
  private final Executor shutdownExecutor;
  private final IntConsumer exit;
  private final IntConsumer halt;
  private final long watchdogMs;
  private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

  @Autowired
  public ApplicationShutdownCoordinator(
      ConfigurableApplicationContext applicationContext, TrayPresencePort tray) {
    this(
        applicationContext,
        tray,
        System.getProperty("os.name", ""),
        task -> daemon("gridsync-shutdown", task).start(),
        System::exit,
        code -> Runtime.getRuntime().halt(code),
        SHUTDOWN_WATCHDOG_MS);
  }

  ApplicationShutdownCoordinator(
      ConfigurableApplicationContext applicationContext,
      TrayPresencePort tray,
      String osName,
      Executor shutdownExecutor,
      IntConsumer exit,
      IntConsumer halt,
      long watchdogMs) {
    this.applicationContext = Objects.requireNonNull(applicationContext, "applicationContext");
    this.tray = Objects.requireNonNull(tray, "tray");
    this.osName = Objects.toString(osName, "");
    this.shutdownExecutor = Objects.requireNonNull(shutdownExecutor, "shutdownExecutor");
    this.exit = Objects.requireNonNull(exit, "exit");
    this.halt = Objects.requireNonNull(halt, "halt");
    this.watchdogMs = watchdogMs;
  }

  /**
   * Acts on the answer to the quit confirmation.
   *
   * @return true if shutdown was started by this call
   */
  public boolean quit(QuitResponse response) {
    if (response != QuitResponse.YES) return false;
    if (!shutdownStarted.compareAndSet(false, true)) return false;

    if (osName.toLowerCase(Locale.ROOT).startsWith("windows")) {
      try {
        tray.hideTray();
      } catch (RuntimeException e) {
        log.warn("[gridsync] Could not hide tray icon before exit", e);
      }
    }

    daemon(
            "gridsync-shutdown-watchdog",
            () -> {
              try {
                Thread.sleep(watchdogMs);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
              }
              log.error(
                  "[gridsync] Shutdown watchdog fired after {}ms; forcing JVM halt.", watchdogMs);
              halt.accept(1);
            })
        .start();

    shutdownExecutor.execute(() -> exit.accept(closeContext()));
    return true;
  }

  private int closeContext() {
    try {
      if (isApplicationContextAlreadyClosed()) {
        log.debug("[gridsync] Spring context already closed before shutdown.");
        return 0;
      }
      return SpringApplication.exit(applicationContext, () -> 0);
    } catch (IllegalStateException ise) {
      if (isAlreadyClosedException(ise)) {
        log.debug("[gridsync] Spring context already closed during shutdown.", ise);
        return 0;
      }
      log.warn("[gridsync] Error while closing Spring context", ise);
      return 1;
    } catch (RuntimeException e) {
      log.warn("[gridsync] Error while closing Spring context", e);
      return 1;
    }
  }

  private boolean isApplicationContextAlreadyClosed() {
    return applicationContext instanceof AbstractApplicationContext ac && !ac.isActive();
  }

  private static boolean isAlreadyClosedException(IllegalStateException ex) {
    String msg = String.valueOf(ex.getMessage()).toLowerCase(Locale.ROOT);
    return msg.contains("has been closed already")
        || msg.contains("beanfactory not initialized or already closed");
  }

  private static Thread daemon(String name, Runnable task) {
    Thread t = new Thread(task, name);
    t.setDaemon(true);
    return t;
  }
}
