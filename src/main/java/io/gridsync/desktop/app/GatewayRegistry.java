package io.gridsync.desktop.app;

import io.gridsync.desktop.model.Gateway;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ordered directory of the gateways shown in the main window, plus the one currently selected.
 *
 * <p>Gateways are compared by identity. Owned by the UI thread; not thread-safe.
 */
@Component
@ApplicationLayer
public class GatewayRegistry {
  private static final Logger log = LoggerFactory.getLogger(GatewayRegistry.class);

  private final List<Gateway> gateways = new ArrayList<>();
  private final BehaviorProcessor<List<Gateway>> updates =
      BehaviorProcessor.createDefault(List.of());
  private Gateway current;

  /**
   * Appends a gateway and makes it the current selection.
   *
   * @return false if the gateway was already registered (nothing changes)
   */
  public boolean register(Gateway gateway) {
    if (gateway == null || contains(gateway)) return false;
    gateways.add(gateway);
    current = gateway;
    log.debug("[gridsync] Registered gateway '{}' ({} total)", gateway.name(), gateways.size());
    updates.onNext(List.copyOf(gateways));
    return true;
  }

  public Optional<Gateway> current() {
    return Optional.ofNullable(current);
  }

  /**
   * Makes a registered gateway current.
   *
   * @return false if the gateway is unknown (selection unchanged)
   */
  public boolean select(Gateway gateway) {
    if (!contains(gateway)) return false;
    current = gateway;
    return true;
  }

  public boolean contains(Gateway gateway) {
    if (gateway == null) return false;
    for (Gateway g : gateways) {
      if (g == gateway) return true;
    }
    return false;
  }

  public List<Gateway> gateways() {
    return List.copyOf(gateways);
  }

  public int size() {
    return gateways.size();
  }

  /** Emits the registered gateways after every registration, starting with the current list. */
  public Flowable<List<Gateway>> updates() {
    return updates.onBackpressureLatest();
  }
}
