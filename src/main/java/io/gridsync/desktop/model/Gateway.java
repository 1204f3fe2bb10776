package io.gridsync.desktop.model;

import io.reactivex.rxjava3.core.Flowable;
import java.util.List;

/**
 * A running storage gateway (grid connection), owned by the gateway subsystem.
 *
 * <p>The desktop shell only reads from gateways. Implementations are compared by identity: two
 * gateways with the same name are still distinct entries.
 */
public interface Gateway {

  String name();

  /** True when the grid requires ZKAP (storage-time) authorization. */
  boolean zkapAuthRequired();

  /** Remaining ZKAPs; {@code 0} until the quota checker has reported. */
  int zkapsRemaining();

  /** Current folder snapshots, in display order. Never null. */
  List<MagicFolder> magicFolders();

  /** Messages and upgrade signals from the newscap checker. */
  default Flowable<NewscapEvent> newscapEvents() {
    return Flowable.never();
  }

  /** True when this gateway needs storage-time and has none left. */
  default boolean quotaExhausted() {
    return zkapAuthRequired() && zkapsRemaining() <= 0;
  }
}
