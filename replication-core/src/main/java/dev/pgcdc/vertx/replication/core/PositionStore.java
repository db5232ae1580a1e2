package dev.pgcdc.vertx.replication.core;

import java.util.Optional;

/**
 * Checkpoint storage for confirmed stream positions, keyed by stream (slot) name. Positions are
 * kept in their textual form.
 */
public interface PositionStore {
  Optional<String> load(String streamName) throws Exception;
  void save(String streamName, String position) throws Exception;

  static PositionStore noop() {
    return NoopPositionStore.INSTANCE;
  }
}
