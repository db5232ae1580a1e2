package dev.pgcdc.vertx.replication.core;

import java.util.Optional;

final class NoopPositionStore implements PositionStore {
  static final NoopPositionStore INSTANCE = new NoopPositionStore();

  private NoopPositionStore() {
  }

  @Override
  public Optional<String> load(String streamName) {
    return Optional.empty();
  }

  @Override
  public void save(String streamName, String position) {
    // nothing is kept
  }
}
