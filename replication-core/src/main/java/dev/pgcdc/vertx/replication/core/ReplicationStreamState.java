package dev.pgcdc.vertx.replication.core;

/**
 * Lifecycle of a supervised replication stream.
 *
 * <p>{@code STARTING} covers session bootstrap (identification, slot and start of stream),
 * {@code STREAMING} means the receive loop is running, {@code RESTARTING} is the backoff
 * pause between a fatal session error and the next bootstrap.
 */
public enum ReplicationStreamState {
  CREATED,
  STARTING,
  STREAMING,
  RESTARTING,
  FAILED,
  CLOSED;

  public boolean isTerminal() {
    return this == FAILED || this == CLOSED;
  }
}
