package dev.pgcdc.vertx.replication.core;

@FunctionalInterface
public interface ReplicationSubscription {
  void cancel();
}
