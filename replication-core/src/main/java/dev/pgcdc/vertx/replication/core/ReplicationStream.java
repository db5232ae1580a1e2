package dev.pgcdc.vertx.replication.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * A supervised change stream delivering events of type {@code E} to subscribers on a Vert.x
 * context.
 */
public interface ReplicationStream<E> extends AutoCloseable {
  Future<Void> start();
  ReplicationStreamState state();
  ReplicationSubscription onStateChange(Handler<ReplicationStateChange> handler);
  ReplicationSubscription subscribe(Handler<E> eventHandler, Handler<Throwable> errorHandler);
  SubscriptionRegistration startAndSubscribe(Handler<E> eventHandler, Handler<Throwable> errorHandler);

  @Override
  void close();
}
