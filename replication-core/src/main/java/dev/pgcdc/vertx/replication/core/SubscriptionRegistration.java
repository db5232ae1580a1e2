package dev.pgcdc.vertx.replication.core;

import io.vertx.core.Future;
import java.util.Objects;

/**
 * A subscription registered together with a start request; {@link #started()} completes once
 * the stream reached {@link ReplicationStreamState#STREAMING} or fails with the bootstrap error.
 */
public final class SubscriptionRegistration {
  private final ReplicationSubscription subscription;
  private final Future<Void> started;

  public SubscriptionRegistration(ReplicationSubscription subscription, Future<Void> started) {
    this.subscription = Objects.requireNonNull(subscription, "subscription");
    this.started = Objects.requireNonNull(started, "started");
  }

  public ReplicationSubscription subscription() {
    return subscription;
  }

  public Future<Void> started() {
    return started;
  }

  public void cancel() {
    subscription.cancel();
  }
}
