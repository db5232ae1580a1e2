/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.pgcdc.vertx.pg.replication;

import dev.pgcdc.vertx.replication.core.ReplicationStateChange;
import dev.pgcdc.vertx.replication.core.ReplicationStream;
import dev.pgcdc.vertx.replication.core.ReplicationStreamState;
import dev.pgcdc.vertx.replication.core.ReplicationSubscription;
import dev.pgcdc.vertx.replication.core.RestartPolicy;
import dev.pgcdc.vertx.replication.core.SubscriptionRegistration;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Change stream backed by PostgreSQL logical replication.
 *
 * <p>Each session runs on a dedicated daemon thread. Events are handed to subscribers on the
 * Vert.x context they subscribed from, in stream order. When a session fails the configured
 * {@link RestartPolicy} decides whether a new one is bootstrapped; the default never restarts.
 */
public class PostgresLogicalReplicationStream implements ReplicationStream<ChangeEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresLogicalReplicationStream.class);

  private final Vertx vertx;
  private final PostgresReplicationOptions options;
  private final ReplicationAdminFactory adminFactory;
  private final Clock clock;
  private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
  private final List<StateHandler> stateHandlers = new CopyOnWriteArrayList<>();
  private final List<ReplicationMetricsListener> metricsListeners = new CopyOnWriteArrayList<>();
  private final ReplicationMetricsListener metricsFanOut = new MetricsFanOut();
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);

  private volatile ReplicationSession session;
  private volatile ReplicationSession lastSession;
  private volatile Thread worker;
  private volatile Promise<Void> startPromise;
  private volatile ReplicationStreamState state = ReplicationStreamState.CREATED;
  private volatile LogPosition confirmedPosition;

  public PostgresLogicalReplicationStream(Vertx vertx, PostgresReplicationOptions options) {
    this(vertx, options, opts -> PgJdbcReplicationAdmin.connect(opts, Clock.systemUTC()), Clock.systemUTC());
  }

  PostgresLogicalReplicationStream(Vertx vertx,
                                   PostgresReplicationOptions options,
                                   ReplicationAdminFactory adminFactory,
                                   Clock clock) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new PostgresReplicationOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.adminFactory = Objects.requireNonNull(adminFactory, "adminFactory");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Future<Void> start() {
    Promise<Void> promiseToReturn;
    synchronized (this) {
      if (state == ReplicationStreamState.CLOSED) {
        return Future.failedFuture("stream is closed");
      }
      if (state == ReplicationStreamState.STREAMING) {
        return Future.succeededFuture();
      }
      if ((state == ReplicationStreamState.STARTING || state == ReplicationStreamState.RESTARTING)
        && startPromise != null) {
        return startPromise.future();
      }

      shouldRun.set(true);
      startPromise = Promise.promise();
      promiseToReturn = startPromise;
      transition(ReplicationStreamState.STARTING, null, 0);
      startWorker();
    }
    return promiseToReturn.future();
  }

  @Override
  public ReplicationStreamState state() {
    return state;
  }

  /**
   * Last position confirmed to the server, or {@code null} before the first status update.
   */
  public LogPosition confirmedPosition() {
    return confirmedPosition;
  }

  @Override
  public ReplicationSubscription onStateChange(Handler<ReplicationStateChange> handler) {
    StateHandler registration = new StateHandler(vertx.getOrCreateContext(), Objects.requireNonNull(handler, "handler"));
    stateHandlers.add(registration);
    return () -> stateHandlers.remove(registration);
  }

  public ReplicationSubscription addMetricsListener(ReplicationMetricsListener listener) {
    ReplicationMetricsListener resolved = Objects.requireNonNull(listener, "listener");
    metricsListeners.add(resolved);
    return () -> metricsListeners.remove(resolved);
  }

  @Override
  public ReplicationSubscription subscribe(Handler<ChangeEvent> eventHandler, Handler<Throwable> errorHandler) {
    return registerSubscription(eventHandler, errorHandler, true);
  }

  @Override
  public SubscriptionRegistration startAndSubscribe(Handler<ChangeEvent> eventHandler, Handler<Throwable> errorHandler) {
    ReplicationSubscription subscription = registerSubscription(eventHandler, errorHandler, false);
    Future<Void> started = start().onFailure(err -> {
      subscription.cancel();
      if (errorHandler != null) {
        errorHandler.handle(err);
      }
    });
    return new SubscriptionRegistration(subscription, started);
  }

  private ReplicationSubscription registerSubscription(Handler<ChangeEvent> eventHandler,
                                                      Handler<Throwable> errorHandler,
                                                      boolean withAutoStart) {
    Objects.requireNonNull(eventHandler, "eventHandler");

    Subscriber subscriber = new Subscriber(vertx.getOrCreateContext(), eventHandler, errorHandler);
    subscribers.add(subscriber);

    if (withAutoStart && options.isAutoStart()) {
      start().onFailure(err -> {
        if (errorHandler != null) {
          errorHandler.handle(err);
        }
      });
    }

    return () -> subscribers.remove(subscriber);
  }

  @Override
  public synchronized void close() {
    shouldRun.set(false);
    transition(ReplicationStreamState.CLOSED, null, 0);

    closeSession();

    Thread thread = worker;
    worker = null;
    if (thread != null) {
      thread.interrupt();
    }

    Promise<Void> currentStartPromise = startPromise;
    startPromise = null;
    if (currentStartPromise != null && !currentStartPromise.future().isComplete()) {
      currentStartPromise.fail("stream closed before reaching STREAMING");
    }
  }

  private synchronized void startWorker() {
    if (!shouldRun.get()) {
      return;
    }
    if (worker != null && worker.isAlive()) {
      return;
    }

    worker = new Thread(this::runLoop, "pg-cdc-" + options.getSlotName());
    worker.setDaemon(true);
    worker.start();
  }

  private void runLoop() {
    long attempt = 0;
    long restarts = 0;

    try {
      while (shouldRun.get()) {
        attempt++;
        if (attempt > 1) {
          transition(ReplicationStreamState.STARTING, null, attempt);
        }
        try {
          SessionOutcome outcome = runSession(attempt);
          if (!shouldRun.get()) {
            return;
          }
          if (outcome == SessionOutcome.PEER_ERROR) {
            ReplicationSessionException error = new ReplicationSessionException(
              "Server ended replication: " + lastPeerError(), confirmedPosition, null, null);
            LOG.warn("Replication stream for slot {} ended by the server", options.getSlotName());
            notifyError(error);
            shouldRun.set(false);
            transition(ReplicationStreamState.CLOSED, error, attempt);
            failStart(error);
            return;
          }
          throw new IllegalStateException("replication session ended unexpectedly");
        } catch (RuntimeException e) {
          if (!shouldRun.get()) {
            return;
          }

          notifyError(e);
          LOG.error("PostgreSQL replication stream failed for slot {}", options.getSlotName(), e);

          RestartPolicy restartPolicy = options.getRestartPolicy();
          if (!restartPolicy.shouldRestart(e, restarts)) {
            transition(ReplicationStreamState.FAILED, e, attempt);
            failStart(e);
            shouldRun.set(false);
            return;
          }

          transition(ReplicationStreamState.RESTARTING, e, attempt);
          sleepInterruptibly(restartPolicy.backoff(restarts).toMillis());
          restarts++;
        }
      }
    } finally {
      closeSession();
      synchronized (this) {
        if (worker == Thread.currentThread()) {
          worker = null;
        }
      }
    }
  }

  private SessionOutcome runSession(long attempt) {
    ReplicationAdmin admin;
    try {
      admin = adminFactory.open(options);
    } catch (SQLException e) {
      throw new SessionBootstrapException(
        "Connecting to " + options.getHost() + ':' + options.getPort() + '/' + options.getDatabase() + " failed", e);
    }

    StreamStart start;
    try {
      start = new SessionBootstrap(admin, options).bootstrap();
    } finally {
      admin.close();
    }

    ReplicationSession current = ReplicationSession.builder()
      .transport(start.transport())
      .startPosition(start.startPosition())
      .statusInterval(options.getStatusInterval())
      .outputFormat(options.getOutputFormat())
      .tupleDecoder(options.newTupleDecoder())
      .positionStore(options.getPositionStore())
      .slotName(options.getSlotName())
      .metrics(metricsFanOut)
      .clock(clock)
      .sink(this::dispatch)
      .build();
    this.session = current;
    if (!shouldRun.get()) {
      current.close();
      return SessionOutcome.CLOSED;
    }

    transition(ReplicationStreamState.STREAMING, null, attempt);
    completeStart();
    try {
      return current.run();
    } finally {
      this.session = null;
      this.lastSession = current;
    }
  }

  private String lastPeerError() {
    ReplicationSession last = lastSession;
    return last == null ? null : last.peerError();
  }

  private void dispatch(ChangeEvent event) {
    for (Subscriber subscriber : subscribers) {
      subscriber.context.runOnContext(v -> deliver(subscriber, event));
    }
  }

  private void deliver(Subscriber subscriber, ChangeEvent event) {
    if (!subscribers.contains(subscriber)) {
      return;
    }
    try {
      subscriber.eventHandler.handle(event);
    } catch (Throwable err) {
      LOG.warn("Subscriber failed on {} at {}", event.kind(), event.position(), err);
      if (subscriber.errorHandler != null) {
        subscriber.errorHandler.handle(err);
      }
    }
  }

  private void notifyError(Throwable error) {
    for (Subscriber subscriber : subscribers) {
      if (subscriber.errorHandler != null) {
        subscriber.context.runOnContext(v -> subscriber.errorHandler.handle(error));
      }
    }
  }

  private void closeSession() {
    ReplicationSession current = this.session;
    this.session = null;
    if (current != null) {
      current.close();
    }
  }

  private void transition(ReplicationStreamState nextState, Throwable cause, long attempt) {
    ReplicationStreamState previous = this.state;
    if (previous == nextState && cause == null) {
      return;
    }
    if (previous == ReplicationStreamState.CLOSED && nextState != ReplicationStreamState.CLOSED) {
      return;
    }

    this.state = nextState;
    LogPosition position = confirmedPosition;
    ReplicationStateChange change = new ReplicationStateChange(previous, nextState, cause, attempt,
      position == null ? null : position.toString());

    metricsFanOut.onStateChange(change);

    for (StateHandler handler : stateHandlers) {
      handler.context.runOnContext(v -> handler.handler.handle(change));
    }
  }

  private void failStart(Throwable error) {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.fail(error);
    }
  }

  private void completeStart() {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.complete();
    }
  }

  private void sleepInterruptibly(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  private final class MetricsFanOut implements ReplicationMetricsListener {

    @Override
    public void onEvent(ChangeEvent event) {
      for (ReplicationMetricsListener listener : metricsListeners) {
        listener.onEvent(event);
      }
    }

    @Override
    public void onDecodeFailure(LogPosition position, Integer relationId, Throwable error) {
      for (ReplicationMetricsListener listener : metricsListeners) {
        listener.onDecodeFailure(position, relationId, error);
      }
    }

    @Override
    public void onStatusSent(LogPosition confirmed) {
      confirmedPosition = confirmed;
      for (ReplicationMetricsListener listener : metricsListeners) {
        listener.onStatusSent(confirmed);
      }
    }

    @Override
    public void onStateChange(ReplicationStateChange stateChange) {
      for (ReplicationMetricsListener listener : metricsListeners) {
        listener.onStateChange(stateChange);
      }
    }
  }

  private static final class Subscriber {
    private final Context context;
    private final Handler<ChangeEvent> eventHandler;
    private final Handler<Throwable> errorHandler;

    private Subscriber(Context context, Handler<ChangeEvent> eventHandler, Handler<Throwable> errorHandler) {
      this.context = context;
      this.eventHandler = eventHandler;
      this.errorHandler = errorHandler;
    }
  }

  private static final class StateHandler {
    private final Context context;
    private final Handler<ReplicationStateChange> handler;

    private StateHandler(Context context, Handler<ReplicationStateChange> handler) {
      this.context = context;
      this.handler = handler;
    }
  }
}
