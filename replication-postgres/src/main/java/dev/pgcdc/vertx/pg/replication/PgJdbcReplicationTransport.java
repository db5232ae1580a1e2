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

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.postgresql.copy.CopyDual;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ReplicationTransport} over a pgjdbc {@link CopyDual} opened by {@code START_REPLICATION}.
 *
 * <p>pgjdbc offers no timed read, so {@link #receive} polls with a non-blocking read and sleeps
 * for at most {@code pollInterval} between attempts.
 */
public final class PgJdbcReplicationTransport implements ReplicationTransport {

  private static final Logger LOG = LoggerFactory.getLogger(PgJdbcReplicationTransport.class);

  private final Connection connection;
  private final CopyDual copy;
  private final Duration pollInterval;
  private final Clock clock;
  private final Object lock = new Object();
  private volatile boolean closed;

  public PgJdbcReplicationTransport(Connection connection, CopyDual copy, Duration pollInterval, Clock clock) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.copy = Objects.requireNonNull(copy, "copy");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public TransportFrame receive(Instant deadline) throws SQLException {
    while (true) {
      byte[] data;
      synchronized (lock) {
        ensureOpen();
        if (!copy.isActive()) {
          throw new TransportClosedException("Replication stream ended by the server");
        }
        try {
          data = copy.readFromCopy(false);
        } catch (PSQLException e) {
          if (closed) {
            throw new TransportClosedException("Replication transport closed", e);
          }
          ServerErrorMessage serverError = e.getServerErrorMessage();
          if (serverError != null) {
            return TransportFrame.errorResponse(serverError.toString());
          }
          throw new TransportClosedException("Replication connection lost: " + e.getMessage(), e);
        }
      }
      if (data != null) {
        return TransportFrame.copyData(data);
      }

      long remainingMillis = Duration.between(clock.instant(), deadline).toMillis();
      if (remainingMillis <= 0) {
        return null;
      }
      try {
        Thread.sleep(Math.min(remainingMillis, pollInterval.toMillis()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TransportClosedException("Interrupted while waiting for replication data", e);
      }
    }
  }

  @Override
  public void send(byte[] message) throws SQLException {
    synchronized (lock) {
      ensureOpen();
      copy.writeToCopy(message, 0, message.length);
      copy.flushCopy();
    }
  }

  @Override
  public boolean isOpen() {
    if (closed || !copy.isActive()) {
      return false;
    }
    try {
      return !connection.isClosed();
    } catch (SQLException e) {
      return false;
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    synchronized (lock) {
      try {
        if (copy.isActive()) {
          copy.cancelCopy();
        }
      } catch (SQLException e) {
        LOG.debug("Failed to cancel replication copy", e);
      }
      try {
        connection.close();
      } catch (SQLException e) {
        LOG.warn("Failed to close replication connection", e);
      }
    }
  }

  private void ensureOpen() throws TransportClosedException {
    if (closed) {
      throw new TransportClosedException("Replication transport closed");
    }
  }
}
