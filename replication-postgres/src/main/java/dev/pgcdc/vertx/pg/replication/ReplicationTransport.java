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

import java.sql.SQLException;
import java.time.Instant;

/**
 * A streaming replication connection after {@code START_REPLICATION}. Used by one session
 * thread; {@link #close()} may be called from any thread to interrupt a pending receive.
 */
public interface ReplicationTransport extends AutoCloseable {

  /**
   * Waits for the next frame until {@code deadline}.
   *
   * @return the frame, or {@code null} if the deadline passed first
   * @throws TransportClosedException if the connection is closed or lost
   */
  TransportFrame receive(Instant deadline) throws SQLException;

  /**
   * Sends one {@code CopyData} message.
   */
  void send(byte[] message) throws SQLException;

  boolean isOpen();

  @Override
  void close();
}
