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

import java.util.Objects;

/**
 * Everything a bootstrap established: the server identity, the slot in use, where streaming
 * started and the transport carrying the stream.
 */
public final class StreamStart {

  private final SystemIdentification identification;
  private final ReplicationSlot slot;
  private final boolean slotCreated;
  private final LogPosition startPosition;
  private final ReplicationTransport transport;

  public StreamStart(SystemIdentification identification,
                     ReplicationSlot slot,
                     boolean slotCreated,
                     LogPosition startPosition,
                     ReplicationTransport transport) {
    this.identification = Objects.requireNonNull(identification, "identification");
    this.slot = Objects.requireNonNull(slot, "slot");
    this.slotCreated = slotCreated;
    this.startPosition = Objects.requireNonNull(startPosition, "startPosition");
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  public SystemIdentification identification() {
    return identification;
  }

  public ReplicationSlot slot() {
    return slot;
  }

  public boolean slotCreated() {
    return slotCreated;
  }

  public LogPosition startPosition() {
    return startPosition;
  }

  public ReplicationTransport transport() {
    return transport;
  }
}
