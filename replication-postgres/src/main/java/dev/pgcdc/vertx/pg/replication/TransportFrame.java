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
 * One frame received on a replication connection while streaming.
 */
public final class TransportFrame {

  public enum Kind {
    /**
     * A {@code CopyData} message; the payload starts with the sub-protocol tag.
     */
    COPY_DATA,
    /**
     * The server reported an error and ended the stream.
     */
    ERROR_RESPONSE,
    /**
     * Anything else the transport surfaced (notices, parameter status).
     */
    OTHER
  }

  private static final byte[] NO_BYTES = new byte[0];

  private final Kind kind;
  private final byte[] payload;
  private final String description;

  private TransportFrame(Kind kind, byte[] payload, String description) {
    this.kind = kind;
    this.payload = payload;
    this.description = description;
  }

  public static TransportFrame copyData(byte[] payload) {
    return new TransportFrame(Kind.COPY_DATA, Objects.requireNonNull(payload, "payload"), null);
  }

  public static TransportFrame errorResponse(String description) {
    return new TransportFrame(Kind.ERROR_RESPONSE, NO_BYTES, description);
  }

  public static TransportFrame other(String description) {
    return new TransportFrame(Kind.OTHER, NO_BYTES, description);
  }

  public Kind kind() {
    return kind;
  }

  public byte[] payload() {
    return payload;
  }

  public String description() {
    return description;
  }

  @Override
  public String toString() {
    return kind == Kind.COPY_DATA
      ? "CopyData[" + payload.length + " bytes]"
      : kind + "[" + description + "]";
  }
}
