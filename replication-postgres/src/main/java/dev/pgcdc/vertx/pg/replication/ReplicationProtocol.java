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

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;

/**
 * Framing of the streaming replication sub-protocol carried inside {@code CopyData}.
 */
public final class ReplicationProtocol {

  public static final byte PRIMARY_KEEPALIVE = 'k';
  public static final byte XLOG_DATA = 'w';
  public static final byte STANDBY_STATUS_UPDATE = 'r';

  /**
   * Seconds between the Unix epoch and 2000-01-01T00:00:00Z, the PostgreSQL epoch.
   */
  public static final long PG_EPOCH_SECONDS = 946684800L;

  static final int KEEPALIVE_LENGTH = 1 + 8 + 8 + 1;
  static final int XLOG_DATA_HEADER_LENGTH = 1 + 8 + 8 + 8;
  static final int STATUS_UPDATE_LENGTH = 1 + 8 + 8 + 8 + 8 + 1;

  private ReplicationProtocol() {
  }

  /**
   * Parses a primary keepalive message including its leading {@code 'k'}.
   */
  public static PrimaryKeepalive parseKeepalive(byte[] data) {
    if (data.length != KEEPALIVE_LENGTH || data[0] != PRIMARY_KEEPALIVE) {
      throw new ProtocolViolationException("Malformed primary keepalive of " + data.length + " bytes");
    }
    ByteCursor cursor = new ByteCursor(data, 1);
    return new PrimaryKeepalive(
      LogPosition.of(cursor.readLong()),
      fromPgEpochMicros(cursor.readLong()),
      cursor.readByte() != 0);
  }

  /**
   * Parses an XLogData message including its leading {@code 'w'}. The payload may be empty.
   */
  public static XLogData parseXLogData(byte[] data) {
    if (data.length < XLOG_DATA_HEADER_LENGTH || data[0] != XLOG_DATA) {
      throw new ProtocolViolationException("Malformed XLogData of " + data.length + " bytes");
    }
    ByteCursor cursor = new ByteCursor(data, 1);
    LogPosition walStart = LogPosition.of(cursor.readLong());
    LogPosition serverWalEnd = LogPosition.of(cursor.readLong());
    Instant serverTime = fromPgEpochMicros(cursor.readLong());
    return new XLogData(walStart, serverWalEnd, serverTime,
      Arrays.copyOfRange(data, XLOG_DATA_HEADER_LENGTH, data.length));
  }

  /**
   * Builds a standby status update reporting {@code position} as written, flushed and applied.
   * The reply-requested flag is always clear.
   */
  public static byte[] encodeStatusUpdate(LogPosition position, Instant clientTime) {
    long lsn = position.asLong();
    return ByteBuffer.allocate(STATUS_UPDATE_LENGTH)
      .put(STANDBY_STATUS_UPDATE)
      .putLong(lsn)
      .putLong(lsn)
      .putLong(lsn)
      .putLong(toPgEpochMicros(clientTime))
      .put((byte) 0)
      .array();
  }

  public static Instant fromPgEpochMicros(long micros) {
    long seconds = Math.floorDiv(micros, 1_000_000L);
    long microsRemainder = Math.floorMod(micros, 1_000_000L);
    return Instant.ofEpochSecond(PG_EPOCH_SECONDS + seconds, microsRemainder * 1_000L);
  }

  public static long toPgEpochMicros(Instant instant) {
    long seconds = instant.getEpochSecond() - PG_EPOCH_SECONDS;
    return seconds * 1_000_000L + instant.getNano() / 1_000L;
  }

  public static final class PrimaryKeepalive {
    private final LogPosition serverWalEnd;
    private final Instant serverTime;
    private final boolean replyRequested;

    PrimaryKeepalive(LogPosition serverWalEnd, Instant serverTime, boolean replyRequested) {
      this.serverWalEnd = serverWalEnd;
      this.serverTime = serverTime;
      this.replyRequested = replyRequested;
    }

    public LogPosition serverWalEnd() {
      return serverWalEnd;
    }

    public Instant serverTime() {
      return serverTime;
    }

    public boolean replyRequested() {
      return replyRequested;
    }
  }

  public static final class XLogData {
    private final LogPosition walStart;
    private final LogPosition serverWalEnd;
    private final Instant serverTime;
    private final byte[] payload;

    XLogData(LogPosition walStart, LogPosition serverWalEnd, Instant serverTime, byte[] payload) {
      this.walStart = walStart;
      this.serverWalEnd = serverWalEnd;
      this.serverTime = serverTime;
      this.payload = payload;
    }

    public LogPosition walStart() {
      return walStart;
    }

    public LogPosition serverWalEnd() {
      return serverWalEnd;
    }

    public Instant serverTime() {
      return serverTime;
    }

    public byte[] payload() {
      return payload;
    }

    /**
     * Position just past this chunk, {@code walStart + payload length}.
     */
    public LogPosition endPosition() {
      return walStart.plus(payload.length);
    }
  }
}
