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
import org.postgresql.replication.LogSequenceNumber;

/**
 * A position in the PostgreSQL write-ahead log (an LSN).
 *
 * <p>Positions are unsigned 64-bit offsets and compare as such. The textual form is the usual
 * {@code 16/B374D848} notation.
 */
public final class LogPosition implements Comparable<LogPosition> {

  public static final LogPosition INVALID = new LogPosition(0L);

  private final long value;

  private LogPosition(long value) {
    this.value = value;
  }

  public static LogPosition of(long value) {
    return value == 0L ? INVALID : new LogPosition(value);
  }

  public static LogPosition of(LogSequenceNumber lsn) {
    Objects.requireNonNull(lsn, "lsn");
    return of(lsn.asLong());
  }

  /**
   * Parses the {@code X/X} notation.
   *
   * @throws IllegalArgumentException if the text is not a log position
   */
  public static LogPosition parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    LogSequenceNumber lsn = LogSequenceNumber.valueOf(trimmed);
    if (LogSequenceNumber.INVALID_LSN.equals(lsn) && !"0/0".equals(trimmed)) {
      throw new IllegalArgumentException("Not a log position: '" + text + "'");
    }
    return of(lsn);
  }

  public long asLong() {
    return value;
  }

  public boolean isValid() {
    return value != 0L;
  }

  /**
   * Returns the position {@code bytes} further into the log.
   */
  public LogPosition plus(long bytes) {
    if (bytes < 0) {
      throw new IllegalArgumentException("bytes must be >= 0");
    }
    return of(value + bytes);
  }

  public boolean isAfter(LogPosition other) {
    return compareTo(other) > 0;
  }

  public boolean isBefore(LogPosition other) {
    return compareTo(other) < 0;
  }

  public static LogPosition max(LogPosition a, LogPosition b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  public LogSequenceNumber toLogSequenceNumber() {
    return LogSequenceNumber.valueOf(value);
  }

  @Override
  public int compareTo(LogPosition other) {
    return Long.compareUnsigned(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LogPosition)) {
      return false;
    }
    return value == ((LogPosition) o).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return toLogSequenceNumber().asString();
  }
}
