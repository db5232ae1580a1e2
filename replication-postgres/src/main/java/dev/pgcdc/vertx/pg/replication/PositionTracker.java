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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Tracks the highest log position processed in a session and when the next standby status
 * update is due.
 *
 * <p>Not thread-safe; owned by the session loop.
 */
public final class PositionTracker {

  private final Duration interval;
  private LogPosition confirmed;
  private Instant deadline;

  public PositionTracker(LogPosition start, Duration interval, Instant now) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(now, "now");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.interval = interval;
    this.confirmed = start;
    this.deadline = now.plus(interval);
  }

  /**
   * Records that everything up to {@code position} has been processed. Positions behind the
   * current one are ignored: transactions arrive in commit order, so a chunk may start below the
   * previous one.
   *
   * @return whether the confirmed position moved
   */
  public boolean advance(LogPosition position) {
    if (position == null || !position.isValid()) {
      throw new IllegalArgumentException("Cannot advance to " + position);
    }
    if (position.isAfter(confirmed)) {
      confirmed = position;
      return true;
    }
    return false;
  }

  public boolean dueForStatusUpdate(Instant now) {
    return !now.isBefore(deadline);
  }

  public void onStatusSent(Instant now) {
    deadline = now.plus(interval);
  }

  /**
   * Makes the next {@link #dueForStatusUpdate} call return {@code true}, as requested by a
   * keepalive.
   */
  public void requestImmediateUpdate() {
    deadline = Instant.MIN;
  }

  public Instant nextDeadline() {
    return deadline;
  }

  public LogPosition confirmedPosition() {
    return confirmed;
  }

  public Duration interval() {
    return interval;
  }
}
