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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class PositionTrackerTest {

  private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void becomesDueOnceTheIntervalElapsed() {
    PositionTracker tracker = new PositionTracker(LogPosition.of(100), Duration.ofSeconds(10), T0);

    assertEquals(T0.plusSeconds(10), tracker.nextDeadline());
    assertFalse(tracker.dueForStatusUpdate(T0.plusSeconds(9)));
    assertTrue(tracker.dueForStatusUpdate(T0.plusSeconds(10)));

    tracker.onStatusSent(T0.plusSeconds(11));
    assertEquals(T0.plusSeconds(21), tracker.nextDeadline());
    assertFalse(tracker.dueForStatusUpdate(T0.plusSeconds(20)));
  }

  @Test
  void immediateUpdateIsDueRightAway() {
    PositionTracker tracker = new PositionTracker(LogPosition.of(100), Duration.ofSeconds(10), T0);

    tracker.requestImmediateUpdate();

    assertTrue(tracker.dueForStatusUpdate(T0));
    tracker.onStatusSent(T0);
    assertFalse(tracker.dueForStatusUpdate(T0.plusSeconds(1)));
  }

  @Test
  void advanceNeverMovesBackwards() {
    PositionTracker tracker = new PositionTracker(LogPosition.of(100), Duration.ofSeconds(10), T0);

    assertTrue(tracker.advance(LogPosition.of(300)));
    assertFalse(tracker.advance(LogPosition.of(200)));
    assertFalse(tracker.advance(LogPosition.of(300)));
    assertEquals(LogPosition.of(300), tracker.confirmedPosition());

    long[] chunks = {400, 350, 900, 10, 901};
    LogPosition previous = tracker.confirmedPosition();
    for (long chunk : chunks) {
      tracker.advance(LogPosition.of(chunk));
      assertFalse(tracker.confirmedPosition().isBefore(previous));
      previous = tracker.confirmedPosition();
    }
    assertEquals(LogPosition.of(901), tracker.confirmedPosition());
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class,
      () -> new PositionTracker(LogPosition.of(1), Duration.ZERO, T0));
    PositionTracker tracker = new PositionTracker(LogPosition.of(1), Duration.ofSeconds(1), T0);
    assertThrows(IllegalArgumentException.class, () -> tracker.advance(LogPosition.INVALID));
    assertThrows(IllegalArgumentException.class, () -> tracker.advance(null));
  }
}
