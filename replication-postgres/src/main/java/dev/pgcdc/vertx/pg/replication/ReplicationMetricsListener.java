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

/**
 * Observation hooks for a replication stream. Session callbacks run on the session thread and
 * must not block.
 */
public interface ReplicationMetricsListener {

  default void onEvent(ChangeEvent event) {
  }

  /**
   * A row or message was skipped because it could not be decoded.
   *
   * @param relationId the relation the row belonged to, or {@code null} for whole messages
   */
  default void onDecodeFailure(LogPosition position, Integer relationId, Throwable error) {
  }

  default void onStatusSent(LogPosition confirmed) {
  }

  default void onStateChange(ReplicationStateChange stateChange) {
  }

  static ReplicationMetricsListener noop() {
    return new ReplicationMetricsListener() {
    };
  }
}
