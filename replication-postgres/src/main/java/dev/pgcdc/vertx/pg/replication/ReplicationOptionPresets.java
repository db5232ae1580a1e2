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

import dev.pgcdc.vertx.replication.core.RestartPolicy;
import java.time.Duration;
import java.util.Objects;

public final class ReplicationOptionPresets {

  private ReplicationOptionPresets() {
  }

  /**
   * Durable slot, explicit start and restarts on session failure with backoff up to 30 seconds.
   */
  public static void applyProductionDefaults(PostgresReplicationOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setAutoStart(false)
      .setTemporarySlot(false)
      .setStatusInterval(Duration.ofSeconds(10))
      .setRestartPolicy(
        RestartPolicy.withBackoff()
          .setInitialBackoff(Duration.ofMillis(500))
          .setMaxBackoff(Duration.ofSeconds(30))
          .setBackoffMultiplier(2.0d)
          .setJitter(0.2d)
      );
  }

  /**
   * Temporary slot dropped with the connection, publication recreated on every start and quick
   * restarts.
   */
  public static void applyLocalDevDefaults(PostgresReplicationOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setAutoStart(true)
      .setTemporarySlot(true)
      .setCreatePublication(true)
      .setRecreatePublication(true)
      .setStatusInterval(Duration.ofSeconds(5))
      .setRestartPolicy(
        RestartPolicy.withBackoff()
          .setInitialBackoff(Duration.ofMillis(200))
          .setMaxBackoff(Duration.ofSeconds(5))
          .setBackoffMultiplier(1.5d)
          .setJitter(0.1d)
          .setMaxRestarts(10)
      );
  }
}
