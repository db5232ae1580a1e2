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
import java.util.Optional;

/**
 * A logical replication slot as found in {@code pg_replication_slots} or as just created.
 */
public final class ReplicationSlot {

  private final String name;
  private final String plugin;
  private final boolean temporary;
  private final LogPosition confirmedFlushPosition;

  public ReplicationSlot(String name, String plugin, boolean temporary, LogPosition confirmedFlushPosition) {
    this.name = Objects.requireNonNull(name, "name");
    this.plugin = Objects.requireNonNull(plugin, "plugin");
    this.temporary = temporary;
    this.confirmedFlushPosition = confirmedFlushPosition;
  }

  public String name() {
    return name;
  }

  public String plugin() {
    return plugin;
  }

  /**
   * The output format, empty when the slot uses a plugin this library cannot decode.
   */
  public Optional<OutputFormat> outputFormat() {
    try {
      return Optional.of(OutputFormat.fromPluginName(plugin));
    } catch (IllegalArgumentException unsupported) {
      return Optional.empty();
    }
  }

  public boolean isTemporary() {
    return temporary;
  }

  public Optional<LogPosition> confirmedFlushPosition() {
    if (confirmedFlushPosition == null || !confirmedFlushPosition.isValid()) {
      return Optional.empty();
    }
    return Optional.of(confirmedFlushPosition);
  }

  @Override
  public String toString() {
    return "ReplicationSlot{" +
      "name='" + name + '\'' +
      ", plugin='" + plugin + '\'' +
      ", temporary=" + temporary +
      ", confirmedFlushPosition=" + confirmedFlushPosition +
      '}';
  }
}
