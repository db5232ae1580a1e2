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
 * Result of {@code IDENTIFY_SYSTEM}, read once per session.
 */
public final class SystemIdentification {

  private final String systemId;
  private final int timeline;
  private final LogPosition currentPosition;
  private final String databaseName;

  public SystemIdentification(String systemId, int timeline, LogPosition currentPosition, String databaseName) {
    this.systemId = Objects.requireNonNull(systemId, "systemId");
    this.timeline = timeline;
    this.currentPosition = Objects.requireNonNull(currentPosition, "currentPosition");
    this.databaseName = databaseName;
  }

  public String systemId() {
    return systemId;
  }

  public int timeline() {
    return timeline;
  }

  public LogPosition currentPosition() {
    return currentPosition;
  }

  public String databaseName() {
    return databaseName;
  }

  @Override
  public String toString() {
    return "SystemIdentification{" +
      "systemId='" + systemId + '\'' +
      ", timeline=" + timeline +
      ", currentPosition=" + currentPosition +
      ", databaseName='" + databaseName + '\'' +
      '}';
  }
}
