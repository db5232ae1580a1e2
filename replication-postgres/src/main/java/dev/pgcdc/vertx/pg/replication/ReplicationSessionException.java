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

/**
 * A failure that ends a replication session. The session cannot continue after it and the
 * caller decides whether to start a new one.
 *
 * <p>The message carries the log position and, when known, the relation id the failure was
 * observed at.
 */
public class ReplicationSessionException extends RuntimeException {

  private final LogPosition position;
  private final Integer relationId;

  public ReplicationSessionException(String message) {
    this(message, null, null, null);
  }

  public ReplicationSessionException(String message, Throwable cause) {
    this(message, null, null, cause);
  }

  public ReplicationSessionException(String message, LogPosition position, Integer relationId, Throwable cause) {
    super(describe(message, position, relationId), cause);
    this.position = position;
    this.relationId = relationId;
  }

  /**
   * Log position the failure was observed at, or {@code null} when it happened outside the
   * stream (during bootstrap for instance).
   */
  public LogPosition position() {
    return position;
  }

  public Integer relationId() {
    return relationId;
  }

  private static String describe(String message, LogPosition position, Integer relationId) {
    StringBuilder sb = new StringBuilder(message);
    if (position != null) {
      sb.append(" [position=").append(position);
      if (relationId != null) {
        sb.append(", relationId=").append(Integer.toUnsignedString(relationId));
      }
      sb.append(']');
    } else if (relationId != null) {
      sb.append(" [relationId=").append(Integer.toUnsignedString(relationId)).append(']');
    }
    return sb.toString();
  }
}
