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
 * The server sent bytes that do not form a valid message: truncated or oversized frames,
 * unknown tuple markers, or tuples whose column count differs from the cached relation.
 */
public class ProtocolViolationException extends ReplicationSessionException {

  public ProtocolViolationException(String message) {
    super(message);
  }

  public ProtocolViolationException(String message, LogPosition position, Integer relationId) {
    super(message, position, relationId, null);
  }

  public ProtocolViolationException(String message, LogPosition position, Integer relationId, Throwable cause) {
    super(message, position, relationId, cause);
  }
}
