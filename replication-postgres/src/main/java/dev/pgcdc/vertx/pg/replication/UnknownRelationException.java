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
 * A row change referenced a relation id whose {@code Relation} message was never seen in this
 * session. Rows cannot be interpreted without the schema, so the session stops.
 */
public class UnknownRelationException extends ReplicationSessionException {

  private final int unknownRelationId;

  public UnknownRelationException(int relationId) {
    this(relationId, null);
  }

  public UnknownRelationException(int relationId, LogPosition position) {
    super("No schema received for relation", position, relationId, null);
    this.unknownRelationId = relationId;
  }

  public int unknownRelationId() {
    return unknownRelationId;
  }
}
