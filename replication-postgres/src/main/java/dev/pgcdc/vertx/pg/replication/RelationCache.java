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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Relation schemas announced in the current session, keyed by relation id. A newer announcement
 * replaces the older one. Owned by a single session; not thread-safe.
 */
public final class RelationCache {

  private final Map<Integer, RelationSchema> relations = new HashMap<>();

  public void put(RelationSchema schema) {
    relations.put(schema.relationId(), schema);
  }

  /**
   * @throws UnknownRelationException if no schema was announced for {@code relationId}
   */
  public RelationSchema get(int relationId) {
    RelationSchema schema = relations.get(relationId);
    if (schema == null) {
      throw new UnknownRelationException(relationId);
    }
    return schema;
  }

  public Optional<RelationSchema> find(int relationId) {
    return Optional.ofNullable(relations.get(relationId));
  }

  public boolean contains(int relationId) {
    return relations.containsKey(relationId);
  }

  public int size() {
    return relations.size();
  }

  public void clear() {
    relations.clear();
  }
}
