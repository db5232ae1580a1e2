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

import java.util.List;
import org.junit.jupiter.api.Test;

class RelationCacheTest {

  @Test
  void newerSchemaReplacesOlder() {
    RelationCache cache = new RelationCache();
    cache.put(schema(1, "trial", new ColumnDef("id", TupleDecoder.OID_INT4, -1, true)));
    cache.put(schema(1, "trial",
      new ColumnDef("id", TupleDecoder.OID_INT4, -1, true),
      new ColumnDef("name", TupleDecoder.OID_TEXT, -1, false)));

    assertEquals(1, cache.size());
    assertEquals(2, cache.get(1).columns().size());
    assertEquals("public.trial", cache.get(1).qualifiedName());
  }

  @Test
  void unknownRelationIsReported() {
    RelationCache cache = new RelationCache();

    UnknownRelationException error = assertThrows(UnknownRelationException.class, () -> cache.get(42));

    assertEquals(42, error.unknownRelationId());
    assertFalse(cache.find(42).isPresent());
    assertFalse(cache.contains(42));
  }

  @Test
  void clearForgetsEverything() {
    RelationCache cache = new RelationCache();
    cache.put(schema(1, "a"));
    cache.put(schema(2, "b"));
    assertTrue(cache.contains(2));

    cache.clear();

    assertEquals(0, cache.size());
  }

  private static RelationSchema schema(int relationId, String name, ColumnDef... columns) {
    return new RelationSchema(relationId, "public", name, RelationSchema.ReplicaIdentity.DEFAULT, List.of(columns));
  }
}
