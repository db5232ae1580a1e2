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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The schema of a replicated table as announced by the server. A later {@code Relation} message
 * with the same id replaces it.
 */
public final class RelationSchema {

  /**
   * {@code REPLICA IDENTITY} setting, which decides what old row data updates and deletes carry.
   */
  public enum ReplicaIdentity {
    DEFAULT('d'),
    NOTHING('n'),
    FULL('f'),
    INDEX('i');

    private final char code;

    ReplicaIdentity(char code) {
      this.code = code;
    }

    public char code() {
      return code;
    }

    public static ReplicaIdentity fromCode(char code) {
      for (ReplicaIdentity identity : values()) {
        if (identity.code == code) {
          return identity;
        }
      }
      throw new IllegalArgumentException("Unknown replica identity '" + code + "'");
    }
  }

  private final int relationId;
  private final String namespace;
  private final String name;
  private final ReplicaIdentity replicaIdentity;
  private final List<ColumnDef> columns;

  public RelationSchema(int relationId,
                        String namespace,
                        String name,
                        ReplicaIdentity replicaIdentity,
                        List<ColumnDef> columns) {
    this.relationId = relationId;
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.name = Objects.requireNonNull(name, "name");
    this.replicaIdentity = Objects.requireNonNull(replicaIdentity, "replicaIdentity");
    this.columns = Collections.unmodifiableList(List.copyOf(columns));
  }

  public int relationId() {
    return relationId;
  }

  public String namespace() {
    return namespace;
  }

  public String name() {
    return name;
  }

  /**
   * {@code namespace.name}; an empty namespace (the server sends one for {@code pg_catalog})
   * yields the bare name.
   */
  public String qualifiedName() {
    return namespace.isEmpty() ? name : namespace + '.' + name;
  }

  public ReplicaIdentity replicaIdentity() {
    return replicaIdentity;
  }

  public List<ColumnDef> columns() {
    return columns;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RelationSchema)) {
      return false;
    }
    RelationSchema other = (RelationSchema) o;
    return relationId == other.relationId
      && namespace.equals(other.namespace)
      && name.equals(other.name)
      && replicaIdentity == other.replicaIdentity
      && columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(relationId, namespace, name, replicaIdentity, columns);
  }

  @Override
  public String toString() {
    return "RelationSchema{" +
      "relationId=" + Integer.toUnsignedString(relationId) +
      ", table=" + qualifiedName() +
      ", replicaIdentity=" + replicaIdentity +
      ", columns=" + columns +
      '}';
  }
}
