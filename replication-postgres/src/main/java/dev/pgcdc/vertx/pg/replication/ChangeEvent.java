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

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A change delivered by a replication session. Every event carries the log position of the
 * chunk that produced it.
 *
 * <p>The set of variants is closed; switch over {@link #kind()} and cast to the nested type.
 */
public abstract class ChangeEvent {

  public enum Kind {
    BEGIN,
    COMMIT,
    INSERT,
    UPDATE,
    DELETE,
    TRUNCATE,
    SCHEMA_CHANGE
  }

  private final Kind kind;
  private final LogPosition position;

  private ChangeEvent(Kind kind, LogPosition position) {
    this.kind = kind;
    this.position = Objects.requireNonNull(position, "position");
  }

  public Kind kind() {
    return kind;
  }

  public LogPosition position() {
    return position;
  }

  /**
   * Whether the event is an insert, update or delete.
   */
  public boolean isRowChange() {
    return kind == Kind.INSERT || kind == Kind.UPDATE || kind == Kind.DELETE;
  }

  public static final class Begin extends ChangeEvent {
    private final LogPosition finalPosition;
    private final Instant commitTime;
    private final long xid;

    public Begin(LogPosition position, LogPosition finalPosition, Instant commitTime, long xid) {
      super(Kind.BEGIN, position);
      this.finalPosition = finalPosition;
      this.commitTime = commitTime;
      this.xid = xid;
    }

    /**
     * End position of the transaction's commit record.
     */
    public LogPosition finalPosition() {
      return finalPosition;
    }

    public Instant commitTime() {
      return commitTime;
    }

    public long xid() {
      return xid;
    }

    @Override
    public String toString() {
      return "Begin{xid=" + xid + ", finalPosition=" + finalPosition + ", commitTime=" + commitTime
        + ", position=" + position() + '}';
    }
  }

  public static final class Commit extends ChangeEvent {
    private final LogPosition commitPosition;
    private final LogPosition endPosition;
    private final Instant commitTime;

    public Commit(LogPosition position, LogPosition commitPosition, LogPosition endPosition, Instant commitTime) {
      super(Kind.COMMIT, position);
      this.commitPosition = commitPosition;
      this.endPosition = endPosition;
      this.commitTime = commitTime;
    }

    public LogPosition commitPosition() {
      return commitPosition;
    }

    public LogPosition endPosition() {
      return endPosition;
    }

    public Instant commitTime() {
      return commitTime;
    }

    @Override
    public String toString() {
      return "Commit{commitPosition=" + commitPosition + ", endPosition=" + endPosition
        + ", commitTime=" + commitTime + ", position=" + position() + '}';
    }
  }

  /**
   * Common shape of the three row-level changes.
   */
  public abstract static class RowChange extends ChangeEvent {
    private final String table;
    private final int relationId;

    private RowChange(Kind kind, LogPosition position, String table, int relationId) {
      super(kind, position);
      this.table = Objects.requireNonNull(table, "table");
      this.relationId = relationId;
    }

    /**
     * Qualified table name, {@code schema.table}.
     */
    public String table() {
      return table;
    }

    public int relationId() {
      return relationId;
    }
  }

  public static final class Insert extends RowChange {
    private final Row row;

    public Insert(LogPosition position, String table, int relationId, Row row) {
      super(Kind.INSERT, position, table, relationId);
      this.row = Objects.requireNonNull(row, "row");
    }

    public Row row() {
      return row;
    }

    @Override
    public String toString() {
      return "Insert{table=" + table() + ", row=" + row + ", position=" + position() + '}';
    }
  }

  public static final class Update extends RowChange {
    private final Row before;
    private final Row after;

    public Update(LogPosition position, String table, int relationId, Row before, Row after) {
      super(Kind.UPDATE, position, table, relationId);
      this.before = before;
      this.after = Objects.requireNonNull(after, "after");
    }

    /**
     * The old row image, or its key columns. Empty when the relation's replica identity does not
     * ship one for this update, which is normal for updates that leave the key unchanged.
     */
    public Optional<Row> before() {
      return Optional.ofNullable(before);
    }

    public Row after() {
      return after;
    }

    @Override
    public String toString() {
      return "Update{table=" + table() + ", before=" + before + ", after=" + after
        + ", position=" + position() + '}';
    }
  }

  public static final class Delete extends RowChange {
    private final Row before;

    public Delete(LogPosition position, String table, int relationId, Row before) {
      super(Kind.DELETE, position, table, relationId);
      this.before = Objects.requireNonNull(before, "before");
    }

    public Row before() {
      return before;
    }

    @Override
    public String toString() {
      return "Delete{table=" + table() + ", before=" + before + ", position=" + position() + '}';
    }
  }

  public static final class Truncate extends ChangeEvent {
    private final List<String> tables;
    private final boolean cascade;
    private final boolean restartIdentity;

    public Truncate(LogPosition position, List<String> tables, boolean cascade, boolean restartIdentity) {
      super(Kind.TRUNCATE, position);
      this.tables = Collections.unmodifiableList(List.copyOf(tables));
      this.cascade = cascade;
      this.restartIdentity = restartIdentity;
    }

    public List<String> tables() {
      return tables;
    }

    public boolean isCascade() {
      return cascade;
    }

    public boolean isRestartIdentity() {
      return restartIdentity;
    }

    @Override
    public String toString() {
      return "Truncate{tables=" + tables + ", cascade=" + cascade + ", restartIdentity=" + restartIdentity
        + ", position=" + position() + '}';
    }
  }

  public static final class SchemaChange extends ChangeEvent {
    private final RelationSchema relation;

    public SchemaChange(LogPosition position, RelationSchema relation) {
      super(Kind.SCHEMA_CHANGE, position);
      this.relation = Objects.requireNonNull(relation, "relation");
    }

    public RelationSchema relation() {
      return relation;
    }

    @Override
    public String toString() {
      return "SchemaChange{relation=" + relation + ", position=" + position() + '}';
    }
  }
}
