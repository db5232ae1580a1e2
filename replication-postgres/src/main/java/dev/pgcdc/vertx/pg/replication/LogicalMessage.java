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

/**
 * A decoded {@code pgoutput} message (protocol version 1).
 */
public abstract class LogicalMessage {

  public enum Type {
    RELATION('R'),
    BEGIN('B'),
    COMMIT('C'),
    INSERT('I'),
    UPDATE('U'),
    DELETE('D'),
    TRUNCATE('T'),
    TYPE('Y'),
    ORIGIN('O');

    private final char tag;

    Type(char tag) {
      this.tag = tag;
    }

    public char tag() {
      return tag;
    }

    /**
     * @return the type for {@code tag}, or {@code null} if the tag is unknown
     */
    public static Type forTag(char tag) {
      for (Type type : values()) {
        if (type.tag == tag) {
          return type;
        }
      }
      return null;
    }
  }

  private final Type type;

  private LogicalMessage(Type type) {
    this.type = type;
  }

  public Type type() {
    return type;
  }

  public static final class Relation extends LogicalMessage {
    private final RelationSchema schema;

    public Relation(RelationSchema schema) {
      super(Type.RELATION);
      this.schema = Objects.requireNonNull(schema, "schema");
    }

    public RelationSchema schema() {
      return schema;
    }
  }

  public static final class Begin extends LogicalMessage {
    private final LogPosition finalPosition;
    private final Instant commitTime;
    private final long xid;

    public Begin(LogPosition finalPosition, Instant commitTime, long xid) {
      super(Type.BEGIN);
      this.finalPosition = finalPosition;
      this.commitTime = commitTime;
      this.xid = xid;
    }

    public LogPosition finalPosition() {
      return finalPosition;
    }

    public Instant commitTime() {
      return commitTime;
    }

    public long xid() {
      return xid;
    }
  }

  public static final class Commit extends LogicalMessage {
    private final int flags;
    private final LogPosition commitPosition;
    private final LogPosition endPosition;
    private final Instant commitTime;

    public Commit(int flags, LogPosition commitPosition, LogPosition endPosition, Instant commitTime) {
      super(Type.COMMIT);
      this.flags = flags;
      this.commitPosition = commitPosition;
      this.endPosition = endPosition;
      this.commitTime = commitTime;
    }

    public int flags() {
      return flags;
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
  }

  public static final class Insert extends LogicalMessage {
    private final int relationId;
    private final TupleData newTuple;

    public Insert(int relationId, TupleData newTuple) {
      super(Type.INSERT);
      this.relationId = relationId;
      this.newTuple = Objects.requireNonNull(newTuple, "newTuple");
    }

    public int relationId() {
      return relationId;
    }

    public TupleData newTuple() {
      return newTuple;
    }
  }

  public static final class Update extends LogicalMessage {
    private final int relationId;
    private final TupleData oldTuple;
    private final boolean oldTupleIsKey;
    private final TupleData newTuple;

    public Update(int relationId, TupleData oldTuple, boolean oldTupleIsKey, TupleData newTuple) {
      super(Type.UPDATE);
      this.relationId = relationId;
      this.oldTuple = oldTuple;
      this.oldTupleIsKey = oldTupleIsKey;
      this.newTuple = Objects.requireNonNull(newTuple, "newTuple");
    }

    public int relationId() {
      return relationId;
    }

    /**
     * Old row image ({@code 'O'}) or old key ({@code 'K'}); {@code null} when neither was sent.
     */
    public TupleData oldTuple() {
      return oldTuple;
    }

    public boolean oldTupleIsKey() {
      return oldTupleIsKey;
    }

    public TupleData newTuple() {
      return newTuple;
    }
  }

  public static final class Delete extends LogicalMessage {
    private final int relationId;
    private final TupleData oldTuple;
    private final boolean oldTupleIsKey;

    public Delete(int relationId, TupleData oldTuple, boolean oldTupleIsKey) {
      super(Type.DELETE);
      this.relationId = relationId;
      this.oldTuple = Objects.requireNonNull(oldTuple, "oldTuple");
      this.oldTupleIsKey = oldTupleIsKey;
    }

    public int relationId() {
      return relationId;
    }

    public TupleData oldTuple() {
      return oldTuple;
    }

    public boolean oldTupleIsKey() {
      return oldTupleIsKey;
    }
  }

  public static final class Truncate extends LogicalMessage {
    public static final int OPTION_CASCADE = 1;
    public static final int OPTION_RESTART_IDENTITY = 2;

    private final int options;
    private final List<Integer> relationIds;

    public Truncate(int options, List<Integer> relationIds) {
      super(Type.TRUNCATE);
      this.options = options;
      this.relationIds = Collections.unmodifiableList(List.copyOf(relationIds));
    }

    public int options() {
      return options;
    }

    public boolean isCascade() {
      return (options & OPTION_CASCADE) != 0;
    }

    public boolean isRestartIdentity() {
      return (options & OPTION_RESTART_IDENTITY) != 0;
    }

    public List<Integer> relationIds() {
      return relationIds;
    }
  }

  public static final class TypeDefinition extends LogicalMessage {
    private final int typeOid;
    private final String namespace;
    private final String name;

    public TypeDefinition(int typeOid, String namespace, String name) {
      super(Type.TYPE);
      this.typeOid = typeOid;
      this.namespace = namespace;
      this.name = name;
    }

    public int typeOid() {
      return typeOid;
    }

    public String namespace() {
      return namespace;
    }

    public String name() {
      return name;
    }
  }

  public static final class Origin extends LogicalMessage {
    private final LogPosition commitPosition;
    private final String name;

    public Origin(LogPosition commitPosition, String name) {
      super(Type.ORIGIN);
      this.commitPosition = commitPosition;
      this.name = name;
    }

    public LogPosition commitPosition() {
      return commitPosition;
    }

    public String name() {
      return name;
    }
  }
}
