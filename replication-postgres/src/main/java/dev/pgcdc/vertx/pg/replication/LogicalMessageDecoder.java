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

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code pgoutput} payloads into {@link LogicalMessage}s.
 *
 * <p>Parsing is strict: a payload that ends early or carries trailing bytes is a
 * {@link ProtocolViolationException}. An unknown leading tag is an
 * {@link UnknownMessageTypeException}, which callers treat as skippable. The decoder holds no
 * state; relation bookkeeping lives in {@link RelationCache}.
 */
public final class LogicalMessageDecoder {

  public LogicalMessage decode(byte[] payload) {
    if (payload == null || payload.length == 0) {
      throw new ProtocolViolationException("Empty logical message");
    }
    ByteCursor cursor = new ByteCursor(payload);
    char tag = cursor.readChar();
    LogicalMessage.Type type = LogicalMessage.Type.forTag(tag);
    if (type == null) {
      throw new UnknownMessageTypeException(tag);
    }

    LogicalMessage message;
    switch (type) {
      case RELATION:
        message = decodeRelation(cursor);
        break;
      case BEGIN:
        message = new LogicalMessage.Begin(
          LogPosition.of(cursor.readLong()),
          ReplicationProtocol.fromPgEpochMicros(cursor.readLong()),
          Integer.toUnsignedLong(cursor.readInt()));
        break;
      case COMMIT:
        message = new LogicalMessage.Commit(
          cursor.readByte() & 0xff,
          LogPosition.of(cursor.readLong()),
          LogPosition.of(cursor.readLong()),
          ReplicationProtocol.fromPgEpochMicros(cursor.readLong()));
        break;
      case INSERT:
        message = decodeInsert(cursor);
        break;
      case UPDATE:
        message = decodeUpdate(cursor);
        break;
      case DELETE:
        message = decodeDelete(cursor);
        break;
      case TRUNCATE:
        message = decodeTruncate(cursor);
        break;
      case TYPE:
        message = new LogicalMessage.TypeDefinition(cursor.readInt(), cursor.readCString(), cursor.readCString());
        break;
      case ORIGIN:
        message = new LogicalMessage.Origin(LogPosition.of(cursor.readLong()), cursor.readCString());
        break;
      default:
        throw new UnknownMessageTypeException(tag);
    }
    cursor.expectEnd(type + " message");
    return message;
  }

  private static LogicalMessage decodeRelation(ByteCursor cursor) {
    int relationId = cursor.readInt();
    String namespace = cursor.readCString();
    String name = cursor.readCString();
    char identityCode = cursor.readChar();
    RelationSchema.ReplicaIdentity identity;
    try {
      identity = RelationSchema.ReplicaIdentity.fromCode(identityCode);
    } catch (IllegalArgumentException e) {
      throw new ProtocolViolationException(e.getMessage(), null, relationId, e);
    }

    int columnCount = cursor.readUnsignedShort();
    List<ColumnDef> columns = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      int flags = cursor.readByte() & 0xff;
      String columnName = cursor.readCString();
      int typeOid = cursor.readInt();
      int typeModifier = cursor.readInt();
      columns.add(new ColumnDef(columnName, typeOid, typeModifier, (flags & 1) != 0));
    }
    return new LogicalMessage.Relation(new RelationSchema(relationId, namespace, name, identity, columns));
  }

  private static LogicalMessage decodeInsert(ByteCursor cursor) {
    int relationId = cursor.readInt();
    char marker = cursor.readChar();
    if (marker != 'N') {
      throw new ProtocolViolationException("Unexpected tuple marker for INSERT: '" + marker + "'", null, relationId);
    }
    return new LogicalMessage.Insert(relationId, decodeTuple(cursor, relationId));
  }

  private static LogicalMessage decodeUpdate(ByteCursor cursor) {
    int relationId = cursor.readInt();
    TupleData oldTuple = null;
    boolean oldIsKey = false;

    char marker = cursor.readChar();
    if (marker == 'K' || marker == 'O') {
      oldIsKey = marker == 'K';
      oldTuple = decodeTuple(cursor, relationId);
      marker = cursor.readChar();
    }
    if (marker != 'N') {
      throw new ProtocolViolationException("Unexpected tuple marker for UPDATE: '" + marker + "'", null, relationId);
    }
    return new LogicalMessage.Update(relationId, oldTuple, oldIsKey, decodeTuple(cursor, relationId));
  }

  private static LogicalMessage decodeDelete(ByteCursor cursor) {
    int relationId = cursor.readInt();
    char marker = cursor.readChar();
    if (marker != 'K' && marker != 'O') {
      throw new ProtocolViolationException("Unexpected tuple marker for DELETE: '" + marker + "'", null, relationId);
    }
    return new LogicalMessage.Delete(relationId, decodeTuple(cursor, relationId), marker == 'K');
  }

  private static LogicalMessage decodeTruncate(ByteCursor cursor) {
    int count = cursor.readInt();
    if (count < 0) {
      throw new ProtocolViolationException("Negative relation count " + count + " in TRUNCATE");
    }
    int options = cursor.readByte() & 0xff;
    List<Integer> relationIds = new ArrayList<>(Math.min(count, cursor.remaining() / 4));
    for (int i = 0; i < count; i++) {
      relationIds.add(cursor.readInt());
    }
    return new LogicalMessage.Truncate(options, relationIds);
  }

  private static TupleData decodeTuple(ByteCursor cursor, int relationId) {
    int columnCount = cursor.readUnsignedShort();
    List<ColumnValue> values = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      char kind = cursor.readChar();
      switch (kind) {
        case 'n':
          values.add(ColumnValue.nullValue());
          break;
        case 'u':
          values.add(ColumnValue.unchangedToast());
          break;
        case 't':
          values.add(ColumnValue.text(cursor.readBytes(cursor.readInt())));
          break;
        case 'b':
          values.add(ColumnValue.binary(cursor.readBytes(cursor.readInt())));
          break;
        default:
          throw new ProtocolViolationException(
            "Unsupported tuple column kind '" + kind + "' at column " + i, null, relationId);
      }
    }
    return new TupleData(values);
  }
}
