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

import static dev.pgcdc.vertx.pg.replication.PgOutputFixtures.column;
import static dev.pgcdc.vertx.pg.replication.PgOutputFixtures.keyColumn;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogicalMessageDecoderTest {

  private final LogicalMessageDecoder decoder = new LogicalMessageDecoder();

  @Test
  void decodesRelation() {
    LogicalMessage message = decoder.decode(PgOutputFixtures.relation(16390, "public", "trial", 'f',
      keyColumn("id", TupleDecoder.OID_INT4),
      column("name", TupleDecoder.OID_TEXT)));

    RelationSchema schema = assertInstanceOf(LogicalMessage.Relation.class, message).schema();
    assertEquals(16390, schema.relationId());
    assertEquals("public.trial", schema.qualifiedName());
    assertEquals(RelationSchema.ReplicaIdentity.FULL, schema.replicaIdentity());
    assertEquals(List.of(
      new ColumnDef("id", TupleDecoder.OID_INT4, -1, true),
      new ColumnDef("name", TupleDecoder.OID_TEXT, -1, false)), schema.columns());
  }

  @Test
  void decodesBeginAndCommit() {
    long micros = 825_000_000_000_000L;
    Instant expectedTime = Instant.ofEpochSecond(ReplicationProtocol.PG_EPOCH_SECONDS + 825_000_000L);

    LogicalMessage.Begin begin = assertInstanceOf(LogicalMessage.Begin.class,
      decoder.decode(PgOutputFixtures.begin(0x16B6C50L, micros, -1)));
    assertEquals(LogPosition.of(0x16B6C50L), begin.finalPosition());
    assertEquals(expectedTime, begin.commitTime());
    assertEquals(4_294_967_295L, begin.xid());

    LogicalMessage.Commit commit = assertInstanceOf(LogicalMessage.Commit.class,
      decoder.decode(PgOutputFixtures.commit(0x16B6C50L, 0x16B6C80L, micros)));
    assertEquals(LogPosition.of(0x16B6C50L), commit.commitPosition());
    assertEquals(LogPosition.of(0x16B6C80L), commit.endPosition());
    assertEquals(expectedTime, commit.commitTime());
  }

  @Test
  void decodesTupleColumnKinds() {
    LogicalMessage.Insert insert = assertInstanceOf(LogicalMessage.Insert.class, decoder.decode(
      PgOutputFixtures.insert(1,
        ColumnValue.text("7"),
        ColumnValue.nullValue(),
        ColumnValue.unchangedToast(),
        ColumnValue.binary(new byte[] {1, 2}))));

    TupleData tuple = insert.newTuple();
    assertEquals(4, tuple.size());
    assertEquals("7", tuple.get(0).asText());
    assertEquals(ColumnValue.Kind.NULL, tuple.get(1).kind());
    assertEquals(ColumnValue.Kind.UNCHANGED_TOAST, tuple.get(2).kind());
    assertEquals(ColumnValue.Kind.BINARY, tuple.get(3).kind());
    assertEquals(2, tuple.get(3).data().length);
  }

  @Test
  void decodesUpdateVariants() {
    LogicalMessage.Update plain = assertInstanceOf(LogicalMessage.Update.class,
      decoder.decode(PgOutputFixtures.update(1, (char) 0, null, ColumnValue.text("1"))));
    assertNull(plain.oldTuple());

    LogicalMessage.Update keyed = assertInstanceOf(LogicalMessage.Update.class, decoder.decode(
      PgOutputFixtures.update(1, 'K', new ColumnValue[] {ColumnValue.text("0")}, ColumnValue.text("1"))));
    assertTrue(keyed.oldTupleIsKey());
    assertEquals("0", keyed.oldTuple().get(0).asText());

    LogicalMessage.Update full = assertInstanceOf(LogicalMessage.Update.class, decoder.decode(
      PgOutputFixtures.update(1, 'O', new ColumnValue[] {ColumnValue.text("0")}, ColumnValue.text("1"))));
    assertFalse(full.oldTupleIsKey());
    assertEquals("1", full.newTuple().get(0).asText());
  }

  @Test
  void decodesDeleteTruncateTypeAndOrigin() {
    LogicalMessage.Delete delete = assertInstanceOf(LogicalMessage.Delete.class,
      decoder.decode(PgOutputFixtures.delete(3, 'O', ColumnValue.text("9"))));
    assertEquals(3, delete.relationId());
    assertFalse(delete.oldTupleIsKey());

    LogicalMessage.Truncate truncate = assertInstanceOf(LogicalMessage.Truncate.class,
      decoder.decode(PgOutputFixtures.truncate(
        LogicalMessage.Truncate.OPTION_CASCADE | LogicalMessage.Truncate.OPTION_RESTART_IDENTITY, 3, 4)));
    assertEquals(List.of(3, 4), truncate.relationIds());
    assertTrue(truncate.isCascade());
    assertTrue(truncate.isRestartIdentity());

    LogicalMessage.TypeDefinition type = assertInstanceOf(LogicalMessage.TypeDefinition.class,
      decoder.decode(PgOutputFixtures.type(16400, "public", "mood")));
    assertEquals(16400, type.typeOid());
    assertEquals("mood", type.name());

    LogicalMessage.Origin origin = assertInstanceOf(LogicalMessage.Origin.class,
      decoder.decode(PgOutputFixtures.origin(0x20L, "upstream")));
    assertEquals("upstream", origin.name());
    assertEquals(LogPosition.of(0x20L), origin.commitPosition());
  }

  @Test
  void unknownTagIsTyped() {
    UnknownMessageTypeException error = assertThrows(UnknownMessageTypeException.class,
      () -> decoder.decode(new byte[] {'M', 0}));

    assertEquals('M', error.tag());
  }

  @Test
  void rejectsMalformedPayloads() {
    assertThrows(ProtocolViolationException.class, () -> decoder.decode(new byte[0]));
    assertThrows(ProtocolViolationException.class, () -> decoder.decode(new byte[] {'B', 0, 0}));

    byte[] insert = PgOutputFixtures.insert(1, ColumnValue.text("7"));
    byte[] trailing = new byte[insert.length + 1];
    System.arraycopy(insert, 0, trailing, 0, insert.length);
    assertThrows(ProtocolViolationException.class, () -> decoder.decode(trailing));

    ByteArrayOutputStream badMarker = new ByteArrayOutputStream();
    PgOutputFixtures.writeByte(badMarker, 'I');
    PgOutputFixtures.writeInt(badMarker, 1);
    PgOutputFixtures.writeByte(badMarker, 'X');
    ProtocolViolationException error = assertThrows(ProtocolViolationException.class,
      () -> decoder.decode(badMarker.toByteArray()));
    assertEquals(Integer.valueOf(1), error.relationId());

    ByteArrayOutputStream badKind = new ByteArrayOutputStream();
    PgOutputFixtures.writeByte(badKind, 'I');
    PgOutputFixtures.writeInt(badKind, 1);
    PgOutputFixtures.writeByte(badKind, 'N');
    PgOutputFixtures.writeShort(badKind, 1);
    PgOutputFixtures.writeByte(badKind, 'q');
    assertThrows(ProtocolViolationException.class, () -> decoder.decode(badKind.toByteArray()));
  }

  @Test
  void rejectsUnknownReplicaIdentity() {
    assertThrows(ProtocolViolationException.class,
      () -> decoder.decode(PgOutputFixtures.relation(1, "public", "t", 'z', column("id", TupleDecoder.OID_INT4))));
  }
}
