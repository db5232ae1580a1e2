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
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.pgcdc.vertx.replication.core.InMemoryPositionStore;
import dev.pgcdc.vertx.replication.core.PositionStore;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionBootstrapTest {

  private ScriptedTransport transport;
  private FakeReplicationAdmin admin;
  private PostgresReplicationOptions options;

  @BeforeEach
  void setUp() {
    transport = new ScriptedTransport(new MutableClock(Instant.EPOCH));
    admin = new FakeReplicationAdmin(() -> transport);
    options = new PostgresReplicationOptions()
      .setDatabase("app")
      .setUser("cdc")
      .setSlotName("orders_slot")
      .setPublicationName("orders_pub");
  }

  @Test
  void createsPublicationAndSlotOnFirstRun() {
    StreamStart start = new SessionBootstrap(admin, options).bootstrap();

    assertTrue(start.slotCreated());
    assertEquals(admin.currentPosition, start.startPosition());
    assertSame(transport, start.transport());
    assertEquals(List.of(
      "IDENTIFY_SYSTEM",
      "CREATE_PUBLICATION orders_pub",
      "FIND_SLOT orders_slot",
      "CREATE_SLOT orders_slot pgoutput",
      "START_REPLICATION orders_slot 0/1000"), admin.commands);
    assertEquals(List.of("proto_version '1'", "publication_names 'orders_pub'"), admin.startArguments);
  }

  @Test
  void reusesExistingSlotFromItsConfirmedPosition() {
    admin.publications.add("orders_pub");
    admin.slots.put("orders_slot", new ReplicationSlot("orders_slot", "pgoutput", false, LogPosition.of(0x800L)));

    StreamStart start = new SessionBootstrap(admin, options).bootstrap();

    assertFalse(start.slotCreated());
    assertEquals(LogPosition.of(0x800L), start.startPosition());
    assertFalse(admin.commands.contains("CREATE_PUBLICATION orders_pub"));
  }

  @Test
  void recreatesPublicationWhenAsked() {
    admin.publications.add("orders_pub");
    options.setRecreatePublication(true);

    new SessionBootstrap(admin, options).bootstrap();

    assertEquals("DROP_PUBLICATION orders_pub", admin.commands.get(1));
    assertEquals("CREATE_PUBLICATION orders_pub", admin.commands.get(2));
  }

  @Test
  void leavesPublicationAloneWhenCreationIsDisabled() {
    options.setCreatePublication(false);

    new SessionBootstrap(admin, options).bootstrap();

    assertTrue(admin.publications.isEmpty());
  }

  @Test
  void temporarySlotIsRequestedAsSuch() {
    options.setTemporarySlot(true);

    StreamStart start = new SessionBootstrap(admin, options).bootstrap();

    assertTrue(start.slot().isTemporary());
    assertTrue(admin.commands.contains("CREATE_SLOT orders_slot pgoutput TEMPORARY"));
  }

  @Test
  void slotWithOtherPluginIsRejected() {
    admin.slots.put("orders_slot", new ReplicationSlot("orders_slot", "test_decoding", false, LogPosition.of(0x800L)));

    SessionBootstrapException error = assertThrows(SessionBootstrapException.class,
      () -> new SessionBootstrap(admin, options).bootstrap());

    assertTrue(error.getMessage().contains("test_decoding"));
    assertFalse(admin.commands.stream().anyMatch(command -> command.startsWith("START_REPLICATION")));
  }

  @Test
  void storedPositionAheadOfSlotWins() throws Exception {
    InMemoryPositionStore store = new InMemoryPositionStore();
    store.save("orders_slot", "0/900");
    options.setPositionStore(store);
    admin.slots.put("orders_slot", new ReplicationSlot("orders_slot", "pgoutput", false, LogPosition.of(0x800L)));

    assertEquals(LogPosition.of(0x900L), new SessionBootstrap(admin, options).bootstrap().startPosition());
  }

  @Test
  void storedPositionBehindSlotIsIgnored() throws Exception {
    InMemoryPositionStore store = new InMemoryPositionStore();
    store.save("orders_slot", "0/700");
    options.setPositionStore(store);
    admin.slots.put("orders_slot", new ReplicationSlot("orders_slot", "pgoutput", false, LogPosition.of(0x800L)));

    assertEquals(LogPosition.of(0x800L), new SessionBootstrap(admin, options).bootstrap().startPosition());
  }

  @Test
  void freshSlotIgnoresStoredPosition() throws Exception {
    InMemoryPositionStore store = new InMemoryPositionStore();
    store.save("orders_slot", "0/9000");
    options.setPositionStore(store);

    assertEquals(admin.currentPosition, new SessionBootstrap(admin, options).bootstrap().startPosition());
  }

  @Test
  void invalidStoredPositionFallsBackToSlot() throws Exception {
    InMemoryPositionStore store = new InMemoryPositionStore();
    store.save("orders_slot", "garbage");
    options.setPositionStore(store);
    admin.slots.put("orders_slot", new ReplicationSlot("orders_slot", "pgoutput", false, LogPosition.of(0x800L)));

    assertEquals(LogPosition.of(0x800L), new SessionBootstrap(admin, options).bootstrap().startPosition());
  }

  @Test
  void slotWithoutConfirmedPositionStartsAtServerPosition() {
    admin.slots.put("orders_slot", new ReplicationSlot("orders_slot", "pgoutput", false, LogPosition.INVALID));

    assertEquals(admin.currentPosition, new SessionBootstrap(admin, options).bootstrap().startPosition());
  }

  @Test
  void failingPositionStoreAbortsBootstrap() {
    options.setPositionStore(new PositionStore() {
      @Override
      public Optional<String> load(String streamName) throws Exception {
        throw new IOException("disk gone");
      }

      @Override
      public void save(String streamName, String position) {
      }
    });
    admin.slots.put("orders_slot", new ReplicationSlot("orders_slot", "pgoutput", false, LogPosition.of(0x800L)));

    SessionBootstrapException error = assertThrows(SessionBootstrapException.class,
      () -> new SessionBootstrap(admin, options).bootstrap());
    assertInstanceOf(IOException.class, error.getCause());
  }

  @Test
  void startFailureIsWrapped() {
    admin.startFailure = new SQLException("replication slot \"orders_slot\" is active for PID 42", "55006");

    SessionBootstrapException error = assertThrows(SessionBootstrapException.class,
      () -> new SessionBootstrap(admin, options).bootstrap());

    assertSame(admin.startFailure, error.getCause());
  }

  @Test
  void wal2JsonGetsItsOwnArguments() {
    options.setOutputFormat(OutputFormat.WAL2JSON).setPublicationName(null);

    new SessionBootstrap(admin, options).bootstrap();

    assertTrue(admin.commands.contains("CREATE_SLOT orders_slot wal2json"));
    assertTrue(admin.startArguments.stream().noneMatch(argument -> argument.startsWith("publication_names")));
  }
}
