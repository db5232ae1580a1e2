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
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.pgcdc.vertx.replication.core.InMemoryPositionStore;
import dev.pgcdc.vertx.replication.core.SubscriptionRegistration;
import io.vertx.core.Vertx;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;

class PostgresLogicalReplicationStreamContainerTest {

  private static final String SLOT_NAME = "vertx_cdc_slot";
  private static final String PUBLICATION_NAME = "vertx_cdc_pub";
  private static final String DB_NAME = "testdb";
  private static final String DB_USER = "test";
  private static final String DB_PASSWORD = "test";

  @Test
  void streamsRowChangesWithTypedValues() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();
      execute(postgres,
        "CREATE TABLE cdc_types (" +
          "id BIGSERIAL PRIMARY KEY," +
          "body TEXT NOT NULL," +
          "active BOOLEAN NOT NULL," +
          "score INTEGER NOT NULL," +
          "amount NUMERIC(10,2) NOT NULL," +
          "meta JSONB NOT NULL," +
          "payload TEXT)");

      Vertx vertx = Vertx.vertx();
      InMemoryPositionStore positions = new InMemoryPositionStore();
      PostgresLogicalReplicationStream stream = new PostgresLogicalReplicationStream(vertx, options(postgres)
        .setStatusInterval(Duration.ofSeconds(1))
        .setPositionStore(positions));

      BlockingQueue<ChangeEvent> events = new LinkedBlockingQueue<>();
      SubscriptionRegistration registration = stream.startAndSubscribe(
        event -> {
          if (event.isRowChange() && "public.cdc_types".equals(((ChangeEvent.RowChange) event).table())) {
            events.offer(event);
          }
        },
        err -> { });

      try {
        registration.started().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        execute(postgres,
          "INSERT INTO cdc_types(body, active, score, amount, meta, payload) VALUES (" +
            "'hello-types', true, 7, 12.34, '{\"a\":1,\"nested\":{\"b\":\"x\"}}'::jsonb, " +
            "(SELECT string_agg(md5(random()::text), '') FROM generate_series(1, 400)))",
          "UPDATE cdc_types SET body='hello-updated', active=false, score=8 WHERE id=1",
          "DELETE FROM cdc_types WHERE id=1");

        ChangeEvent.Insert insert = (ChangeEvent.Insert) poll(events, "insert");
        ChangeEvent.Update update = (ChangeEvent.Update) poll(events, "update");
        ChangeEvent.Delete delete = (ChangeEvent.Delete) poll(events, "delete");

        Row inserted = insert.row();
        assertEquals("hello-types", inserted.string("body"));
        assertEquals(Boolean.TRUE, inserted.bool("active"));
        assertEquals(7, inserted.integer("score"));
        assertEquals(new BigDecimal("12.34"), inserted.decimal("amount"));
        assertEquals(1L, inserted.longValue("id"));
        Map<?, ?> meta = (Map<?, ?>) inserted.value("meta");
        assertEquals(1, ((Number) meta.get("a")).intValue());

        Row updated = update.after();
        assertEquals("hello-updated", updated.string("body"));
        assertEquals(Boolean.FALSE, updated.bool("active"));
        assertFalse(updated.get("payload").isAvailable(), "unchanged TOAST column must not be fabricated");
        assertFalse(update.before().isPresent());

        assertEquals(1L, delete.before().longValue("id"));

        assertTrue(waitForStoredPosition(positions, SLOT_NAME), "confirmed position was never stored");
      } finally {
        registration.subscription().cancel();
        stream.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  @Test
  void truncateAndSchemaChangesAreReported() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();
      execute(postgres, "CREATE TABLE messages (id SERIAL PRIMARY KEY, body TEXT NOT NULL)");

      Vertx vertx = Vertx.vertx();
      PostgresLogicalReplicationStream stream = new PostgresLogicalReplicationStream(vertx, options(postgres)
        .setSlotName(SLOT_NAME + "_truncate")
        .setTemporarySlot(true));

      BlockingQueue<ChangeEvent> events = new LinkedBlockingQueue<>();
      SubscriptionRegistration registration = stream.startAndSubscribe(events::offer, err -> { });

      try {
        registration.started().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        execute(postgres,
          "INSERT INTO messages(body) VALUES ('first')",
          "TRUNCATE messages");

        ChangeEvent.SchemaChange schema = (ChangeEvent.SchemaChange) pollKind(events, ChangeEvent.Kind.SCHEMA_CHANGE);
        assertEquals("public.messages", schema.relation().qualifiedName());
        assertEquals(List.of("id", "body"), List.of(
          schema.relation().columns().get(0).name(),
          schema.relation().columns().get(1).name()));

        ChangeEvent.Insert insert = (ChangeEvent.Insert) pollKind(events, ChangeEvent.Kind.INSERT);
        assertEquals("first", insert.row().string("body"));

        ChangeEvent.Truncate truncate = (ChangeEvent.Truncate) pollKind(events, ChangeEvent.Kind.TRUNCATE);
        assertEquals(List.of("public.messages"), truncate.tables());
      } finally {
        registration.subscription().cancel();
        stream.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  private static PostgresReplicationOptions options(GenericContainer<?> postgres) {
    return new PostgresReplicationOptions()
      .setHost(postgres.getHost())
      .setPort(postgres.getFirstMappedPort())
      .setDatabase(DB_NAME)
      .setUser(DB_USER)
      .setPassword(DB_PASSWORD)
      .setSlotName(SLOT_NAME)
      .setPublicationName(PUBLICATION_NAME);
  }

  private static ChangeEvent poll(BlockingQueue<ChangeEvent> events, String label) throws Exception {
    ChangeEvent event = events.poll(30, TimeUnit.SECONDS);
    if (event == null) {
      throw new IllegalStateException("Timed out waiting for " + label + " event");
    }
    return event;
  }

  private static ChangeEvent pollKind(BlockingQueue<ChangeEvent> events, ChangeEvent.Kind kind) throws Exception {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
    while (System.nanoTime() < deadline) {
      ChangeEvent event = events.poll(1, TimeUnit.SECONDS);
      if (event != null && event.kind() == kind) {
        return event;
      }
    }
    throw new IllegalStateException("Timed out waiting for " + kind + " event");
  }

  private static boolean waitForStoredPosition(InMemoryPositionStore positions, String slotName) throws Exception {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (System.nanoTime() < deadline) {
      if (positions.load(slotName).isPresent()) {
        return true;
      }
      Thread.sleep(200);
    }
    return false;
  }

  private static void execute(GenericContainer<?> postgres, String... sql) throws Exception {
    try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD);
         Statement statement = conn.createStatement()) {
      for (String command : sql) {
        statement.execute(command);
      }
    }
  }

  private static GenericContainer<?> createPostgresContainer() {
    return new GenericContainer<>("postgres:16")
      .withExposedPorts(5432)
      .withEnv("POSTGRES_DB", DB_NAME)
      .withEnv("POSTGRES_USER", DB_USER)
      .withEnv("POSTGRES_PASSWORD", DB_PASSWORD)
      .withStartupTimeout(Duration.ofMinutes(10))
      .withCommand("postgres",
        "-c", "wal_level=logical",
        "-c", "max_replication_slots=10",
        "-c", "max_wal_senders=10");
  }

  private static String jdbcUrl(GenericContainer<?> postgres) {
    return "jdbc:postgresql://" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + DB_NAME;
  }
}
