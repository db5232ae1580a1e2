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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.pgcdc.vertx.replication.core.InMemoryPositionStore;
import dev.pgcdc.vertx.replication.core.RestartPolicy;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PostgresReplicationOptionsTest {

  @Test
  void readsFromJsonAndSerializesToJson() {
    JsonObject json = new JsonObject()
      .put("host", "db.internal")
      .put("port", 15432)
      .put("database", "app")
      .put("user", "service")
      .put("passwordEnv", "PG_PASSWORD")
      .put("ssl", true)
      .put("slotName", "app_slot")
      .put("publicationName", "app_pub")
      .put("recreatePublication", true)
      .put("outputFormat", "wal2json")
      .put("temporarySlot", true)
      .put("statusIntervalMs", 2500L)
      .put("pluginOptions", new JsonObject().put("include-timestamp", true))
      .put("autoStart", false)
      .put("restartPolicy", new JsonObject()
        .put("initialBackoffMs", 250L)
        .put("maxBackoffMs", 5000L)
        .put("multiplier", 1.5d)
        .put("jitter", 0.1d)
        .put("maxRestarts", 5L));

    PostgresReplicationOptions options = new PostgresReplicationOptions(json);

    assertEquals("db.internal", options.getHost());
    assertEquals(15432, options.getPort());
    assertEquals("app", options.getDatabase());
    assertEquals("service", options.getUser());
    assertEquals("PG_PASSWORD", options.getPasswordEnv());
    assertTrue(options.getSsl());
    assertEquals("app_slot", options.getSlotName());
    assertEquals("app_pub", options.getPublicationName());
    assertTrue(options.isRecreatePublication());
    assertEquals(OutputFormat.WAL2JSON, options.getOutputFormat());
    assertTrue(options.isTemporarySlot());
    assertEquals(Duration.ofMillis(2500), options.getStatusInterval());
    assertEquals(Boolean.TRUE, options.getPluginOptions().get("include-timestamp"));
    assertFalse(options.isAutoStart());
    assertTrue(options.getRestartPolicy().isEnabled());
    assertEquals(5L, options.getRestartPolicy().getMaxRestarts());
    assertEquals(Duration.ofMillis(250), options.getRestartPolicy().getInitialBackoff());

    JsonObject out = options.toJson();
    assertEquals("db.internal", out.getString("host"));
    assertEquals(15432, out.getInteger("port"));
    assertEquals("wal2json", out.getString("outputFormat"));
    assertEquals(2500L, out.getLong("statusIntervalMs"));
    assertFalse(out.getBoolean("autoStart"));
    assertEquals(5L, out.getJsonObject("restartPolicy").getLong("maxRestarts"));
  }

  @Test
  void defaultsFavourPgOutputAndTenSecondStatusUpdates() {
    PostgresReplicationOptions options = new PostgresReplicationOptions();

    assertEquals(OutputFormat.PGOUTPUT, options.getOutputFormat());
    assertEquals(Duration.ofSeconds(10), options.getStatusInterval());
    assertTrue(options.isCreatePublication());
    assertFalse(options.getRestartPolicy().isEnabled());
    assertFalse(options.toJson().containsKey("restartPolicy"));
  }

  @Test
  void mergesWithJsonLikeOtherVertxOptions() {
    InMemoryPositionStore store = new InMemoryPositionStore();
    PostgresReplicationOptions base = new PostgresReplicationOptions()
      .setHost("localhost")
      .setPort(5432)
      .setDatabase("db")
      .setUser("u")
      .setSlotName("slot")
      .setPositionStore(store)
      .setRestartPolicy(RestartPolicy.withBackoff().setMaxRestarts(3))
      .addTextDecoder(790, text -> new BigDecimal(text.substring(1)));

    PostgresReplicationOptions merged = base.merge(new JsonObject()
      .put("host", "replica")
      .put("ssl", true));

    assertEquals("replica", merged.getHost());
    assertTrue(merged.getSsl());
    assertEquals(5432, merged.getPort());
    assertSame(store, merged.getPositionStore());
    assertEquals(3L, merged.getRestartPolicy().getMaxRestarts());
    assertTrue(merged.newTupleDecoder().isRegistered(790));
  }

  @Test
  void copyIsIndependent() {
    PostgresReplicationOptions original = new PostgresReplicationOptions().setSlotName("a");
    PostgresReplicationOptions copy = new PostgresReplicationOptions(original).setSlotName("b");

    assertEquals("a", original.getSlotName());
    assertEquals("b", copy.getSlotName());
  }

  @Test
  void validatesSlotPublicationAndIntervals() {
    assertDoesNotThrow(valid()::validate);

    assertThrows(IllegalArgumentException.class, valid().setSlotName("Bad-Slot")::validate);
    assertThrows(IllegalArgumentException.class, valid().setPublicationName(null)::validate);
    assertThrows(IllegalArgumentException.class, valid().setStatusInterval(Duration.ZERO)::validate);
    assertThrows(IllegalArgumentException.class, valid().setPort(0)::validate);
    assertDoesNotThrow(valid().setOutputFormat(OutputFormat.WAL2JSON).setPublicationName(null)::validate);
  }

  @Test
  void jdbcHelpers() {
    assertEquals("jdbc:postgresql://db.internal:5433/app",
      PgJdbcReplicationAdmin.jdbcUrl(valid().setHost("db.internal").setPort(5433)));
    assertEquals("secret", PgJdbcReplicationAdmin.resolvePassword(valid().setPassword("secret")));
    assertEquals("\"odd\"\"name\"", PgJdbcReplicationAdmin.quoteIdentifier("odd\"name"));
  }

  private static PostgresReplicationOptions valid() {
    return new PostgresReplicationOptions()
      .setDatabase("app")
      .setUser("cdc")
      .setSlotName("orders_slot")
      .setPublicationName("orders_pub");
  }
}
