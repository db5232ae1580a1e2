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

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReplicationAppConfigTest {

  @Test
  void mapsEnvironmentAndBuildsOptions() {
    Map<String, String> env = new HashMap<>();
    env.put("PGHOST", "pg.internal");
    env.put("PGPORT", "15432");
    env.put("PGDATABASE", "app");
    env.put("PGUSER", "service");
    env.put("PG_PASSWORD_ENV", "APP_DB_PASSWORD");
    env.put("PGSSL", "true");
    env.put("CDC_SLOT", "fraud_detection_slot");
    env.put("CDC_PUBLICATION", "fraud_pub");
    env.put("CDC_OUTPUT_FORMAT", "wal2json");
    env.put("CDC_STATUS_INTERVAL_SECONDS", "5");

    ReplicationAppConfig cfg = ReplicationAppConfig.fromMap(env);

    assertEquals("pg.internal", cfg.pgHost());
    assertEquals(15432, cfg.pgPort());
    assertEquals("app", cfg.pgDatabase());
    assertEquals("service", cfg.pgUser());
    assertEquals("APP_DB_PASSWORD", cfg.pgPasswordEnv());
    assertTrue(cfg.ssl());
    assertEquals(OutputFormat.WAL2JSON, cfg.outputFormat());

    PostgresReplicationOptions options = cfg.toReplicationOptions();
    assertEquals("pg.internal", options.getHost());
    assertEquals(15432, options.getPort());
    assertEquals("fraud_detection_slot", options.getSlotName());
    assertEquals("fraud_pub", options.getPublicationName());
    assertEquals("APP_DB_PASSWORD", options.getPasswordEnv());
    assertEquals(Duration.ofSeconds(5), options.getStatusInterval());
  }

  @Test
  void fallsBackToDefaults() {
    Map<String, String> env = new HashMap<>();
    env.put("PGPORT", "not-a-port");
    env.put("CDC_STATUS_INTERVAL_SECONDS", "0");

    ReplicationAppConfig cfg = ReplicationAppConfig.fromMap(env);

    assertEquals("localhost", cfg.pgHost());
    assertEquals(5432, cfg.pgPort());
    assertEquals("postgres", cfg.pgUser());
    assertEquals("PGPASSWORD", cfg.pgPasswordEnv());
    assertFalse(cfg.ssl());
    assertEquals("pg_cdc_slot", cfg.slotName());
    assertEquals(OutputFormat.PGOUTPUT, cfg.outputFormat());
    assertEquals(Duration.ofSeconds(10), cfg.statusInterval());
  }

  @Test
  void presetsConfigureRestarts() {
    PostgresReplicationOptions production = new PostgresReplicationOptions();
    ReplicationOptionPresets.applyProductionDefaults(production);
    assertTrue(production.getRestartPolicy().isEnabled());
    assertFalse(production.isTemporarySlot());
    assertFalse(production.isAutoStart());

    PostgresReplicationOptions local = new PostgresReplicationOptions();
    ReplicationOptionPresets.applyLocalDevDefaults(local);
    assertTrue(local.isTemporarySlot());
    assertTrue(local.isRecreatePublication());
    assertEquals(10L, local.getRestartPolicy().getMaxRestarts());
  }
}
