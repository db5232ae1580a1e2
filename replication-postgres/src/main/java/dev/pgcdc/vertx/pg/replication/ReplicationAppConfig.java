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

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of the logging application, read from the environment.
 */
public final class ReplicationAppConfig {

  private static final String DEFAULT_SLOT = "pg_cdc_slot";
  private static final String DEFAULT_PUBLICATION = "pg_cdc_publication";

  private final String pgHost;
  private final int pgPort;
  private final String pgDatabase;
  private final String pgUser;
  private final String pgPasswordEnv;
  private final boolean ssl;
  private final String slotName;
  private final String publicationName;
  private final OutputFormat outputFormat;
  private final Duration statusInterval;

  private ReplicationAppConfig(String pgHost,
                               int pgPort,
                               String pgDatabase,
                               String pgUser,
                               String pgPasswordEnv,
                               boolean ssl,
                               String slotName,
                               String publicationName,
                               OutputFormat outputFormat,
                               Duration statusInterval) {
    this.pgHost = pgHost;
    this.pgPort = pgPort;
    this.pgDatabase = pgDatabase;
    this.pgUser = pgUser;
    this.pgPasswordEnv = pgPasswordEnv;
    this.ssl = ssl;
    this.slotName = slotName;
    this.publicationName = publicationName;
    this.outputFormat = outputFormat;
    this.statusInterval = statusInterval;
  }

  public static ReplicationAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static ReplicationAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    String host = envOrDefault(env, "PGHOST", PostgresReplicationOptions.DEFAULT_HOST);
    int port = intEnvOrDefault(env, "PGPORT", PostgresReplicationOptions.DEFAULT_PORT);
    String database = envOrDefault(env, "PGDATABASE", "postgres");
    String user = envOrDefault(env, "PGUSER", "postgres");
    String passwordEnv = envOrDefault(env, "PG_PASSWORD_ENV", "PGPASSWORD");
    boolean ssl = boolEnvOrDefault(env, "PGSSL", false);
    String slot = envOrDefault(env, "CDC_SLOT", DEFAULT_SLOT);
    String publication = envOrDefault(env, "CDC_PUBLICATION", DEFAULT_PUBLICATION);
    OutputFormat format = OutputFormat.fromPluginName(
      envOrDefault(env, "CDC_OUTPUT_FORMAT", PostgresReplicationOptions.DEFAULT_OUTPUT_FORMAT.pluginName()));
    int intervalSeconds = intEnvOrDefault(env, "CDC_STATUS_INTERVAL_SECONDS",
      (int) PostgresReplicationOptions.DEFAULT_STATUS_INTERVAL.getSeconds());
    if (intervalSeconds < 1) {
      intervalSeconds = (int) PostgresReplicationOptions.DEFAULT_STATUS_INTERVAL.getSeconds();
    }

    return new ReplicationAppConfig(host, port, database, user, passwordEnv, ssl, slot, publication, format,
      Duration.ofSeconds(intervalSeconds));
  }

  public String pgHost() {
    return pgHost;
  }

  public int pgPort() {
    return pgPort;
  }

  public String pgDatabase() {
    return pgDatabase;
  }

  public String pgUser() {
    return pgUser;
  }

  public String pgPasswordEnv() {
    return pgPasswordEnv;
  }

  public boolean ssl() {
    return ssl;
  }

  public String slotName() {
    return slotName;
  }

  public String publicationName() {
    return publicationName;
  }

  public OutputFormat outputFormat() {
    return outputFormat;
  }

  public Duration statusInterval() {
    return statusInterval;
  }

  public PostgresReplicationOptions toReplicationOptions() {
    return new PostgresReplicationOptions()
      .setHost(pgHost)
      .setPort(pgPort)
      .setDatabase(pgDatabase)
      .setUser(pgUser)
      .setPasswordEnv(pgPasswordEnv)
      .setSsl(ssl)
      .setSlotName(slotName)
      .setPublicationName(publicationName)
      .setOutputFormat(outputFormat)
      .setStatusInterval(statusInterval);
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }
}
