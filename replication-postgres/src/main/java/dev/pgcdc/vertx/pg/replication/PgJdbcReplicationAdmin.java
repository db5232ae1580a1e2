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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.postgresql.copy.CopyDual;
import org.postgresql.replication.ReplicationSlotInfo;
import org.postgresql.replication.fluent.logical.ChainedLogicalCreateSlotBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ReplicationAdmin} on a pgjdbc connection opened with {@code replication=database}.
 */
public final class PgJdbcReplicationAdmin implements ReplicationAdmin {

  private static final Logger LOG = LoggerFactory.getLogger(PgJdbcReplicationAdmin.class);

  private final Connection connection;
  private final Duration pollInterval;
  private final Clock clock;
  private boolean streaming;

  public PgJdbcReplicationAdmin(Connection connection, Duration pollInterval, Clock clock) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Opens a replication connection as described by {@code options}.
   */
  public static PgJdbcReplicationAdmin connect(PostgresReplicationOptions options, Clock clock) throws SQLException {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());
    String password = resolvePassword(options);
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }
    if (Boolean.TRUE.equals(options.getSsl())) {
      PGProperty.SSL.set(props, "true");
    }
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "10");
    PGProperty.APPLICATION_NAME.set(props, "vertx-pg-cdc-" + options.getSlotName());

    Connection connection = DriverManager.getConnection(jdbcUrl(options), props);
    return new PgJdbcReplicationAdmin(connection, options.getReceivePollInterval(), clock);
  }

  static String jdbcUrl(PostgresReplicationOptions options) {
    return "jdbc:postgresql://" + options.getHost() + ':' + options.getPort() + '/' + options.getDatabase();
  }

  static String resolvePassword(PostgresReplicationOptions options) {
    String password = options.getPassword();
    if (password == null || password.isBlank()) {
      String envName = options.getPasswordEnv();
      if (envName != null && !envName.isBlank()) {
        password = System.getenv(envName);
      }
    }
    return password;
  }

  @Override
  public SystemIdentification identifySystem() throws SQLException {
    try (Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery("IDENTIFY_SYSTEM")) {
      if (!rs.next()) {
        throw new SQLException("IDENTIFY_SYSTEM returned no row");
      }
      return new SystemIdentification(
        rs.getString("systemid"),
        rs.getInt("timeline"),
        LogPosition.parse(rs.getString("xlogpos")),
        rs.getString("dbname"));
    }
  }

  @Override
  public Optional<ReplicationSlot> findSlot(String slotName) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(
      "SELECT slot_name, plugin, temporary, confirmed_flush_lsn FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        String confirmed = rs.getString("confirmed_flush_lsn");
        return Optional.of(new ReplicationSlot(
          rs.getString("slot_name"),
          rs.getString("plugin"),
          rs.getBoolean("temporary"),
          confirmed == null ? null : LogPosition.parse(confirmed)));
      }
    }
  }

  @Override
  public ReplicationSlot createSlot(String slotName, OutputFormat outputFormat, boolean temporary) throws SQLException {
    ChainedLogicalCreateSlotBuilder builder = connection.unwrap(PGConnection.class)
      .getReplicationAPI()
      .createReplicationSlot()
      .logical()
      .withSlotName(slotName)
      .withOutputPlugin(outputFormat.pluginName());
    if (temporary) {
      builder.withTemporaryOption();
    }
    ReplicationSlotInfo info = builder.make();
    LOG.info("Created replication slot {} (plugin={}, temporary={}, consistentPoint={})",
      info.getSlotName(), info.getOutputPlugin(), temporary, info.getConsistentPoint());
    return new ReplicationSlot(info.getSlotName(), info.getOutputPlugin(), temporary,
      LogPosition.of(info.getConsistentPoint()));
  }

  @Override
  public boolean publicationExists(String publicationName) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement("SELECT 1 FROM pg_publication WHERE pubname = ?")) {
      statement.setString(1, publicationName);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next();
      }
    }
  }

  @Override
  public void createPublication(String publicationName) throws SQLException {
    try (Statement statement = connection.createStatement()) {
      statement.execute("CREATE PUBLICATION " + quoteIdentifier(publicationName) + " FOR ALL TABLES");
    }
    LOG.info("Created publication {} for all tables", publicationName);
  }

  @Override
  public void dropPublication(String publicationName) throws SQLException {
    try (Statement statement = connection.createStatement()) {
      statement.execute("DROP PUBLICATION IF EXISTS " + quoteIdentifier(publicationName));
    }
    LOG.info("Dropped publication {}", publicationName);
  }

  @Override
  public ReplicationTransport startReplication(String slotName, LogPosition start, List<String> pluginArguments)
    throws SQLException {
    StringBuilder sql = new StringBuilder("START_REPLICATION SLOT ")
      .append(quoteIdentifier(slotName))
      .append(" LOGICAL ")
      .append(start);
    if (!pluginArguments.isEmpty()) {
      sql.append(" (").append(String.join(", ", pluginArguments)).append(')');
    }
    LOG.debug("Issuing {}", sql);
    CopyDual copy = connection.unwrap(PGConnection.class).getCopyAPI().copyDual(sql.toString());
    streaming = true;
    return new PgJdbcReplicationTransport(connection, copy, pollInterval, clock);
  }

  /**
   * Closes the connection unless it was handed over to a transport.
   */
  @Override
  public void close() {
    if (streaming) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.warn("Failed to close replication admin connection", e);
    }
  }

  static String quoteIdentifier(String identifier) {
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }
}
