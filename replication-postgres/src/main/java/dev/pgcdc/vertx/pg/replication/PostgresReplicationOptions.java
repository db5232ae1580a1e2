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

import dev.pgcdc.vertx.replication.core.OptionValidation;
import dev.pgcdc.vertx.replication.core.PositionStore;
import dev.pgcdc.vertx.replication.core.RestartPolicy;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Connection, slot and session configuration for a PostgreSQL change stream.
 */
@DataObject
@JsonGen(publicConverter = false)
public class PostgresReplicationOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final OutputFormat DEFAULT_OUTPUT_FORMAT = OutputFormat.PGOUTPUT;
  public static final Duration DEFAULT_STATUS_INTERVAL = ReplicationSession.DEFAULT_STATUS_INTERVAL;
  public static final Duration DEFAULT_RECEIVE_POLL_INTERVAL = Duration.ofMillis(50);

  private String host;
  private int port;
  private String database;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String slotName;
  private String publicationName;
  private boolean createPublication;
  private boolean recreatePublication;
  private OutputFormat outputFormat;
  private boolean temporarySlot;
  private Duration statusInterval;
  private Duration receivePollInterval;
  private Map<String, Object> pluginOptions;
  private RestartPolicy restartPolicy;
  private boolean autoStart;
  private PositionStore positionStore;
  private Map<Integer, TextValueDecoder> textDecoders;

  public PostgresReplicationOptions() {
    init();
  }

  public PostgresReplicationOptions(JsonObject json) {
    init();
    PostgresReplicationOptionsConverter.fromJson(json, this);
  }

  public PostgresReplicationOptions(PostgresReplicationOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.slotName = other.slotName;
    this.publicationName = other.publicationName;
    this.createPublication = other.createPublication;
    this.recreatePublication = other.recreatePublication;
    this.outputFormat = other.outputFormat;
    this.temporarySlot = other.temporarySlot;
    this.statusInterval = other.statusInterval;
    this.receivePollInterval = other.receivePollInterval;
    this.pluginOptions = new LinkedHashMap<>(other.pluginOptions);
    this.restartPolicy = other.restartPolicy.copy();
    this.autoStart = other.autoStart;
    this.positionStore = other.positionStore;
    this.textDecoders = new LinkedHashMap<>(other.textDecoders);
  }

  public String getHost() {
    return host;
  }

  public PostgresReplicationOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public PostgresReplicationOptions setPort(Integer port) {
    this.port = port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public PostgresReplicationOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public PostgresReplicationOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public PostgresReplicationOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  /**
   * Name of an environment variable holding the password, read when no password is set.
   */
  public String getPasswordEnv() {
    return passwordEnv;
  }

  public PostgresReplicationOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public PostgresReplicationOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getSlotName() {
    return slotName;
  }

  public PostgresReplicationOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public String getPublicationName() {
    return publicationName;
  }

  public PostgresReplicationOptions setPublicationName(String publicationName) {
    this.publicationName = publicationName;
    return this;
  }

  /**
   * Whether bootstrap creates the publication ({@code FOR ALL TABLES}) when it does not exist.
   */
  public boolean isCreatePublication() {
    return createPublication;
  }

  public PostgresReplicationOptions setCreatePublication(boolean createPublication) {
    this.createPublication = createPublication;
    return this;
  }

  /**
   * Whether bootstrap drops and recreates the publication. Only applies when
   * {@link #isCreatePublication()} is set.
   */
  public boolean isRecreatePublication() {
    return recreatePublication;
  }

  public PostgresReplicationOptions setRecreatePublication(boolean recreatePublication) {
    this.recreatePublication = recreatePublication;
    return this;
  }

  public OutputFormat getOutputFormat() {
    return outputFormat;
  }

  public PostgresReplicationOptions setOutputFormat(OutputFormat outputFormat) {
    this.outputFormat = outputFormat;
    return this;
  }

  public boolean isTemporarySlot() {
    return temporarySlot;
  }

  public PostgresReplicationOptions setTemporarySlot(boolean temporarySlot) {
    this.temporarySlot = temporarySlot;
    return this;
  }

  @GenIgnore
  public Duration getStatusInterval() {
    return statusInterval;
  }

  @GenIgnore
  public PostgresReplicationOptions setStatusInterval(Duration statusInterval) {
    this.statusInterval = statusInterval;
    return this;
  }

  @GenIgnore
  public Duration getReceivePollInterval() {
    return receivePollInterval;
  }

  @GenIgnore
  public PostgresReplicationOptions setReceivePollInterval(Duration receivePollInterval) {
    this.receivePollInterval = receivePollInterval;
    return this;
  }

  public Map<String, Object> getPluginOptions() {
    return Collections.unmodifiableMap(pluginOptions);
  }

  public PostgresReplicationOptions setPluginOptions(Map<String, Object> options) {
    this.pluginOptions = options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options);
    return this;
  }

  @GenIgnore
  public RestartPolicy getRestartPolicy() {
    return restartPolicy;
  }

  @GenIgnore
  public PostgresReplicationOptions setRestartPolicy(RestartPolicy restartPolicy) {
    this.restartPolicy = Objects.requireNonNull(restartPolicy, "restartPolicy");
    return this;
  }

  public boolean isAutoStart() {
    return autoStart;
  }

  public PostgresReplicationOptions setAutoStart(boolean autoStart) {
    this.autoStart = autoStart;
    return this;
  }

  @GenIgnore
  public PositionStore getPositionStore() {
    return positionStore;
  }

  @GenIgnore
  public PostgresReplicationOptions setPositionStore(PositionStore positionStore) {
    this.positionStore = Objects.requireNonNull(positionStore, "positionStore");
    return this;
  }

  @GenIgnore
  public Map<Integer, TextValueDecoder> getTextDecoders() {
    return Collections.unmodifiableMap(textDecoders);
  }

  /**
   * Decodes text values of {@code typeOid} with {@code decoder}, replacing the built-in decoder
   * if there is one.
   */
  @GenIgnore
  public PostgresReplicationOptions addTextDecoder(int typeOid, TextValueDecoder decoder) {
    textDecoders.put(typeOid, Objects.requireNonNull(decoder, "decoder"));
    return this;
  }

  /**
   * A tuple decoder with the built-in decoders plus the ones added here.
   */
  TupleDecoder newTupleDecoder() {
    TupleDecoder decoder = new TupleDecoder();
    textDecoders.forEach(decoder::register);
    return decoder;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresReplicationOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresReplicationOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    PostgresReplicationOptions merged = new PostgresReplicationOptions(json);
    merged.positionStore = positionStore;
    merged.textDecoders = new LinkedHashMap<>(textDecoders);
    if (!other.containsKey("restartPolicy")) {
      merged.restartPolicy = restartPolicy.copy();
    }
    return merged;
  }

  void validate() {
    OptionValidation.require("host", host);
    OptionValidation.requirePort(port);
    OptionValidation.require("database", database);
    OptionValidation.require("user", user);
    OptionValidation.requireIdentifier("slotName", slotName);
    Objects.requireNonNull(outputFormat, "outputFormat");
    if (outputFormat == OutputFormat.PGOUTPUT) {
      OptionValidation.requireIdentifier("publicationName", publicationName);
    } else if (publicationName != null) {
      OptionValidation.requireIdentifier("publicationName", publicationName);
    }
    OptionValidation.requirePositive("statusInterval", statusInterval);
    OptionValidation.requirePositive("receivePollInterval", receivePollInterval);
    Objects.requireNonNull(pluginOptions, "pluginOptions");
    Objects.requireNonNull(restartPolicy, "restartPolicy").validate();
    Objects.requireNonNull(positionStore, "positionStore");
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    createPublication = true;
    recreatePublication = false;
    outputFormat = DEFAULT_OUTPUT_FORMAT;
    temporarySlot = false;
    statusInterval = DEFAULT_STATUS_INTERVAL;
    receivePollInterval = DEFAULT_RECEIVE_POLL_INTERVAL;
    pluginOptions = new LinkedHashMap<>();
    restartPolicy = RestartPolicy.never();
    autoStart = true;
    positionStore = PositionStore.noop();
    textDecoders = new LinkedHashMap<>();
  }
}
