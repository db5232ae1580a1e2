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

import dev.pgcdc.vertx.replication.core.RestartPolicy;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

final class PostgresReplicationOptionsConverter {

  private PostgresReplicationOptionsConverter() {
  }

  static void fromJson(JsonObject json, PostgresReplicationOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("host")) {
      options.setHost(json.getString("host"));
    }
    if (json.containsKey("port")) {
      options.setPort(json.getInteger("port"));
    }
    if (json.containsKey("database")) {
      options.setDatabase(json.getString("database"));
    }
    if (json.containsKey("user")) {
      options.setUser(json.getString("user"));
    }
    if (json.containsKey("password")) {
      options.setPassword(json.getString("password"));
    }
    if (json.containsKey("passwordEnv")) {
      options.setPasswordEnv(json.getString("passwordEnv"));
    }
    if (json.containsKey("ssl")) {
      options.setSsl(json.getBoolean("ssl"));
    }
    if (json.containsKey("slotName")) {
      options.setSlotName(json.getString("slotName"));
    }
    if (json.containsKey("publicationName")) {
      options.setPublicationName(json.getString("publicationName"));
    }
    if (json.containsKey("createPublication")) {
      options.setCreatePublication(json.getBoolean("createPublication"));
    }
    if (json.containsKey("recreatePublication")) {
      options.setRecreatePublication(json.getBoolean("recreatePublication"));
    }
    if (json.containsKey("outputFormat")) {
      options.setOutputFormat(OutputFormat.fromPluginName(json.getString("outputFormat")));
    }
    if (json.containsKey("temporarySlot")) {
      options.setTemporarySlot(json.getBoolean("temporarySlot"));
    }
    if (json.containsKey("statusIntervalMs")) {
      options.setStatusInterval(Duration.ofMillis(json.getLong("statusIntervalMs")));
    }
    if (json.containsKey("receivePollIntervalMs")) {
      options.setReceivePollInterval(Duration.ofMillis(json.getLong("receivePollIntervalMs")));
    }

    JsonObject pluginOptionsJson = json.getJsonObject("pluginOptions");
    if (pluginOptionsJson != null) {
      options.setPluginOptions(pluginOptionsJson.getMap());
    }

    if (json.containsKey("autoStart")) {
      options.setAutoStart(json.getBoolean("autoStart"));
    }

    JsonObject restartJson = json.getJsonObject("restartPolicy");
    if (restartJson != null) {
      RestartPolicy parsed = RestartPolicy.withBackoff();
      parsed.setInitialBackoff(Duration.ofMillis(restartJson.getLong("initialBackoffMs", 1000L)));
      parsed.setMaxBackoff(Duration.ofMillis(restartJson.getLong("maxBackoffMs", 30000L)));
      parsed.setBackoffMultiplier(restartJson.getDouble("multiplier", 2.0d));
      parsed.setJitter(restartJson.getDouble("jitter", 0.2d));
      parsed.setMaxRestarts(restartJson.getLong("maxRestarts", 0L));
      options.setRestartPolicy(parsed);
    }
  }

  static void toJson(PostgresReplicationOptions options, JsonObject json) {
    json.put("host", options.getHost());
    json.put("port", options.getPort());
    json.put("database", options.getDatabase());
    json.put("user", options.getUser());
    json.put("password", options.getPassword());
    json.put("passwordEnv", options.getPasswordEnv());
    json.put("ssl", options.getSsl());
    json.put("slotName", options.getSlotName());
    json.put("publicationName", options.getPublicationName());
    json.put("createPublication", options.isCreatePublication());
    json.put("recreatePublication", options.isRecreatePublication());
    if (options.getOutputFormat() != null) {
      json.put("outputFormat", options.getOutputFormat().pluginName());
    }
    json.put("temporarySlot", options.isTemporarySlot());
    if (options.getStatusInterval() != null) {
      json.put("statusIntervalMs", options.getStatusInterval().toMillis());
    }
    if (options.getReceivePollInterval() != null) {
      json.put("receivePollIntervalMs", options.getReceivePollInterval().toMillis());
    }

    Map<String, Object> pluginOptions = options.getPluginOptions();
    json.put("pluginOptions", pluginOptions == null ? new JsonObject() : new JsonObject(new LinkedHashMap<>(pluginOptions)));

    json.put("autoStart", options.isAutoStart());

    RestartPolicy restartPolicy = options.getRestartPolicy();
    if (restartPolicy != null && restartPolicy.isEnabled()) {
      JsonObject restart = new JsonObject();
      restart.put("initialBackoffMs", restartPolicy.getInitialBackoff().toMillis());
      restart.put("maxBackoffMs", restartPolicy.getMaxBackoff().toMillis());
      restart.put("multiplier", restartPolicy.getBackoffMultiplier());
      restart.put("jitter", restartPolicy.getJitter());
      restart.put("maxRestarts", restartPolicy.getMaxRestarts());
      json.put("restartPolicy", restart);
    }
  }
}
