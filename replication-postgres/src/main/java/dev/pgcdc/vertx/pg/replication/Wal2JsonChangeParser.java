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

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns {@code wal2json} payloads into the same {@link ChangeEvent} model the {@code pgoutput}
 * path produces. Handles format version 1 (one document per transaction with a {@code change}
 * array) and format version 2 (one document per action).
 *
 * <p>wal2json carries no relation ids, so row events report relation id 0.
 */
public final class Wal2JsonChangeParser {

  public List<ChangeEvent> parse(byte[] payload, LogPosition position) {
    String message = new String(payload, StandardCharsets.UTF_8);
    if (message.isBlank()) {
      return Collections.emptyList();
    }

    JsonObject document;
    try {
      document = new JsonObject(message);
    } catch (DecodeException e) {
      throw new ProtocolViolationException("Malformed wal2json payload", position, null, e);
    }

    if (document.containsKey("action")) {
      return parseVersion2(document, position);
    }
    return parseVersion1(document, position);
  }

  private static List<ChangeEvent> parseVersion1(JsonObject document, LogPosition position) {
    Instant commitTime = parseTimestamp(document.getString("timestamp"));
    LogPosition nextPosition = parsePosition(document.getString("nextlsn"), position);
    Long xid = document.getLong("xid");

    List<ChangeEvent> events = new ArrayList<>();
    if (xid != null) {
      events.add(new ChangeEvent.Begin(position, nextPosition, commitTime, xid));
    }

    JsonArray changes = document.getJsonArray("change");
    if (changes != null) {
      for (int i = 0; i < changes.size(); i++) {
        Object raw = changes.getValue(i);
        if (!(raw instanceof JsonObject)) {
          continue;
        }
        JsonObject change = (JsonObject) raw;
        String table = tableName(change.getString("schema"), change.getString("table"));
        if (table == null) {
          continue;
        }
        Row newRow = row(change.getJsonArray("columnnames"), change.getJsonArray("columnvalues"), table, position);
        JsonObject oldKeys = change.getJsonObject("oldkeys");
        Row oldRow = oldKeys == null
          ? null
          : row(oldKeys.getJsonArray("keynames"), oldKeys.getJsonArray("keyvalues"), table, position);

        String kind = change.getString("kind", "").toLowerCase(Locale.ROOT);
        switch (kind) {
          case "insert":
            events.add(new ChangeEvent.Insert(position, table, 0, newRow));
            break;
          case "update":
            events.add(new ChangeEvent.Update(position, table, 0, oldRow, newRow));
            break;
          case "delete":
            events.add(new ChangeEvent.Delete(position, table, 0, oldRow == null ? newRow : oldRow));
            break;
          default:
            break;
        }
      }
    }

    if (xid != null) {
      events.add(new ChangeEvent.Commit(position, position, nextPosition, commitTime));
    }
    return events;
  }

  private static List<ChangeEvent> parseVersion2(JsonObject document, LogPosition position) {
    String action = document.getString("action", "").toUpperCase(Locale.ROOT);
    Instant commitTime = parseTimestamp(document.getString("timestamp"));
    switch (action) {
      case "B":
        return List.of(new ChangeEvent.Begin(position,
          parsePosition(document.getString("nextlsn"), position),
          commitTime,
          document.getLong("xid", 0L)));
      case "C":
        return List.of(new ChangeEvent.Commit(position, position,
          parsePosition(document.getString("nextlsn"), position),
          commitTime));
      default:
        break;
    }

    String table = tableName(document.getString("schema"), document.getString("table"));
    if (table == null) {
      return Collections.emptyList();
    }
    switch (action) {
      case "I":
        return List.of(new ChangeEvent.Insert(position, table, 0, namedColumns(document.getJsonArray("columns"))));
      case "U": {
        JsonArray identity = document.getJsonArray("identity");
        Row before = identity == null ? null : namedColumns(identity);
        return List.of(new ChangeEvent.Update(position, table, 0, before, namedColumns(document.getJsonArray("columns"))));
      }
      case "D":
        return List.of(new ChangeEvent.Delete(position, table, 0, namedColumns(document.getJsonArray("identity"))));
      case "T":
        return List.of(new ChangeEvent.Truncate(position, List.of(table), false, false));
      default:
        return Collections.emptyList();
    }
  }

  private static Row row(JsonArray names, JsonArray values, String table, LogPosition position) {
    Map<String, DecodedValue> columns = new LinkedHashMap<>();
    if (names != null && values != null) {
      if (names.size() != values.size()) {
        throw new ProtocolViolationException("wal2json change for " + table + " has " + names.size()
          + " column names but " + values.size() + " values", position, null);
      }
      for (int i = 0; i < names.size(); i++) {
        columns.put(names.getString(i), decoded(values.getValue(i)));
      }
    }
    return new Row(columns);
  }

  private static Row namedColumns(JsonArray columnArray) {
    Map<String, DecodedValue> columns = new LinkedHashMap<>();
    if (columnArray != null) {
      for (int i = 0; i < columnArray.size(); i++) {
        Object raw = columnArray.getValue(i);
        if (!(raw instanceof JsonObject)) {
          continue;
        }
        JsonObject column = (JsonObject) raw;
        String name = column.getString("name");
        if (name != null) {
          columns.put(name, decoded(column.getValue("value")));
        }
      }
    }
    return new Row(columns);
  }

  private static DecodedValue decoded(Object value) {
    if (value == null) {
      return DecodedValue.nullValue();
    }
    if (value instanceof JsonObject) {
      return DecodedValue.typed(((JsonObject) value).getMap());
    }
    if (value instanceof JsonArray) {
      return DecodedValue.typed(((JsonArray) value).getList());
    }
    if (value instanceof String) {
      String trimmed = ((String) value).trim();
      try {
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
          return DecodedValue.typed(new JsonObject(trimmed).getMap());
        }
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
          return DecodedValue.typed(new JsonArray(trimmed).getList());
        }
      } catch (DecodeException notJson) {
        return DecodedValue.typed(value);
      }
    }
    return DecodedValue.typed(value);
  }

  private static String tableName(String schema, String table) {
    if (table == null || table.isBlank()) {
      return null;
    }
    if (schema == null || schema.isBlank()) {
      return table;
    }
    return schema + "." + table;
  }

  private static LogPosition parsePosition(String text, LogPosition fallback) {
    if (text == null || text.isBlank()) {
      return fallback;
    }
    try {
      return LogPosition.parse(text);
    } catch (IllegalArgumentException e) {
      return fallback;
    }
  }

  private static Instant parseTimestamp(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    try {
      return TupleDecoder.parseTimestampTz(text).toInstant();
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
