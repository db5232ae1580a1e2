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

import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One row image in column order. Columns the record does not carry are present as
 * {@link DecodedValue#unavailable()}; binary-format columns are left out.
 */
public final class Row {

  private final Map<String, DecodedValue> columns;

  public Row(Map<String, DecodedValue> columns) {
    this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(columns, "columns")));
  }

  public Map<String, DecodedValue> columns() {
    return columns;
  }

  public Set<String> columnNames() {
    return columns.keySet();
  }

  public boolean contains(String column) {
    return columns.containsKey(column);
  }

  /**
   * The decoded value of {@code column}, or {@code null} when the row has no such column.
   */
  public DecodedValue get(String column) {
    return columns.get(column);
  }

  /**
   * Plain Java value of {@code column}; {@code null} for SQL {@code NULL}, for unavailable values
   * and for missing columns.
   */
  public Object value(String column) {
    DecodedValue decoded = columns.get(column);
    if (decoded == null || !decoded.isAvailable()) {
      return null;
    }
    return decoded.value();
  }

  public String string(String column) {
    Object value = value(column);
    return value == null ? null : String.valueOf(value);
  }

  public Integer integer(String column) {
    Object value = value(column);
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value instanceof String) {
      try {
        return Integer.valueOf((String) value);
      } catch (NumberFormatException ignore) {
        return null;
      }
    }
    return null;
  }

  public Long longValue(String column) {
    Object value = value(column);
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    if (value instanceof String) {
      try {
        return Long.valueOf((String) value);
      } catch (NumberFormatException ignore) {
        return null;
      }
    }
    return null;
  }

  public BigDecimal decimal(String column) {
    Object value = value(column);
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof Number) {
      return new BigDecimal(value.toString());
    }
    if (value instanceof String) {
      try {
        return new BigDecimal((String) value);
      } catch (NumberFormatException ignore) {
        return null;
      }
    }
    return null;
  }

  public Boolean bool(String column) {
    Object value = value(column);
    return value instanceof Boolean ? (Boolean) value : null;
  }

  /**
   * JSON rendering for logging and forwarding. Unavailable columns are omitted, temporal and
   * numeric values are rendered with {@code toString()}.
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    for (Map.Entry<String, DecodedValue> entry : columns.entrySet()) {
      DecodedValue decoded = entry.getValue();
      if (!decoded.isAvailable()) {
        continue;
      }
      json.put(entry.getKey(), jsonValue(decoded.value()));
    }
    return json;
  }

  private static Object jsonValue(Object value) {
    if (value == null
      || value instanceof String
      || value instanceof Boolean
      || value instanceof Integer
      || value instanceof Long
      || value instanceof Short
      || value instanceof Double
      || value instanceof Float
      || value instanceof Map
      || value instanceof List
      || value instanceof byte[]) {
      return value;
    }
    return value.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Row && columns.equals(((Row) o).columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return columns.toString();
  }
}
