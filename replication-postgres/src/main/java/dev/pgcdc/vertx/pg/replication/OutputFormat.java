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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Logical decoding output plugins a slot can be bound to.
 */
public enum OutputFormat {
  PGOUTPUT("pgoutput"),
  WAL2JSON("wal2json");

  private final String pluginName;

  OutputFormat(String pluginName) {
    this.pluginName = pluginName;
  }

  public String pluginName() {
    return pluginName;
  }

  public static OutputFormat fromPluginName(String pluginName) {
    if (pluginName != null) {
      for (OutputFormat format : values()) {
        if (format.pluginName.equalsIgnoreCase(pluginName.trim())) {
          return format;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported output plugin: " + pluginName);
  }

  /**
   * Renders the option list of {@code START_REPLICATION}. {@code extraOptions} are appended after
   * the plugin defaults and override them on equal keys.
   */
  public List<String> startArguments(String publicationName, Map<String, Object> extraOptions) {
    Map<String, Object> merged = new LinkedHashMap<>();
    switch (this) {
      case PGOUTPUT:
        merged.put("proto_version", "1");
        if (publicationName != null) {
          merged.put("publication_names", publicationName);
        }
        break;
      case WAL2JSON:
        merged.put("pretty-print", "true");
        break;
      default:
        throw new IllegalStateException("Unhandled output format " + this);
    }
    if (extraOptions != null) {
      merged.putAll(extraOptions);
    }

    List<String> arguments = new ArrayList<>(merged.size());
    for (Map.Entry<String, Object> entry : merged.entrySet()) {
      arguments.add(quoteKey(entry.getKey()) + " '" + String.valueOf(entry.getValue()).replace("'", "''") + "'");
    }
    return arguments;
  }

  private static String quoteKey(String key) {
    for (int i = 0; i < key.length(); i++) {
      char c = key.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '_') || Character.isUpperCase(c)) {
        return '"' + key.replace("\"", "\"\"") + '"';
      }
    }
    return key.toLowerCase(Locale.ROOT);
  }
}
