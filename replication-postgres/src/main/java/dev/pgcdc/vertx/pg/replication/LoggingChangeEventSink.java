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

import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Writes every change event as one structured log line.
 */
public final class LoggingChangeEventSink implements ChangeEventSink {

  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger("dev.pgcdc.vertx.pg.replication.changes");

  private final Logger logger;

  public LoggingChangeEventSink() {
    this(DEFAULT_LOGGER);
  }

  public LoggingChangeEventSink(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void accept(ChangeEvent event) {
    LoggingEventBuilder line = logger.atInfo()
      .addKeyValue("kind", event.kind())
      .addKeyValue("position", event.position());

    switch (event.kind()) {
      case BEGIN: {
        ChangeEvent.Begin begin = (ChangeEvent.Begin) event;
        line.addKeyValue("xid", begin.xid())
          .addKeyValue("commitTime", begin.commitTime())
          .log("begin");
        break;
      }
      case COMMIT: {
        ChangeEvent.Commit commit = (ChangeEvent.Commit) event;
        line.addKeyValue("commitPosition", commit.commitPosition())
          .addKeyValue("commitTime", commit.commitTime())
          .log("commit");
        break;
      }
      case INSERT: {
        ChangeEvent.Insert insert = (ChangeEvent.Insert) event;
        line.addKeyValue("table", insert.table())
          .addKeyValue("row", insert.row().toJson().encode())
          .log("insert");
        break;
      }
      case UPDATE: {
        ChangeEvent.Update update = (ChangeEvent.Update) event;
        line.addKeyValue("table", update.table())
          .addKeyValue("before", update.before().map(row -> row.toJson().encode()).orElse(null))
          .addKeyValue("after", update.after().toJson().encode())
          .log("update");
        break;
      }
      case DELETE: {
        ChangeEvent.Delete delete = (ChangeEvent.Delete) event;
        line.addKeyValue("table", delete.table())
          .addKeyValue("before", delete.before().toJson().encode())
          .log("delete");
        break;
      }
      case TRUNCATE: {
        ChangeEvent.Truncate truncate = (ChangeEvent.Truncate) event;
        line.addKeyValue("tables", String.join(",", truncate.tables()))
          .addKeyValue("cascade", truncate.isCascade())
          .addKeyValue("restartIdentity", truncate.isRestartIdentity())
          .log("truncate");
        break;
      }
      case SCHEMA_CHANGE: {
        RelationSchema relation = ((ChangeEvent.SchemaChange) event).relation();
        line.addKeyValue("table", relation.qualifiedName())
          .addKeyValue("relationId", Integer.toUnsignedString(relation.relationId()))
          .addKeyValue("columns", relation.columns().stream().map(ColumnDef::name).collect(Collectors.joining(",")))
          .log("relation");
        break;
      }
      default:
        line.log("change");
    }
  }
}
