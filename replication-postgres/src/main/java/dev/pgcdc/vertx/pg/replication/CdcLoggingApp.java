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

import dev.pgcdc.vertx.replication.core.FilePositionStore;
import dev.pgcdc.vertx.replication.core.ReplicationStreamState;
import io.vertx.core.Vertx;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams changes from the database configured in the environment and logs each one.
 *
 * <p>Set {@code CDC_POSITION_FILE} to keep the confirmed position across restarts. Exits with
 * status 1 when the stream fails.
 */
public final class CdcLoggingApp {

  private static final Logger LOG = LoggerFactory.getLogger(CdcLoggingApp.class);

  private CdcLoggingApp() {
  }

  public static void main(String[] args) throws Exception {
    ReplicationAppConfig config = ReplicationAppConfig.fromEnv();
    PostgresReplicationOptions options = config.toReplicationOptions();
    String positionFile = System.getenv("CDC_POSITION_FILE");
    if (positionFile != null && !positionFile.isBlank()) {
      options.setPositionStore(new FilePositionStore(Paths.get(positionFile)));
    }

    Vertx vertx = Vertx.vertx();
    PostgresLogicalReplicationStream stream = new PostgresLogicalReplicationStream(vertx, options);
    LoggingChangeEventSink sink = new LoggingChangeEventSink();
    CountDownLatch finished = new CountDownLatch(1);

    ReplicationLogging.attachDefaultLogging(stream, LOG, config.slotName());
    stream.onStateChange(change -> {
      if (change.state().isTerminal()) {
        finished.countDown();
      }
    });

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      LOG.info("Shutting down replication for slot {}", config.slotName());
      stream.close();
      vertx.close();
    }, "pg-cdc-shutdown"));

    stream.startAndSubscribe(sink::accept, err -> LOG.error("Replication error", err))
      .started()
      .onSuccess(v -> LOG.info("Streaming changes from {}:{}/{} via slot {}",
        config.pgHost(), config.pgPort(), config.pgDatabase(), config.slotName()));

    finished.await();
    boolean failed = stream.state() == ReplicationStreamState.FAILED;
    vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    if (failed) {
      System.exit(1);
    }
  }
}
