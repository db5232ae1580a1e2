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

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Request/response commands issued on a replication connection before streaming starts.
 */
public interface ReplicationAdmin extends AutoCloseable {

  SystemIdentification identifySystem() throws SQLException;

  Optional<ReplicationSlot> findSlot(String slotName) throws SQLException;

  ReplicationSlot createSlot(String slotName, OutputFormat outputFormat, boolean temporary) throws SQLException;

  boolean publicationExists(String publicationName) throws SQLException;

  /**
   * Creates a publication {@code FOR ALL TABLES}.
   */
  void createPublication(String publicationName) throws SQLException;

  /**
   * Drops the publication if it exists.
   */
  void dropPublication(String publicationName) throws SQLException;

  /**
   * Issues {@code START_REPLICATION} and hands the connection over to the returned transport.
   * No other command may be issued afterwards.
   */
  ReplicationTransport startReplication(String slotName, LogPosition start, List<String> pluginArguments)
    throws SQLException;

  @Override
  void close();
}
