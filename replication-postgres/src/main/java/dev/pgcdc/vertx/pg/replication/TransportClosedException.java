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

/**
 * The replication connection is gone, either closed locally or dropped by the server.
 */
public class TransportClosedException extends SQLException {

  private static final String CONNECTION_DOES_NOT_EXIST = "08003";

  public TransportClosedException(String reason) {
    super(reason, CONNECTION_DOES_NOT_EXIST);
  }

  public TransportClosedException(String reason, Throwable cause) {
    super(reason, CONNECTION_DOES_NOT_EXIST, cause);
  }
}
