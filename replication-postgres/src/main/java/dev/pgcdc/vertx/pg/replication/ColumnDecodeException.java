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

/**
 * A single column value could not be decoded. The row holding it is dropped; the session goes
 * on.
 */
public class ColumnDecodeException extends RuntimeException {

  private final int typeOid;

  public ColumnDecodeException(int typeOid, String message) {
    this(typeOid, message, null);
  }

  public ColumnDecodeException(int typeOid, String message, Throwable cause) {
    super(message, cause);
    this.typeOid = typeOid;
  }

  public int typeOid() {
    return typeOid;
  }
}
