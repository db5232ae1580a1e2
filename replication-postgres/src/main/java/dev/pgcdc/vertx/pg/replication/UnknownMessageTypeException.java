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
 * A logical message carried a tag this decoder does not understand. Only that message is
 * skipped.
 */
public class UnknownMessageTypeException extends RuntimeException {

  private final char tag;

  public UnknownMessageTypeException(char tag) {
    super("Unsupported logical message type '" + tag + "' (0x" + Integer.toHexString(tag & 0xff) + ")");
    this.tag = tag;
  }

  public char tag() {
    return tag;
  }
}
