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

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * One column of a pgoutput tuple in its wire form.
 *
 * <p>{@link Kind#UNCHANGED_TOAST} marks an out-of-line value the server did not resend because
 * it did not change. It is neither null nor empty; the value is simply not in this record.
 */
public final class ColumnValue {

  public enum Kind {
    NULL('n'),
    UNCHANGED_TOAST('u'),
    TEXT('t'),
    BINARY('b');

    private final char tag;

    Kind(char tag) {
      this.tag = tag;
    }

    public char tag() {
      return tag;
    }
  }

  private static final byte[] NO_BYTES = new byte[0];
  private static final ColumnValue NULL = new ColumnValue(Kind.NULL, NO_BYTES);
  private static final ColumnValue UNCHANGED_TOAST = new ColumnValue(Kind.UNCHANGED_TOAST, NO_BYTES);

  private final Kind kind;
  private final byte[] data;

  private ColumnValue(Kind kind, byte[] data) {
    this.kind = kind;
    this.data = data;
  }

  public static ColumnValue nullValue() {
    return NULL;
  }

  public static ColumnValue unchangedToast() {
    return UNCHANGED_TOAST;
  }

  public static ColumnValue text(byte[] data) {
    return new ColumnValue(Kind.TEXT, Objects.requireNonNull(data, "data"));
  }

  public static ColumnValue text(String value) {
    return text(value.getBytes(StandardCharsets.UTF_8));
  }

  public static ColumnValue binary(byte[] data) {
    return new ColumnValue(Kind.BINARY, Objects.requireNonNull(data, "data"));
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Raw bytes of a text or binary column; empty for the other kinds. Not copied.
   */
  public byte[] data() {
    return data;
  }

  public String asText() {
    if (kind != Kind.TEXT) {
      throw new IllegalStateException("column value is " + kind + ", not TEXT");
    }
    return new String(data, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    switch (kind) {
      case TEXT:
        return "text(" + asText() + ')';
      case BINARY:
        return "binary(" + data.length + " bytes)";
      default:
        return kind.name().toLowerCase(Locale.ROOT);
    }
  }
}
