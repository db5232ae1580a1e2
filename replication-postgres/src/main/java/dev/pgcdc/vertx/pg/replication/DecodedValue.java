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

import java.util.Arrays;
import java.util.Objects;

/**
 * A decoded column value: SQL {@code NULL}, a value the record does not carry (an unchanged
 * TOASTed column), or a typed Java value.
 */
public final class DecodedValue {

  public enum Kind {
    NULL,
    UNAVAILABLE,
    TYPED
  }

  private static final DecodedValue NULL = new DecodedValue(Kind.NULL, null);
  private static final DecodedValue UNAVAILABLE = new DecodedValue(Kind.UNAVAILABLE, null);

  private final Kind kind;
  private final Object value;

  private DecodedValue(Kind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static DecodedValue nullValue() {
    return NULL;
  }

  public static DecodedValue unavailable() {
    return UNAVAILABLE;
  }

  public static DecodedValue typed(Object value) {
    return new DecodedValue(Kind.TYPED, Objects.requireNonNull(value, "value"));
  }

  public Kind kind() {
    return kind;
  }

  public boolean isNull() {
    return kind == Kind.NULL;
  }

  public boolean isAvailable() {
    return kind != Kind.UNAVAILABLE;
  }

  /**
   * The typed value, or {@code null} for SQL {@code NULL}.
   *
   * @throws IllegalStateException if the value is not available in this record
   */
  public Object value() {
    if (kind == Kind.UNAVAILABLE) {
      throw new IllegalStateException("value not available in this record (unchanged TOAST)");
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DecodedValue)) {
      return false;
    }
    DecodedValue other = (DecodedValue) o;
    if (kind != other.kind) {
      return false;
    }
    if (value instanceof byte[] && other.value instanceof byte[]) {
      return Arrays.equals((byte[]) value, (byte[]) other.value);
    }
    return Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    if (value instanceof byte[]) {
      return 31 * kind.hashCode() + Arrays.hashCode((byte[]) value);
    }
    return Objects.hash(kind, value);
  }

  @Override
  public String toString() {
    switch (kind) {
      case NULL:
        return "NULL";
      case UNAVAILABLE:
        return "<unchanged>";
      default:
        return value instanceof byte[] ? "bytes[" + ((byte[]) value).length + "]" : String.valueOf(value);
    }
  }
}
