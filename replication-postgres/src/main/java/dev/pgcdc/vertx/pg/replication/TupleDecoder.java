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

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns wire-form column values into {@link DecodedValue}s using the column's type OID.
 *
 * <p>Text values of registered types go through their {@link TextValueDecoder}; unregistered
 * types pass through as the raw string. Binary values are not supported.
 */
public final class TupleDecoder {

  public static final int OID_BOOL = 16;
  public static final int OID_BYTEA = 17;
  public static final int OID_NAME = 19;
  public static final int OID_INT8 = 20;
  public static final int OID_INT2 = 21;
  public static final int OID_INT4 = 23;
  public static final int OID_TEXT = 25;
  public static final int OID_OID = 26;
  public static final int OID_JSON = 114;
  public static final int OID_FLOAT4 = 700;
  public static final int OID_FLOAT8 = 701;
  public static final int OID_BPCHAR = 1042;
  public static final int OID_VARCHAR = 1043;
  public static final int OID_DATE = 1082;
  public static final int OID_TIME = 1083;
  public static final int OID_TIMESTAMP = 1114;
  public static final int OID_TIMESTAMPTZ = 1184;
  public static final int OID_NUMERIC = 1700;
  public static final int OID_UUID = 2950;
  public static final int OID_JSONB = 3802;

  private final Map<Integer, TextValueDecoder> decoders = new HashMap<>();

  public TupleDecoder() {
    TextValueDecoder identity = text -> text;
    register(OID_BOOL, TupleDecoder::parseBool);
    register(OID_BYTEA, TupleDecoder::parseByteaHex);
    register(OID_NAME, identity);
    register(OID_TEXT, identity);
    register(OID_BPCHAR, identity);
    register(OID_VARCHAR, identity);
    register(OID_INT2, Short::valueOf);
    register(OID_INT4, Integer::valueOf);
    register(OID_INT8, Long::valueOf);
    register(OID_OID, Long::valueOf);
    register(OID_FLOAT4, Float::valueOf);
    register(OID_FLOAT8, Double::valueOf);
    register(OID_NUMERIC, TupleDecoder::parseNumeric);
    register(OID_JSON, TupleDecoder::parseJson);
    register(OID_JSONB, TupleDecoder::parseJson);
    register(OID_UUID, UUID::fromString);
    register(OID_DATE, TupleDecoder::parseDate);
    register(OID_TIME, TupleDecoder::parseTime);
    register(OID_TIMESTAMP, TupleDecoder::parseTimestamp);
    register(OID_TIMESTAMPTZ, TupleDecoder::parseTimestampTz);
  }

  /**
   * Registers (or replaces) the decoder for {@code typeOid}.
   */
  public TupleDecoder register(int typeOid, TextValueDecoder decoder) {
    decoders.put(typeOid, Objects.requireNonNull(decoder, "decoder"));
    return this;
  }

  public boolean isRegistered(int typeOid) {
    return decoders.containsKey(typeOid);
  }

  /**
   * @throws ColumnDecodeException if a text value is malformed for its type, or the value is in
   *     binary format
   */
  public DecodedValue decode(ColumnValue value, int typeOid) {
    switch (value.kind()) {
      case NULL:
        return DecodedValue.nullValue();
      case UNCHANGED_TOAST:
        return DecodedValue.unavailable();
      case BINARY:
        throw new ColumnDecodeException(typeOid,
          "Binary column values are not supported (type oid " + Integer.toUnsignedString(typeOid) + ")");
      case TEXT:
        return decodeText(value.asText(), typeOid);
      default:
        throw new IllegalStateException("Unhandled column kind " + value.kind());
    }
  }

  private DecodedValue decodeText(String text, int typeOid) {
    TextValueDecoder decoder = decoders.get(typeOid);
    if (decoder == null) {
      return DecodedValue.typed(text);
    }
    Object decoded;
    try {
      decoded = decoder.decode(text);
    } catch (RuntimeException e) {
      throw new ColumnDecodeException(typeOid,
        "Cannot decode '" + abbreviate(text) + "' as type oid " + Integer.toUnsignedString(typeOid), e);
    }
    if (decoded == null) {
      throw new ColumnDecodeException(typeOid,
        "Decoder for type oid " + Integer.toUnsignedString(typeOid) + " returned null");
    }
    return DecodedValue.typed(decoded);
  }

  private static Boolean parseBool(String text) {
    switch (text) {
      case "t":
      case "true":
        return Boolean.TRUE;
      case "f":
      case "false":
        return Boolean.FALSE;
      default:
        throw new IllegalArgumentException("not a boolean: " + text);
    }
  }

  private static Object parseNumeric(String text) {
    switch (text) {
      case "NaN":
        return Double.NaN;
      case "Infinity":
        return Double.POSITIVE_INFINITY;
      case "-Infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        return new BigDecimal(text);
    }
  }

  /**
   * JSON objects and arrays become {@code Map}/{@code List}; scalars become their Java value. A
   * JSON {@code null} document keeps its text, so it stays distinguishable from SQL {@code NULL}.
   */
  private static Object parseJson(String text) {
    String trimmed = text.trim();
    if (trimmed.startsWith("{")) {
      return new JsonObject(trimmed).getMap();
    }
    if (trimmed.startsWith("[")) {
      return new JsonArray(trimmed).getList();
    }
    Object scalar;
    try {
      scalar = Json.decodeValue(trimmed);
    } catch (DecodeException e) {
      throw new IllegalArgumentException("not JSON: " + abbreviate(text), e);
    }
    return scalar == null ? text : scalar;
  }

  private static byte[] parseByteaHex(String text) {
    if (!text.startsWith("\\x")) {
      throw new IllegalArgumentException("bytea is not in hex output format");
    }
    int digits = text.length() - 2;
    if (digits % 2 != 0) {
      throw new IllegalArgumentException("odd number of hex digits in bytea");
    }
    byte[] out = new byte[digits / 2];
    for (int i = 0; i < out.length; i++) {
      int hi = Character.digit(text.charAt(2 + 2 * i), 16);
      int lo = Character.digit(text.charAt(3 + 2 * i), 16);
      if (hi < 0 || lo < 0) {
        throw new IllegalArgumentException("invalid hex digit in bytea");
      }
      out[i] = (byte) ((hi << 4) | lo);
    }
    return out;
  }

  /**
   * {@code infinity} and {@code -infinity} map to {@link LocalDate#MAX} and {@link LocalDate#MIN}.
   */
  static LocalDate parseDate(String text) {
    switch (text) {
      case "infinity":
        return LocalDate.MAX;
      case "-infinity":
        return LocalDate.MIN;
      default:
        break;
    }
    boolean bc = isBeforeChrist(text);
    LocalDate date = LocalDate.parse(isoYear(withoutEra(text, bc)));
    return bc ? date.withYear(1 - date.getYear()) : date;
  }

  /**
   * The end-of-day value {@code 24:00:00} becomes {@link LocalTime#MAX}.
   */
  static LocalTime parseTime(String text) {
    if (text.startsWith("24:00:00")) {
      return LocalTime.MAX;
    }
    return LocalTime.parse(text);
  }

  static LocalDateTime parseTimestamp(String text) {
    switch (text) {
      case "infinity":
        return LocalDateTime.MAX;
      case "-infinity":
        return LocalDateTime.MIN;
      default:
        break;
    }
    boolean bc = isBeforeChrist(text);
    LocalDateTime timestamp = LocalDateTime.parse(isoYear(withoutEra(text, bc).replace(' ', 'T')));
    return bc ? timestamp.withYear(1 - timestamp.getYear()) : timestamp;
  }

  /**
   * PostgreSQL prints {@code 2024-01-02 03:04:05.123+00}; the offset may lack minutes.
   */
  static OffsetDateTime parseTimestampTz(String text) {
    switch (text) {
      case "infinity":
        return OffsetDateTime.MAX;
      case "-infinity":
        return OffsetDateTime.MIN;
      default:
        break;
    }
    boolean bc = isBeforeChrist(text);
    String iso = isoYear(withoutEra(text, bc).replace(' ', 'T'));
    int sign = Math.max(iso.lastIndexOf('+'), iso.lastIndexOf('-'));
    if (sign > iso.indexOf('T') && iso.length() - sign == 3) {
      iso = iso + ":00";
    }
    OffsetDateTime timestamp = OffsetDateTime.parse(iso);
    return bc ? timestamp.withYear(1 - timestamp.getYear()) : timestamp;
  }

  private static boolean isBeforeChrist(String text) {
    return text.endsWith(" BC");
  }

  private static String withoutEra(String text, boolean bc) {
    return bc ? text.substring(0, text.length() - 3) : text;
  }

  // ISO parsing wants a sign on years past 9999.
  private static String isoYear(String text) {
    return text.indexOf('-') > 4 ? "+" + text : text;
  }

  private static String abbreviate(String text) {
    return text.length() <= 64 ? text : text.substring(0, 61) + "...";
  }
}
