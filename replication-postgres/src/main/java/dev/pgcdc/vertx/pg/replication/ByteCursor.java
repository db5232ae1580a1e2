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

/**
 * Bounds-checked big-endian reader over a message payload. Reading past the end raises
 * {@link ProtocolViolationException}.
 */
final class ByteCursor {

  private final byte[] bytes;
  private int index;

  ByteCursor(byte[] bytes) {
    this(bytes, 0);
  }

  ByteCursor(byte[] bytes, int offset) {
    this.bytes = bytes;
    this.index = offset;
  }

  boolean hasRemaining() {
    return index < bytes.length;
  }

  int remaining() {
    return bytes.length - index;
  }

  byte readByte() {
    require(1, "byte");
    return bytes[index++];
  }

  char readChar() {
    return (char) (readByte() & 0xff);
  }

  int readUnsignedShort() {
    require(2, "int16");
    int value = ((bytes[index] & 0xff) << 8) | (bytes[index + 1] & 0xff);
    index += 2;
    return value;
  }

  int readInt() {
    require(4, "int32");
    int value = ((bytes[index] & 0xff) << 24)
      | ((bytes[index + 1] & 0xff) << 16)
      | ((bytes[index + 2] & 0xff) << 8)
      | (bytes[index + 3] & 0xff);
    index += 4;
    return value;
  }

  long readLong() {
    require(8, "int64");
    long value = ((long) (bytes[index] & 0xff) << 56)
      | ((long) (bytes[index + 1] & 0xff) << 48)
      | ((long) (bytes[index + 2] & 0xff) << 40)
      | ((long) (bytes[index + 3] & 0xff) << 32)
      | ((long) (bytes[index + 4] & 0xff) << 24)
      | ((long) (bytes[index + 5] & 0xff) << 16)
      | ((long) (bytes[index + 6] & 0xff) << 8)
      | (bytes[index + 7] & 0xff);
    index += 8;
    return value;
  }

  String readCString() {
    int start = index;
    while (index < bytes.length && bytes[index] != 0) {
      index++;
    }
    if (index >= bytes.length) {
      throw new ProtocolViolationException("Unterminated string at offset " + start);
    }
    String out = new String(bytes, start, index - start, StandardCharsets.UTF_8);
    index++;
    return out;
  }

  byte[] readBytes(int len) {
    if (len < 0) {
      throw new ProtocolViolationException("Negative length " + len + " at offset " + index);
    }
    require(len, "bytes");
    byte[] out = new byte[len];
    System.arraycopy(bytes, index, out, 0, len);
    index += len;
    return out;
  }

  void expectEnd(String what) {
    if (hasRemaining()) {
      throw new ProtocolViolationException(what + " has " + remaining() + " trailing bytes");
    }
  }

  private void require(int count, String what) {
    if (bytes.length - index < count) {
      throw new ProtocolViolationException(
        "Truncated message: need " + count + " byte(s) for " + what + " at offset " + index
          + ", " + (bytes.length - index) + " left");
    }
  }
}
