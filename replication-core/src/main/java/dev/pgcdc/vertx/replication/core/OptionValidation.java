package dev.pgcdc.vertx.replication.core;

import java.time.Duration;

public final class OptionValidation {

  private OptionValidation() {
  }

  public static void require(String fieldName, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  public static void requirePort(int port) {
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
  }

  public static void requirePositive(String fieldName, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(fieldName + " must be a positive duration");
    }
  }

  /**
   * Replication slot names are limited to lower case letters, digits and underscores, at most
   * 63 characters.
   */
  public static void requireIdentifier(String fieldName, String value) {
    require(fieldName, value);
    if (value.length() > 63) {
      throw new IllegalArgumentException(fieldName + " must be at most 63 characters");
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      boolean valid = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
      if (!valid) {
        throw new IllegalArgumentException(
          fieldName + " may only contain lower case letters, numbers and underscores: " + value);
      }
    }
  }
}
