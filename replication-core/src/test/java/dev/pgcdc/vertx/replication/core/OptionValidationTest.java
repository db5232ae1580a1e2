package dev.pgcdc.vertx.replication.core;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class OptionValidationTest {

  @Test
  void acceptsSlotStyleIdentifiers() {
    assertDoesNotThrow(() -> OptionValidation.requireIdentifier("slotName", "orders_cdc_1"));
  }

  @Test
  void rejectsUpperCaseAndPunctuationInIdentifiers() {
    assertThrows(IllegalArgumentException.class, () -> OptionValidation.requireIdentifier("slotName", "Orders"));
    assertThrows(IllegalArgumentException.class, () -> OptionValidation.requireIdentifier("slotName", "a-b"));
    assertThrows(IllegalArgumentException.class, () -> OptionValidation.requireIdentifier("slotName", ""));
    assertThrows(IllegalArgumentException.class,
      () -> OptionValidation.requireIdentifier("slotName", "x".repeat(64)));
  }

  @Test
  void requiresPositiveDurations() {
    assertDoesNotThrow(() -> OptionValidation.requirePositive("statusInterval", Duration.ofSeconds(10)));
    assertThrows(IllegalArgumentException.class,
      () -> OptionValidation.requirePositive("statusInterval", Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
      () -> OptionValidation.requirePositive("statusInterval", null));
  }

  @Test
  void validatesPortRange() {
    assertThrows(IllegalArgumentException.class, () -> OptionValidation.requirePort(0));
    assertThrows(IllegalArgumentException.class, () -> OptionValidation.requirePort(70000));
    assertDoesNotThrow(() -> OptionValidation.requirePort(5432));
  }
}
