package dev.pgcdc.vertx.replication.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FilePositionStoreTest {

  @TempDir
  Path dir;

  @Test
  void persistsAndLoadsCheckpoint() throws Exception {
    Path file = dir.resolve("positions.json");

    FilePositionStore writer = new FilePositionStore(file);
    writer.save("slot_a", "0/16B4F50");

    FilePositionStore reader = new FilePositionStore(file);
    assertEquals("0/16B4F50", reader.load("slot_a").orElse(null));
  }

  @Test
  void returnsEmptyWhenMissing() throws Exception {
    FilePositionStore store = new FilePositionStore(dir.resolve("missing.json"));
    assertFalse(store.load("missing").isPresent());

    store.save("slot_a", "0/1");
    assertTrue(store.load("slot_a").isPresent());
  }

  @Test
  void keepsOtherStreamsWhenSaving() throws Exception {
    Path file = dir.resolve("nested/positions.json");
    FilePositionStore store = new FilePositionStore(file);
    store.save("slot_a", "0/10");
    store.save("slot_b", "0/20");
    store.save("slot_a", "0/30");

    assertEquals("0/30", store.load("slot_a").orElse(null));
    assertEquals("0/20", store.load("slot_b").orElse(null));
    assertFalse(Files.exists(file.resolveSibling("positions.json.tmp")));
  }

  @Test
  void noopStoreKeepsNothing() throws Exception {
    PositionStore store = PositionStore.noop();
    store.save("slot_a", "0/10");
    assertFalse(store.load("slot_a").isPresent());
  }

  @Test
  void inMemoryStoreReturnsLastSaved() {
    InMemoryPositionStore store = new InMemoryPositionStore();
    store.save("slot_a", "0/10");
    store.save("slot_a", "0/20");
    assertEquals("0/20", store.load("slot_a").orElse(null));
  }
}
