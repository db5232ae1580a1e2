package dev.pgcdc.vertx.replication.core;

import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists stream checkpoints in a JSON file, one field per stream. Writes go to a sibling
 * temporary file that then replaces the original.
 */
public final class FilePositionStore implements PositionStore {

  private final Path file;
  private final Object monitor = new Object();

  public FilePositionStore(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  public Path file() {
    return file;
  }

  @Override
  public Optional<String> load(String streamName) throws Exception {
    Objects.requireNonNull(streamName, "streamName");
    synchronized (monitor) {
      return Optional.ofNullable(readAll().get(streamName));
    }
  }

  @Override
  public void save(String streamName, String position) throws Exception {
    Objects.requireNonNull(streamName, "streamName");
    Objects.requireNonNull(position, "position");

    synchronized (monitor) {
      Map<String, String> values = readAll();
      if (position.equals(values.get(streamName))) {
        return;
      }
      values.put(streamName, position);
      writeAll(values);
    }
  }

  private Map<String, String> readAll() throws IOException {
    if (Files.notExists(file)) {
      return new LinkedHashMap<>();
    }

    String raw = Files.readString(file, StandardCharsets.UTF_8);
    if (raw.isBlank()) {
      return new LinkedHashMap<>();
    }

    JsonObject json = new JsonObject(raw);
    Map<String, String> values = new LinkedHashMap<>();
    for (String key : json.fieldNames()) {
      Object value = json.getValue(key);
      if (value != null) {
        values.put(key, String.valueOf(value));
      }
    }
    return values;
  }

  private void writeAll(Map<String, String> values) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    JsonObject json = new JsonObject();
    values.forEach(json::put);
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    Files.writeString(tmp, json.encodePrettily(), StandardCharsets.UTF_8);
    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
  }
}
