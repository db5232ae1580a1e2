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

import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares a replication session: identifies the server, makes sure the publication and slot
 * exist, picks the start position and issues {@code START_REPLICATION}.
 *
 * <p>Slots are looked up before they are created, so bootstrapping twice against the same server
 * reuses the slot. Every failure surfaces as a {@link SessionBootstrapException}.
 */
public final class SessionBootstrap {

  private static final Logger LOG = LoggerFactory.getLogger(SessionBootstrap.class);

  private final ReplicationAdmin admin;
  private final PostgresReplicationOptions options;

  public SessionBootstrap(ReplicationAdmin admin, PostgresReplicationOptions options) {
    this.admin = Objects.requireNonNull(admin, "admin");
    this.options = Objects.requireNonNull(options, "options");
  }

  public StreamStart bootstrap() {
    SystemIdentification identification;
    try {
      identification = admin.identifySystem();
    } catch (SQLException e) {
      throw new SessionBootstrapException("IDENTIFY_SYSTEM failed", e);
    }
    LOG.info("Connected to system {} timeline {} database {} at {}",
      identification.systemId(), identification.timeline(), identification.databaseName(),
      identification.currentPosition());

    ensurePublication();

    String slotName = options.getSlotName();
    OutputFormat format = options.getOutputFormat();
    ReplicationSlot slot;
    boolean created;
    try {
      Optional<ReplicationSlot> existing = admin.findSlot(slotName);
      if (existing.isPresent()) {
        slot = existing.get();
        created = false;
        if (!format.pluginName().equalsIgnoreCase(slot.plugin())) {
          LOG.warn("Slot {} uses plugin {} but {} is configured", slotName, slot.plugin(), format.pluginName());
          throw new SessionBootstrapException("Replication slot " + slotName + " uses plugin '" + slot.plugin()
            + "' but output format " + format.pluginName() + " is configured");
        }
        LOG.info("Reusing replication slot {} (confirmed {})", slotName,
          slot.confirmedFlushPosition().map(LogPosition::toString).orElse("none"));
      } else {
        slot = admin.createSlot(slotName, format, options.isTemporarySlot());
        created = true;
      }
    } catch (SQLException e) {
      throw new SessionBootstrapException("Replication slot setup failed for " + slotName, e);
    }

    LogPosition start = resolveStartPosition(identification, slot, created);
    try {
      ReplicationTransport transport = admin.startReplication(slotName, start,
        format.startArguments(options.getPublicationName(), options.getPluginOptions()));
      LOG.info("Streaming slot {} from {}", slotName, start);
      return new StreamStart(identification, slot, created, start, transport);
    } catch (SQLException e) {
      throw new SessionBootstrapException("START_REPLICATION failed for slot " + slotName + " at " + start, e);
    }
  }

  private void ensurePublication() {
    String publication = options.getPublicationName();
    if (publication == null || !options.isCreatePublication()) {
      return;
    }
    try {
      if (options.isRecreatePublication()) {
        admin.dropPublication(publication);
        admin.createPublication(publication);
      } else if (!admin.publicationExists(publication)) {
        admin.createPublication(publication);
      } else {
        LOG.debug("Publication {} already exists", publication);
      }
    } catch (SQLException e) {
      throw new SessionBootstrapException("Publication setup failed for " + publication, e);
    }
  }

  /**
   * A stored checkpoint wins when it is not behind the slot; the server would not replay from
   * there anyway. A freshly created slot ignores the store since its history starts now.
   */
  LogPosition resolveStartPosition(SystemIdentification identification, ReplicationSlot slot, boolean created) {
    if (created) {
      return identification.currentPosition();
    }

    Optional<LogPosition> slotPosition = slot.confirmedFlushPosition();
    Optional<LogPosition> stored = loadStoredPosition(slot.name());
    if (stored.isPresent() && (slotPosition.isEmpty() || !stored.get().isBefore(slotPosition.get()))) {
      return stored.get();
    }
    if (stored.isPresent()) {
      LOG.info("Stored position {} is behind slot {} at {}, using the slot position",
        stored.get(), slot.name(), slotPosition.get());
    }
    return slotPosition.orElse(identification.currentPosition());
  }

  private Optional<LogPosition> loadStoredPosition(String slotName) {
    Optional<String> raw;
    try {
      raw = options.getPositionStore().load(slotName);
    } catch (Exception e) {
      throw new SessionBootstrapException("Loading the stored position for " + slotName + " failed", e);
    }
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      LogPosition position = LogPosition.parse(raw.get());
      return position.isValid() ? Optional.of(position) : Optional.empty();
    } catch (IllegalArgumentException e) {
      LOG.warn("Ignoring invalid stored position '{}' for slot {}", raw.get(), slotName);
      return Optional.empty();
    }
  }
}
