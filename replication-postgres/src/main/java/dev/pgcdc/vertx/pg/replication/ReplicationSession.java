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

import dev.pgcdc.vertx.replication.core.PositionStore;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one streaming replication connection: receives frames until a deadline, answers
 * keepalives, decodes change data into {@link ChangeEvent}s for the sink and reports the
 * processed position back to the server.
 *
 * <p>{@link #run()} blocks the calling thread until the session ends. It returns normally when
 * {@link #close()} was called or the server ended the stream with an error response; every other
 * way out is a {@link ReplicationSessionException}. The transport is closed in all cases.
 */
public final class ReplicationSession implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ReplicationSession.class);

  public static final Duration DEFAULT_STATUS_INTERVAL = Duration.ofSeconds(10);

  private final ReplicationTransport transport;
  private final LogPosition startPosition;
  private final Duration statusInterval;
  private final ChangeEventSink sink;
  private final ReplicationMetricsListener metrics;
  private final Clock clock;
  private final OutputFormat outputFormat;
  private final RelationCache relations;
  private final TupleDecoder tupleDecoder;
  private final PositionStore positionStore;
  private final String slotName;
  private final LogicalMessageDecoder messageDecoder = new LogicalMessageDecoder();
  private final Wal2JsonChangeParser wal2JsonParser = new Wal2JsonChangeParser();

  private final AtomicBoolean started = new AtomicBoolean();
  private volatile boolean stopRequested;
  private volatile LogPosition confirmedPosition;
  private volatile String peerError;
  private PositionTracker tracker;
  private LogPosition lastSaved;

  private ReplicationSession(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.startPosition = Objects.requireNonNull(builder.startPosition, "startPosition");
    this.statusInterval = builder.statusInterval;
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    this.metrics = builder.metrics;
    this.clock = builder.clock;
    this.outputFormat = builder.outputFormat;
    this.relations = builder.relations;
    this.tupleDecoder = builder.tupleDecoder;
    this.positionStore = builder.positionStore;
    this.slotName = builder.slotName;
    this.confirmedPosition = startPosition;
    this.lastSaved = startPosition;
  }

  public static Builder builder() {
    return new Builder();
  }

  public SessionOutcome run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("session already ran");
    }
    tracker = new PositionTracker(startPosition, statusInterval, clock.instant());
    LOG.info("Replication session started for slot {} at {} ({})", slotName, startPosition, outputFormat.pluginName());
    try {
      return loop();
    } finally {
      transport.close();
    }
  }

  private SessionOutcome loop() {
    while (true) {
      if (stopRequested) {
        return SessionOutcome.CLOSED;
      }
      Instant now = clock.instant();
      if (tracker.dueForStatusUpdate(now) && !sendStatusUpdate(now)) {
        return SessionOutcome.CLOSED;
      }

      TransportFrame frame;
      try {
        frame = transport.receive(tracker.nextDeadline());
      } catch (SQLException e) {
        if (stopRequested) {
          return SessionOutcome.CLOSED;
        }
        String reason = e instanceof TransportClosedException
          ? "Replication connection closed unexpectedly"
          : "Receiving from the replication connection failed";
        throw new ReplicationSessionException(reason, tracker.confirmedPosition(), null, e);
      }
      if (frame == null) {
        continue;
      }

      switch (frame.kind()) {
        case ERROR_RESPONSE:
          peerError = frame.description();
          LOG.warn("Server ended replication on slot {}: {}", slotName, frame.description());
          return SessionOutcome.PEER_ERROR;
        case COPY_DATA:
          handleCopyData(frame.payload());
          break;
        default:
          LOG.debug("Ignoring unexpected frame {}", frame);
          break;
      }
    }
  }

  private void handleCopyData(byte[] data) {
    if (data.length == 0) {
      LOG.debug("Ignoring empty CopyData");
      return;
    }
    switch (data[0]) {
      case ReplicationProtocol.PRIMARY_KEEPALIVE: {
        ReplicationProtocol.PrimaryKeepalive keepalive = ReplicationProtocol.parseKeepalive(data);
        LOG.trace("Keepalive serverWalEnd={} replyRequested={}", keepalive.serverWalEnd(), keepalive.replyRequested());
        if (keepalive.replyRequested()) {
          tracker.requestImmediateUpdate();
        }
        break;
      }
      case ReplicationProtocol.XLOG_DATA: {
        ReplicationProtocol.XLogData xlog = ReplicationProtocol.parseXLogData(data);
        if (xlog.payload().length > 0) {
          dispatch(xlog.walStart(), xlog.payload());
        }
        LogPosition end = xlog.endPosition();
        if (end.isValid() && tracker.advance(end)) {
          confirmedPosition = end;
        }
        break;
      }
      default:
        LOG.warn("Ignoring CopyData with unknown tag '{}'", (char) (data[0] & 0xff));
        break;
    }
  }

  private void dispatch(LogPosition position, byte[] payload) {
    if (outputFormat == OutputFormat.WAL2JSON) {
      for (ChangeEvent event : wal2JsonParser.parse(payload, position)) {
        emit(event, null);
      }
      return;
    }

    LogicalMessage message;
    try {
      message = messageDecoder.decode(payload);
    } catch (UnknownMessageTypeException e) {
      LOG.warn("Skipping logical message at {}: {}", position, e.getMessage());
      metrics.onDecodeFailure(position, null, e);
      return;
    } catch (ProtocolViolationException e) {
      throw new ProtocolViolationException("Malformed logical message", position, e.relationId(), e);
    }
    route(message, position);
  }

  private void route(LogicalMessage message, LogPosition position) {
    switch (message.type()) {
      case RELATION: {
        RelationSchema schema = ((LogicalMessage.Relation) message).schema();
        relations.put(schema);
        emit(new ChangeEvent.SchemaChange(position, schema), schema.relationId());
        break;
      }
      case BEGIN: {
        LogicalMessage.Begin begin = (LogicalMessage.Begin) message;
        emit(new ChangeEvent.Begin(position, begin.finalPosition(), begin.commitTime(), begin.xid()), null);
        break;
      }
      case COMMIT: {
        LogicalMessage.Commit commit = (LogicalMessage.Commit) message;
        emit(new ChangeEvent.Commit(position, commit.commitPosition(), commit.endPosition(), commit.commitTime()), null);
        break;
      }
      case INSERT: {
        LogicalMessage.Insert insert = (LogicalMessage.Insert) message;
        RelationSchema schema = relation(insert.relationId(), position);
        try {
          Row row = buildRow(schema, insert.newTuple(), position);
          emit(new ChangeEvent.Insert(position, schema.qualifiedName(), schema.relationId(), row), schema.relationId());
        } catch (ColumnDecodeException e) {
          skipRow(schema, position, e);
        }
        break;
      }
      case UPDATE: {
        LogicalMessage.Update update = (LogicalMessage.Update) message;
        RelationSchema schema = relation(update.relationId(), position);
        try {
          Row before = update.oldTuple() == null ? null : buildRow(schema, update.oldTuple(), position);
          Row after = buildRow(schema, update.newTuple(), position);
          emit(new ChangeEvent.Update(position, schema.qualifiedName(), schema.relationId(), before, after),
            schema.relationId());
        } catch (ColumnDecodeException e) {
          skipRow(schema, position, e);
        }
        break;
      }
      case DELETE: {
        LogicalMessage.Delete delete = (LogicalMessage.Delete) message;
        RelationSchema schema = relation(delete.relationId(), position);
        try {
          Row before = buildRow(schema, delete.oldTuple(), position);
          emit(new ChangeEvent.Delete(position, schema.qualifiedName(), schema.relationId(), before), schema.relationId());
        } catch (ColumnDecodeException e) {
          skipRow(schema, position, e);
        }
        break;
      }
      case TRUNCATE: {
        LogicalMessage.Truncate truncate = (LogicalMessage.Truncate) message;
        List<String> tables = new ArrayList<>(truncate.relationIds().size());
        for (Integer relationId : truncate.relationIds()) {
          tables.add(relation(relationId, position).qualifiedName());
        }
        emit(new ChangeEvent.Truncate(position, tables, truncate.isCascade(), truncate.isRestartIdentity()), null);
        break;
      }
      case TYPE: {
        LogicalMessage.TypeDefinition type = (LogicalMessage.TypeDefinition) message;
        LOG.debug("Type {}.{} has oid {}", type.namespace(), type.name(), Integer.toUnsignedString(type.typeOid()));
        break;
      }
      case ORIGIN: {
        LogicalMessage.Origin origin = (LogicalMessage.Origin) message;
        LOG.debug("Transaction originates from {} at {}", origin.name(), origin.commitPosition());
        break;
      }
      default:
        LOG.warn("Unhandled logical message {} at {}", message.type(), position);
        break;
    }
  }

  private RelationSchema relation(int relationId, LogPosition position) {
    if (!relations.contains(relationId)) {
      throw new UnknownRelationException(relationId, position);
    }
    return relations.get(relationId);
  }

  private Row buildRow(RelationSchema schema, TupleData tuple, LogPosition position) {
    List<ColumnDef> columns = schema.columns();
    if (tuple.size() != columns.size()) {
      throw new ProtocolViolationException(
        "Tuple has " + tuple.size() + " columns but " + schema.qualifiedName() + " declares " + columns.size(),
        position, schema.relationId());
    }

    Map<String, DecodedValue> values = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      ColumnDef column = columns.get(i);
      ColumnValue value = tuple.get(i);
      if (value.kind() == ColumnValue.Kind.BINARY) {
        LOG.warn("Omitting binary-format column {} of {} at {}", column.name(), schema.qualifiedName(), position);
        continue;
      }
      try {
        values.put(column.name(), tupleDecoder.decode(value, column.typeOid()));
      } catch (ColumnDecodeException e) {
        throw new ColumnDecodeException(e.typeOid(), "column " + column.name() + ": " + e.getMessage(), e.getCause());
      }
    }
    return new Row(values);
  }

  private void skipRow(RelationSchema schema, LogPosition position, ColumnDecodeException error) {
    LOG.warn("Skipping row of {} (relation {}) at {}: {}",
      schema.qualifiedName(), Integer.toUnsignedString(schema.relationId()), position, error.getMessage());
    metrics.onDecodeFailure(position, schema.relationId(), error);
  }

  private void emit(ChangeEvent event, Integer relationId) {
    try {
      sink.accept(event);
    } catch (Exception e) {
      throw new ReplicationSessionException("Change event sink failed", event.position(), relationId, e);
    }
    metrics.onEvent(event);
  }

  /**
   * @return {@code false} if the send failed because the session is being closed
   */
  private boolean sendStatusUpdate(Instant now) {
    LogPosition position = tracker.confirmedPosition();
    try {
      transport.send(ReplicationProtocol.encodeStatusUpdate(position, now));
    } catch (SQLException e) {
      if (stopRequested) {
        LOG.debug("Status update at {} dropped, session is closing", position);
        return false;
      }
      throw new ReplicationSessionException("Sending standby status update failed", position, null, e);
    }
    tracker.onStatusSent(now);
    LOG.debug("Confirmed {} on slot {}", position, slotName);
    metrics.onStatusSent(position);

    if (position.isValid() && !position.equals(lastSaved)) {
      try {
        positionStore.save(slotName, position.toString());
      } catch (Exception e) {
        throw new ReplicationSessionException("Saving the confirmed position failed", position, null, e);
      }
      lastSaved = position;
    }
    return true;
  }

  /**
   * Highest position processed so far; the start position before anything arrived.
   */
  public LogPosition confirmedPosition() {
    return confirmedPosition;
  }

  /**
   * The server's error message when the session ended with {@link SessionOutcome#PEER_ERROR}.
   */
  public String peerError() {
    return peerError;
  }

  /**
   * Asks the loop to stop and closes the transport to interrupt a pending receive. Safe to call
   * from any thread.
   */
  @Override
  public void close() {
    stopRequested = true;
    transport.close();
  }

  public static final class Builder {
    private ReplicationTransport transport;
    private LogPosition startPosition;
    private Duration statusInterval = DEFAULT_STATUS_INTERVAL;
    private ChangeEventSink sink;
    private ReplicationMetricsListener metrics = ReplicationMetricsListener.noop();
    private Clock clock = Clock.systemUTC();
    private OutputFormat outputFormat = OutputFormat.PGOUTPUT;
    private RelationCache relations = new RelationCache();
    private TupleDecoder tupleDecoder = new TupleDecoder();
    private PositionStore positionStore = PositionStore.noop();
    private String slotName = "";

    private Builder() {
    }

    public Builder transport(ReplicationTransport transport) {
      this.transport = transport;
      return this;
    }

    public Builder startPosition(LogPosition startPosition) {
      this.startPosition = startPosition;
      return this;
    }

    public Builder statusInterval(Duration statusInterval) {
      this.statusInterval = Objects.requireNonNull(statusInterval, "statusInterval");
      return this;
    }

    public Builder sink(ChangeEventSink sink) {
      this.sink = sink;
      return this;
    }

    public Builder metrics(ReplicationMetricsListener metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder outputFormat(OutputFormat outputFormat) {
      this.outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
      return this;
    }

    public Builder relations(RelationCache relations) {
      this.relations = Objects.requireNonNull(relations, "relations");
      return this;
    }

    public Builder tupleDecoder(TupleDecoder tupleDecoder) {
      this.tupleDecoder = Objects.requireNonNull(tupleDecoder, "tupleDecoder");
      return this;
    }

    public Builder positionStore(PositionStore positionStore) {
      this.positionStore = Objects.requireNonNull(positionStore, "positionStore");
      return this;
    }

    public Builder slotName(String slotName) {
      this.slotName = Objects.requireNonNull(slotName, "slotName");
      return this;
    }

    public ReplicationSession build() {
      return new ReplicationSession(this);
    }
  }
}
