package io.github.goodees.aggregates.store.jdbc;

/*-
 * #%L
 * aggregates
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.aggregates.Event;
import io.github.goodees.aggregates.store.EventStore;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.MetadataUpdate;
import io.github.goodees.aggregates.store.StreamReads;
import io.github.goodees.aggregates.stream.RecordedEvent;
import io.github.goodees.aggregates.stream.StreamMetadata;
import io.github.goodees.aggregates.stream.WritableEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Event store persisting streams through JDBC. Optimistic concurrency is enforced by conditional update of the stream
 * version within the same transaction that inserts the events.
 */
public class JdbcEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);
    private static final TypeReference<Map<String, String>> HEADERS = new TypeReference<Map<String, String>>() {
    };

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<Event> serialization;
    private final TxHandler txHandler;
    private final ObjectMapper mapper = ObjectMappers.create();
    private Clock clock = Clock.systemUTC();

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<Event> serialization) {
        this(dataSource, schema, serialization, TxHandler.LOCAL);
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<Event> serialization,
            TxHandler handler) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
        this.txHandler = handler;
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    protected Event checkCast(Event event) throws EventStoreException {
        Event cast = serialization.toSerializable(event);
        if (cast == null) {
            throw EventStoreException.unsupported(event);
        } else {
            return cast;
        }
    }

    @Override
    public List<RecordedEvent> getEvents(String stream, Long start, Integer count) throws EventStoreException {
        return readEvents(stream, start, count, false);
    }

    @Override
    public List<RecordedEvent> getEventsBackwards(String stream, Long start, Integer count)
            throws EventStoreException {
        return readEvents(stream, start, count, true);
    }

    private List<RecordedEvent> readEvents(String stream, Long start, Integer count, boolean backwards)
            throws EventStoreException {
        if (count != null && count <= 0) {
            return Collections.emptyList();
        }
        try (Connection connection = dataSource.getConnection()) {
            StreamMetadata metadata = StreamReads.metadata(stream, readMetadata(connection, stream));
            Instant createdSince = metadata.getMaxAge().map(clock.instant()::minus).orElse(null);
            long lowest = metadata.getTruncateBefore().orElse(1L);
            if (metadata.getMaxCount().isPresent()) {
                lowest = lowestRetained(connection, stream, lowest, createdSince, metadata.getMaxCount().getAsLong());
            }
            long from = backwards || start == null ? lowest : Math.max(lowest, start);
            long to = backwards && start != null ? start : Long.MAX_VALUE;
            List<RecordedEvent> events = new ArrayList<>();
            try (PreparedStatement select = schema.selectEvents(connection, stream, from, to, createdSince, backwards,
                    count);
                    ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    events.add(readEvent(stream, rs));
                }
            }
            return events;
        } catch (SQLException | RuntimeException e) {
            logger.error("Failed to read stream {}", stream, e);
            throw EventStoreException.readFailed(stream, e);
        }
    }

    /**
     * Lowest version within the last {@code maxCount} events that pass the other retention rules.
     */
    private long lowestRetained(Connection connection, String stream, long fromVersion, Instant createdSince,
            long maxCount) throws SQLException {
        if (maxCount <= 0) {
            return Long.MAX_VALUE;
        }
        long lowest = fromVersion;
        try (PreparedStatement select = schema.selectEventVersions(connection, stream, fromVersion, createdSince,
                (int) Math.min(maxCount, Integer.MAX_VALUE));
                ResultSet rs = select.executeQuery()) {
            while (rs.next()) {
                lowest = schema.readEventVersion(rs);
            }
        }
        return lowest;
    }

    private RecordedEvent readEvent(String stream, ResultSet rs) throws SQLException {
        String type = schema.readEventType(rs);
        Event event = serialization.deserialize(schema.readEventPayloadVersion(rs), schema.readEventPayload(rs), type);
        WritableEvent data = new WritableEvent(schema.readEventId(rs), type, schema.readEventCreated(rs),
                readHeaders(schema.readEventHeaders(rs)), event);
        return new RecordedEvent(stream, schema.readEventVersion(rs), data);
    }

    private Map<String, String> readHeaders(String json) {
        if (json == null || json.isEmpty()) {
            return Collections.emptyMap();
        }
        try {
            return mapper.readValue(json, HEADERS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable event headers", e);
        }
    }

    private String writeHeaders(Map<String, String> headers) throws EventStoreException {
        try {
            return mapper.writeValueAsString(headers);
        } catch (JsonProcessingException e) {
            throw EventStoreException.unsupported(headers);
        }
    }

    @Override
    public long writeEvents(String stream, List<WritableEvent> events, Map<String, String> commitHeaders,
            Long expectedVersion) throws EventStoreException {
        List<String> payloads = new ArrayList<>(events.size());
        List<String> headers = new ArrayList<>(events.size());
        for (WritableEvent event : events) {
            payloads.add(serialization.serialize(checkCast(event.getEvent())));
            headers.add(writeHeaders(StreamReads.mergeHeaders(commitHeaders, event.getHeaders())));
        }
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try {
                long newVersion = persist(connection, stream, events, headers, payloads, expectedVersion);
                txHandler.commit(connection);
                return newVersion;
            } catch (SQLException | RuntimeException | EventStoreException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException ex) {
            if (isConstraintViolation(ex)) {
                throw EventStoreException.optimisticLock(stream, expectedVersion == null ? -1 : expectedVersion);
            }
            throw EventStoreException.storeFailed(stream, ex);
        }
    }

    private long persist(Connection connection, String stream, List<WritableEvent> events, List<String> headers,
            List<String> payloads, Long expectedVersion) throws SQLException, EventStoreException {
        if (Boolean.parseBoolean(readMetadata(connection, stream, StreamMetadata.FROZEN))) {
            throw EventStoreException.frozen(stream);
        }
        Long currentVersion = readVersion(connection, stream);
        long version = currentVersion == null ? 0 : currentVersion;
        if (expectedVersion != null && expectedVersion != version) {
            throw EventStoreException.optimisticLock(stream, expectedVersion, version);
        }
        if (events.isEmpty()) {
            return version;
        }
        long newVersion = version + events.size();
        try (PreparedStatement insert = schema.insertEvent(connection)) {
            for (int i = 0; i < events.size(); i++) {
                schema.prepareInsert(insert, stream, version + i + 1, events.get(i), headers.get(i),
                    serialization.payloadVersion(events.get(i).getEvent()), payloads.get(i));
                insert.addBatch();
            }
            insert.executeBatch();
        }
        if (currentVersion == null) {
            try (PreparedStatement create = schema.createStreamVersion(connection, stream, newVersion)) {
                create.executeUpdate();
            }
        } else {
            try (PreparedStatement update = schema.updateStreamVersion(connection, stream, version, newVersion)) {
                if (update.executeUpdate() != 1) {
                    throw EventStoreException.optimisticLock(stream, version);
                }
            }
        }
        return newVersion;
    }

    private Long readVersion(Connection connection, String stream) throws SQLException {
        try (PreparedStatement select = schema.selectStreamVersion(connection, stream);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? schema.readStreamVersion(rs) : null;
        }
    }

    private static boolean isConstraintViolation(SQLException ex) {
        for (Throwable t = ex; t != null && t.getCause() != t; t = t.getCause()) {
            if (t instanceof SQLException) {
                SQLException e = (SQLException) t;
                if (e.getSQLState() != null && e.getSQLState().startsWith("23")) {
                    return true;
                }
                if (e.getNextException() != null && isConstraintViolation(e.getNextException())) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public long writeSnapshot(String stream, WritableEvent snapshot, Map<String, String> commitHeaders)
            throws EventStoreException {
        return writeEvents(stream + SNAPSHOT_SUFFIX, Collections.singletonList(snapshot), commitHeaders, null);
    }

    @Override
    public void writeMetadata(String stream, Long maxCount, Long truncateBefore, Duration maxAge, Duration cacheControl,
            Boolean frozen, UUID owner, boolean force, Map<String, String> custom) throws EventStoreException {
        MetadataUpdate update = new MetadataUpdate(maxCount, truncateBefore, maxAge, cacheControl, frozen, owner,
                force, custom);
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try {
                Map<String, String> entries = update.applyTo(stream, readMetadata(connection, stream));
                try (PreparedStatement delete = schema.deleteMetadata(connection, stream)) {
                    delete.executeUpdate();
                }
                try (PreparedStatement insert = schema.insertMetadata(connection)) {
                    for (Map.Entry<String, String> entry : entries.entrySet()) {
                        schema.prepareMetadata(insert, stream, entry.getKey(), entry.getValue());
                        insert.addBatch();
                    }
                    insert.executeBatch();
                }
                txHandler.commit(connection);
            } catch (SQLException | RuntimeException | EventStoreException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException ex) {
            throw EventStoreException.storeFailed(stream, ex);
        }
    }

    @Override
    public String getMetadata(String stream, String key) throws EventStoreException {
        try (Connection connection = dataSource.getConnection()) {
            return readMetadata(connection, stream, key);
        } catch (SQLException e) {
            throw EventStoreException.readFailed(stream, e);
        }
    }

    @Override
    public Map<String, String> getMetadata(String stream) throws EventStoreException {
        try (Connection connection = dataSource.getConnection()) {
            return readMetadata(connection, stream);
        } catch (SQLException e) {
            throw EventStoreException.readFailed(stream, e);
        }
    }

    private Map<String, String> readMetadata(Connection connection, String stream) throws SQLException {
        Map<String, String> result = new LinkedHashMap<>();
        try (PreparedStatement select = schema.selectMetadata(connection, stream);
                ResultSet rs = select.executeQuery()) {
            while (rs.next()) {
                result.put(schema.readMetadataKey(rs), schema.readMetadataValue(rs));
            }
        }
        return result;
    }

    private String readMetadata(Connection connection, String stream, String key) throws SQLException {
        try (PreparedStatement select = schema.selectMetadata(connection, stream, key);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? schema.readMetadataValue(rs) : null;
        }
    }
}
