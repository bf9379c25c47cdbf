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

import io.github.goodees.aggregates.stream.WritableEvent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;

/**
 * SQL dialect and table layout of {@link JdbcEventStore}. Implementations create statements, the store executes them.
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement selectStreamVersion(Connection connection, String stream)
            throws SQLException;

    protected abstract long readStreamVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement createStreamVersion(Connection connection, String stream, long version)
            throws SQLException;

    protected abstract PreparedStatement updateStreamVersion(Connection connection, String stream,
            long expectedVersion, long newVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, String stream, long version,
            WritableEvent event, String headers, int payloadVersion, String payload) throws SQLException;

    /**
     * Select events of a stream in version order. Columns are read by the {@code readEvent*} methods.
     * @param connection connection to use
     * @param stream stream name
     * @param fromVersion lowest version included
     * @param toVersion highest version included
     * @param createdSince oldest creation time included, null for any
     * @param descending whether newest events come first
     * @param limit maximum number of rows, null for no limit
     * @return prepared statement
     * @throws SQLException when statement cannot be prepared
     */
    protected abstract PreparedStatement selectEvents(Connection connection, String stream, long fromVersion,
            long toVersion, Instant createdSince, boolean descending, Integer limit) throws SQLException;

    /**
     * Select versions of newest events of a stream, newest first, readable by {@link #readEventVersion(ResultSet)}.
     * @param connection connection to use
     * @param stream stream name
     * @param fromVersion lowest version included
     * @param createdSince oldest creation time included, null for any
     * @param limit maximum number of rows
     * @return prepared statement
     * @throws SQLException when statement cannot be prepared
     */
    protected abstract PreparedStatement selectEventVersions(Connection connection, String stream, long fromVersion,
            Instant createdSince, int limit) throws SQLException;

    protected abstract long readEventVersion(ResultSet rs) throws SQLException;

    protected abstract UUID readEventId(ResultSet rs) throws SQLException;

    protected abstract Instant readEventCreated(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventHeaders(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement selectMetadata(Connection connection, String stream) throws SQLException;

    protected abstract PreparedStatement selectMetadata(Connection connection, String stream, String key)
            throws SQLException;

    protected abstract String readMetadataKey(ResultSet rs) throws SQLException;

    protected abstract String readMetadataValue(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement deleteMetadata(Connection connection, String stream) throws SQLException;

    protected abstract PreparedStatement insertMetadata(Connection connection) throws SQLException;

    protected abstract void prepareMetadata(PreparedStatement insertMetadata, String stream, String key, String value)
            throws SQLException;
}
