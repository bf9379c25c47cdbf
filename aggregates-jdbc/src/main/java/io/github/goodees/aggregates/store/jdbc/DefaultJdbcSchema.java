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
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/**
 * JDBC schema with all streams sharing tables. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(STREAM, VERSION, EVENT_ID, CREATED, TYPE, PAYLOAD_VERSION, HEADERS, PAYLOAD) primary key
 * (STREAM, VERSION)</li>
 * <li><em>versionTable</em>(STREAM, VERSION) primary key (STREAM)</li>
 * <li><em>metadataTable</em>(STREAM, META_KEY, META_VALUE) primary key (STREAM, META_KEY)</li>
 * </ul>
 */
public class DefaultJdbcSchema extends JdbcSchema {

    private final String eventTable;
    private final String versionTable;
    private final String metadataTable;

    public DefaultJdbcSchema(String eventTable, String versionTable, String metadataTable) {
        this.eventTable = eventTable;
        this.versionTable = versionTable;
        this.metadataTable = metadataTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getVersionTable() {
        return versionTable;
    }

    protected String getMetadataTable() {
        return metadataTable;
    }

    @Override
    protected PreparedStatement selectStreamVersion(Connection connection, String stream) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION FROM " + getVersionTable()
                + " WHERE STREAM=?");
        st.setString(1, stream);
        return st;
    }

    @Override
    protected long readStreamVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement createStreamVersion(Connection connection, String stream, long version)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getVersionTable()
                + " (STREAM, VERSION) VALUES (?, ?)");
        st.setString(1, stream);
        st.setLong(2, version);
        return st;
    }

    @Override
    protected PreparedStatement updateStreamVersion(Connection connection, String stream, long expectedVersion,
            long newVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getVersionTable()
                + " SET VERSION=? WHERE STREAM=? AND VERSION=?");
        st.setLong(1, newVersion);
        st.setString(2, stream);
        st.setLong(3, expectedVersion);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (STREAM, VERSION, EVENT_ID, CREATED, TYPE, PAYLOAD_VERSION, HEADERS, PAYLOAD)"
                + " VALUES (?,?,?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, String stream, long version, WritableEvent event,
            String headers, int payloadVersion, String payload) throws SQLException {
        insertEvent.setString(1, stream);
        insertEvent.setLong(2, version);
        insertEvent.setString(3, event.getEventId().toString());
        insertEvent.setTimestamp(4, Timestamp.from(event.getTimestamp()));
        insertEvent.setString(5, event.getType());
        insertEvent.setInt(6, payloadVersion);
        insertEvent.setString(7, headers);
        insertEvent.setString(8, payload);
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String stream, long fromVersion, long toVersion,
            Instant createdSince, boolean descending, Integer limit) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION, EVENT_ID, CREATED, TYPE, PAYLOAD_VERSION,"
                + " HEADERS, PAYLOAD FROM " + getEventTable() + " WHERE STREAM=? AND VERSION >= ? AND VERSION <= ?"
                + (createdSince == null ? "" : " AND CREATED >= ?")
                + " ORDER BY VERSION" + (descending ? " DESC" : ""));
        st.setString(1, stream);
        st.setLong(2, fromVersion);
        st.setLong(3, toVersion);
        if (createdSince != null) {
            st.setTimestamp(4, Timestamp.from(createdSince));
        }
        if (limit != null) {
            st.setMaxRows(limit);
        }
        return st;
    }

    @Override
    protected PreparedStatement selectEventVersions(Connection connection, String stream, long fromVersion,
            Instant createdSince, int limit) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION FROM " + getEventTable()
                + " WHERE STREAM=? AND VERSION >= ?" + (createdSince == null ? "" : " AND CREATED >= ?")
                + " ORDER BY VERSION DESC");
        st.setString(1, stream);
        st.setLong(2, fromVersion);
        if (createdSince != null) {
            st.setTimestamp(3, Timestamp.from(createdSince));
        }
        st.setMaxRows(limit);
        return st;
    }

    @Override
    protected long readEventVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected UUID readEventId(ResultSet rs) throws SQLException {
        return UUID.fromString(rs.getString(2));
    }

    @Override
    protected Instant readEventCreated(ResultSet rs) throws SQLException {
        return rs.getTimestamp(3).toInstant();
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(4);
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(5);
    }

    @Override
    protected String readEventHeaders(ResultSet rs) throws SQLException {
        return rs.getString(6);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(7);
    }

    @Override
    protected PreparedStatement selectMetadata(Connection connection, String stream) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT META_KEY, META_VALUE FROM " + getMetadataTable()
                + " WHERE STREAM=? ORDER BY META_KEY");
        st.setString(1, stream);
        return st;
    }

    @Override
    protected PreparedStatement selectMetadata(Connection connection, String stream, String key)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT META_KEY, META_VALUE FROM " + getMetadataTable()
                + " WHERE STREAM=? AND META_KEY=?");
        st.setString(1, stream);
        st.setString(2, key);
        return st;
    }

    @Override
    protected String readMetadataKey(ResultSet rs) throws SQLException {
        return rs.getString(1);
    }

    @Override
    protected String readMetadataValue(ResultSet rs) throws SQLException {
        return rs.getString(2);
    }

    @Override
    protected PreparedStatement deleteMetadata(Connection connection, String stream) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getMetadataTable() + " WHERE STREAM=?");
        st.setString(1, stream);
        return st;
    }

    @Override
    protected PreparedStatement insertMetadata(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getMetadataTable()
                + " (STREAM, META_KEY, META_VALUE) VALUES (?,?,?)");
    }

    @Override
    protected void prepareMetadata(PreparedStatement insertMetadata, String stream, String key, String value)
            throws SQLException {
        insertMetadata.setString(1, stream);
        insertMetadata.setString(2, key);
        insertMetadata.setString(3, value);
    }
}
