package io.github.goodees.aggregates.store;

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

import io.github.goodees.aggregates.stream.RecordedEvent;
import io.github.goodees.aggregates.stream.StreamMetadata;
import io.github.goodees.aggregates.stream.WritableEvent;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Storage of event streams. Streams are addressed by name, and their events are versioned from 1. An empty stream
 * has version 0.
 *
 * <p>Reads respect retention set in stream metadata, see {@link StreamMetadata}.
 */
public interface EventStore {

    /**
     * Suffix of the stream holding snapshots of a stream.
     */
    String SNAPSHOT_SUFFIX = ".SNAP";

    /**
     * Suffix of the stream holding out of band events of a stream.
     */
    String OUT_OF_BAND_SUFFIX = ".OOB";

    /**
     * Read events in ascending order.
     * @param stream stream name
     * @param start first version to read, null to read from the beginning
     * @param count maximum number of events, null for all
     * @return events, empty when stream does not exist
     * @throws EventStoreException when reading fails
     */
    List<RecordedEvent> getEvents(String stream, Long start, Integer count) throws EventStoreException;

    /**
     * Read events in descending order.
     * @param stream stream name
     * @param start last version to read, null to read from the end
     * @param count maximum number of events, null for all
     * @return events, empty when stream does not exist
     * @throws EventStoreException when reading fails
     */
    List<RecordedEvent> getEventsBackwards(String stream, Long start, Integer count) throws EventStoreException;

    /**
     * Append events to a stream. Commit headers are added to each event's headers, event headers take precedence.
     * @param stream stream name
     * @param events events to write
     * @param commitHeaders headers of the whole commit
     * @param expectedVersion version the stream must have, null to skip the check
     * @return new version of the stream
     * @throws EventStoreException with fault {@code OPTIMISTIC_LOCK} when version does not match, with fault
     * {@code FROZEN} when stream is frozen
     */
    long writeEvents(String stream, List<WritableEvent> events, Map<String, String> commitHeaders,
            Long expectedVersion) throws EventStoreException;

    /**
     * Append a snapshot to the snapshot stream of a stream.
     * @param stream stream name
     * @param snapshot event carrying the snapshot
     * @param commitHeaders headers of the commit
     * @return version of the snapshot stream
     * @throws EventStoreException when storing fails
     */
    long writeSnapshot(String stream, WritableEvent snapshot, Map<String, String> commitHeaders)
            throws EventStoreException;

    /**
     * Update stream metadata. Null arguments keep the stored values. Unfreezing a stream clears its owner.
     * @param stream stream name
     * @param maxCount number of latest events to keep visible
     * @param truncateBefore events with lower version are hidden
     * @param maxAge events older than that are hidden
     * @param cacheControl cache hint for readers
     * @param frozen whether the stream accepts writes
     * @param owner owner of the freeze
     * @param force override a freeze held by another owner
     * @param custom application entries
     * @throws EventStoreException with fault {@code FROZEN} when the stream is frozen by another owner
     */
    void writeMetadata(String stream, Long maxCount, Long truncateBefore, Duration maxAge, Duration cacheControl,
            Boolean frozen, UUID owner, boolean force, Map<String, String> custom) throws EventStoreException;

    /**
     * Read a single metadata entry.
     * @param stream stream name
     * @param key the entry key
     * @return value or null when not set
     * @throws EventStoreException when reading fails
     */
    String getMetadata(String stream, String key) throws EventStoreException;

    /**
     * Read all metadata entries of a stream.
     * @param stream stream name
     * @return entries, empty when none set
     * @throws EventStoreException when reading fails
     */
    Map<String, String> getMetadata(String stream) throws EventStoreException;

    default boolean isFrozen(String stream) throws EventStoreException {
        return Boolean.parseBoolean(getMetadata(stream, StreamMetadata.FROZEN));
    }
}
