package io.github.goodees.aggregates.stream;

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

import io.github.goodees.aggregates.Event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Event stream of exactly one aggregate. The stream knows the persisted history it was loaded from, collects events
 * applied during the current processing cycle and events raised out of band.
 *
 * <p>The persisted version only advances through {@link #flushed(long, long)}, after the pending events were written
 * under optimistic concurrency check.
 */
public class EventStream {
    private final String bucket;
    private final String streamId;
    private final List<RecordedEvent> committed;
    private final List<WritableEvent> uncommitted = new ArrayList<>();
    private final List<WritableEvent> outOfBand = new ArrayList<>();
    private final StreamMetadata metadata;
    private final long snapshotVersion;
    private long streamVersion;

    public EventStream(String bucket, String streamId, long streamVersion, List<RecordedEvent> committed,
            StreamMetadata metadata, long snapshotVersion) {
        this.bucket = Objects.requireNonNull(bucket, "Bucket cannot be null");
        this.streamId = Objects.requireNonNull(streamId, "Stream id cannot be null");
        this.streamVersion = streamVersion;
        this.committed = Collections.unmodifiableList(new ArrayList<>(committed));
        this.metadata = Objects.requireNonNull(metadata, "Metadata cannot be null");
        this.snapshotVersion = snapshotVersion;
    }

    /**
     * Stream of an aggregate that has not been stored yet.
     * @param bucket bucket of the aggregate
     * @param streamId id of the aggregate stream
     * @return empty stream at version 0
     */
    public static EventStream empty(String bucket, String streamId) {
        return new EventStream(bucket, streamId, 0, Collections.emptyList(), StreamMetadata.empty(), 0);
    }

    /**
     * Name under which the stream is kept in an event store.
     * @param bucket bucket of the aggregate
     * @param streamId id of the aggregate stream
     * @return {@code bucket.streamId}
     */
    public static String streamName(String bucket, String streamId) {
        return bucket + "." + streamId;
    }

    public String getBucket() {
        return bucket;
    }

    public String getStreamId() {
        return streamId;
    }

    public String getStreamName() {
        return streamName(bucket, streamId);
    }

    /**
     * Version of last persisted event.
     * @return persisted version, 0 for new streams
     */
    public long getStreamVersion() {
        return streamVersion;
    }

    /**
     * Version the stream will have once pending events are written.
     * @return persisted version plus number of pending events
     */
    public long getCommitVersion() {
        return streamVersion + uncommitted.size();
    }

    public long getSnapshotVersion() {
        return snapshotVersion;
    }

    public StreamMetadata getMetadata() {
        return metadata;
    }

    public List<RecordedEvent> getCommitted() {
        return committed;
    }

    public List<WritableEvent> getUncommitted() {
        return Collections.unmodifiableList(uncommitted);
    }

    public List<WritableEvent> getOutOfBand() {
        return Collections.unmodifiableList(outOfBand);
    }

    public boolean isDirty() {
        return !uncommitted.isEmpty() || !outOfBand.isEmpty();
    }

    public void add(Event event, Map<String, String> metadata) {
        uncommitted.add(WritableEvent.of(event, metadata));
    }

    public void addOutOfBand(Event event, Map<String, String> metadata) {
        outOfBand.add(WritableEvent.of(event, metadata));
    }

    /**
     * Mark pending events as persisted.
     * @param expectedVersion the version the events were written against
     * @param newVersion version reported by the store
     * @throws IllegalStateException when the expected version does not match the persisted version of the stream
     */
    public void flushed(long expectedVersion, long newVersion) {
        if (expectedVersion != streamVersion) {
            throw new IllegalStateException("Stream " + getStreamName() + " is at version " + streamVersion
                    + ", flush expected " + expectedVersion);
        }
        this.streamVersion = newVersion;
        this.uncommitted.clear();
    }

    public void outOfBandFlushed() {
        this.outOfBand.clear();
    }

    @Override
    public String toString() {
        return "EventStream{" + getStreamName() + "@" + streamVersion + ", pending=" + uncommitted.size()
                + ", outOfBand=" + outOfBand.size() + '}';
    }
}
