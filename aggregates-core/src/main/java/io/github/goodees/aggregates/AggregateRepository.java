package io.github.goodees.aggregates;

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

import io.github.goodees.aggregates.pipeline.Headers;
import io.github.goodees.aggregates.store.EventStore;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.StreamReads;
import io.github.goodees.aggregates.stream.EventStream;
import io.github.goodees.aggregates.stream.RecordedEvent;
import io.github.goodees.aggregates.stream.StreamMetadata;
import io.github.goodees.aggregates.stream.WritableEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static java.util.stream.Collectors.toList;

/**
 * Loads and stores aggregates of one type. A repository lives for one processing cycle, and tracks every aggregate it
 * loaded or created, so that subsequent lookups return the same instance and {@link #commit(UUID, Map)} writes all of
 * them.
 *
 * <p>An aggregate is restored from its latest snapshot, if the aggregate accepts it, followed by events stored after
 * the snapshot. On commit, pending events are written with optimistic concurrency check against the version the
 * aggregate was loaded at. A concurrent modification is handled according to {@link ConflictPolicy}.
 * @param <A> type of aggregate
 * @param <ID> type of aggregate id
 */
public class AggregateRepository<A extends AggregateRoot<ID>, ID> {
    private static final Logger logger = LoggerFactory.getLogger(AggregateRepository.class);

    private final Class<A> aggregateType;
    private final AggregateFactory<A, ID> factory;
    private final RepositoryFactory config;
    private final EventStore eventStore;
    private final Map<String, A> tracked = new LinkedHashMap<>();

    AggregateRepository(Class<A> aggregateType, AggregateFactory<A, ID> factory, RepositoryFactory config) {
        this.aggregateType = aggregateType;
        this.factory = factory;
        this.config = config;
        this.eventStore = config.getEventStore();
    }

    public Class<A> getAggregateType() {
        return aggregateType;
    }

    public A get(ID id) throws EventStoreException {
        return get(config.getDefaultBucket(), id);
    }

    /**
     * Get existing aggregate.
     * @param bucket bucket of the aggregate
     * @param id id of the aggregate
     * @return hydrated aggregate
     * @throws AggregateNotFoundException when the aggregate has no history
     * @throws EventStoreException when reading fails
     */
    public A get(String bucket, ID id) throws EventStoreException {
        Optional<A> aggregate = tryGet(bucket, id);
        if (!aggregate.isPresent()) {
            throw new AggregateNotFoundException(EventStream.streamName(bucket, streamId(id)));
        }
        return aggregate.get();
    }

    public Optional<A> tryGet(ID id) throws EventStoreException {
        return tryGet(config.getDefaultBucket(), id);
    }

    public Optional<A> tryGet(String bucket, ID id) throws EventStoreException {
        String streamName = EventStream.streamName(bucket, streamId(id));
        A known = tracked.get(streamName);
        if (known != null) {
            return Optional.of(known);
        }
        Optional<A> loaded = load(bucket, id);
        loaded.ifPresent(a -> tracked.put(streamName, a));
        return loaded;
    }

    public A create(ID id) {
        return create(config.getDefaultBucket(), id);
    }

    /**
     * Create a new aggregate. Existence of the stream is verified on commit.
     * @param bucket bucket of the aggregate
     * @param id id of the aggregate
     * @return aggregate with empty history
     * @throws IllegalStateException when the aggregate is already tracked by this repository
     */
    public A create(String bucket, ID id) {
        EventStream stream = EventStream.empty(bucket, streamId(id));
        if (tracked.containsKey(stream.getStreamName())) {
            throw new IllegalStateException("Aggregate " + stream.getStreamName() + " already exists");
        }
        A aggregate = instantiate(id, stream);
        tracked.put(stream.getStreamName(), aggregate);
        return aggregate;
    }

    /**
     * Write pending and out of band events of all tracked aggregates.
     * @param commitId id of the commit, stable across retries of a message
     * @param headers headers attached to each written event
     * @throws EventStoreException when writing fails, or the conflict cannot be resolved
     * @throws NoRouteException when a conflicting event has no conflict route
     */
    public void commit(UUID commitId, Map<String, String> headers) throws EventStoreException {
        Map<String, String> commitHeaders = new LinkedHashMap<>(headers);
        commitHeaders.put(Headers.COMMIT_ID, commitId.toString());
        for (Map.Entry<String, A> entry : new ArrayList<>(tracked.entrySet())) {
            tracked.put(entry.getKey(), write(entry.getValue(), commitHeaders));
        }
    }

    /**
     * Forget all tracked aggregates and their pending events.
     */
    public void discard() {
        tracked.clear();
    }

    public int getTrackedCount() {
        return tracked.size();
    }

    protected String streamId(ID id) {
        return String.valueOf(id);
    }

    private A instantiate(ID id, EventStream stream) {
        return factory.create(new AggregateContext<>(id, stream, config.getEventFactory(), config.getRouteResolver()));
    }

    private Optional<A> load(String bucket, ID id) throws EventStoreException {
        long start = System.nanoTime();
        String streamId = streamId(id);
        String streamName = EventStream.streamName(bucket, streamId);
        Snapshot snapshot = readSnapshot(streamName);
        List<RecordedEvent> events = eventStore.getEvents(streamName, snapshot == null ? null
                : snapshot.getVersion() + 1, null);
        if (snapshot == null && events.isEmpty()) {
            return Optional.empty();
        }
        StreamMetadata metadata = StreamReads.metadata(streamName, eventStore.getMetadata(streamName));
        A aggregate = instantiate(id, stream(bucket, streamId, snapshot, events, metadata));
        if (snapshot != null && !aggregate.restoreFromSnapshot(snapshot.getState())) {
            logger.debug("Aggregate {} did not accept snapshot at version {}, replaying full history", streamName,
                snapshot.getVersion());
            snapshot = null;
            events = eventStore.getEvents(streamName, null, null);
            aggregate = instantiate(id, stream(bucket, streamId, null, events, metadata));
        }
        try {
            aggregate.hydrate(events.stream().map(RecordedEvent::getEvent).collect(toList()));
        } catch (RuntimeException e) {
            logger.error("Failed to hydrate aggregate {}", streamName, e);
            throw e;
        }
        logger.info("Loaded {} at version {} from {} events{} in {} ms", streamName, aggregate.getVersion(),
            events.size(), snapshot == null ? "" : " and snapshot", (System.nanoTime() - start) / 1_000_000);
        return Optional.of(aggregate);
    }

    private Snapshot readSnapshot(String streamName) throws EventStoreException {
        List<RecordedEvent> snapshots = eventStore.getEventsBackwards(streamName + EventStore.SNAPSHOT_SUFFIX, null,
            1);
        if (snapshots.isEmpty()) {
            return null;
        }
        Event event = snapshots.get(0).getEvent();
        if (!(event instanceof Snapshot)) {
            logger.warn("Snapshot stream of {} contains {}, ignoring", streamName, event.getType());
            return null;
        }
        return (Snapshot) event;
    }

    private static EventStream stream(String bucket, String streamId, Snapshot snapshot, List<RecordedEvent> events,
            StreamMetadata metadata) {
        long snapshotVersion = snapshot == null ? 0 : snapshot.getVersion();
        long version = events.isEmpty() ? snapshotVersion : events.get(events.size() - 1).getVersion();
        return new EventStream(bucket, streamId, version, events, metadata, snapshotVersion);
    }

    private A write(A aggregate, Map<String, String> commitHeaders) throws EventStoreException {
        A current = aggregate;
        boolean hadPending = !aggregate.getStream().getUncommitted().isEmpty();
        int resolutions = 0;
        while (!current.getStream().getUncommitted().isEmpty()) {
            EventStream stream = current.getStream();
            long expected = stream.getStreamVersion();
            try {
                long newVersion = eventStore.writeEvents(stream.getStreamName(), stream.getUncommitted(),
                    commitHeaders, expected);
                stream.flushed(expected, newVersion);
            } catch (EventStoreException e) {
                if (e.getFault() != EventStoreException.Fault.OPTIMISTIC_LOCK || expected == 0) {
                    throw e;
                }
                switch (config.getConflictPolicy()) {
                    case IGNORE:
                        logger.warn("Stream {} modified concurrently, writing {} events regardless",
                            stream.getStreamName(), stream.getUncommitted().size());
                        stream.flushed(expected, eventStore.writeEvents(stream.getStreamName(),
                            stream.getUncommitted(), commitHeaders, null));
                        break;
                    case RESOLVE:
                        if (resolutions++ >= config.getMaxConflictResolutions()) {
                            throw e;
                        }
                        current = resolve(current);
                        break;
                    default:
                        throw e;
                }
            }
        }
        writeOutOfBand(current.getStream(), commitHeaders);
        if (hadPending) {
            writeSnapshot(current, commitHeaders);
        }
        return current;
    }

    private A resolve(A stale) throws EventStoreException {
        EventStream staleStream = stale.getStream();
        logger.debug("Resolving conflict of {} pending events on {}", staleStream.getUncommitted().size(),
            staleStream.getStreamName());
        A latest = load(stale.getBucket(), stale.getId())
                .orElseThrow(() -> new AggregateNotFoundException(staleStream.getStreamName()));
        for (WritableEvent pending : staleStream.getUncommitted()) {
            latest.conflict(pending.getEvent(), pending.getHeaders());
        }
        for (WritableEvent outOfBand : staleStream.getOutOfBand()) {
            latest.raise(outOfBand.getEvent(), outOfBand.getHeaders());
        }
        return latest;
    }

    private void writeOutOfBand(EventStream stream, Map<String, String> commitHeaders) throws EventStoreException {
        if (stream.getOutOfBand().isEmpty()) {
            return;
        }
        eventStore.writeEvents(stream.getStreamName() + EventStore.OUT_OF_BAND_SUFFIX, stream.getOutOfBand(),
            commitHeaders, null);
        stream.outOfBandFlushed();
    }

    private void writeSnapshot(A aggregate, Map<String, String> commitHeaders) throws EventStoreException {
        EventStream stream = aggregate.getStream();
        long eventsSinceSnapshot = stream.getStreamVersion() - stream.getSnapshotVersion();
        if (eventsSinceSnapshot <= 0 || !config.getSnapshotPolicy().shouldStoreSnapshot(aggregate,
            eventsSinceSnapshot)) {
            return;
        }
        Object state = aggregate.createSnapshot();
        if (state != null) {
            eventStore.writeSnapshot(stream.getStreamName(),
                WritableEvent.of(new Snapshot(stream.getStreamVersion(), state), Collections.emptyMap()),
                commitHeaders);
            logger.debug("Stored snapshot of {} at version {}", stream.getStreamName(), stream.getStreamVersion());
        }
    }
}
