package io.github.goodees.aggregates.store.inmemory;

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

import io.github.goodees.aggregates.store.EventStore;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.MetadataUpdate;
import io.github.goodees.aggregates.store.StreamReads;
import io.github.goodees.aggregates.stream.RecordedEvent;
import io.github.goodees.aggregates.stream.StreamMetadata;
import io.github.goodees.aggregates.stream.WritableEvent;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Event store keeping streams in memory. Every stream is updated atomically under its own lock.
 */
public class InMemoryEventStore implements EventStore {
    private final ConcurrentMap<String, StreamLog> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    int streamCount() {
        return storage.size();
    }

    private StreamLog streamLog(String stream) {
        return storage.computeIfAbsent(stream, s -> new StreamLog());
    }

    private List<RecordedEvent> visibleEvents(String stream) throws EventStoreException {
        StreamLog log = storage.get(stream);
        if (log == null) {
            return Collections.emptyList();
        }
        List<RecordedEvent> events;
        Map<String, String> entries;
        synchronized (log) {
            events = new ArrayList<>(log.events);
            entries = log.metadata;
        }
        return StreamReads.metadata(stream, entries).retain(events, clock.instant());
    }

    @Override
    public List<RecordedEvent> getEvents(String stream, Long start, Integer count) throws EventStoreException {
        return StreamReads.forwards(visibleEvents(stream), start, count);
    }

    @Override
    public List<RecordedEvent> getEventsBackwards(String stream, Long start, Integer count)
            throws EventStoreException {
        return StreamReads.backwards(visibleEvents(stream), start, count);
    }

    @Override
    public long writeEvents(String stream, List<WritableEvent> events, Map<String, String> commitHeaders,
            Long expectedVersion) throws EventStoreException {
        StreamLog log = streamLog(stream);
        synchronized (log) {
            if (Boolean.parseBoolean(log.metadata.get(StreamMetadata.FROZEN))) {
                throw EventStoreException.frozen(stream);
            }
            long version = log.events.size();
            if (expectedVersion != null && expectedVersion != version) {
                throw EventStoreException.optimisticLock(stream, expectedVersion, version);
            }
            for (WritableEvent event : events) {
                WritableEvent stored = new WritableEvent(event.getEventId(), event.getType(), event.getTimestamp(),
                        StreamReads.mergeHeaders(commitHeaders, event.getHeaders()), event.getEvent());
                log.events.add(new RecordedEvent(stream, ++version, stored));
            }
            return version;
        }
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
        StreamLog log = streamLog(stream);
        synchronized (log) {
            log.metadata = update.applyTo(stream, log.metadata);
        }
    }

    @Override
    public String getMetadata(String stream, String key) {
        return getMetadata(stream).get(key);
    }

    @Override
    public Map<String, String> getMetadata(String stream) {
        StreamLog log = storage.get(stream);
        if (log == null) {
            return Collections.emptyMap();
        }
        synchronized (log) {
            return new LinkedHashMap<>(log.metadata);
        }
    }

    private static class StreamLog {
        private final List<RecordedEvent> events = new ArrayList<>();
        private Map<String, String> metadata = Collections.emptyMap();
    }
}
