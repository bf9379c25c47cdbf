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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Event staged for writing, together with the metadata attached when it was applied or raised.
 */
public final class WritableEvent {
    private final UUID eventId;
    private final String type;
    private final Instant timestamp;
    private final Map<String, String> headers;
    private final Event event;

    public WritableEvent(UUID eventId, String type, Instant timestamp, Map<String, String> headers, Event event) {
        this.eventId = Objects.requireNonNull(eventId, "Event id cannot be null");
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.headers = headers == null || headers.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.event = Objects.requireNonNull(event, "Event cannot be null");
    }

    public static WritableEvent of(Event event, Map<String, String> headers) {
        return new WritableEvent(UUID.randomUUID(), event.getType(), Instant.now(), headers, event);
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Event getEvent() {
        return event;
    }

    @Override
    public String toString() {
        return "WritableEvent{" + type + ", id=" + eventId + ", headers=" + headers + '}';
    }
}
