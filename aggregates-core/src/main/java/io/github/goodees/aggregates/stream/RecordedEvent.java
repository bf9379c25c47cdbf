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
import java.util.Map;
import java.util.UUID;

/**
 * Event as read from a store, positioned at a version of its stream. Versions start at 1.
 */
public final class RecordedEvent {
    private final String stream;
    private final long version;
    private final WritableEvent data;

    public RecordedEvent(String stream, long version, WritableEvent data) {
        this.stream = stream;
        this.version = version;
        this.data = data;
    }

    public String getStream() {
        return stream;
    }

    public long getVersion() {
        return version;
    }

    public UUID getEventId() {
        return data.getEventId();
    }

    public String getType() {
        return data.getType();
    }

    public Instant getTimestamp() {
        return data.getTimestamp();
    }

    public Map<String, String> getHeaders() {
        return data.getHeaders();
    }

    public Event getEvent() {
        return data.getEvent();
    }

    public WritableEvent getData() {
        return data;
    }

    @Override
    public String toString() {
        return "RecordedEvent{" + stream + "@" + version + ", " + data.getType() + '}';
    }
}
