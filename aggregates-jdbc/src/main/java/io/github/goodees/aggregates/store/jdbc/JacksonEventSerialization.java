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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.aggregates.Event;
import io.github.goodees.aggregates.Snapshot;

import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON serialization of events. Event classes are registered under their {@linkplain Event#getType() type}, and need
 * to be deserializable by Jackson. Snapshots are supported out of the box, their state is stored along with its class
 * name.
 */
public class JacksonEventSerialization implements Serialization<Event> {
    static final String SNAPSHOT_TYPE = "Snapshot";

    private final ObjectMapper mapper;
    private final Map<String, Class<? extends Event>> types = new ConcurrentHashMap<>();

    public JacksonEventSerialization() {
        this(ObjectMappers.create());
    }

    public JacksonEventSerialization(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JacksonEventSerialization register(Class<? extends Event> eventType, String type) {
        types.put(type, eventType);
        return this;
    }

    /**
     * Register event type under its default type name.
     * @param eventType event class with no-argument constructor
     * @return this
     */
    public JacksonEventSerialization register(Class<? extends Event> eventType) {
        try {
            return register(eventType, eventType.getDeclaredConstructor().newInstance().getType());
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot determine type of " + eventType.getName(), e);
        }
    }

    @Override
    public int payloadVersion(Event object) {
        return 1;
    }

    @Override
    public String serialize(Event object) {
        try {
            if (object instanceof Snapshot) {
                Snapshot snapshot = (Snapshot) object;
                ObjectNode node = mapper.createObjectNode();
                node.put("version", snapshot.getVersion());
                node.put("stateType", snapshot.getState().getClass().getName());
                node.set("state", mapper.valueToTree(snapshot.getState()));
                return mapper.writeValueAsString(node);
            }
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public Event deserialize(int payloadVersion, String payload, String type) {
        try {
            if (SNAPSHOT_TYPE.equals(type)) {
                JsonNode node = mapper.readTree(payload);
                Class<?> stateType = Class.forName(node.get("stateType").asText());
                return new Snapshot(node.get("version").asLong(), mapper.treeToValue(node.get("state"), stateType));
            }
            Class<? extends Event> eventType = types.get(type);
            if (eventType == null) {
                throw new IllegalArgumentException("Unknown event type " + type);
            }
            return mapper.readValue(payload, eventType);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Unknown snapshot state type", e);
        }
    }

    @Override
    public Event toSerializable(Object o) {
        if (o instanceof Snapshot) {
            return (Snapshot) o;
        }
        if (o instanceof Event && types.get(((Event) o).getType()) == o.getClass()) {
            return (Event) o;
        }
        return null;
    }
}
