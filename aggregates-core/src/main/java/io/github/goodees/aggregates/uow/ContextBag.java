package io.github.goodees.aggregates.uow;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recovery state of a unit of work. The bag is saved after the unit of work ends, and handed back to the same kind of
 * unit of work when the message is delivered again. Values should be simple, serializable types.
 */
public class ContextBag {
    private final Map<String, Object> entries;

    public ContextBag() {
        this.entries = new LinkedHashMap<>();
    }

    public ContextBag(Map<String, ?> entries) {
        this.entries = new LinkedHashMap<>(entries);
    }

    public void put(String key, Object value) {
        entries.put(key, value);
    }

    public Object remove(String key) {
        return entries.remove(key);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Typed access to a value. Numbers are converted between integral types, as stores may not preserve them.
     * @param key the key
     * @param type expected type
     * @param <T> expected type
     * @return value, empty when absent
     * @throws ClassCastException when value is of different type
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = entries.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number && !type.isInstance(value)) {
            Number number = (Number) value;
            if (type == Long.class) {
                return Optional.of(type.cast(number.longValue()));
            } else if (type == Integer.class) {
                return Optional.of(type.cast(number.intValue()));
            }
        }
        return Optional.of(type.cast(value));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    @Override
    public String toString() {
        return "ContextBag" + entries;
    }
}
