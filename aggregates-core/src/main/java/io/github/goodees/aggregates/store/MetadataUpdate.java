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

import io.github.goodees.aggregates.stream.StreamMetadata;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Change of stream metadata entries, as requested by
 * {@link EventStore#writeMetadata(String, Long, Long, Duration, Duration, Boolean, UUID, boolean, Map)}.
 */
public final class MetadataUpdate {
    private final Long maxCount;
    private final Long truncateBefore;
    private final Duration maxAge;
    private final Duration cacheControl;
    private final Boolean frozen;
    private final UUID owner;
    private final boolean force;
    private final Map<String, String> custom;

    public MetadataUpdate(Long maxCount, Long truncateBefore, Duration maxAge, Duration cacheControl, Boolean frozen,
            UUID owner, boolean force, Map<String, String> custom) {
        this.maxCount = maxCount;
        this.truncateBefore = truncateBefore;
        this.maxAge = maxAge;
        this.cacheControl = cacheControl;
        this.frozen = frozen;
        this.owner = owner;
        this.force = force;
        this.custom = custom;
    }

    /**
     * Compute new entries of a stream.
     * @param stream stream name
     * @param current entries currently stored
     * @return entries to store
     * @throws EventStoreException when stream is frozen by another owner and update is not forced, or custom
     *     entries use a reserved key
     */
    public Map<String, String> applyTo(String stream, Map<String, String> current) throws EventStoreException {
        if (custom != null) {
            for (String key : custom.keySet()) {
                if (StreamMetadata.RESERVED_KEYS.contains(key)) {
                    throw EventStoreException.reservedMetadata(stream, key);
                }
            }
        }
        String currentOwner = current.get(StreamMetadata.OWNER);
        boolean currentlyFrozen = Boolean.parseBoolean(current.get(StreamMetadata.FROZEN));
        if (currentlyFrozen && !force && currentOwner != null
                && !Objects.equals(currentOwner, owner == null ? null : owner.toString())) {
            throw EventStoreException.frozenByOther(stream, currentOwner);
        }
        Map<String, String> result = new LinkedHashMap<>(current);
        if (custom != null) {
            result.putAll(custom);
        }
        putIfSet(result, StreamMetadata.MAX_COUNT, maxCount);
        putIfSet(result, StreamMetadata.TRUNCATE_BEFORE, truncateBefore);
        putIfSet(result, StreamMetadata.MAX_AGE, maxAge == null ? null : maxAge.getSeconds());
        putIfSet(result, StreamMetadata.CACHE_CONTROL, cacheControl == null ? null : cacheControl.getSeconds());
        if (Boolean.TRUE.equals(frozen)) {
            result.put(StreamMetadata.FROZEN, "true");
            if (owner != null) {
                result.put(StreamMetadata.OWNER, owner.toString());
            }
        } else if (Boolean.FALSE.equals(frozen)) {
            result.remove(StreamMetadata.FROZEN);
            result.remove(StreamMetadata.OWNER);
        }
        return result;
    }

    private static void putIfSet(Map<String, String> entries, String key, Object value) {
        if (value != null) {
            entries.put(key, value.toString());
        }
    }
}
