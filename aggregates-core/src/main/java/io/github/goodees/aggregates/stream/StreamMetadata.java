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

import io.github.goodees.aggregates.immutables.ImmutablesSupport;
import org.immutables.value.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;

/**
 * Metadata of an event stream. Retention settings limit which events are visible to readers, the freeze flag
 * together with owner prevents further writes.
 *
 * <p>Stores keep metadata as string entries under the keys defined here. Durations are stored in seconds.
 */
@Value.Immutable
@ImmutablesSupport
public abstract class StreamMetadata {
    public static final String MAX_COUNT = "$maxCount";
    public static final String TRUNCATE_BEFORE = "$tb";
    public static final String MAX_AGE = "$maxAge";
    public static final String CACHE_CONTROL = "$cacheControl";
    public static final String FROZEN = "frozen";
    public static final String OWNER = "owner";
    public static final Set<String> RESERVED_KEYS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
        MAX_COUNT, TRUNCATE_BEFORE, MAX_AGE, CACHE_CONTROL, FROZEN, OWNER)));

    public abstract OptionalLong getMaxCount();

    public abstract OptionalLong getTruncateBefore();

    public abstract Optional<Duration> getMaxAge();

    public abstract Optional<Duration> getCacheControl();

    @Value.Default
    public boolean isFrozen() {
        return false;
    }

    public abstract Optional<UUID> getOwner();

    /**
     * Application specific entries.
     * @return entries not reserved by the keys above
     */
    public abstract Map<String, String> getCustom();

    public static ImmutableStreamMetadata.Builder builder() {
        return ImmutableStreamMetadata.builder();
    }

    public static StreamMetadata empty() {
        return builder().build();
    }

    /**
     * Interpret stored metadata entries.
     * @param entries entries as kept by a store
     * @return parsed metadata
     * @throws IllegalArgumentException when a reserved entry cannot be parsed
     */
    public static StreamMetadata fromEntries(Map<String, String> entries) {
        ImmutableStreamMetadata.Builder builder = builder();
        entries.forEach((key, value) -> {
            try {
                switch (key) {
                    case MAX_COUNT:
                        builder.maxCount(Long.parseLong(value));
                        break;
                    case TRUNCATE_BEFORE:
                        builder.truncateBefore(Long.parseLong(value));
                        break;
                    case MAX_AGE:
                        builder.maxAge(Duration.ofSeconds(Long.parseLong(value)));
                        break;
                    case CACHE_CONTROL:
                        builder.cacheControl(Duration.ofSeconds(Long.parseLong(value)));
                        break;
                    case FROZEN:
                        builder.frozen(Boolean.parseBoolean(value));
                        break;
                    case OWNER:
                        builder.owner(UUID.fromString(value));
                        break;
                    default:
                        builder.putCustom(key, value);
                }
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid metadata entry " + key + "=" + value, e);
            }
        });
        return builder.build();
    }

    /**
     * Filter events by retention rules. Events below truncate-before version and events older than max age are
     * dropped, and then only the last max-count events are kept.
     * @param ascending events in ascending version order
     * @param now reference time for max age
     * @return visible events in ascending order
     */
    public List<RecordedEvent> retain(List<RecordedEvent> ascending, Instant now) {
        List<RecordedEvent> result = new ArrayList<>(ascending.size());
        Instant oldest = getMaxAge().map(now::minus).orElse(null);
        for (RecordedEvent event : ascending) {
            if (getTruncateBefore().isPresent() && event.getVersion() < getTruncateBefore().getAsLong()) {
                continue;
            }
            if (oldest != null && event.getTimestamp().isBefore(oldest)) {
                continue;
            }
            result.add(event);
        }
        if (getMaxCount().isPresent() && result.size() > getMaxCount().getAsLong()) {
            return new ArrayList<>(result.subList(result.size() - (int) getMaxCount().getAsLong(), result.size()));
        }
        return result;
    }
}
