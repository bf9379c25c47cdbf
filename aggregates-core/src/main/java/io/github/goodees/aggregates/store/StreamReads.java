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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;

/**
 * Slicing of stream content for {@link EventStore} reads.
 */
public final class StreamReads {
    private StreamReads() {
    }

    public static List<RecordedEvent> forwards(List<RecordedEvent> ascending, Long start, Integer count) {
        List<RecordedEvent> result = new ArrayList<>();
        for (RecordedEvent event : ascending) {
            if (count != null && result.size() >= count) {
                break;
            }
            if (start == null || event.getVersion() >= start) {
                result.add(event);
            }
        }
        return result;
    }

    public static List<RecordedEvent> backwards(List<RecordedEvent> ascending, Long start, Integer count) {
        List<RecordedEvent> result = new ArrayList<>();
        ListIterator<RecordedEvent> it = ascending.listIterator(ascending.size());
        while (it.hasPrevious()) {
            if (count != null && result.size() >= count) {
                break;
            }
            RecordedEvent event = it.previous();
            if (start == null || event.getVersion() <= start) {
                result.add(event);
            }
        }
        return result;
    }

    /**
     * Parse stored metadata entries of a stream.
     * @param stream stream name
     * @param entries entries as stored
     * @return parsed metadata
     * @throws EventStoreException with programmatic error fault when reserved entries cannot be parsed
     */
    public static StreamMetadata metadata(String stream, Map<String, String> entries) throws EventStoreException {
        try {
            return StreamMetadata.fromEntries(entries);
        } catch (IllegalArgumentException e) {
            throw EventStoreException.invalidMetadata(stream, e);
        }
    }

    /**
     * Headers of an event as stored, commit headers overridden by event's own headers.
     * @param commitHeaders headers of the commit
     * @param eventHeaders headers of the event
     * @return merged headers
     */
    public static Map<String, String> mergeHeaders(Map<String, String> commitHeaders,
            Map<String, String> eventHeaders) {
        Map<String, String> result = new LinkedHashMap<>();
        if (commitHeaders != null) {
            result.putAll(commitHeaders);
        }
        result.putAll(eventHeaders);
        return result;
    }
}
