package io.github.goodees.aggregates.pipeline;

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
import java.util.Objects;

/**
 * A message whose processing was postponed, to be replayed as part of a bulk delivery.
 */
public final class DelayedMessage {
    private final Map<String, String> headers;
    private final String channelKey;
    private final Object message;

    public DelayedMessage(Map<String, String> headers, String channelKey, Object message) {
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.channelKey = Objects.requireNonNull(channelKey, "Channel key cannot be null");
        this.message = Objects.requireNonNull(message, "Message cannot be null");
    }

    /**
     * Headers of the message at the time it was delayed.
     * @return original headers
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getChannelKey() {
        return channelKey;
    }

    public Object getMessage() {
        return message;
    }
}
