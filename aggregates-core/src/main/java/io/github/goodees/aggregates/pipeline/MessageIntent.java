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

import java.util.Optional;

/**
 * Why a message was sent, as carried in header {@link Headers#MESSAGE_INTENT}.
 */
public enum MessageIntent {
    SEND("Send"), PUBLISH("Publish"), REPLY("Reply"), SUBSCRIBE("Subscribe"), UNSUBSCRIBE("Unsubscribe");

    private final String headerValue;

    MessageIntent(String headerValue) {
        this.headerValue = headerValue;
    }

    public String getHeaderValue() {
        return headerValue;
    }

    public static Optional<MessageIntent> fromHeader(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MessageIntent intent : values()) {
            if (intent.headerValue.equalsIgnoreCase(value)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
