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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Processing context of one inbound message, passed along the {@link Behavior} chain. Headers and message instance
 * are mutable, as behaviors may replace them before calling the next stage.
 */
public class MessageContext {
    private final String messageId;
    private final Map<String, String> headers;
    private final int retries;
    private final List<DelayedMessage> delayedMessages;
    private final List<Object> unitsOfWork = new ArrayList<>();
    private Object message;

    public MessageContext(String messageId, Map<String, String> headers, Object message, int retries) {
        this(messageId, headers, message, retries, Collections.emptyList());
    }

    public MessageContext(String messageId, Map<String, String> headers, Object message, int retries,
            List<DelayedMessage> delayedMessages) {
        this.messageId = Objects.requireNonNull(messageId, "Message id cannot be null");
        this.headers = new LinkedHashMap<>(headers);
        this.message = message;
        this.retries = retries;
        this.delayedMessages = delayedMessages == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(delayedMessages));
    }

    public String getMessageId() {
        return messageId;
    }

    public Optional<MessageIntent> getIntent() {
        return MessageIntent.fromHeader(headers.get(Headers.MESSAGE_INTENT));
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public void replaceHeaders(Map<String, String> newHeaders) {
        headers.clear();
        headers.putAll(newHeaders);
    }

    public Object getMessage() {
        return message;
    }

    public void setMessage(Object message) {
        this.message = message;
    }

    /**
     * Number of previous failed delivery attempts of this message.
     * @return 0 on first delivery
     */
    public int getRetries() {
        return retries;
    }

    public List<DelayedMessage> getDelayedMessages() {
        return delayedMessages;
    }

    /**
     * A bulk message carries the bulk header, and delayed messages to replay.
     * @return true if delayed messages should be processed instead of the message itself
     */
    public boolean isBulk() {
        return headers.containsKey(Headers.BULK) && !delayedMessages.isEmpty();
    }

    /**
     * Make a unit of work available to later stages.
     * @param unitOfWork active unit of work
     */
    public void attach(Object unitOfWork) {
        unitsOfWork.add(unitOfWork);
    }

    public void detachAll() {
        unitsOfWork.clear();
    }

    public <U> Optional<U> findUnitOfWork(Class<U> type) {
        for (Object unit : unitsOfWork) {
            if (type.isInstance(unit)) {
                return Optional.of(type.cast(unit));
            }
        }
        return Optional.empty();
    }

    /**
     * Active unit of work of given type.
     * @param type class of the unit of work
     * @param <U> type of the unit of work
     * @return the unit of work
     * @throws IllegalStateException when no such unit of work takes part in processing of the message
     */
    public <U> U getUnitOfWork(Class<U> type) {
        return findUnitOfWork(type).orElseThrow(() -> new IllegalStateException("No unit of work " + type.getName()
                + " active for message " + messageId));
    }

    @Override
    public String toString() {
        return "MessageContext{" + messageId + ", headers=" + headers + ", retries=" + retries + '}';
    }
}
