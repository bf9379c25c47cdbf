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

/**
 * Exception generated when reading or storing of events fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        OPTIMISTIC_LOCK, FROZEN, TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException optimisticLock(String stream, long expectedVersion, long actualVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Stream " + stream + " expected at version "
                + expectedVersion + " but is at version " + actualVersion, null);
    }

    public static EventStoreException optimisticLock(String stream, long expectedVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Stream " + stream
                + " was modified concurrently, expected version " + expectedVersion, null);
    }

    public static EventStoreException frozen(String stream) {
        return new EventStoreException(Fault.FROZEN, "Stream " + stream + " is frozen", null);
    }

    public static EventStoreException frozenByOther(String stream, Object owner) {
        return new EventStoreException(Fault.FROZEN, "Stream " + stream + " is frozen by " + owner, null);
    }

    public static EventStoreException storeFailed(String stream, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Store of stream " + stream + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException readFailed(String stream, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Reading of stream " + stream + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException reservedMetadata(String stream, String key) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Custom metadata of stream " + stream
                + " cannot set reserved key " + key, null);
    }

    public static EventStoreException invalidMetadata(String stream, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR,
            "Metadata of stream " + stream + " is invalid. " + cause.getMessage(), cause);
    }

    public static EventStoreException unsupported(Object event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type: " + event, null);
    }
}
