package io.github.goodees.aggregates;

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
 * No conflict handler is registered for an event that conflicts with concurrently stored events. The conflicting
 * event cannot be merged, and processing of the message must fail.
 */
public class NoRouteException extends RuntimeException {

    private final Class<?> aggregateType;
    private final String eventType;

    public NoRouteException(Class<?> aggregateType, Event event) {
        super("No conflict route registered on " + aggregateType.getName() + " for event " + event.getType());
        this.aggregateType = aggregateType;
        this.eventType = event.getType();
    }

    public Class<?> getAggregateType() {
        return aggregateType;
    }

    public String getEventType() {
        return eventType;
    }
}
