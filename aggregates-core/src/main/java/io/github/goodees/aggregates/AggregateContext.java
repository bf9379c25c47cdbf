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

import io.github.goodees.aggregates.routing.RouteResolver;
import io.github.goodees.aggregates.stream.EventStream;

import java.util.Objects;

/**
 * Everything an aggregate needs from its environment. Created by the {@link AggregateRepository} and handed to the
 * aggregate's constructor.
 * @param <ID> type of aggregate id
 */
public final class AggregateContext<ID> {
    private final ID id;
    private final EventStream stream;
    private final EventFactory eventFactory;
    private final RouteResolver routeResolver;

    public AggregateContext(ID id, EventStream stream, EventFactory eventFactory, RouteResolver routeResolver) {
        this.id = Objects.requireNonNull(id, "Id cannot be null");
        this.stream = Objects.requireNonNull(stream, "Stream cannot be null");
        this.eventFactory = Objects.requireNonNull(eventFactory, "Event factory cannot be null");
        this.routeResolver = Objects.requireNonNull(routeResolver, "Route resolver cannot be null");
    }

    public ID getId() {
        return id;
    }

    public EventStream getStream() {
        return stream;
    }

    public EventFactory getEventFactory() {
        return eventFactory;
    }

    public RouteResolver getRouteResolver() {
        return routeResolver;
    }
}
