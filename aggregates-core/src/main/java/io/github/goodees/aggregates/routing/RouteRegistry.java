package io.github.goodees.aggregates.routing;

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

import io.github.goodees.aggregates.Event;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Route resolver backed by route tables registered at startup. The table of an aggregate is looked up by its class,
 * then by its superclasses.
 */
public class RouteRegistry implements RouteResolver {
    private final ConcurrentMap<Class<?>, RouteTable<?>> tables = new ConcurrentHashMap<>();

    public <A> RouteRegistry register(RouteTable<A> table) {
        RouteTable<?> previous = tables.putIfAbsent(table.getAggregateType(), table);
        if (previous != null) {
            throw new IllegalStateException("Routes for " + table.getAggregateType().getName()
                    + " are already registered");
        }
        return this;
    }

    @Override
    public Optional<Route<Object>> resolve(Object aggregate, Class<? extends Event> eventType) {
        return tableOf(aggregate).flatMap(t -> t.resolve(eventType));
    }

    @Override
    public Optional<Route<Object>> resolveConflict(Object aggregate, Class<? extends Event> eventType) {
        return tableOf(aggregate).flatMap(t -> t.resolveConflict(eventType));
    }

    @SuppressWarnings("unchecked")
    private Optional<RouteTable<Object>> tableOf(Object aggregate) {
        for (Class<?> c = aggregate.getClass(); c != null; c = c.getSuperclass()) {
            RouteTable<?> table = tables.get(c);
            if (table != null) {
                return Optional.of((RouteTable<Object>) table);
            }
        }
        return Optional.empty();
    }
}
