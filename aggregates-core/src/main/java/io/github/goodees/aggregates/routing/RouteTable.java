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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiConsumer;

/**
 * Typesafe routes of single aggregate type. Routes are matched by exact event class first, then by the first
 * registered supertype of the event in registration order.
 *
 * <pre>
 * RouteTable.builder(Order.class)
 *     .on(ItemAddedEvent.class, Order::itemAdded)
 *     .onConflict(ItemAddedEvent.class, Order::concurrentItemAdded)
 *     .build();
 * </pre>
 * @param <A> type of aggregate
 */
public class RouteTable<A> {

    private final Class<A> aggregateType;
    private final List<RouteBranch<A, ?>> applyBranches;
    private final List<RouteBranch<A, ?>> conflictBranches;
    private final ConcurrentMap<Class<?>, Optional<Route<A>>> applyCache = new ConcurrentHashMap<>();
    private final ConcurrentMap<Class<?>, Optional<Route<A>>> conflictCache = new ConcurrentHashMap<>();

    private RouteTable(Builder<A> b) {
        this.aggregateType = b.aggregateType;
        this.applyBranches = Collections.unmodifiableList(new ArrayList<>(b.applyBranches));
        this.conflictBranches = Collections.unmodifiableList(new ArrayList<>(b.conflictBranches));
    }

    public Class<A> getAggregateType() {
        return aggregateType;
    }

    public Optional<Route<A>> resolve(Class<? extends Event> eventType) {
        return applyCache.computeIfAbsent(eventType, t -> find(applyBranches, t));
    }

    public Optional<Route<A>> resolveConflict(Class<? extends Event> eventType) {
        return conflictCache.computeIfAbsent(eventType, t -> find(conflictBranches, t));
    }

    private static <A> Optional<Route<A>> find(List<RouteBranch<A, ?>> branches, Class<?> eventType) {
        for (RouteBranch<A, ?> branch : branches) {
            if (branch.eventType.equals(eventType)) {
                return Optional.of(branch);
            }
        }
        for (RouteBranch<A, ?> branch : branches) {
            if (branch.eventType.isAssignableFrom(eventType)) {
                return Optional.of(branch);
            }
        }
        return Optional.empty();
    }

    public static <A> Builder<A> builder(Class<A> aggregateType) {
        return new Builder<>(aggregateType);
    }

    public static class Builder<A> {
        private final Class<A> aggregateType;
        private final List<RouteBranch<A, ?>> applyBranches = new ArrayList<>();
        private final List<RouteBranch<A, ?>> conflictBranches = new ArrayList<>();

        Builder(Class<A> aggregateType) {
            this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        }

        public <E extends Event> Builder<A> on(Class<E> eventType, BiConsumer<? super A, ? super E> handler) {
            applyBranches.add(new RouteBranch<>(eventType, handler));
            return this;
        }

        public <E extends Event> Builder<A> onConflict(Class<E> eventType, BiConsumer<? super A, ? super E> handler) {
            conflictBranches.add(new RouteBranch<>(eventType, handler));
            return this;
        }

        public RouteTable<A> build() {
            return new RouteTable<>(this);
        }
    }

    private static class RouteBranch<A, E extends Event> implements Route<A> {
        private final Class<E> eventType;
        private final BiConsumer<? super A, ? super E> handler;

        RouteBranch(Class<E> eventType, BiConsumer<? super A, ? super E> handler) {
            this.eventType = Objects.requireNonNull(eventType, "Event type cannot be null");
            this.handler = Objects.requireNonNull(handler, "Handler cannot be null");
        }

        @Override
        public void route(A aggregate, Event event) {
            handler.accept(aggregate, eventType.cast(event));
        }
    }
}
