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
import io.github.goodees.aggregates.store.EventStore;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Configuration of aggregate repositories. Built once at startup, it creates a fresh {@link AggregateRepository} for
 * every processing cycle.
 *
 * <pre>
 * RepositoryFactory repositories = RepositoryFactory.builder(eventStore, routes)
 *     .conflictPolicy(ConflictPolicy.RESOLVE)
 *     .register(Order.class, Order::new)
 *     .build();
 * </pre>
 */
public class RepositoryFactory {
    private final EventStore eventStore;
    private final RouteResolver routeResolver;
    private final EventFactory eventFactory;
    private final ConflictPolicy conflictPolicy;
    private final SnapshotPolicy snapshotPolicy;
    private final String defaultBucket;
    private final int maxConflictResolutions;
    private final Map<Class<?>, AggregateFactory<?, ?>> factories;

    private RepositoryFactory(Builder b) {
        this.eventStore = b.eventStore;
        this.routeResolver = b.routeResolver;
        this.eventFactory = b.eventFactory;
        this.conflictPolicy = b.conflictPolicy;
        this.snapshotPolicy = b.snapshotPolicy;
        this.defaultBucket = b.defaultBucket;
        this.maxConflictResolutions = b.maxConflictResolutions;
        this.factories = new ConcurrentHashMap<>(b.factories);
    }

    /**
     * Create repository for aggregates of given type.
     * @param aggregateType registered aggregate type
     * @param <A> type of aggregate
     * @param <ID> type of aggregate id
     * @return new repository, that tracks the aggregates it loads
     * @throws IllegalArgumentException when aggregate type is not registered
     */
    @SuppressWarnings("unchecked")
    public <A extends AggregateRoot<ID>, ID> AggregateRepository<A, ID> forType(Class<A> aggregateType) {
        AggregateFactory<A, ID> factory = (AggregateFactory<A, ID>) factories.get(aggregateType);
        if (factory == null) {
            throw new IllegalArgumentException("Aggregate type " + aggregateType.getName() + " is not registered");
        }
        return new AggregateRepository<>(aggregateType, factory, this);
    }

    EventStore getEventStore() {
        return eventStore;
    }

    RouteResolver getRouteResolver() {
        return routeResolver;
    }

    EventFactory getEventFactory() {
        return eventFactory;
    }

    ConflictPolicy getConflictPolicy() {
        return conflictPolicy;
    }

    SnapshotPolicy getSnapshotPolicy() {
        return snapshotPolicy;
    }

    String getDefaultBucket() {
        return defaultBucket;
    }

    int getMaxConflictResolutions() {
        return maxConflictResolutions;
    }

    public static Builder builder(EventStore eventStore, RouteResolver routeResolver) {
        return new Builder(eventStore, routeResolver);
    }

    public static class Builder {
        private final EventStore eventStore;
        private final RouteResolver routeResolver;
        private EventFactory eventFactory = new ConstructorEventFactory();
        private ConflictPolicy conflictPolicy = ConflictPolicy.RESOLVE;
        private SnapshotPolicy snapshotPolicy = SnapshotPolicy.NEVER;
        private String defaultBucket = "default";
        private int maxConflictResolutions = 3;
        private final Map<Class<?>, AggregateFactory<?, ?>> factories = new ConcurrentHashMap<>();

        Builder(EventStore eventStore, RouteResolver routeResolver) {
            this.eventStore = Objects.requireNonNull(eventStore, "Event store cannot be null");
            this.routeResolver = Objects.requireNonNull(routeResolver, "Route resolver cannot be null");
        }

        public Builder eventFactory(EventFactory eventFactory) {
            this.eventFactory = Objects.requireNonNull(eventFactory);
            return this;
        }

        public Builder conflictPolicy(ConflictPolicy conflictPolicy) {
            this.conflictPolicy = Objects.requireNonNull(conflictPolicy);
            return this;
        }

        public Builder snapshotPolicy(SnapshotPolicy snapshotPolicy) {
            this.snapshotPolicy = Objects.requireNonNull(snapshotPolicy);
            return this;
        }

        public Builder defaultBucket(String defaultBucket) {
            this.defaultBucket = Objects.requireNonNull(defaultBucket);
            return this;
        }

        public Builder maxConflictResolutions(int maxConflictResolutions) {
            if (maxConflictResolutions < 0) {
                throw new IllegalArgumentException("Conflict resolution attempts cannot be negative");
            }
            this.maxConflictResolutions = maxConflictResolutions;
            return this;
        }

        public <A extends AggregateRoot<ID>, ID> Builder register(Class<A> aggregateType,
                AggregateFactory<A, ID> factory) {
            factories.put(aggregateType, factory);
            return this;
        }

        public RepositoryFactory build() {
            return new RepositoryFactory(this);
        }
    }
}
