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

import io.github.goodees.aggregates.routing.Route;
import io.github.goodees.aggregates.routing.RouteResolver;
import io.github.goodees.aggregates.stream.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An event sourced aggregate. The aggregate is identified by bucket and id, and owns one {@link EventStream}.
 *
 * <p>The state of the aggregate can <strong>only</strong> change as result of an event being routed to it (with
 * exception of restoring a snapshot). Command methods of subclasses validate their input and then
 * {@linkplain #apply(Class, Consumer) apply} events. Routes registered in a
 * {@link io.github.goodees.aggregates.routing.RouteTable} perform the actual mutation, so that replaying the
 * history yields exactly the same state.
 *
 * <p>Events that need to be published without changing the aggregate are {@linkplain #raise(Class, Consumer) raised}
 * out of band. They are stored separately and never routed.
 *
 * <p>When the aggregate's stream was modified concurrently, the pending events are offered to the latest version of
 * the aggregate through {@link #conflict(Event, Map)}. Every event type that may be merged needs a conflict route.
 * @param <ID> type of aggregate id
 */
public abstract class AggregateRoot<ID> {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final ID id;
    private final EventStream stream;
    private final EventFactory eventFactory;
    private final RouteResolver routeResolver;

    protected AggregateRoot(AggregateContext<ID> context) {
        this.id = context.getId();
        this.stream = context.getStream();
        this.eventFactory = context.getEventFactory();
        this.routeResolver = context.getRouteResolver();
    }

    public final ID getId() {
        return id;
    }

    public final String getBucket() {
        return stream.getBucket();
    }

    public final String getStreamId() {
        return stream.getStreamId();
    }

    /**
     * Version of last persisted event.
     * @return persisted version
     */
    public final long getVersion() {
        return stream.getStreamVersion();
    }

    /**
     * Version including events applied in current processing cycle.
     * @return version after pending events are written
     */
    public final long getCommitVersion() {
        return stream.getCommitVersion();
    }

    final EventStream getStream() {
        return stream;
    }

    protected final <E extends Event> void apply(Class<E> eventType, Consumer<? super E> mutator) {
        apply(eventType, mutator, Collections.emptyMap());
    }

    protected final <E extends Event> void apply(Class<E> eventType, Consumer<? super E> mutator,
            Map<String, String> metadata) {
        apply(eventFactory.create(eventType, mutator), metadata);
    }

    protected final <E extends Event> void raise(Class<E> eventType, Consumer<? super E> mutator) {
        raise(eventType, mutator, Collections.emptyMap());
    }

    protected final <E extends Event> void raise(Class<E> eventType, Consumer<? super E> mutator,
            Map<String, String> metadata) {
        raise(eventFactory.create(eventType, mutator), metadata);
    }

    /**
     * Route the event and stage it for writing. Events without a route are staged without changing state.
     * @param event the event
     * @param metadata metadata of the event
     */
    public final void apply(Event event, Map<String, String> metadata) {
        route(event);
        stream.add(event, metadata);
    }

    /**
     * Stage the event as out of band. Aggregate state and versions are not affected.
     * @param event the event
     * @param metadata metadata of the event
     */
    public final void raise(Event event, Map<String, String> metadata) {
        stream.addOutOfBand(event, metadata);
    }

    /**
     * Replay persisted history. Nothing is staged.
     * @param events events in the order they were stored
     */
    public final void hydrate(Iterable<? extends Event> events) {
        for (Event event : events) {
            route(event);
        }
    }

    /**
     * Merge an event that was applied against an outdated version of this aggregate. Conflict route runs first,
     * then the regular route, and the event is staged. Either route may throw {@link DiscardEventException} to
     * drop the event, in which case nothing is staged.
     * @param event the conflicting event
     * @param metadata metadata of the event
     * @throws NoRouteException when no conflict route is registered for the event
     */
    public final void conflict(Event event, Map<String, String> metadata) {
        Route<Object> conflictRoute = routeResolver.resolveConflict(this, event.getClass())
                .orElseThrow(() -> new NoRouteException(getClass(), event));
        try {
            conflictRoute.route(this, event);
            route(event);
        } catch (DiscardEventException e) {
            logger.debug("Aggregate {} discarded conflicting event {}: {}", stream.getStreamName(), event.getType(),
                e.getMessage());
            return;
        }
        stream.add(event, metadata);
    }

    private void route(Event event) {
        Optional<Route<Object>> route = routeResolver.resolve(this, event.getClass());
        if (route.isPresent()) {
            route.get().route(this, event);
        } else {
            logger.debug("Aggregate {} has no route for {}", stream.getStreamName(), event.getType());
        }
    }

    /**
     * Create snapshot of the aggregate's state. Snapshots are taken as the
     * {@linkplain SnapshotPolicy snapshot policy} decides.
     * @return snapshot of state, or null if aggregate does not support snapshots
     */
    protected Object createSnapshot() {
        return null;
    }

    /**
     * Restore state from a snapshot.
     * @param snapshot state previously created by {@link #createSnapshot()}
     * @return true if snapshot was applied, false if the whole history should be replayed instead
     */
    protected boolean restoreFromSnapshot(Object snapshot) {
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + stream.getStreamName() + "@" + getVersion() + "}";
    }
}
