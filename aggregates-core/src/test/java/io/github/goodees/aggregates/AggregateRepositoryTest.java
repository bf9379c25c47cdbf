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

import io.github.goodees.aggregates.example.order.Order;
import io.github.goodees.aggregates.example.order.OrderSnapshot;
import io.github.goodees.aggregates.pipeline.Headers;
import io.github.goodees.aggregates.routing.RouteRegistry;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.inmemory.InMemoryEventStore;
import io.github.goodees.aggregates.stream.EventStream;
import io.github.goodees.aggregates.stream.RecordedEvent;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AggregateRepositoryTest {
    @Rule
    public TestName testName = new TestName();

    private InMemoryEventStore store;
    private RouteRegistry routes;

    @Before
    public void setUp() {
        store = new InMemoryEventStore();
        routes = new RouteRegistry().register(Order.ROUTES);
    }

    private String id() {
        return testName.getMethodName();
    }

    private String stream() {
        return "orders." + id();
    }

    private AggregateRepository<Order, String> repository(ConflictPolicy policy) {
        return repository(policy, SnapshotPolicy.NEVER);
    }

    private AggregateRepository<Order, String> repository(ConflictPolicy policy, SnapshotPolicy snapshots) {
        return RepositoryFactory.builder(store, routes)
                .defaultBucket("orders")
                .conflictPolicy(policy)
                .snapshotPolicy(snapshots)
                .register(Order.class, Order::new)
                .build()
                .forType(Order.class);
    }

    private void commit(AggregateRepository<Order, String> repository) throws EventStoreException {
        repository.commit(UUID.randomUUID(), Collections.emptyMap());
    }

    private void createOrder() throws EventStoreException {
        AggregateRepository<Order, String> repository = repository(ConflictPolicy.THROW);
        repository.create(id()).create("alice");
        commit(repository);
    }

    @Test
    public void created_aggregate_is_stored_and_loaded() throws EventStoreException {
        AggregateRepository<Order, String> repository = repository(ConflictPolicy.THROW);
        Order order = repository.create(id());
        order.create("alice");
        order.addItem("apple", 2);
        UUID commitId = UUID.randomUUID();
        repository.commit(commitId, Collections.singletonMap("user", "bob"));
        assertEquals(2, order.getVersion());

        Order loaded = repository(ConflictPolicy.THROW).get(id());
        assertEquals("alice", loaded.getCustomer());
        assertEquals(Integer.valueOf(2), loaded.getItems().get("apple"));
        assertEquals(2, loaded.getVersion());

        RecordedEvent first = store.getEvents(stream(), null, 1).get(0);
        assertEquals(commitId.toString(), first.getHeaders().get(Headers.COMMIT_ID));
        assertEquals("bob", first.getHeaders().get("user"));
    }

    @Test
    public void missing_aggregate_is_not_found() throws EventStoreException {
        AggregateRepository<Order, String> repository = repository(ConflictPolicy.THROW);
        assertFalse(repository.tryGet(id()).isPresent());
        try {
            repository.get(id());
            fail("Missing aggregate should not be found");
        } catch (AggregateNotFoundException e) {
            assertEquals(stream(), e.getStream());
        }
    }

    @Test
    public void repository_tracks_loaded_aggregates() throws EventStoreException {
        createOrder();
        AggregateRepository<Order, String> repository = repository(ConflictPolicy.THROW);
        assertSame(repository.get(id()), repository.get(id()));
        assertEquals(1, repository.getTrackedCount());
    }

    @Test
    public void out_of_band_events_go_to_separate_stream() throws EventStoreException {
        createOrder();
        AggregateRepository<Order, String> repository = repository(ConflictPolicy.THROW);
        Order order = repository.get(id());
        order.announce("hello");
        commit(repository);

        assertEquals(1, store.getEvents(stream(), null, null).size());
        assertEquals(1, store.getEvents(stream() + ".OOB", null, null).size());
        assertTrue(streamOf(order).getOutOfBand().isEmpty());
    }

    @Test
    public void concurrent_additions_are_merged() throws EventStoreException {
        createOrder();
        AggregateRepository<Order, String> first = repository(ConflictPolicy.RESOLVE);
        AggregateRepository<Order, String> second = repository(ConflictPolicy.RESOLVE);
        first.get(id()).addItem("apple", 1);
        second.get(id()).addItem("pear", 2);
        commit(first);
        commit(second);

        Order merged = second.get(id());
        assertEquals(3, merged.getVersion());
        Order loaded = repository(ConflictPolicy.THROW).get(id());
        assertEquals(Integer.valueOf(1), loaded.getItems().get("apple"));
        assertEquals(Integer.valueOf(2), loaded.getItems().get("pear"));
    }

    @Test
    public void conflicting_event_can_be_discarded() throws EventStoreException {
        createOrder();
        AggregateRepository<Order, String> first = repository(ConflictPolicy.RESOLVE);
        AggregateRepository<Order, String> second = repository(ConflictPolicy.RESOLVE);
        first.get(id()).place("alice");
        second.get(id()).addItem("pear", 2);
        commit(first);
        commit(second);

        List<RecordedEvent> events = store.getEvents(stream(), null, null);
        assertEquals(2, events.size());
        assertTrue(repository(ConflictPolicy.THROW).get(id()).getItems().isEmpty());
    }

    @Test
    public void conflict_without_route_fails_commit() throws EventStoreException {
        createOrder();
        AggregateRepository<Order, String> first = repository(ConflictPolicy.RESOLVE);
        AggregateRepository<Order, String> second = repository(ConflictPolicy.RESOLVE);
        first.get(id()).addItem("apple", 1);
        second.get(id()).removeItem("apple");
        commit(first);
        try {
            commit(second);
            fail("Removal cannot be merged");
        } catch (NoRouteException e) {
            assertEquals(2, store.getEvents(stream(), null, null).size());
        }
    }

    @Test
    public void throw_policy_reports_optimistic_lock() throws EventStoreException {
        createOrder();
        AggregateRepository<Order, String> first = repository(ConflictPolicy.THROW);
        AggregateRepository<Order, String> second = repository(ConflictPolicy.THROW);
        first.get(id()).addItem("apple", 1);
        second.get(id()).addItem("pear", 1);
        commit(first);
        try {
            commit(second);
            fail("Concurrent modification should fail");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
    }

    @Test
    public void ignore_policy_writes_regardless() throws EventStoreException {
        createOrder();
        AggregateRepository<Order, String> first = repository(ConflictPolicy.IGNORE);
        AggregateRepository<Order, String> second = repository(ConflictPolicy.IGNORE);
        first.get(id()).addItem("apple", 1);
        Order stale = second.get(id());
        stale.removeItem("apple");
        commit(first);
        commit(second);

        assertEquals(3, stale.getVersion());
        assertEquals(3, store.getEvents(stream(), null, null).size());
    }

    @Test
    public void creating_existing_stream_fails() throws EventStoreException {
        createOrder();
        AggregateRepository<Order, String> repository = repository(ConflictPolicy.RESOLVE);
        repository.create(id()).create("mallory");
        try {
            commit(repository);
            fail("Stream already exists");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
    }

    @Test
    public void snapshot_is_stored_and_restored() throws EventStoreException {
        AggregateRepository<Order, String> repository = repository(ConflictPolicy.THROW,
            SnapshotPolicy.everyNEvents(2));
        Order order = repository.create(id());
        order.create("alice");
        order.addItem("apple", 2);
        commit(repository);

        List<RecordedEvent> snapshots = store.getEvents(stream() + ".SNAP", null, null);
        assertEquals(1, snapshots.size());
        Snapshot snapshot = (Snapshot) snapshots.get(0).getEvent();
        assertEquals(2, snapshot.getVersion());
        assertThat(snapshot.getState(), instanceOf(OrderSnapshot.class));

        AggregateRepository<Order, String> next = repository(ConflictPolicy.THROW);
        next.get(id()).addItem("pear", 1);
        commit(next);

        Order loaded = repository(ConflictPolicy.THROW).get(id());
        assertTrue(loaded.isRestoredFromSnapshot());
        assertEquals(3, loaded.getVersion());
        assertEquals("alice", loaded.getCustomer());
        assertEquals(Integer.valueOf(2), loaded.getItems().get("apple"));
        assertEquals(Integer.valueOf(1), loaded.getItems().get("pear"));
    }

    @Test
    public void discard_forgets_pending_changes() throws EventStoreException {
        AggregateRepository<Order, String> repository = repository(ConflictPolicy.THROW);
        repository.create(id()).create("alice");
        repository.discard();
        commit(repository);
        assertTrue(store.getEvents(stream(), null, null).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unregistered_type_is_rejected() {
        RepositoryFactory.builder(store, routes).build().forType(Order.class);
    }

    private static EventStream streamOf(AggregateRoot<?> aggregate) {
        return aggregate.getStream();
    }
}
