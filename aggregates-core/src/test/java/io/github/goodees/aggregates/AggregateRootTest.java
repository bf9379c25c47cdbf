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
import io.github.goodees.aggregates.example.order.event.ItemAddedEvent;
import io.github.goodees.aggregates.example.order.event.ItemRemovedEvent;
import io.github.goodees.aggregates.example.order.event.NoteAddedEvent;
import io.github.goodees.aggregates.routing.RouteRegistry;
import io.github.goodees.aggregates.stream.EventStream;
import io.github.goodees.aggregates.stream.WritableEvent;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AggregateRootTest {
    private RouteRegistry routes;
    private EventFactory eventFactory;

    @Before
    public void setUp() {
        routes = new RouteRegistry().register(Order.ROUTES);
        eventFactory = new ConstructorEventFactory();
    }

    private Order newOrder(String id) {
        return new Order(new AggregateContext<>(id, EventStream.empty("orders", id), eventFactory, routes));
    }

    private ItemAddedEvent itemAdded(String product, int quantity) {
        return eventFactory.create(ItemAddedEvent.class, e -> {
            e.setProductId(product);
            e.setQuantity(quantity);
        });
    }

    @Test
    public void applied_event_changes_state_and_is_staged() {
        Order order = newOrder("o1");
        order.create("alice");
        order.addItem("apple", 2);

        assertEquals("alice", order.getCustomer());
        assertEquals(Integer.valueOf(2), order.getItems().get("apple"));
        assertEquals(0, order.getVersion());
        assertEquals(2, order.getCommitVersion());
        List<WritableEvent> pending = streamOf(order).getUncommitted();
        assertEquals(Arrays.asList("OrderCreated", "ItemAdded"), pending.stream().map(WritableEvent::getType)
                .collect(toList()));
        assertEquals("addItem", pending.get(1).getHeaders().get("source"));
    }

    @Test
    public void event_without_route_is_staged_without_state_change() {
        Order order = newOrder("o1");
        order.create("alice");
        order.note("fragile");

        assertEquals(2, order.getCommitVersion());
        assertThat(streamOf(order).getUncommitted().get(1).getEvent(), instanceOf(NoteAddedEvent.class));
        assertTrue(order.getItems().isEmpty());
    }

    @Test
    public void raised_event_is_out_of_band_only() {
        Order order = newOrder("o1");
        order.create("alice");
        order.announce("new order");

        assertEquals(1, order.getCommitVersion());
        assertEquals(1, streamOf(order).getUncommitted().size());
        assertEquals(1, streamOf(order).getOutOfBand().size());
        assertEquals("NoteAdded", streamOf(order).getOutOfBand().get(0).getType());
    }

    @Test
    public void hydration_replays_state_without_staging() {
        Order original = newOrder("o1");
        original.create("alice");
        original.addItem("apple", 2);
        original.addItem("pear", 1);
        original.addItem("apple", 3);
        original.removeItem("pear");
        original.place("bob");

        Order replayed = newOrder("o1");
        replayed.hydrate(streamOf(original).getUncommitted().stream().map(WritableEvent::getEvent)
                .collect(toList()));

        assertEquals(original.getCustomer(), replayed.getCustomer());
        assertEquals(original.getItems(), replayed.getItems());
        assertEquals(original.isPlaced(), replayed.isPlaced());
        assertTrue(streamOf(replayed).getUncommitted().isEmpty());
        assertEquals(0, replayed.getCommitVersion());
    }

    @Test
    public void conflict_runs_conflict_route_then_apply_route_and_stages() {
        Order order = newOrder("o1");
        order.hydrate(Collections.singletonList(itemAdded("apple", 1)));
        order.getTrace().clear();

        order.conflict(itemAdded("pear", 4), Collections.singletonMap("k", "v"));

        assertThat(order.getTrace(), contains("conflict pear", "apply pear"));
        assertEquals(Integer.valueOf(4), order.getItems().get("pear"));
        assertEquals(1, streamOf(order).getUncommitted().size());
        assertEquals("v", streamOf(order).getUncommitted().get(0).getHeaders().get("k"));
    }

    @Test
    public void discarded_conflict_leaves_aggregate_unchanged() {
        Order order = newOrder("o1");
        order.create("alice");
        order.place("bob");
        long commitVersion = order.getCommitVersion();

        order.conflict(itemAdded("apple", 1), Collections.emptyMap());

        assertEquals(commitVersion, order.getCommitVersion());
        assertFalse(order.getItems().containsKey("apple"));
    }

    @Test
    public void discard_from_apply_route_during_conflict_stages_nothing() {
        Order order = newOrder("o1");
        order.hydrate(Collections.singletonList(itemAdded("apple", 1)));
        order.getTrace().clear();

        order.conflict(itemAdded("pear", 0), Collections.emptyMap());

        assertThat(order.getTrace(), contains("conflict pear", "apply pear"));
        assertFalse(order.getItems().containsKey("pear"));
        assertTrue(streamOf(order).getUncommitted().isEmpty());
    }

    @Test
    public void conflict_without_route_fails_and_stages_nothing() {
        Order order = newOrder("o1");
        ItemRemovedEvent removed = eventFactory.create(ItemRemovedEvent.class, e -> e.setProductId("apple"));
        order.hydrate(Collections.singletonList(itemAdded("apple", 1)));

        try {
            order.conflict(removed, Collections.emptyMap());
            fail("Conflict without route should fail");
        } catch (NoRouteException e) {
            assertEquals("ItemRemoved", e.getEventType());
            assertEquals(Order.class, e.getAggregateType());
        }
        assertEquals(0, order.getCommitVersion());
        assertEquals(Integer.valueOf(1), order.getItems().get("apple"));
    }

    @Test
    public void aggregate_without_routes_accepts_events() {
        Order order = new Order(new AggregateContext<>("o1", EventStream.empty("orders", "o1"), eventFactory,
                new RouteRegistry()));
        order.addItem("apple", 1);
        assertEquals(1, order.getCommitVersion());
        assertTrue(order.getItems().isEmpty());
    }

    private static EventStream streamOf(AggregateRoot<?> aggregate) {
        return aggregate.getStream();
    }
}
