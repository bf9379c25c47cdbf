package io.github.goodees.aggregates.example.order;

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

import io.github.goodees.aggregates.AggregateContext;
import io.github.goodees.aggregates.AggregateRoot;
import io.github.goodees.aggregates.DiscardEventException;
import io.github.goodees.aggregates.example.order.event.ItemAddedEvent;
import io.github.goodees.aggregates.example.order.event.ItemRemovedEvent;
import io.github.goodees.aggregates.example.order.event.NoteAddedEvent;
import io.github.goodees.aggregates.example.order.event.OrderCreatedEvent;
import io.github.goodees.aggregates.example.order.event.OrderPlacedEvent;
import io.github.goodees.aggregates.routing.RouteTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sample aggregate. Items may be added concurrently until the order is placed, concurrent removals cannot be merged.
 */
public class Order extends AggregateRoot<String> {
    public static final RouteTable<Order> ROUTES = RouteTable.builder(Order.class)
            .on(OrderCreatedEvent.class, Order::created)
            .on(ItemAddedEvent.class, Order::itemAdded)
            .on(ItemRemovedEvent.class, Order::itemRemoved)
            .on(OrderPlacedEvent.class, Order::placed)
            .onConflict(ItemAddedEvent.class, Order::concurrentItemAdded)
            .onConflict(OrderPlacedEvent.class, Order::concurrentlyPlaced)
            .build();

    private String customer;
    private final Map<String, Integer> items = new LinkedHashMap<>();
    private boolean placed;
    private boolean restoredFromSnapshot;
    private final List<String> trace = new ArrayList<>();

    public Order(AggregateContext<String> context) {
        super(context);
    }

    public void create(String customer) {
        apply(OrderCreatedEvent.class, e -> e.setCustomer(customer));
    }

    public void addItem(String productId, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (placed) {
            throw new IllegalStateException("Order " + getId() + " is already placed");
        }
        apply(ItemAddedEvent.class, e -> {
            e.setProductId(productId);
            e.setQuantity(quantity);
        }, Collections.singletonMap("source", "addItem"));
    }

    public void removeItem(String productId) {
        apply(ItemRemovedEvent.class, e -> e.setProductId(productId));
    }

    public void place(String by) {
        apply(OrderPlacedEvent.class, e -> e.setPlacedBy(by));
    }

    public void note(String text) {
        apply(NoteAddedEvent.class, e -> e.setText(text));
    }

    public void announce(String text) {
        raise(NoteAddedEvent.class, e -> e.setText(text));
    }

    private void created(OrderCreatedEvent event) {
        this.customer = event.getCustomer();
    }

    private void itemAdded(ItemAddedEvent event) {
        trace.add("apply " + event.getProductId());
        if (event.getQuantity() <= 0) {
            throw new DiscardEventException("Nothing to add");
        }
        items.merge(event.getProductId(), event.getQuantity(), Integer::sum);
    }

    private void itemRemoved(ItemRemovedEvent event) {
        items.remove(event.getProductId());
    }

    private void placed(OrderPlacedEvent event) {
        this.placed = true;
    }

    private void concurrentItemAdded(ItemAddedEvent event) {
        trace.add("conflict " + event.getProductId());
        if (placed) {
            throw new DiscardEventException("Order already placed");
        }
    }

    private void concurrentlyPlaced(OrderPlacedEvent event) {
        if (placed) {
            throw new DiscardEventException();
        }
    }

    @Override
    protected Object createSnapshot() {
        OrderSnapshot snapshot = new OrderSnapshot();
        snapshot.setCustomer(customer);
        snapshot.setItems(new LinkedHashMap<>(items));
        snapshot.setPlaced(placed);
        return snapshot;
    }

    @Override
    protected boolean restoreFromSnapshot(Object snapshot) {
        if (!(snapshot instanceof OrderSnapshot)) {
            return false;
        }
        OrderSnapshot s = (OrderSnapshot) snapshot;
        this.customer = s.getCustomer();
        this.items.putAll(s.getItems());
        this.placed = s.isPlaced();
        this.restoredFromSnapshot = true;
        return true;
    }

    public String getCustomer() {
        return customer;
    }

    public Map<String, Integer> getItems() {
        return Collections.unmodifiableMap(items);
    }

    public boolean isPlaced() {
        return placed;
    }

    public boolean isRestoredFromSnapshot() {
        return restoredFromSnapshot;
    }

    public List<String> getTrace() {
        return trace;
    }
}
