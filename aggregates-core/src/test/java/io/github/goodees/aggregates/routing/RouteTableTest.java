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
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RouteTableTest {

    static class Counter {
        final List<String> calls = new ArrayList<>();
    }

    static class SpecialCounter extends Counter {
    }

    static class Incremented implements Event {
    }

    static class IncrementedTwice extends Incremented {
    }

    static class Reset implements Event {
    }

    private final RouteTable<Counter> table = RouteTable.builder(Counter.class)
            .on(Incremented.class, (c, e) -> c.calls.add("incremented"))
            .on(IncrementedTwice.class, (c, e) -> c.calls.add("twice"))
            .onConflict(Reset.class, (c, e) -> c.calls.add("reset conflict"))
            .build();

    @Test
    public void exact_type_wins_over_supertype() {
        Counter counter = new Counter();
        table.resolve(IncrementedTwice.class).get().route(counter, new IncrementedTwice());
        assertEquals("twice", counter.calls.get(0));
    }

    @Test
    public void subtype_falls_back_to_supertype_route() {
        RouteTable<Counter> onlyBase = RouteTable.builder(Counter.class)
                .on(Incremented.class, (c, e) -> c.calls.add("incremented"))
                .build();
        Counter counter = new Counter();
        onlyBase.resolve(IncrementedTwice.class).get().route(counter, new IncrementedTwice());
        assertEquals("incremented", counter.calls.get(0));
    }

    @Test
    public void apply_and_conflict_tables_are_disjoint() {
        assertFalse(table.resolve(Reset.class).isPresent());
        assertFalse(table.resolveConflict(Incremented.class).isPresent());
        assertTrue(table.resolveConflict(Reset.class).isPresent());
    }

    @Test
    public void registry_finds_table_of_superclass() {
        RouteRegistry registry = new RouteRegistry().register(table);
        SpecialCounter counter = new SpecialCounter();
        registry.resolve(counter, Incremented.class).get().route(counter, new Incremented());
        assertEquals("incremented", counter.calls.get(0));
        assertFalse(registry.resolve("not an aggregate", Incremented.class).isPresent());
    }

    @Test(expected = IllegalStateException.class)
    public void duplicate_registration_fails() {
        new RouteRegistry().register(table).register(RouteTable.builder(Counter.class).build());
    }
}
