package io.github.goodees.aggregates.store.jdbc;

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

import io.github.goodees.aggregates.AggregateRepository;
import io.github.goodees.aggregates.RepositoryFactory;
import io.github.goodees.aggregates.SnapshotPolicy;
import io.github.goodees.aggregates.routing.RouteRegistry;
import io.github.goodees.aggregates.store.EventStoreException;
import org.junit.Test;

import java.util.Collections;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class JdbcRepositoryTest extends JdbcTest {

    private RepositoryFactory factory(SnapshotPolicy snapshotPolicy) {
        return RepositoryFactory.builder(eventStore, new RouteRegistry().register(Ledger.ROUTES))
                .snapshotPolicy(snapshotPolicy)
                .register(Ledger.class, Ledger::new)
                .build();
    }

    private AggregateRepository<Ledger, String> repository(SnapshotPolicy snapshotPolicy) {
        return factory(snapshotPolicy).forType(Ledger.class);
    }

    @Test
    public void aggregate_is_restored_from_jdbc_store() throws EventStoreException {
        AggregateRepository<Ledger, String> writer = repository(SnapshotPolicy.NEVER);
        Ledger ledger = writer.create(name());
        ledger.post("opening", 100);
        ledger.post("deposit", 50);
        writer.commit(UUID.randomUUID(), Collections.emptyMap());

        Ledger restored = repository(SnapshotPolicy.NEVER).get(name());
        assertEquals(150, restored.getTotal());
        assertEquals(2, restored.getVersion());
        assertFalse(restored.isRestoredFromSnapshot());
        assertDb(2, "select count(*) from event where stream = ?", "default." + name());
    }

    @Test
    public void snapshot_is_used_on_load() throws EventStoreException {
        AggregateRepository<Ledger, String> writer = repository(SnapshotPolicy.everyNEvents(2));
        Ledger ledger = writer.create(name());
        ledger.post("opening", 100);
        ledger.post("deposit", 50);
        writer.commit(UUID.randomUUID(), Collections.emptyMap());
        assertDb(1, "select count(*) from event where stream = ?", "default." + name() + ".SNAP");

        Ledger restored = repository(SnapshotPolicy.NEVER).get(name());
        assertTrue(restored.isRestoredFromSnapshot());
        assertEquals(150, restored.getTotal());
        assertEquals(2, restored.getVersion());
    }

    @Test
    public void concurrent_postings_are_merged() throws EventStoreException {
        AggregateRepository<Ledger, String> creator = repository(SnapshotPolicy.NEVER);
        creator.create(name()).post("opening", 100);
        creator.commit(UUID.randomUUID(), Collections.emptyMap());

        AggregateRepository<Ledger, String> first = repository(SnapshotPolicy.NEVER);
        AggregateRepository<Ledger, String> second = repository(SnapshotPolicy.NEVER);
        first.get(name()).post("first", 10);
        second.get(name()).post("second", 20);

        first.commit(UUID.randomUUID(), Collections.emptyMap());
        second.commit(UUID.randomUUID(), Collections.emptyMap());

        Ledger merged = second.get(name());
        assertEquals(1, merged.getMerged());
        assertEquals(130, merged.getTotal());
        Ledger restored = repository(SnapshotPolicy.NEVER).get(name());
        assertEquals(130, restored.getTotal());
        assertEquals(3, restored.getVersion());
    }
}
