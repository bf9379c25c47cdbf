package io.github.goodees.aggregates.store.inmemory;

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

import io.github.goodees.aggregates.uow.BagStore;
import io.github.goodees.aggregates.uow.ContextBag;
import io.github.goodees.aggregates.uow.SavedBag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bag store keeping bags in memory. Bags are copied on save, so later modifications of the bag are not visible.
 */
public class InMemoryBagStore implements BagStore {
    private final ConcurrentMap<String, Map<String, ContextBag>> storage = new ConcurrentHashMap<>();

    @Override
    public List<SavedBag> remove(String messageId) {
        Map<String, ContextBag> bags = storage.remove(messageId);
        if (bags == null) {
            return Collections.emptyList();
        }
        List<SavedBag> result = new ArrayList<>();
        synchronized (bags) {
            bags.forEach((kind, bag) -> result.add(new SavedBag(messageId, kind, new ContextBag(bag.asMap()))));
        }
        return result;
    }

    @Override
    public void save(String messageId, String kind, ContextBag bag) {
        storage.compute(messageId, (id, bags) -> {
            Map<String, ContextBag> result = bags == null ? Collections.synchronizedMap(new LinkedHashMap<>()) : bags;
            result.put(kind, new ContextBag(bag.asMap()));
            return result;
        });
    }

    public boolean contains(String messageId) {
        return storage.containsKey(messageId);
    }
}
