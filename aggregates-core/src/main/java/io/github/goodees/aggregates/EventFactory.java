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

import java.util.function.Consumer;

/**
 * Creates event instances. Aggregates never instantiate events themselves, they describe what the event should contain
 * and let the factory produce it.
 */
@FunctionalInterface
public interface EventFactory {

    /**
     * Create and populate an event.
     * @param eventType class of the event
     * @param mutator populates the freshly created instance
     * @param <E> type of the event
     * @return populated event
     * @throws IllegalArgumentException when the event type cannot be instantiated
     */
    <E extends Event> E create(Class<E> eventType, Consumer<? super E> mutator);
}
