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

import java.util.Optional;

/**
 * Finds the routes of an aggregate. Every aggregate type has two disjoint tables, one for applying events and one for
 * resolving conflicts.
 *
 * <p>The two lookups interpret absence differently. A missing apply route means the event does not change state
 * and is skipped silently, while a missing conflict route means the event cannot be merged.
 */
public interface RouteResolver {

    /**
     * Resolve the route applying an event.
     * @param aggregate aggregate instance
     * @param eventType type of the event
     * @return route, or empty when the event carries no state change for the aggregate
     */
    Optional<Route<Object>> resolve(Object aggregate, Class<? extends Event> eventType);

    /**
     * Resolve the route merging an event that conflicts with concurrently stored history.
     * @param aggregate aggregate instance
     * @param eventType type of the event
     * @return route, or empty when the conflict cannot be resolved
     */
    Optional<Route<Object>> resolveConflict(Object aggregate, Class<? extends Event> eventType);
}
