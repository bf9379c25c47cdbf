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

/**
 * An immutable fact that happened to an aggregate. Events carry no identity of their own, they are positioned within
 * the {@linkplain io.github.goodees.aggregates.stream.EventStream event stream} of an aggregate, and are described by
 * the metadata attached at the time they were applied or raised.
 *
 * <p>Once an event is handed to an aggregate it must not be mutated anymore. {@link EventFactory} is the only place
 * where event instances are populated.
 */
public interface Event {

    /**
     * Type tag of the event, used for storage and diagnostics.
     * @return simple class name of the event without the Event suffix
     */
    default String getType() {
        return EventType.defaultTypeName(getClass());
    }
}
