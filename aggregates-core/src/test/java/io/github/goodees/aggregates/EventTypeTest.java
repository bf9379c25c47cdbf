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

import io.github.goodees.aggregates.example.order.event.ItemAddedEvent;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class EventTypeTest {

    @Test
    public void suffix_is_stripped() {
        assertEquals("ItemAdded", EventType.defaultTypeName(ItemAddedEvent.class));
        assertEquals("ItemAdded", new ItemAddedEvent().getType());
    }

    @Test
    public void bare_suffix_is_kept() {
        assertEquals("Event", EventType.defaultTypeName("Event"));
    }

    @Test
    public void prefix_is_stripped() {
        assertEquals("Added", EventType.fromSimpleClassnameStripping("ItemAddedEvent", "Item", "Event"));
    }
}
