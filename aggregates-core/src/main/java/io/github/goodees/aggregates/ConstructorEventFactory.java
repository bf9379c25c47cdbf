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

import java.lang.reflect.Constructor;
import java.util.function.Consumer;

/**
 * Event factory instantiating events through their no-argument constructor.
 */
public class ConstructorEventFactory implements EventFactory {

    @Override
    public <E extends Event> E create(Class<E> eventType, Consumer<? super E> mutator) {
        E event = instantiate(eventType);
        mutator.accept(event);
        return event;
    }

    protected <E extends Event> E instantiate(Class<E> eventType) {
        try {
            Constructor<E> constructor = eventType.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot instantiate event " + eventType.getName()
                    + ". Events need a no-argument constructor", e);
        }
    }
}
