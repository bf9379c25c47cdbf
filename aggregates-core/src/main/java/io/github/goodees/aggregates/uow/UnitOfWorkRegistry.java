package io.github.goodees.aggregates.uow;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Units of work taking part in processing of every message. A new instance of each is created per message.
 */
public class UnitOfWorkRegistry {
    private final List<Supplier<? extends UnitOfWork>> factories = new CopyOnWriteArrayList<>();

    public UnitOfWorkRegistry register(Supplier<? extends UnitOfWork> factory) {
        factories.add(Objects.requireNonNull(factory, "Factory cannot be null"));
        return this;
    }

    /**
     * Create units of work for a message. Terminal units of work come first, otherwise registration order is kept.
     * @return units of work in the order they should begin
     */
    public List<UnitOfWork> create() {
        List<UnitOfWork> terminal = new ArrayList<>();
        List<UnitOfWork> other = new ArrayList<>();
        for (Supplier<? extends UnitOfWork> factory : factories) {
            UnitOfWork unit = factory.get();
            if (unit instanceof TerminalUnitOfWork) {
                terminal.add(unit);
            } else {
                other.add(unit);
            }
        }
        terminal.addAll(other);
        return terminal;
    }
}
