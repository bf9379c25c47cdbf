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
 * Instantiates aggregates of a type. Usually a constructor reference, e. g. {@code Order::new}.
 * @param <A> type of aggregate
 * @param <ID> type of aggregate id
 */
@FunctionalInterface
public interface AggregateFactory<A extends AggregateRoot<ID>, ID> {
    A create(AggregateContext<ID> context);
}
