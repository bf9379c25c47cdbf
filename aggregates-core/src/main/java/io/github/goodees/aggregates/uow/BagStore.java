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

import java.util.List;

/**
 * Durable storage of unit of work bags, keyed by message id and unit of work kind.
 */
public interface BagStore {

    /**
     * Fetch and remove all bags of a message in one step.
     * @param messageId id of the message
     * @return bags saved for the message, empty when none
     * @throws BagStoreException when storage fails
     */
    List<SavedBag> remove(String messageId) throws BagStoreException;

    /**
     * Store bag of a unit of work, replacing previous one.
     * @param messageId id of the message
     * @param kind kind of the unit of work
     * @param bag the bag
     * @throws BagStoreException when storage fails
     */
    void save(String messageId, String kind, ContextBag bag) throws BagStoreException;
}
