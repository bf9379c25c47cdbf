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

/**
 * Base for units of work, keeping the bag and the retry count.
 */
public abstract class AbstractUnitOfWork implements UnitOfWork {
    private ContextBag bag = new ContextBag();
    private int retries;

    @Override
    public ContextBag getBag() {
        return bag;
    }

    @Override
    public void setBag(ContextBag bag) {
        this.bag = bag;
    }

    @Override
    public int getRetries() {
        return retries;
    }

    @Override
    public void setRetries(int retries) {
        this.retries = retries;
    }

    @Override
    public void begin() throws Exception {
    }
}
