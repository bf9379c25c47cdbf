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
 * A participant in processing of an inbound message. Units of work begin before the message is handled and end after
 * it, in reverse order. {@link #end(Throwable)} receives the error that failed the processing, if any.
 *
 * <p>Partial progress that must survive redelivery of the message is kept in the {@linkplain #getBag() bag}. The bag
 * is saved whenever the unit of work ends, whether successfully or not.
 * @see UnitOfWorkBehavior
 */
public interface UnitOfWork {

    /**
     * Identity of the unit of work, under which its bag is stored.
     * @return kind, class name by default
     */
    default String getKind() {
        return getClass().getName();
    }

    ContextBag getBag();

    void setBag(ContextBag bag);

    /**
     * Number of previous attempts to process current message.
     * @return retry count
     */
    int getRetries();

    void setRetries(int retries);

    void begin() throws Exception;

    /**
     * End processing.
     * @param error error that failed processing, null on success
     * @throws Exception when ending fails
     */
    void end(Throwable error) throws Exception;
}
