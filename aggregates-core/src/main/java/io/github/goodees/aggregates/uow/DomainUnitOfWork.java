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

import io.github.goodees.aggregates.AggregateRepository;
import io.github.goodees.aggregates.AggregateRoot;
import io.github.goodees.aggregates.RepositoryFactory;
import io.github.goodees.aggregates.pipeline.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Unit of work committing aggregates changed while processing a message. Handlers obtain repositories through
 * {@link #repository(Class)}, and all of them are committed when processing succeeds.
 *
 * <p>The commit id is kept in the bag, so that all attempts to process a message write under the same id.
 */
public class DomainUnitOfWork extends AbstractUnitOfWork {
    static final String COMMIT_ID = "CommitId";
    private static final Logger logger = LoggerFactory.getLogger(DomainUnitOfWork.class);

    private final RepositoryFactory repositoryFactory;
    private final Map<Class<?>, AggregateRepository<?, ?>> repositories = new LinkedHashMap<>();
    private UUID commitId;

    public DomainUnitOfWork(RepositoryFactory repositoryFactory) {
        this.repositoryFactory = repositoryFactory;
    }

    public UUID getCommitId() {
        return commitId;
    }

    @Override
    public void begin() {
        this.commitId = getBag().get(COMMIT_ID, String.class).map(UUID::fromString).orElseGet(UUID::randomUUID);
        getBag().put(COMMIT_ID, commitId.toString());
    }

    @SuppressWarnings("unchecked")
    public <A extends AggregateRoot<ID>, ID> AggregateRepository<A, ID> repository(Class<A> aggregateType) {
        return (AggregateRepository<A, ID>) repositories.computeIfAbsent(aggregateType,
            t -> repositoryFactory.forType(aggregateType));
    }

    @Override
    public void end(Throwable error) throws Exception {
        if (error != null) {
            logger.debug("Discarding changes of commit {} after {}", commitId, error.toString());
            repositories.values().forEach(AggregateRepository::discard);
            return;
        }
        Map<String, String> headers = Collections.singletonMap(Headers.RETRIES, String.valueOf(getRetries()));
        for (AggregateRepository<?, ?> repository : repositories.values()) {
            repository.commit(commitId, headers);
        }
        logger.debug("Commit {} written by {} repositories", commitId, repositories.size());
    }
}
