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
import java.util.Collections;
import java.util.List;

/**
 * Processing of a message failed, and so did ending some of its units of work. The original error is the cause,
 * compensation errors follow in the order they happened.
 */
public class UnitOfWorkException extends Exception {
    private final Throwable original;
    private final List<Throwable> compensationErrors;

    public UnitOfWorkException(Throwable original, List<? extends Throwable> compensationErrors) {
        super("Processing failed with " + original + ", and " + compensationErrors.size()
                + " unit(s) of work failed to end", original);
        this.original = original;
        this.compensationErrors = Collections.unmodifiableList(new ArrayList<>(compensationErrors));
        compensationErrors.forEach(this::addSuppressed);
    }

    public Throwable getOriginal() {
        return original;
    }

    public List<Throwable> getCompensationErrors() {
        return compensationErrors;
    }

    /**
     * All errors.
     * @return original error followed by compensation errors
     */
    public List<Throwable> getErrors() {
        List<Throwable> errors = new ArrayList<>(compensationErrors.size() + 1);
        errors.add(original);
        errors.addAll(compensationErrors);
        return errors;
    }
}
