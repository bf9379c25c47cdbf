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

import java.util.Objects;

/**
 * Event carrying the state of an aggregate at certain version. Snapshots are kept in a separate stream and spare
 * replaying of the whole history.
 */
public final class Snapshot implements Event {
    private final long version;
    private final Object state;

    public Snapshot(long version, Object state) {
        this.version = version;
        this.state = Objects.requireNonNull(state, "Snapshot state cannot be null");
    }

    /**
     * Version of the aggregate stream the snapshot reflects.
     * @return stream version
     */
    public long getVersion() {
        return version;
    }

    public Object getState() {
        return state;
    }

    @Override
    public String getType() {
        return "Snapshot";
    }
}
