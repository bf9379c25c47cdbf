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

class RecordingUnitOfWork extends AbstractUnitOfWork {
    private final String kind;
    private final List<String> log;
    Exception failOnBegin;
    Exception failOnEnd;
    Throwable endedWith;
    int ends;

    RecordingUnitOfWork(String kind, List<String> log) {
        this.kind = kind;
        this.log = log;
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public void begin() throws Exception {
        log.add("begin " + kind);
        if (failOnBegin != null) {
            throw failOnBegin;
        }
    }

    @Override
    public void end(Throwable error) throws Exception {
        log.add("end " + kind);
        endedWith = error;
        ends++;
        if (failOnEnd != null) {
            throw failOnEnd;
        }
    }

    static class Terminal extends RecordingUnitOfWork implements TerminalUnitOfWork {
        Terminal(String kind, List<String> log) {
            super(kind, log);
        }
    }
}
