package io.github.goodees.aggregates.pipeline;

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
 * Chain of behaviors ending with a message handler.
 */
public class Pipeline {
    private final List<Behavior> behaviors;
    private final MessageHandler handler;

    public Pipeline(List<Behavior> behaviors, MessageHandler handler) {
        this.behaviors = Collections.unmodifiableList(new ArrayList<>(behaviors));
        this.handler = handler;
    }

    public void process(MessageContext context) throws Exception {
        invoke(0, context);
    }

    private void invoke(int stage, MessageContext context) throws Exception {
        if (stage == behaviors.size()) {
            handler.handle(context.getMessage(), context);
        } else {
            behaviors.get(stage).invoke(context, () -> invoke(stage + 1, context));
        }
    }
}
