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

/**
 * Names of message and commit headers understood by the library.
 */
public final class Headers {
    /**
     * Intent of the message, value of {@link MessageIntent#getHeaderValue()}.
     */
    public static final String MESSAGE_INTENT = "MessageIntent";
    /**
     * Present on a message that delivers a batch of delayed messages.
     */
    public static final String BULK = "Bulk";
    /**
     * Channel the delayed message was originally delivered through.
     */
    public static final String CHANNEL_KEY = "ChannelKey";
    public static final String MESSAGE_ID = "MessageId";
    public static final String COMMIT_ID = "CommitId";
    public static final String RETRIES = "Retries";

    private Headers() {
    }
}
