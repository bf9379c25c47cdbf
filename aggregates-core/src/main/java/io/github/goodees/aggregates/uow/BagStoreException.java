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
 * Storing or fetching of unit of work bags failed.
 */
public class BagStoreException extends Exception {

    public BagStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public static BagStoreException saveFailed(String messageId, String kind, Throwable cause) {
        return new BagStoreException("Saving bag of " + kind + " for message " + messageId + " failed. "
                + cause.getMessage(), cause);
    }

    public static BagStoreException removeFailed(String messageId, Throwable cause) {
        return new BagStoreException("Removing bags of message " + messageId + " failed. " + cause.getMessage(),
                cause);
    }
}
