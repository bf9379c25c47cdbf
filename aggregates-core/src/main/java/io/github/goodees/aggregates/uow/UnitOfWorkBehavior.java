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

import io.github.goodees.aggregates.pipeline.Behavior;
import io.github.goodees.aggregates.pipeline.DelayedMessage;
import io.github.goodees.aggregates.pipeline.Headers;
import io.github.goodees.aggregates.pipeline.MessageContext;
import io.github.goodees.aggregates.pipeline.MessageIntent;
import io.github.goodees.aggregates.pipeline.Next;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs processing of a sent message within the registered units of work.
 *
 * <p>Units of work begin in the order given by {@link UnitOfWorkRegistry#create()}, and end in exactly reverse order.
 * Each unit of work starts with the bag it saved during previous failed attempt to process the message. Bags are saved
 * after every end, and removed once the whole cycle succeeds.
 *
 * <p>When beginning, processing or ending fails, remaining units of work end with the error. Their bags are saved even
 * if ending fails. Failures during this compensation are reported together with the original error in
 * {@link UnitOfWorkException}, otherwise the original error propagates unchanged.
 *
 * <p>A bulk message is processed as its delayed messages, one after another, each with its own headers, within a
 * single cycle.
 */
public class UnitOfWorkBehavior implements Behavior {
    private static final Logger logger = LoggerFactory.getLogger(UnitOfWorkBehavior.class);

    private final UnitOfWorkRegistry registry;
    private final BagStore bagStore;

    public UnitOfWorkBehavior(UnitOfWorkRegistry registry, BagStore bagStore) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.bagStore = Objects.requireNonNull(bagStore, "Bag store cannot be null");
    }

    @Override
    public void invoke(MessageContext context, Next next) throws Exception {
        if (!context.getIntent().filter(MessageIntent.SEND::equals).isPresent()) {
            next.invoke();
            return;
        }
        String messageId = context.getMessageId();
        logger.info("Processing message {} within units of work, retry {}", messageId, context.getRetries());
        // begun units of work, removed as they end
        List<UnitOfWork> begun = new ArrayList<>();
        // bags not written back since they were recovered or attached, by kind
        Map<String, ContextBag> unsaved = new LinkedHashMap<>();
        try {
            List<UnitOfWork> units = registry.create();
            unsaved.putAll(savedBags(messageId));
            for (UnitOfWork unit : units) {
                unit.setRetries(context.getRetries());
                ContextBag bag = unsaved.get(unit.getKind());
                if (bag == null) {
                    bag = new ContextBag();
                    unsaved.put(unit.getKind(), bag);
                }
                unit.setBag(bag);
            }
            for (UnitOfWork unit : units) {
                context.attach(unit);
                logger.debug("Beginning {} for message {}", unit.getKind(), messageId);
                unit.begin();
                begun.add(unit);
            }

            process(context, next);

            while (!begun.isEmpty()) {
                UnitOfWork unit = begun.remove(begun.size() - 1);
                logger.debug("Ending {} for message {}", unit.getKind(), messageId);
                endSuccessfully(messageId, unit, unsaved);
            }
            bagStore.remove(messageId);
        } catch (Exception e) {
            logger.warn("Processing of message {} failed, ending {} units of work", messageId, begun.size(), e);
            List<Throwable> compensationErrors = new ArrayList<>();
            while (!begun.isEmpty()) {
                UnitOfWork unit = begun.remove(begun.size() - 1);
                try {
                    unit.end(e);
                } catch (Exception endError) {
                    logger.error("Unit of work {} failed to end for message {}", unit.getKind(), messageId,
                        endError);
                    compensationErrors.add(endError);
                }
                saveDuringCompensation(messageId, unit.getKind(), unit.getBag(), unsaved, compensationErrors);
            }
            // units that never began keep their bags for the next attempt
            for (Map.Entry<String, ContextBag> entry : new ArrayList<>(unsaved.entrySet())) {
                saveDuringCompensation(messageId, entry.getKey(), entry.getValue(), unsaved, compensationErrors);
            }
            if (!compensationErrors.isEmpty()) {
                throw new UnitOfWorkException(e, compensationErrors);
            }
            throw e;
        } finally {
            context.detachAll();
        }
    }

    private Map<String, ContextBag> savedBags(String messageId) throws BagStoreException {
        Map<String, ContextBag> result = new HashMap<>();
        for (SavedBag bag : bagStore.remove(messageId)) {
            result.put(bag.getKind(), bag.getBag());
        }
        if (!result.isEmpty()) {
            logger.debug("Recovered bags of {} for message {}", result.keySet(), messageId);
        }
        return result;
    }

    private void process(MessageContext context, Next next) throws Exception {
        if (!context.isBulk()) {
            next.invoke();
            return;
        }
        logger.debug("Message {} delivers {} delayed messages", context.getMessageId(),
            context.getDelayedMessages().size());
        for (DelayedMessage delayed : context.getDelayedMessages()) {
            context.replaceHeaders(delayed.getHeaders());
            context.getHeaders().put(Headers.CHANNEL_KEY, delayed.getChannelKey());
            context.setMessage(delayed.getMessage());
            next.invoke();
        }
    }

    private void saveDuringCompensation(String messageId, String kind, ContextBag bag, Map<String, ContextBag> unsaved,
            List<Throwable> compensationErrors) {
        unsaved.remove(kind);
        try {
            bagStore.save(messageId, kind, bag);
        } catch (Exception saveError) {
            logger.error("Bag of {} could not be saved for message {}", kind, messageId, saveError);
            compensationErrors.add(saveError);
        }
    }

    private void endSuccessfully(String messageId, UnitOfWork unit, Map<String, ContextBag> unsaved)
            throws Exception {
        Exception failure = null;
        try {
            unit.end(null);
        } catch (Exception e) {
            failure = e;
        }
        try {
            bagStore.save(messageId, unit.getKind(), unit.getBag());
            unsaved.remove(unit.getKind());
        } catch (BagStoreException | RuntimeException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
