/*
 * Copyright (C) 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.github.pustike.signalbus;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Registry of subscriptions to a single event bus, indexed by exact event type.
 *
 * <p>All changes to the list of one event type go through {@link ConcurrentMap#compute} or
 * {@link ConcurrentMap#computeIfPresent}, so they are serialized per type and the entry of a type is present exactly
 * when its list is not empty.
 */
final class SubscriptionRegistry {
    /**
     * All registered subscriptions, indexed by event type.
     *
     * <p>The {@link CopyOnWriteArrayList} values keep registration order and make it cheap to get an immutable snapshot
     * of the current subscriptions to an event type without any locking.
     */
    private final ConcurrentMap<Class<?>, Subscriptions<?>> subscriptions = new ConcurrentHashMap<>();

    /**
     * Appends {@code subscription} to the list for its event type, creating the list on first use.
     */
    <E> void register(Subscription<E> subscription) {
        Class<E> eventType = subscription.getEventType();
        subscriptions.compute(eventType, (type, existing) -> {
            Subscriptions<E> eventSubscriptions = existing == null
                    ? new Subscriptions<>(eventType) : cast(existing, eventType);
            eventSubscriptions.entries.add(subscription);
            return eventSubscriptions;
        });
    }

    /**
     * Removes every subscription of {@code eventType} bound to {@code handlerIdentity} on {@code subscriber}.
     * @return the number of subscriptions removed
     */
    int unregister(Class<?> eventType, Object subscriber, MethodIdentity handlerIdentity) {
        return removeIf(eventType, subscription -> subscription.matches(subscriber, handlerIdentity));
    }

    /**
     * Removes every subscription targeting {@code subscriber}, whatever its event type.
     * @return the number of subscriptions removed
     */
    int unregisterAll(Object subscriber) {
        int removed = 0;
        for (Class<?> eventType : subscriptions.keySet()) {
            removed += removeIf(eventType, subscription -> subscription.isBoundTo(subscriber));
        }
        return removed;
    }

    private int removeIf(Class<?> eventType, Predicate<Subscription<?>> filter) {
        AtomicInteger removed = new AtomicInteger();
        subscriptions.computeIfPresent(eventType, (type, existing) -> {
            int sizeBefore = existing.entries.size();
            existing.entries.removeIf(filter);
            removed.set(sizeBefore - existing.entries.size());
            // the entry of a type is dropped only once nothing is left in it
            return existing.entries.isEmpty() ? null : existing;
        });
        return removed.get();
    }

    /**
     * Gets an iterator representing an immutable snapshot of all subscriptions to the given event type at the time
     * this method is called.
     */
    <E> Iterator<Subscription<E>> getSubscriptions(Class<E> eventType) {
        Subscriptions<?> eventSubscriptions = subscriptions.get(eventType);
        if (eventSubscriptions == null) {
            return Collections.emptyIterator();
        }
        return cast(eventSubscriptions, eventType).entries.iterator();
    }

    boolean hasSubscriptions(Class<?> eventType) {
        return subscriptions.containsKey(eventType);
    }

    /**
     * Clear all subscriptions.
     */
    void clear() {
        subscriptions.clear();
    }

    List<Subscription<?>> getSubscriptionsForTesting(Class<?> eventType) {
        Subscriptions<?> eventSubscriptions = subscriptions.get(eventType);
        if (eventSubscriptions == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(eventSubscriptions.entries);
    }

    Set<Class<?>> getEventTypesForTesting() {
        return Collections.unmodifiableSet(subscriptions.keySet());
    }

    @SuppressWarnings("unchecked")
    private static <E> Subscriptions<E> cast(Subscriptions<?> eventSubscriptions, Class<E> eventType) {
        if (eventSubscriptions.eventType != eventType) {
            throw new AssertionError("Subscriptions of " + eventSubscriptions.eventType.getName()
                    + " stored under " + eventType.getName());
        }
        return (Subscriptions<E>) eventSubscriptions;
    }

    /**
     * The subscriptions to one event type, in registration order.
     */
    private static final class Subscriptions<E> {
        private final Class<E> eventType;
        private final CopyOnWriteArrayList<Subscription<E>> entries = new CopyOnWriteArrayList<>();

        private Subscriptions(Class<E> eventType) {
            this.eventType = Objects.requireNonNull(eventType);
        }
    }
}
