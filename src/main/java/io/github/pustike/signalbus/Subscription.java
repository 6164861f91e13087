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

import java.util.Objects;

/**
 * A subscriber method on a specific object, bound for one event type.
 *
 * <p>Subscriptions are compared by identity. Binding the same method on the same object twice yields two
 * subscriptions, and both receive every event.
 * @param <E> the event type
 */
final class Subscription<E> {
    /**
     * Creates a {@code Subscription} delivering events of {@code eventType} to {@code handler} on {@code subscriber}.
     */
    static <E, C> Subscription<E> create(Class<E> eventType, C subscriber, EventHandler<C, E> handler,
                                         MethodIdentity handlerIdentity) {
        Delegate<E, Void> delegate = new Delegate<>();
        delegate.bind(subscriber, handler, handlerIdentity);
        return new Subscription<>(eventType, delegate);
    }

    /** The exact event type this subscription was bound for. */
    private final Class<E> eventType;

    /** The delegate calling the subscriber method. */
    private final Delegate<E, Void> delegate;

    Subscription(Class<E> eventType, Delegate<E, Void> delegate) {
        this.eventType = Objects.requireNonNull(eventType);
        this.delegate = Objects.requireNonNull(delegate);
    }

    Class<E> getEventType() {
        return eventType;
    }

    /**
     * Delivers {@code event} to the subscriber method.
     * @throws UnboundDelegateException if the wrapped delegate was never bound
     */
    void dispatch(E event) {
        delegate.invoke(event);
    }

    boolean matches(Object subscriber, MethodIdentity handlerIdentity) {
        return delegate.matches(subscriber, handlerIdentity);
    }

    boolean isBoundTo(Object subscriber) {
        return delegate.isBoundTo(subscriber);
    }

    Object getTarget() {
        return delegate.getTarget();
    }

    @Override
    public String toString() {
        return "Subscription{eventType=" + eventType.getName() + ", " + delegate + "}";
    }
}
