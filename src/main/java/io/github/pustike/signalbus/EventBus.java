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

import java.util.Iterator;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches events to subscriber methods, and provides ways for subscribers to bind and unbind those methods.
 *
 * <p>The EventBus allows publish-subscribe-style communication between components without requiring the components to
 * explicitly register with one another (and thus be aware of each other). It is an in-process, synchronous mechanism,
 * <em>not</em> a general-purpose publish-subscribe system, nor is it intended for interprocess communication.
 *
 * <h2>Receiving Events</h2> <p>To receive events, an object binds one of its methods that accepts a single argument
 * of the event type, using an unbound method reference:
 * <pre>{@code
 * bus.bind(StringEvent.class, console, Console::print);
 * }</pre>
 * The same method can be bound more than once; every binding receives every event. {@link #unbind} removes all
 * bindings of that method on that object, and {@link #unbindAll(Object)} removes all bindings of the object.
 *
 * <h2>Emitting Events</h2> <p>To emit an event, provide the event object to {@link #emit(Object)}. Events are routed
 * by <em>exact</em> type: a subscriber bound to {@code Object} does not receive a {@code String}. Use
 * {@link #emit(Class, Object)} to emit an instance of a subclass under one of its supertypes.
 *
 * <p>When {@code emit} is called, the subscribers bound at that moment are called in sequence, in the order they were
 * bound, on the calling thread, before {@code emit} returns. A subscriber that binds or unbinds during delivery
 * affects only later events. A subscriber that emits during delivery has the nested event delivered immediately.
 * Emitting an event nobody subscribed to does nothing.
 *
 * <p>Exceptions thrown by subscribers are not caught: they propagate to the caller of {@code emit}, and the remaining
 * subscribers do not receive that event.
 *
 * <p>The bus keeps strong references to bound subscribers; unbind them, or {@linkplain #close() close} the bus, when
 * they are no longer needed.
 *
 * <p>This class is safe for concurrent use.
 */
public final class EventBus {
    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    // the identifier for this event bus
    private final String identifier;
    private final SubscriptionRegistry subscriptionRegistry;

    /**
     * Creates a new EventBus named "default".
     */
    public EventBus() {
        this("default");
    }

    /**
     * Creates a new EventBus with the given {@code identifier}.
     * @param identifier a brief name for this bus, for logging purposes.
     */
    public EventBus(String identifier) {
        this.identifier = Objects.requireNonNull(identifier);
        this.subscriptionRegistry = new SubscriptionRegistry();
    }

    /**
     * Returns the identifier for this event bus.
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * Binds {@code handler} on {@code subscriber} to events of exactly {@code eventType}. The subscriber is appended
     * after every subscriber already bound to that type. Binding the same handler on the same subscriber again adds
     * a second, independent subscription.
     * @param eventType the type of event to receive
     * @param subscriber the object whose method is called
     * @param handler the method to call, for example {@code Console::print}
     * @param <E> the event type
     * @param <C> the subscriber type
     */
    public <E, C> void bind(Class<E> eventType, C subscriber, EventHandler<C, E> handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(subscriber, "subscriber");
        Objects.requireNonNull(handler, "handler");
        MethodIdentity handlerIdentity = MethodIdentity.of(handler);
        subscriptionRegistry.register(Subscription.create(eventType, subscriber, handler, handlerIdentity));
        logger.debug("Bound {} on {} to {} in bus {}", handlerIdentity, subscriber, eventType.getName(), identifier);
    }

    /**
     * Unbinds every subscription of {@code handler} on {@code subscriber} for {@code eventType}. Does nothing if there
     * is none.
     *
     * <p>A handler matches when it calls the same method and captured the same objects, compared by identity: a
     * method reference like {@code Console::print} written anywhere matches, while {@code router1::route} does not
     * match {@code router2::route}. A handler class that is not a lambda, or a lambda declared in a module that does
     * not open its package to this library, only matches the very handler object that was bound.
     * @param eventType the type of event the handler was bound to
     * @param subscriber the object the handler was bound on, compared by identity
     * @param handler the method that was bound
     * @param <E> the event type
     * @param <C> the subscriber type
     */
    public <E, C> void unbind(Class<E> eventType, C subscriber, EventHandler<C, E> handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(subscriber, "subscriber");
        Objects.requireNonNull(handler, "handler");
        MethodIdentity handlerIdentity = MethodIdentity.of(handler);
        int removed = subscriptionRegistry.unregister(eventType, subscriber, handlerIdentity);
        logger.debug("Unbound {} subscription(s) of {} on {} from {} in bus {}", removed, handlerIdentity, subscriber,
                eventType.getName(), identifier);
    }

    /**
     * Unbinds all subscriptions of {@code subscriber}, for every event type.
     * @param subscriber the object whose subscriptions should be removed, compared by identity
     */
    public void unbindAll(Object subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        int removed = subscriptionRegistry.unregisterAll(subscriber);
        logger.debug("Unbound all {} subscription(s) of {} in bus {}", removed, subscriber, identifier);
    }

    /**
     * Emits {@code event} to every subscriber bound to the exact runtime class of the event.
     * @param event event to emit.
     */
    public void emit(Object event) {
        Objects.requireNonNull(event, "event");
        dispatch(event.getClass(), event);
    }

    /**
     * Emits {@code event} to every subscriber bound to exactly {@code eventType}.
     * @param eventType the type the event is emitted as
     * @param event event to emit.
     * @param <E> the event type
     * @throws IllegalArgumentException if {@code event} is not an instance of {@code eventType}
     */
    public <E> void emit(Class<E> eventType, E event) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(event, "event");
        if (!eventType.isInstance(event)) {
            String message = "Event of type %s cannot be emitted as %s";
            throw new IllegalArgumentException(String.format(message, event.getClass().getName(),
                    eventType.getName()));
        }
        dispatch(eventType, event);
    }

    private <E> void dispatch(Class<E> eventType, Object event) {
        Iterator<Subscription<E>> eventSubscriptions = subscriptionRegistry.getSubscriptions(eventType);
        if (!eventSubscriptions.hasNext()) {
            logger.trace("No subscribers for {} in bus {}", eventType.getName(), identifier);
            return;
        }
        E typedEvent = eventType.cast(event);
        while (eventSubscriptions.hasNext()) {
            Subscription<E> subscription = eventSubscriptions.next();
            try {
                subscription.dispatch(typedEvent);
            } catch (RuntimeException | Error e) {
                logger.debug("{} failed on {} in bus {}, abandoning this emit", subscription, typedEvent,
                        identifier, e);
                throw e;
            }
        }
    }

    /**
     * Returns whether any subscriber is bound to exactly {@code eventType}.
     * @param eventType the event type
     */
    public boolean hasSubscribers(Class<?> eventType) {
        return subscriptionRegistry.hasSubscriptions(Objects.requireNonNull(eventType));
    }

    /**
     * Unbinds all subscribers.
     */
    public void close() {
        subscriptionRegistry.clear();
        logger.debug("Closed bus {}", identifier);
    }

    SubscriptionRegistry registry() {
        return subscriptionRegistry;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{identifier=" + identifier + "}";
    }
}
