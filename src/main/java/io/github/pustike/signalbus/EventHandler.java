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

/**
 * A {@link MemberFunction} that accepts an event and returns nothing, the shape of every subscriber method bound to
 * an {@link EventBus}.
 *
 * <pre>{@code
 * bus.bind(StringEvent.class, console, Console::print);
 * }</pre>
 * @param <C> the subscriber class declaring the method
 * @param <E> the event type
 */
@FunctionalInterface
public interface EventHandler<C, E> extends MemberFunction<C, E, Void> {
    /**
     * Delivers {@code event} to {@code subscriber}.
     * @param subscriber the object whose method is called
     * @param event the event being emitted
     */
    void handle(C subscriber, E event);

    @Override
    default Void apply(C instance, E argument) {
        handle(instance, argument);
        return null;
    }
}
