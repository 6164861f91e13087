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
/**
 * Pustike SignalBus is a typed, synchronous, in-process event bus derived from Pustike EventBus, itself a fork of
 * <a href= "https://github.com/google/guava/wiki/EventBusExplained">Guava EventBus</a>.
 *
 * <p>Instead of scanning subscribers for annotated methods, subscribers are bound explicitly, one method reference at
 * a time, to an exact event type:
 * <pre>{@code
 * EventBus bus = new EventBus("ui");
 * bus.bind(StringEvent.class, console, Console::print);
 * bus.emit(new StringEvent("Test1"));
 * bus.unbind(StringEvent.class, console, Console::print);
 * }</pre>
 *
 * <p>The building block is {@link io.github.pustike.signalbus.Delegate}, a copyable callable bound either to a free
 * function or to an instance and one of its methods, which can tell whether it is bound to a given instance and
 * method. Other differences to Pustike EventBus: <li>Events are routed by exact type, without supertype delivery
 * <li>Subscriber exceptions propagate to the emitting caller <li>Subscribers are held by strong references
 * <li>The same method can be bound several times, and is then called several times
 */
package io.github.pustike.signalbus;
