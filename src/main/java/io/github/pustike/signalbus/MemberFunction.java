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

import java.io.Serializable;

/**
 * A reference to a single-argument method declared on {@code C}, usually written as an unbound method reference such
 * as {@code Listener::onEvent}.
 *
 * <p>The interface is {@link Serializable} so that the method behind a method reference can be recovered at runtime.
 * Two references to the same method are treated as the same member function even when they are written at different
 * places in the code, see {@link MethodIdentity}.
 * @param <C> the class declaring the method
 * @param <A> the argument type
 * @param <R> the return type
 */
@FunctionalInterface
public interface MemberFunction<C, A, R> extends Serializable {
    /**
     * Calls the referenced method on {@code instance}.
     * @param instance the receiver of the call
     * @param argument the single argument
     * @return the value returned by the method
     */
    R apply(C instance, A argument);
}
