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
import java.util.function.Function;

/**
 * A type-safe callable that holds at most one target: a free function, or an instance together with one of its
 * methods.
 *
 * <p>A delegate starts out unbound. {@link #bind(Function)} or {@link #bind(Object, MemberFunction)} installs the
 * target, replacing any previous one, and {@link #invoke(Object)} calls it. Invoking an unbound delegate throws
 * {@link UnboundDelegateException}.
 *
 * <p>Delegates have value semantics: the {@linkplain #Delegate(Delegate) copy constructor} produces an independent
 * delegate bound to the same target, and two delegates are equal when they are bound to the same instance (compared
 * with {@code ==}) and the same member function. Member functions are compared by the method they reference and the
 * objects they captured, not by the function object, so {@code Listener::onEvent} written in two different places
 * denotes the same member function while {@code router1::route} and {@code router2::route} do not.
 *
 * <p>{@code equals} and {@code hashCode} follow the current binding, so a delegate must not be rebound while it is
 * stored as a key in a hash-based collection.
 *
 * <p>The bound instance is held by a strong reference. It stays reachable as long as the delegate, or a copy of it,
 * is reachable.
 *
 * <p>This class is not thread-safe; a delegate shared between threads must not be rebound concurrently.
 * @param <A> the argument type
 * @param <R> the result type, {@link Void} for event handlers
 */
public final class Delegate<A, R> {
    /** The bound instance, or {@code null} for free functions. */
    private Object target;

    /** The trampoline calling the bound function, or {@code null} while unbound. */
    private Invoker<A, R> invoker;

    /** The {@link MethodIdentity} of a bound member function, or the bound free function itself. */
    private Object identity;

    /**
     * Creates an unbound delegate.
     */
    public Delegate() {
    }

    /**
     * Creates a delegate bound to the same target as {@code other}.
     * @param other the delegate to copy
     */
    public Delegate(Delegate<A, R> other) {
        Objects.requireNonNull(other, "other");
        this.target = other.target;
        this.invoker = other.invoker;
        this.identity = other.identity;
    }

    /**
     * Binds this delegate to a free function, replacing any previous binding.
     * @param function the function to call on invocation
     */
    public void bind(Function<? super A, ? extends R> function) {
        Objects.requireNonNull(function, "function");
        this.target = null;
        this.invoker = (ignored, argument) -> function.apply(argument);
        this.identity = function;
    }

    /**
     * Binds this delegate to {@code method} on {@code instance}, replacing any previous binding.
     * @param instance the receiver of every invocation
     * @param method the method to call, usually an unbound method reference like {@code Listener::onEvent}
     * @param <C> the class declaring the method
     */
    public <C> void bind(C instance, MemberFunction<C, A, R> method) {
        bind(instance, method, MethodIdentity.of(method));
    }

    <C> void bind(C instance, MemberFunction<C, A, R> method, MethodIdentity methodIdentity) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(method, "method");
        this.target = instance;
        this.invoker = (boundTarget, argument) -> {
            @SuppressWarnings("unchecked")
            C receiver = (C) boundTarget;
            return method.apply(receiver, argument);
        };
        this.identity = Objects.requireNonNull(methodIdentity);
    }

    /**
     * Calls the bound function with {@code argument}.
     * @param argument the argument to pass
     * @return the result of the bound function
     * @throws UnboundDelegateException if this delegate has not been bound
     */
    public R invoke(A argument) {
        if (invoker == null) {
            throw new UnboundDelegateException();
        }
        return invoker.invoke(target, argument);
    }

    /**
     * Returns whether a function or member function has been bound.
     */
    public boolean isBound() {
        return invoker != null;
    }

    /**
     * Returns whether this delegate is bound to {@code method} on exactly {@code instance}.
     * @param instance the instance to compare by identity
     * @param method the member function to compare by the method it references
     * @param <C> the class declaring the method
     * @return {@code true} if both the instance and the method match
     */
    public <C> boolean matches(C instance, MemberFunction<C, A, R> method) {
        return isBoundTo(instance) && matches(instance, MethodIdentity.of(method));
    }

    /**
     * Returns whether this delegate is bound to the free function {@code function}, compared by identity.
     * @param function the function to compare
     * @return {@code true} if this delegate was bound with that very function object
     */
    public boolean matches(Function<?, ?> function) {
        return invoker != null && target == null && identity == function;
    }

    boolean matches(Object instance, MethodIdentity methodIdentity) {
        return invoker != null && target == instance && methodIdentity.equals(identity);
    }

    boolean isBoundTo(Object instance) {
        return target != null && target == instance;
    }

    Object getTarget() {
        return target;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(target) + Objects.hashCode(identity);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Delegate) {
            Delegate<?, ?> that = (Delegate<?, ?>) obj;
            // Use == on the target so that distinct but equal instances remain different bindings
            return target == that.target && Objects.equals(identity, that.identity);
        }
        return false;
    }

    @Override
    public String toString() {
        if (invoker == null) {
            return "Delegate{unbound}";
        }
        if (target == null) {
            return "Delegate{function=" + identity + "}";
        }
        return "Delegate{target=" + target.getClass().getName() + "@"
                + Integer.toHexString(System.identityHashCode(target)) + ", method=" + identity + "}";
    }

    /**
     * Fixed-shape dispatch function, chosen at bind time.
     */
    @FunctionalInterface
    private interface Invoker<A, R> {
        R invoke(Object target, A argument);
    }
}
