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
 * Thrown when a {@link Delegate} is invoked before it has been bound to a function or a member function.
 *
 * <p>This signals a programming error in the caller, not an environmental condition, so it is unchecked. Unbinding
 * a subscription that was never bound is not an error and never raises this exception.
 */
public class UnboundDelegateException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with the default message.
     */
    public UnboundDelegateException() {
        super("Delegate is not bound to a function or a member function");
    }

    /**
     * Creates an exception with the given detail message.
     * @param message the detail message
     */
    public UnboundDelegateException(String message) {
        super(message);
    }
}
