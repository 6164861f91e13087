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

import java.lang.invoke.SerializedLambda;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The identity of the function behind a {@link MemberFunction}: the method it calls, together with the values it
 * captured.
 *
 * <p>Each method reference expression compiles to its own lambda class, so comparing the function objects would
 * treat {@code Listener::onEvent} written in two places as two different methods. The identity is therefore read
 * from the {@link SerializedLambda} form of the reference, which names the implementation method and lists the
 * captured arguments. Captured arguments are compared with {@code ==}, boxed primitives by value, so {@code router1::route} and
 * {@code router2::route} are different functions, as are two evaluations of a lambda that captured different
 * objects.
 *
 * <p>References that are not lambdas (a named or anonymous class implementing the interface), and lambdas whose
 * serialized form cannot be read, are identified by the function object itself.
 */
final class MethodIdentity {
    private static final Logger logger = LoggerFactory.getLogger(MethodIdentity.class);

    private static final Object[] NO_CAPTURES = new Object[0];

    /** The {@code writeReplace} method of each lambda class, looked up once per class. */
    private static final ClassValue<Optional<Method>> WRITE_REPLACE = new ClassValue<>() {
        @Override
        protected Optional<Method> computeValue(Class<?> type) {
            try {
                Method method = type.getDeclaredMethod("writeReplace");
                method.setAccessible(true);
                return Optional.of(method);
            } catch (NoSuchMethodException e) {
                return Optional.empty();
            } catch (InaccessibleObjectException | SecurityException e) {
                logger.warn("Cannot access writeReplace of {}; its functions can only be unbound with the same "
                        + "function object that was bound", type.getName(), e);
                return Optional.empty();
            }
        }
    };

    private final String declaringClass;
    private final String methodName;
    private final String descriptor;
    private final Object[] capturedArgs;
    private final int hashCode;

    MethodIdentity(String declaringClass, String methodName, String descriptor) {
        this(declaringClass, methodName, descriptor, NO_CAPTURES);
    }

    MethodIdentity(String declaringClass, String methodName, String descriptor, Object[] capturedArgs) {
        this.declaringClass = Objects.requireNonNull(declaringClass);
        this.methodName = Objects.requireNonNull(methodName);
        this.descriptor = Objects.requireNonNull(descriptor);
        this.capturedArgs = capturedArgs.clone();
        int result = Objects.hash(declaringClass, methodName, descriptor);
        for (Object capturedArg : this.capturedArgs) {
            result = 31 * result + (isBoxedPrimitive(capturedArg)
                    ? capturedArg.hashCode() : System.identityHashCode(capturedArg));
        }
        this.hashCode = result;
    }

    /**
     * Resolves the identity of the function {@code reference}.
     * @throws IllegalArgumentException if the serialized form of a lambda cannot be obtained
     */
    static MethodIdentity of(MemberFunction<?, ?, ?> reference) {
        Objects.requireNonNull(reference, "reference");
        Optional<Method> writeReplace = WRITE_REPLACE.get(reference.getClass());
        if (writeReplace.isEmpty()) {
            return forInstance(reference);
        }
        Object replacement;
        try {
            replacement = writeReplace.get().invoke(reference);
        } catch (IllegalAccessException e) {
            throw new IllegalArgumentException("Member reference became inaccessible: " + reference, e);
        } catch (InvocationTargetException e) {
            throw new IllegalArgumentException("Cannot resolve member reference: " + reference, e.getCause());
        }
        if (replacement instanceof SerializedLambda) {
            SerializedLambda lambda = (SerializedLambda) replacement;
            Object[] capturedArgs = new Object[lambda.getCapturedArgCount()];
            for (int i = 0; i < capturedArgs.length; i++) {
                capturedArgs[i] = lambda.getCapturedArg(i);
            }
            return new MethodIdentity(lambda.getImplClass().replace('/', '.'), lambda.getImplMethodName(),
                    lambda.getImplMethodSignature(), capturedArgs);
        }
        return forInstance(reference);
    }

    private static MethodIdentity forInstance(MemberFunction<?, ?, ?> reference) {
        return new MethodIdentity(reference.getClass().getName(), "apply", "", new Object[] {reference});
    }

    String getDeclaringClass() {
        return declaringClass;
    }

    String getMethodName() {
        return methodName;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof MethodIdentity) {
            MethodIdentity that = (MethodIdentity) obj;
            return declaringClass.equals(that.declaringClass) && methodName.equals(that.methodName)
                    && descriptor.equals(that.descriptor) && sameCapturedArgs(that.capturedArgs);
        }
        return false;
    }

    private boolean sameCapturedArgs(Object[] otherCapturedArgs) {
        if (capturedArgs.length != otherCapturedArgs.length) {
            return false;
        }
        for (int i = 0; i < capturedArgs.length; i++) {
            // captured receivers and values are compared by identity, like bound subscribers
            Object capturedArg = capturedArgs[i];
            if (capturedArg != otherCapturedArgs[i]
                    && !(isBoxedPrimitive(capturedArg) && capturedArg.equals(otherCapturedArgs[i]))) {
                return false;
            }
        }
        return true;
    }

    /** Captured primitives are boxed anew on each read. */
    private static boolean isBoxedPrimitive(Object value) {
        return value instanceof Number || value instanceof Character || value instanceof Boolean;
    }

    @Override
    public String toString() {
        if (capturedArgs.length == 0) {
            return declaringClass + "::" + methodName + descriptor;
        }
        return declaringClass + "::" + methodName + descriptor + " capturing " + capturedArgs.length + " value(s)";
    }
}
