/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.bespoke.util.exceptions;

import static com.google.common.base.Preconditions.checkNotNull;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.List;
import java.util.concurrent.ExecutionException;

import javax.annotation.Nullable;

import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

public class Exceptions {

    /** {@link Throwable} types whose existence is unhelpful in a <b>message</b>. */
    private static final List<Class<? extends Throwable>> BORING_MESSAGE_THROWABLE_SUPERTYPES = ImmutableList.<Class<? extends Throwable>>of(
        ExecutionException.class, InvocationTargetException.class, UndeclaredThrowableException.class, PropagatedRuntimeException.class);

    private static final List<Class<? extends Throwable>> BORING_PREFIX_THROWABLE_EXACT_TYPES = ImmutableList.<Class<? extends Throwable>>of(
        RuntimeException.class, Exception.class, Throwable.class,
        IllegalStateException.class, IllegalArgumentException.class);

    private Exceptions() {}

    private static boolean isBoringForMessage(Throwable t) {
        if (t.getCause() == null) return false;
        for (Class<? extends Throwable> type: BORING_MESSAGE_THROWABLE_SUPERTYPES) {
            if (type.isInstance(t)) return true;
        }
        return false;
    }

    /** Whether the type name of the given throwable adds nothing to a message. Null is treated as not boring. */
    public static boolean isPrefixBoring(@Nullable Throwable t) {
        if (t == null) return false;
        for (Class<? extends Throwable> type: BORING_PREFIX_THROWABLE_EXACT_TYPES) {
            if (t.getClass().equals(type)) return true;
        }
        return false;
    }

    /**
     * Propagate a {@link Throwable} as a {@link RuntimeException}.
     * <p>
     * Like Guava {@link Throwables#propagate(Throwable)} but:
     * <li> throws {@link RuntimeInterruptedException} to handle {@link InterruptedException}s; and
     * <li> wraps as PropagatedRuntimeException for easier filtering
     */
    public static RuntimeException propagate(Throwable throwable) {
        if (throwable instanceof InterruptedException) {
            throw new RuntimeInterruptedException((InterruptedException) throwable);
        } else if (throwable instanceof RuntimeInterruptedException) {
            Thread.currentThread().interrupt();
            throw (RuntimeInterruptedException) throwable;
        }
        Throwables.throwIfUnchecked(checkNotNull(throwable));
        throw new PropagatedRuntimeException(throwable);
    }

    /**
     * As {@link #propagate(Throwable)}, but the given message is included
     * when the {@link Throwable} needs to be wrapped.
     */
    public static RuntimeException propagate(String msg, Throwable throwable) {
        if (throwable instanceof InterruptedException) {
            throw new RuntimeInterruptedException(msg, (InterruptedException) throwable);
        } else if (throwable instanceof RuntimeInterruptedException) {
            Thread.currentThread().interrupt();
            throw (RuntimeInterruptedException) throwable;
        }
        Throwables.throwIfUnchecked(checkNotNull(throwable));
        throw new PropagatedRuntimeException(msg, throwable);
    }

    /**
     * Propagate exceptions which are fatal.
     * <p>
     * Propagates only those exceptions which one rarely (if ever) wants to capture,
     * such as {@link InterruptedException} and {@link Error}s.
     */
    public static void propagateIfFatal(Throwable throwable) {
        if (isFatal(throwable)) {
            throw propagate(throwable);
        }
    }

    /** True if the throwable is one which should never be swallowed by a catch-all. */
    public static boolean isFatal(Throwable throwable) {
        return (throwable instanceof InterruptedException)
                || (throwable instanceof RuntimeInterruptedException)
                || (throwable instanceof Error);
    }

    /** Returns the chain of causes, starting with the given throwable. */
    public static List<Throwable> getCausalChain(Throwable t) {
        return Throwables.getCausalChain(t);
    }

    /** Returns the first throwable of the given type in the causal chain, or null. */
    @Nullable
    public static <T extends Throwable> T getFirstThrowableOfType(Throwable from, Class<T> clazz) {
        return Iterables.getFirst(Iterables.filter(getCausalChain(from), clazz), null);
    }

    /**
     * Returns the message of the first _interesting_ element in the causal chain,
     * falling back to its class name when it has none.
     */
    public static String collapseText(Throwable t) {
        Throwable interesting = t;
        while (interesting.getCause() != null && isBoringForMessage(interesting)) {
            interesting = interesting.getCause();
        }
        String message = interesting.getMessage();
        if (Strings.isNullOrEmpty(message)) {
            return interesting.getClass().getName();
        }
        if (isPrefixBoring(interesting)) {
            return message;
        }
        return interesting.getClass().getSimpleName() + ": " + message;
    }

}
