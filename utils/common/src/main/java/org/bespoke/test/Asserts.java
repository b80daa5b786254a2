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
package org.bespoke.test;

import javax.annotation.Nullable;

import org.bespoke.util.exceptions.Exceptions;

/**
 * Assertion helpers for the expected-failure pattern:
 * <pre>
 * {@code
 * try {
 *     sut.checkout(0);
 *     Asserts.shouldHaveFailedPreviously();
 * } catch (CheckoutTimeoutRangeException e) {
 *     Asserts.expectedFailureContains(e, "not valid");
 * }
 * }
 * </pre>
 * Failures are reported as {@link AssertionError} so no test framework is needed on the classpath.
 */
public class Asserts {

    private Asserts() {}

    /** Throws an {@link AssertionError}; declared to return one so callers can write {@code throw Asserts.shouldHaveFailedPreviously()}. */
    public static AssertionError shouldHaveFailedPreviously() {
        throw new AssertionError("Should have failed previously");
    }

    public static AssertionError shouldHaveFailedPreviously(@Nullable Object result) {
        throw new AssertionError("Should have failed previously, but got " + result);
    }

    /** Rethrows the given exception unless its text (including causes) contains all the given phrases. */
    public static void expectedFailureContains(Throwable e, String phrase, String... more) {
        if (e instanceof AssertionError && "Should have failed previously".equals(e.getMessage())) throw (AssertionError) e;
        String text = fullText(e);
        checkContains(e, text, phrase);
        for (String p : more) {
            checkContains(e, text, p);
        }
    }

    /** Rethrows the given exception unless it, or something in its causal chain, is of the given type. */
    public static void expectedFailureOfType(Throwable e, Class<? extends Throwable> type) {
        if (Exceptions.getFirstThrowableOfType(e, type) == null) {
            throw new AssertionError("Expected failure of type " + type.getName() + " but got " + e, e);
        }
    }

    private static String fullText(Throwable e) {
        StringBuilder result = new StringBuilder();
        for (Throwable t : Exceptions.getCausalChain(e)) {
            result.append(t).append('\n');
        }
        return result.toString();
    }

    private static void checkContains(Throwable e, String text, String phrase) {
        if (!text.contains(phrase)) {
            throw new AssertionError("Expected failure containing '" + phrase + "' but got " + e, e);
        }
    }

}
