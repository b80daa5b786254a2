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
package org.bespoke.util.repeat;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.concurrent.Callable;

import org.bespoke.util.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Predicate;
import com.google.common.base.Predicates;

/**
 * Simple mechanism to repeat an operation until it succeeds or a limit is reached.
 * <p>
 * <pre>
 * {@code
 * Repeater.create("ping " + host)
 *     .every(1)
 *     .limitIterationsTo(5)
 *     .retryOn(HostUnreachableException.class)
 *     .run(() -> agent.ping(host));
 * }
 * </pre>
 * Exceptions matched by {@link #retryOn(Class)} are swallowed until the last iteration, which rethrows
 * whatever the operation threw. Any other exception is rethrown immediately.
 */
public class Repeater {

    private static final Logger LOG = LoggerFactory.getLogger(Repeater.class);

    private final String description;
    private long periodSeconds = 1;
    private int iterationLimit = 1;
    private Predicate<? super Exception> retryable = Predicates.alwaysFalse();
    private Sleeper sleeper = Sleeper.SYSTEM;

    public static Repeater create(String description) {
        return new Repeater(description);
    }

    public Repeater(String description) {
        this.description = checkNotNull(description, "description");
    }

    /** Sets how long to wait between attempts. */
    public Repeater every(long seconds) {
        checkArgument(seconds >= 0, "period must not be negative: %s", seconds);
        this.periodSeconds = seconds;
        return this;
    }

    public Repeater limitIterationsTo(int iterationLimit) {
        checkArgument(iterationLimit > 0, "iteration limit must be positive: %s", iterationLimit);
        this.iterationLimit = iterationLimit;
        return this;
    }

    public Repeater retryOn(Class<? extends Exception> type) {
        this.retryable = Predicates.instanceOf(type);
        return this;
    }

    public Repeater sleeper(Sleeper sleeper) {
        this.sleeper = checkNotNull(sleeper, "sleeper");
        return this;
    }

    /**
     * Runs the body until it returns normally, or until the iteration limit is reached.
     *
     * @return the value of the first successful call
     */
    public <T> T run(Callable<T> body) throws Exception {
        Exception lastError = null;
        for (int iteration = 1; iteration <= iterationLimit; iteration++) {
            try {
                return body.call();
            } catch (Exception e) {
                if (!retryable.apply(e)) {
                    throw e;
                }
                lastError = e;
                if (iteration < iterationLimit) {
                    if (LOG.isDebugEnabled()) {
                        LOG.debug("{}: attempt {} of {} failed ({}); retrying in {}s",
                                new Object[] {description, iteration, iterationLimit, e.getMessage(), periodSeconds});
                    }
                    sleeper.sleepSeconds(periodSeconds);
                }
            }
        }
        checkState(lastError != null, "no attempt made for %s", description);
        throw lastError;
    }

    @Override
    public String toString() {
        return "Repeater[" + description + "]";
    }

}
