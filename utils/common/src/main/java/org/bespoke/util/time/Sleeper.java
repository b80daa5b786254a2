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
package org.bespoke.util.time;

import java.util.concurrent.TimeUnit;

import org.bespoke.util.exceptions.Exceptions;

/**
 * Blocks the calling thread for a whole number of seconds.
 * <p>
 * Post-wait and boot-settle pauses go through a sleeper so that tests can substitute one which
 * records the requested waits instead of blocking.
 */
public interface Sleeper {

    /** Sleeps using {@link Thread#sleep(long)}; interruption surfaces as a {@link org.bespoke.util.exceptions.RuntimeInterruptedException}. */
    Sleeper SYSTEM = new Sleeper() {
        @Override
        public void sleepSeconds(long seconds) {
            if (seconds <= 0) return;
            try {
                Thread.sleep(TimeUnit.SECONDS.toMillis(seconds));
            } catch (InterruptedException e) {
                throw Exceptions.propagate(e);
            }
        }
        @Override
        public String toString() {
            return "Sleeper.SYSTEM";
        }
    };

    void sleepSeconds(long seconds);

}
