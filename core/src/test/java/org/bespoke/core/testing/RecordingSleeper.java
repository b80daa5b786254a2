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
package org.bespoke.core.testing;

import java.util.List;

import org.bespoke.util.time.Sleeper;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/** Records requested sleeps instead of blocking; optionally advances a {@link ManualClock} by the same amount. */
public class RecordingSleeper implements Sleeper {

    private final List<Long> sleeps = Lists.newCopyOnWriteArrayList();
    private final ManualClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(ManualClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleepSeconds(long seconds) {
        sleeps.add(seconds);
        if (clock != null) {
            clock.tick(seconds);
        }
    }

    public List<Long> getSleeps() {
        return ImmutableList.copyOf(sleeps);
    }

    public long getTotalSeconds() {
        long total = 0;
        for (Long sleep : sleeps) {
            total += sleep;
        }
        return total;
    }
}
