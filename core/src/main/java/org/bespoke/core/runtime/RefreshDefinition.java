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
package org.bespoke.core.runtime;

import static com.google.common.base.Preconditions.checkNotNull;

/** Re-applies the preparation of a resource part way through a test case. */
public class RefreshDefinition implements StepEntry {

    private final String resourceId;
    private final boolean restart;
    private final boolean restartWait;

    public RefreshDefinition(String resourceId, boolean restart, boolean restartWait) {
        this.resourceId = checkNotNull(resourceId, "resourceId");
        this.restart = restart;
        this.restartWait = restartWait;
    }

    @Override
    public String getResourceId() {
        return resourceId;
    }

    @Override
    public boolean isRestart() {
        return restart;
    }

    @Override
    public boolean isRestartWait() {
        return restartWait;
    }
}
