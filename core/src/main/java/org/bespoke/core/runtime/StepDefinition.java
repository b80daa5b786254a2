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

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

/** A test script to run against a resource. Parameter values are raw; the assembler escapes them. */
public class StepDefinition implements StepEntry {

    private final String description;
    private final String resourceId;
    private final String directory;
    private final String interpreter;
    private final String executable;
    private final Map<String, String> params;
    private final long timeoutSeconds;
    private final long postWaitSeconds;
    private final boolean restart;
    private final boolean restartWait;

    private StepDefinition(Builder builder) {
        this.description = checkNotNull(builder.description, "description");
        this.resourceId = checkNotNull(builder.resourceId, "resourceId");
        this.directory = checkNotNull(builder.directory, "directory");
        this.interpreter = builder.interpreter;
        this.executable = checkNotNull(builder.executable, "executable");
        this.params = ImmutableMap.copyOf(builder.params);
        this.timeoutSeconds = builder.timeoutSeconds;
        this.postWaitSeconds = builder.postWaitSeconds;
        this.restart = builder.restart;
        this.restartWait = builder.restartWait;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String getResourceId() {
        return resourceId;
    }

    public String getDirectory() {
        return directory;
    }

    @Nullable
    public String getInterpreter() {
        return interpreter;
    }

    public String getExecutable() {
        return executable;
    }

    public Map<String, String> getParams() {
        return params;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public long getPostWaitSeconds() {
        return postWaitSeconds;
    }

    @Override
    public boolean isRestart() {
        return restart;
    }

    @Override
    public boolean isRestartWait() {
        return restartWait;
    }

    public static class Builder {
        private String description;
        private String resourceId;
        private String directory;
        private String interpreter;
        private String executable;
        private Map<String, String> params = ImmutableMap.of();
        private long timeoutSeconds;
        private long postWaitSeconds;
        private boolean restart;
        private boolean restartWait;

        public Builder description(String val) {
            this.description = val;
            return this;
        }

        public Builder resourceId(String val) {
            this.resourceId = val;
            return this;
        }

        public Builder directory(String val) {
            this.directory = val;
            return this;
        }

        public Builder interpreter(@Nullable String val) {
            this.interpreter = val;
            return this;
        }

        public Builder executable(String val) {
            this.executable = val;
            return this;
        }

        public Builder params(Map<String, String> val) {
            this.params = checkNotNull(val, "params");
            return this;
        }

        public Builder timeoutSeconds(long val) {
            this.timeoutSeconds = val;
            return this;
        }

        public Builder postWaitSeconds(long val) {
            this.postWaitSeconds = val;
            return this;
        }

        public Builder restart(boolean restart, boolean wait) {
            this.restart = restart;
            this.restartWait = wait;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(this);
        }
    }
}
