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

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

/** A resource slot of a test case: the machine to prepare and the tools and builds to install on it. */
public class ResourceDefinition {

    private final String resourceId;
    private final String virtualMachine;
    private final String checkpoint;
    private final long postWaitSeconds;
    private final long timeoutSeconds;
    private final boolean restart;
    private final boolean restartWait;
    private final List<String> tools;
    private final List<String> builds;

    private ResourceDefinition(Builder builder) {
        this.resourceId = checkNotNull(builder.resourceId, "resourceId");
        this.virtualMachine = checkNotNull(builder.virtualMachine, "virtualMachine");
        this.checkpoint = builder.checkpoint;
        this.postWaitSeconds = builder.postWaitSeconds;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.restart = builder.restart;
        this.restartWait = builder.restartWait;
        this.tools = ImmutableList.copyOf(builder.tools);
        this.builds = ImmutableList.copyOf(builder.builds);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getResourceId() {
        return resourceId;
    }

    /** Alias of the system under test in the resource registry. */
    public String getVirtualMachine() {
        return virtualMachine;
    }

    @Nullable
    public String getCheckpoint() {
        return checkpoint;
    }

    public long getPostWaitSeconds() {
        return postWaitSeconds;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public boolean isRestart() {
        return restart;
    }

    public boolean isRestartWait() {
        return restartWait;
    }

    public List<String> getTools() {
        return tools;
    }

    public List<String> getBuilds() {
        return builds;
    }

    public static class Builder {
        private String resourceId;
        private String virtualMachine;
        private String checkpoint;
        private long postWaitSeconds;
        private long timeoutSeconds;
        private boolean restart;
        private boolean restartWait;
        private List<String> tools = ImmutableList.of();
        private List<String> builds = ImmutableList.of();

        public Builder resourceId(String val) {
            this.resourceId = val;
            return this;
        }

        public Builder virtualMachine(String val) {
            this.virtualMachine = val;
            return this;
        }

        public Builder checkpoint(@Nullable String val) {
            this.checkpoint = val;
            return this;
        }

        public Builder postWaitSeconds(long val) {
            this.postWaitSeconds = val;
            return this;
        }

        public Builder timeoutSeconds(long val) {
            this.timeoutSeconds = val;
            return this;
        }

        public Builder restart(boolean restart, boolean wait) {
            this.restart = restart;
            this.restartWait = wait;
            return this;
        }

        public Builder tools(String... val) {
            this.tools = ImmutableList.copyOf(val);
            return this;
        }

        public Builder builds(String... val) {
            this.builds = ImmutableList.copyOf(val);
            return this;
        }

        public ResourceDefinition build() {
            return new ResourceDefinition(this);
        }
    }
}
