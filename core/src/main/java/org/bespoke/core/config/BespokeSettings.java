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
package org.bespoke.core.config;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;

import org.bespoke.util.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

/**
 * Process-wide paths, timings and time sources, passed explicitly to every component that needs them.
 */
public class BespokeSettings {

    private static final Logger LOG = LoggerFactory.getLogger(BespokeSettings.class);

    /** The maximum time, in seconds, a system under test may be checked out for. */
    public static final long MAX_CHECKOUT_TIME_SECONDS = 7200;

    public static final long DEFAULT_BOOT_WAIT_SECONDS = 30;
    public static final int DEFAULT_PING_RETRY_COUNT = 5;
    public static final long DEFAULT_PING_RETRY_DELAY_SECONDS = 1;
    public static final long DEFAULT_POWER_COMMAND_TIMEOUT_SECONDS = 10;

    public static final String RESULTS_PATH_KEY = "bespoke.results.path";
    public static final String TOOLS_PATH_KEY = "bespoke.tools.path";
    public static final String TESTS_PATH_KEY = "bespoke.tests.path";
    public static final String SERVER_HOSTNAME_KEY = "bespoke.server.hostname";
    public static final String BOOT_WAIT_KEY = "bespoke.vm.boot.wait";
    public static final String PING_RETRIES_KEY = "bespoke.ping.retries";
    public static final String PING_RETRY_DELAY_KEY = "bespoke.ping.retry.delay";
    public static final String POWER_COMMAND_TIMEOUT_KEY = "bespoke.power.command.timeout";

    private final Path resultsPath;
    private final Path toolsPath;
    private final Path testScriptsPath;
    private final String serverHostname;
    private final long bootWaitSeconds;
    private final int pingRetryCount;
    private final long pingRetryDelaySeconds;
    private final long powerCommandTimeoutSeconds;
    private final Clock clock;
    private final Sleeper sleeper;

    private BespokeSettings(Builder builder) {
        this.resultsPath = checkNotNull(builder.resultsPath, "resultsPath");
        this.toolsPath = checkNotNull(builder.toolsPath, "toolsPath");
        this.testScriptsPath = checkNotNull(builder.testScriptsPath, "testScriptsPath");
        this.serverHostname = checkNotNull(builder.serverHostname, "serverHostname");
        this.bootWaitSeconds = builder.bootWaitSeconds;
        this.pingRetryCount = builder.pingRetryCount;
        this.pingRetryDelaySeconds = builder.pingRetryDelaySeconds;
        this.powerCommandTimeoutSeconds = builder.powerCommandTimeoutSeconds;
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
        checkArgument(bootWaitSeconds >= 0, "boot wait must not be negative: %s", bootWaitSeconds);
        checkArgument(pingRetryCount > 0, "ping retry count must be positive: %s", pingRetryCount);
        checkArgument(pingRetryDelaySeconds >= 0, "ping retry delay must not be negative: %s", pingRetryDelaySeconds);
        checkArgument(powerCommandTimeoutSeconds > 0, "power command timeout must be positive: %s", powerCommandTimeoutSeconds);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from a flat map using the {@code bespoke.*} keys.
     * Path keys are required; timings fall back to their defaults; a missing server hostname is
     * resolved from the local host name.
     *
     * @throws ValidationException if a required key is missing or a timing is not a whole number
     */
    public static BespokeSettings fromProperties(Map<String, String> properties) {
        Builder builder = builder()
                .resultsPath(Paths.get(required(properties, RESULTS_PATH_KEY)))
                .toolsPath(Paths.get(required(properties, TOOLS_PATH_KEY)))
                .testScriptsPath(Paths.get(required(properties, TESTS_PATH_KEY)))
                .bootWaitSeconds(optionalLong(properties, BOOT_WAIT_KEY, DEFAULT_BOOT_WAIT_SECONDS))
                .pingRetryCount((int) optionalLong(properties, PING_RETRIES_KEY, DEFAULT_PING_RETRY_COUNT))
                .pingRetryDelaySeconds(optionalLong(properties, PING_RETRY_DELAY_KEY, DEFAULT_PING_RETRY_DELAY_SECONDS))
                .powerCommandTimeoutSeconds(optionalLong(properties, POWER_COMMAND_TIMEOUT_KEY, DEFAULT_POWER_COMMAND_TIMEOUT_SECONDS));
        String hostname = properties.get(SERVER_HOSTNAME_KEY);
        builder.serverHostname(Strings.isNullOrEmpty(hostname) ? localHostname() : hostname.trim());
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid Bespoke settings: " + e.getMessage(), null, e);
        }
    }

    private static String required(Map<String, String> properties, String key) {
        String value = properties.get(key);
        if (Strings.isNullOrEmpty(value) || value.trim().isEmpty()) {
            throw new ValidationException("The required setting \"" + key + "\" is missing!");
        }
        return value.trim();
    }

    private static long optionalLong(Map<String, String> properties, String key, long defaultValue) {
        String value = properties.get(key);
        if (Strings.isNullOrEmpty(value)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("The setting \"" + key + "\" must be a whole number of seconds, not \"" + value + "\"!");
        }
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOG.warn("Unable to resolve local hostname (using localhost): {}", e.getMessage());
            return "localhost";
        }
    }

    /** Local directory test results are copied back into. */
    public Path getResultsPath() {
        return resultsPath;
    }

    /** Local directory tools and builds are staged into and installed from. */
    public Path getToolsPath() {
        return toolsPath;
    }

    /** Local directory holding the test script directories. */
    public Path getTestScriptsPath() {
        return testScriptsPath;
    }

    /** Host name systems under test copy their results back to. */
    public String getServerHostname() {
        return serverHostname;
    }

    public long getBootWaitSeconds() {
        return bootWaitSeconds;
    }

    public int getPingRetryCount() {
        return pingRetryCount;
    }

    public long getPingRetryDelaySeconds() {
        return pingRetryDelaySeconds;
    }

    public long getPowerCommandTimeoutSeconds() {
        return powerCommandTimeoutSeconds;
    }

    public Clock getClock() {
        return clock;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public Builder toBuilder() {
        return builder()
                .resultsPath(resultsPath)
                .toolsPath(toolsPath)
                .testScriptsPath(testScriptsPath)
                .serverHostname(serverHostname)
                .bootWaitSeconds(bootWaitSeconds)
                .pingRetryCount(pingRetryCount)
                .pingRetryDelaySeconds(pingRetryDelaySeconds)
                .powerCommandTimeoutSeconds(powerCommandTimeoutSeconds)
                .clock(clock)
                .sleeper(sleeper);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("resultsPath", resultsPath)
                .add("toolsPath", toolsPath)
                .add("testScriptsPath", testScriptsPath)
                .add("serverHostname", serverHostname)
                .add("bootWaitSeconds", bootWaitSeconds)
                .add("pingRetryCount", pingRetryCount)
                .add("pingRetryDelaySeconds", pingRetryDelaySeconds)
                .add("powerCommandTimeoutSeconds", powerCommandTimeoutSeconds)
                .toString();
    }

    public static class Builder {
        private Path resultsPath;
        private Path toolsPath;
        private Path testScriptsPath;
        private String serverHostname;
        private long bootWaitSeconds = DEFAULT_BOOT_WAIT_SECONDS;
        private int pingRetryCount = DEFAULT_PING_RETRY_COUNT;
        private long pingRetryDelaySeconds = DEFAULT_PING_RETRY_DELAY_SECONDS;
        private long powerCommandTimeoutSeconds = DEFAULT_POWER_COMMAND_TIMEOUT_SECONDS;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.SYSTEM;

        public Builder resultsPath(Path val) {
            this.resultsPath = val;
            return this;
        }

        public Builder toolsPath(Path val) {
            this.toolsPath = val;
            return this;
        }

        public Builder testScriptsPath(Path val) {
            this.testScriptsPath = val;
            return this;
        }

        public Builder serverHostname(String val) {
            this.serverHostname = val;
            return this;
        }

        public Builder bootWaitSeconds(long val) {
            this.bootWaitSeconds = val;
            return this;
        }

        public Builder pingRetryCount(int val) {
            this.pingRetryCount = val;
            return this;
        }

        public Builder pingRetryDelaySeconds(long val) {
            this.pingRetryDelaySeconds = val;
            return this;
        }

        public Builder powerCommandTimeoutSeconds(long val) {
            this.powerCommandTimeoutSeconds = val;
            return this;
        }

        public Builder clock(Clock val) {
            this.clock = checkNotNull(val, "clock");
            return this;
        }

        public Builder sleeper(Sleeper val) {
            this.sleeper = checkNotNull(val, "sleeper");
            return this;
        }

        public BespokeSettings build() {
            return new BespokeSettings(this);
        }
    }
}
