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

import static org.assertj.core.api.Assertions.assertThat;
import static org.testng.Assert.assertEquals;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;

import org.bespoke.test.Asserts;
import org.bespoke.util.time.Sleeper;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

public class BespokeSettingsTest {

    private static Map<String, String> paths() {
        Map<String, String> result = Maps.newHashMap();
        result.put(BespokeSettings.RESULTS_PATH_KEY, "/srv/bespoke/results");
        result.put(BespokeSettings.TOOLS_PATH_KEY, "/srv/bespoke/tools");
        result.put(BespokeSettings.TESTS_PATH_KEY, "/srv/bespoke/tests");
        return result;
    }

    @Test
    public void testDefaults() throws Exception {
        Map<String, String> props = paths();
        props.put(BespokeSettings.SERVER_HOSTNAME_KEY, " bespoke01 ");
        BespokeSettings settings = BespokeSettings.fromProperties(props);

        assertEquals(settings.getResultsPath(), Paths.get("/srv/bespoke/results"));
        assertEquals(settings.getToolsPath(), Paths.get("/srv/bespoke/tools"));
        assertEquals(settings.getTestScriptsPath(), Paths.get("/srv/bespoke/tests"));
        assertEquals(settings.getServerHostname(), "bespoke01");
        assertEquals(settings.getBootWaitSeconds(), 30);
        assertEquals(settings.getPingRetryCount(), 5);
        assertEquals(settings.getPingRetryDelaySeconds(), 1);
        assertEquals(settings.getPowerCommandTimeoutSeconds(), 10);
        assertEquals(settings.getClock(), Clock.systemUTC());
        assertEquals(settings.getSleeper(), Sleeper.SYSTEM);
    }

    @Test
    public void testOverrides() throws Exception {
        Map<String, String> props = paths();
        props.put(BespokeSettings.BOOT_WAIT_KEY, "90");
        props.put(BespokeSettings.PING_RETRIES_KEY, "3");
        props.put(BespokeSettings.PING_RETRY_DELAY_KEY, "2");
        props.put(BespokeSettings.POWER_COMMAND_TIMEOUT_KEY, "20");
        BespokeSettings settings = BespokeSettings.fromProperties(props);

        assertEquals(settings.getBootWaitSeconds(), 90);
        assertEquals(settings.getPingRetryCount(), 3);
        assertEquals(settings.getPingRetryDelaySeconds(), 2);
        assertEquals(settings.getPowerCommandTimeoutSeconds(), 20);
        assertThat(settings.getServerHostname()).isNotEmpty();
    }

    @Test
    public void testMissingPath() throws Exception {
        Map<String, String> props = paths();
        props.remove(BespokeSettings.TOOLS_PATH_KEY);
        try {
            BespokeSettings.fromProperties(props);
            Asserts.shouldHaveFailedPreviously();
        } catch (ValidationException e) {
            assertEquals(e.getMessage(), "The required setting \"bespoke.tools.path\" is missing!");
        }
    }

    @Test
    public void testNonNumericTiming() throws Exception {
        Map<String, String> props = paths();
        props.put(BespokeSettings.BOOT_WAIT_KEY, "soon");
        try {
            BespokeSettings.fromProperties(props);
            Asserts.shouldHaveFailedPreviously();
        } catch (ValidationException e) {
            Asserts.expectedFailureContains(e, "bespoke.vm.boot.wait", "soon");
        }
    }

    @Test
    public void testOutOfRangeTiming() throws Exception {
        Map<String, String> props = paths();
        props.put(BespokeSettings.PING_RETRIES_KEY, "0");
        try {
            BespokeSettings.fromProperties(props);
            Asserts.shouldHaveFailedPreviously();
        } catch (ValidationException e) {
            Asserts.expectedFailureContains(e, "ping retry count must be positive");
        }
    }

    @Test
    public void testToBuilderCopiesEverything() throws Exception {
        BespokeSettings settings = BespokeSettings.fromProperties(ImmutableMap.<String, String>builder()
                .putAll(paths())
                .put(BespokeSettings.SERVER_HOSTNAME_KEY, "bespoke01")
                .build());
        BespokeSettings copy = settings.toBuilder().bootWaitSeconds(0).build();
        assertEquals(copy.getBootWaitSeconds(), 0);
        assertEquals(copy.getResultsPath(), settings.getResultsPath());
        assertEquals(copy.getServerHostname(), "bespoke01");
    }
}
