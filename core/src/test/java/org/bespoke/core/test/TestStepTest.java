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
package org.bespoke.core.test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.testng.Assert.assertEquals;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import org.bespoke.api.test.TestFailureException;
import org.bespoke.api.test.TestStatus;
import org.bespoke.core.config.BespokeSettings;
import org.bespoke.core.resource.SystemUnderTest;
import org.bespoke.core.testing.Fixtures;
import org.bespoke.core.testing.ManualClock;
import org.bespoke.core.testing.RecordingRemoteAgent;
import org.bespoke.core.testing.RecordingRemoteAgent.Call;
import org.bespoke.core.testing.RecordingRemoteAgent.CallType;
import org.bespoke.core.testing.RecordingSleeper;
import org.bespoke.test.Asserts;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class TestStepTest {

    private Path tempDir;
    private RecordingSleeper sleeper;
    private BespokeSettings settings;
    private RecordingRemoteAgent agent;
    private SystemUnderTest sut;

    @BeforeMethod(alwaysRun=true)
    public void setUp() throws Exception {
        tempDir = Files.createTempDirectory("bespoke-step");
        ManualClock clock = new ManualClock();
        sleeper = new RecordingSleeper(clock);
        settings = Fixtures.settings(tempDir, clock, sleeper);
        Files.createDirectories(settings.getTestScriptsPath().resolve("smoke"));
        agent = new RecordingRemoteAgent();
        sut = Fixtures.windowsSut("VM-A", settings);
    }

    @AfterMethod(alwaysRun=true)
    public void tearDown() throws Exception {
        Fixtures.deleteRecursively(tempDir);
    }

    private TestStep newStep(String interpreter, Map<String, String> params) {
        return new TestStep("Run", sut, "smoke", interpreter, "run.sh", params, 120, 2, settings, agent);
    }

    @Test
    public void testRunsScriptAndRetrievesResults() throws Exception {
        TestStep step = newStep(null, ImmutableMap.<String, String>of());
        step.execute();

        assertEquals(step.getStatus(), TestStatus.PASS);
        assertEquals(step.getRemoteTestPath(), "C:/bespoke/tests/smoke");
        assertThat(step.getRemoteResultsPath()).startsWith("C:/bespoke/results/").endsWith(step.getResultsId());
        assertThat(agent.getCallDescriptions()).containsExactly(
                "OPEN",
                "PING VM-A.lab",
                "CREATE_DIRECTORY VM-A.lab " + step.getRemoteResultsPath(),
                "COPY_DIRECTORY local " + settings.getTestScriptsPath().resolve("smoke") + " VM-A.lab C:/bespoke/tests/smoke",
                "RUN_COMMAND VM-A.lab C:/bespoke/tests/smoke run.sh",
                "COPY_DIRECTORY VM-A.lab " + step.getRemoteResultsPath() + " " + Fixtures.SERVER + " " + step.getLocalResultsPath(),
                "CLOSE");
        assertEquals(agent.getLastCall(CallType.RUN_COMMAND).timeoutSeconds, 120);
        assertEquals(sleeper.getSleeps(), Arrays.asList(2L));
    }

    @Test
    public void testEachStepHasItsOwnResultsDirectory() throws Exception {
        TestStep first = newStep(null, ImmutableMap.<String, String>of());
        TestStep second = newStep(null, ImmutableMap.<String, String>of());
        assertThat(first.getResultsId()).isNotEqualTo(second.getResultsId());
        assertEquals(first.getLocalResultsPath().getParent(), settings.getResultsPath());
    }

    @Test
    public void testInterpreterPrefixesCommand() throws Exception {
        assertEquals(newStep("python", ImmutableMap.<String, String>of()).command(), "python run.sh");
        assertEquals(newStep("  ", ImmutableMap.<String, String>of()).command(), "run.sh");
    }

    @Test
    public void testParameters() throws Exception {
        TestStep step = newStep("bash", ImmutableMap.of(
                "--target", TestStep.escapeParameterValue("C:/Program Files"),
                "--verbose", TestStep.escapeParameterValue("")));
        assertEquals(step.commandParameters(), ImmutableList.of("--target \"\\\"C:/Program Files\\\"\"", "--verbose"));

        step.execute();
        Call call = agent.getLastCall(CallType.RUN_COMMAND);
        assertEquals(call.args.subList(2, call.args.size()),
                ImmutableList.of("bash run.sh", "--target \"\\\"C:/Program Files\\\"\"", "--verbose"));
    }

    @Test
    public void testEscapeParameterValue() throws Exception {
        assertEquals(TestStep.escapeParameterValue("abc"), "\"\\\"abc\\\"\"");
        assertEquals(TestStep.escapeParameterValue(""), "");
    }

    @Test
    public void testNonZeroExitFails() throws Exception {
        agent.setCommandResponse("RUN_COMMAND .* run\\.sh.*", 3, "assertion failed");
        TestStep step = newStep(null, ImmutableMap.<String, String>of());
        try {
            step.execute();
            Asserts.shouldHaveFailedPreviously();
        } catch (TestFailureException e) {
            assertEquals(e.getMessage(), "Test step \"Run\" failed: assertion failed");
            assertEquals(e.getTestName(), "Run");
        }
        assertEquals(step.getStatus(), TestStatus.FAIL);
        assertEquals(step.getMessage(), "Test step \"Run\" failed: assertion failed");
        assertThat(agent.getCalls(CallType.CLOSE)).hasSize(1);
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    public void testMissingTestDirectoryFails() throws Exception {
        TestStep step = new TestStep("Run", sut, "missing", null, "run.sh", ImmutableMap.<String, String>of(), 120, 0, settings, agent);
        try {
            step.execute();
            Asserts.shouldHaveFailedPreviously();
        } catch (TestFailureException e) {
            Asserts.expectedFailureContains(e, "Failed to stage test step \"Run\"", "does not exist");
        }
        assertThat(agent.getCalls(CallType.RUN_COMMAND)).isEmpty();
    }

    @Test
    public void testAgentErrorFails() throws Exception {
        agent.setFailure("COPY_DIRECTORY VM-A\\.lab .*", "share unavailable");
        TestStep step = newStep(null, ImmutableMap.<String, String>of());
        try {
            step.execute();
            Asserts.shouldHaveFailedPreviously();
        } catch (TestFailureException e) {
            Asserts.expectedFailureContains(e, "Failed to copy the results directory");
        }
        assertEquals(step.getStatus(), TestStatus.FAIL);
    }
}
