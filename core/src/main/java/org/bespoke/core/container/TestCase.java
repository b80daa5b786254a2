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
package org.bespoke.core.container;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import org.bespoke.api.agent.RemoteAgent;
import org.bespoke.api.test.FatalTestException;
import org.bespoke.api.test.TestFailureException;
import org.bespoke.api.test.TestStatus;
import org.bespoke.api.test.TestUnit;
import org.bespoke.core.config.BespokeSettings;
import org.bespoke.core.config.ValidationException;
import org.bespoke.core.resource.CheckoutTimeoutRangeException;
import org.bespoke.core.resource.ResourceBusyException;
import org.bespoke.core.resource.ResourceNotCheckedOutException;
import org.bespoke.core.resource.SystemUnderTest;
import org.bespoke.core.resource.SystemUnderTestException;
import org.bespoke.core.test.BasicInstaller;
import org.bespoke.core.test.MsiInstaller;
import org.bespoke.core.test.PowerControl;
import org.bespoke.core.test.PowerEvent;
import org.bespoke.core.test.TestPrep;
import org.bespoke.core.test.TestStep;
import org.bespoke.core.tool.Build;
import org.bespoke.core.tool.InstallType;
import org.bespoke.core.tool.Tool;
import org.bespoke.core.tool.ToolValidator;
import org.bespoke.util.exceptions.Exceptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * Owns a set of named resources (each a {@link TestPrep} bound to a system under test) and an ordered
 * queue of test units to run against them.
 * <p>
 * Execution checks out every resource up front, all or nothing, then runs the queue in insertion
 * order. Before each unit the lock on every resource is refreshed with that unit's timeout. A failed
 * unit is recorded and the queue carries on; a fatal unit stops the queue. Resources are checked in on
 * every path out of {@link #execute()}.
 */
public class TestCase extends AbstractTestContainer {

    private static final Logger LOG = LoggerFactory.getLogger(TestCase.class);

    private final BespokeSettings settings;
    private final RemoteAgent agent;

    private final Map<String, TestPrep> testPreps = Maps.newLinkedHashMap();
    private final List<TestUnit> queue = Lists.newArrayList();
    private final Set<String> sutAliases = Sets.newHashSet();

    public TestCase(String name, BespokeSettings settings, RemoteAgent agent) {
        super(name);
        this.settings = checkNotNull(settings, "settings");
        this.agent = checkNotNull(agent, "agent");
    }

    @Override
    protected String getContainerType() {
        return "test case";
    }

    /**
     * Registers a resource and queues its preparation, followed by a restart when requested.
     *
     * @throws ValidationException if the resource id is taken or the machine is already bound in this test case
     */
    public TestCase addTestPrep(String resourceId, SystemUnderTest sut, @Nullable String checkpoint, long postWaitSeconds,
            long timeoutSeconds, boolean restart, boolean restartWait) {
        if (testPreps.containsKey(resourceId)) {
            throw new ValidationException("The \"" + resourceId + "\" resource_id specified for TestPrep in TestCase \""
                    + getName() + "\" already in use!");
        }
        if (sutAliases.contains(sut.getAlias())) {
            throw new ValidationException("The alias \"" + sut.getAlias() + "\" referenced by resource_id \"" + resourceId
                    + "\" for the TestPrep in TestCase \"" + getName() + "\" is already in use!");
        }
        TestPrep testPrep;
        try {
            testPrep = new TestPrep(resourceId, sut, checkpoint, postWaitSeconds, timeoutSeconds, settings, agent);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("The TestCase \"" + getName() + "\" could not be created because of an error in the TestPrep \""
                    + resourceId + "\": " + e.getMessage(), null, e);
        }
        sutAliases.add(sut.getAlias());
        testPreps.put(resourceId, testPrep);
        queue.add(testPrep);
        if (restart) {
            addPowerEvent(resourceId, sut, restartWait);
        }
        return this;
    }

    /**
     * Queues the installer for the tool's install type; {@code no_install} queues nothing.
     *
     * @throws ValidationException for any other install type
     */
    public TestCase addTool(SystemUnderTest sut, Tool tool, long timeoutSeconds) {
        return addInstaller(sut, tool, timeoutSeconds);
    }

    /** As {@link #addTool(SystemUnderTest, Tool, long)}. */
    public TestCase addBuild(SystemUnderTest sut, Build build, long timeoutSeconds) {
        return addInstaller(sut, build, timeoutSeconds);
    }

    private TestCase addInstaller(SystemUnderTest sut, Tool tool, long timeoutSeconds) {
        InstallType installType;
        try {
            installType = InstallType.fromValue(tool.getInstallType());
        } catch (ValidationException e) {
            throw new ValidationException("The install_type \"" + tool.getInstallType() + "\" for "
                    + tool.getKind().toLowerCase(Locale.ROOT) + " \"" + tool.getName() + "\" is unsupported!");
        }
        try {
            ToolValidator.validate(tool);
        } catch (ValidationException e) {
            throw new ValidationException("The TestCase \"" + getName() + "\" could not be created because of an error in the "
                    + tool.getKind().toLowerCase(Locale.ROOT) + " \"" + tool.getName() + "\": " + e.getMessage(), null, e);
        }
        switch (installType) {
            case BASIC_INSTALL:
                queue.add(new BasicInstaller(tool, sut, timeoutSeconds, settings, agent));
                break;
            case MSI_INSTALL:
                queue.add(new MsiInstaller(tool, sut, timeoutSeconds, settings, agent));
                break;
            case NO_INSTALL:
            default:
                break;
        }
        return this;
    }

    /**
     * Queues a test step against a registered resource, followed by a restart when requested.
     *
     * @throws ValidationException if the resource id has not been registered
     */
    public TestCase addTestStep(String description, String resourceId, String testDirectory, @Nullable String interpreter,
            String executable, Map<String, String> params, long timeoutSeconds, long postWaitSeconds,
            boolean restart, boolean restartWait) {
        TestPrep testPrep = testPreps.get(resourceId);
        if (testPrep == null) {
            throw new ValidationException("The \"" + resourceId + "\" resource_id specified for TestStep \"" + description
                    + "\" in TestCase \"" + getName() + "\" is not valid!");
        }
        SystemUnderTest sut = testPrep.getSut();
        queue.add(new TestStep(description, sut, testDirectory, interpreter, executable, params, timeoutSeconds,
                postWaitSeconds, settings, agent));
        if (restart) {
            addPowerEvent(description, sut, restartWait);
        }
        return this;
    }

    /**
     * Queues the existing preparation of a resource again, so its checkpoint is re-applied at this point.
     *
     * @throws ValidationException if the resource id has not been registered
     */
    public TestCase addResourceRefresh(String resourceId, boolean restart, boolean restartWait) {
        TestPrep testPrep = testPreps.get(resourceId);
        if (testPrep == null) {
            throw new ValidationException("The \"" + resourceId + "\" resource_id specified for ResourceRefresh in TestCase \""
                    + getName() + "\" is not valid!");
        }
        queue.add(testPrep);
        if (restart) {
            addPowerEvent(resourceId, testPrep.getSut(), restartWait);
        }
        return this;
    }

    private void addPowerEvent(String name, SystemUnderTest sut, boolean waitForBoot) {
        queue.add(new PowerControl(name, sut, PowerEvent.RESTART, waitForBoot, settings, agent));
    }

    @Override
    public void execute() throws TestFailureException, FatalTestException {
        setStatus(TestStatus.RUNNING);
        setMessage("");
        LOG.debug("Executing test case {} with resources {}", getName(), testPreps.keySet());
        try {
            checkoutResources();
            for (TestUnit unit : queue) {
                try {
                    updateResourceTimeouts(unit.getTimeoutSeconds());
                    unit.execute();
                } catch (TestFailureException e) {
                    setStatus(TestStatus.FAIL);
                    setMessage("The \"" + unit.getName() + "\" test in the test case \"" + getName()
                            + "\" failed with the message: \"" + e.getMessage() + "\"");
                    LOG.debug("Test case {}: {}", getName(), getMessage());
                } catch (FatalTestException e) {
                    setStatus(TestStatus.FATAL);
                    setMessage("The \"" + unit.getName() + "\" test in the test case \"" + getName()
                            + "\" encountered the fatal error: \"" + e.getMessage() + "\"");
                    LOG.warn("Test case {} aborted: {}", getName(), getMessage());
                    throw new FatalTestException(getName(), getMessage(), e);
                } catch (RuntimeException e) {
                    setStatus(TestStatus.FATAL);
                    setMessage("The \"" + unit.getName() + "\" test in the test case \"" + getName()
                            + "\" was interrupted by an unexpected error: \"" + Exceptions.collapseText(e) + "\"");
                    LOG.warn("Test case {} aborted: {}", getName(), getMessage());
                    throw e;
                }
            }
        } finally {
            checkinResources();
        }
        finish();
    }

    private void checkoutResources() throws FatalTestException {
        for (Map.Entry<String, TestPrep> entry : testPreps.entrySet()) {
            String resourceId = entry.getKey();
            TestPrep testPrep = entry.getValue();
            try {
                testPrep.getSut().checkout(testPrep.getTimeoutSeconds());
            } catch (ResourceBusyException e) {
                throw checkoutFailed(e, "The \"" + resourceId + "\" resource is busy and cannot be checked-out by the \""
                        + getName() + "\" test case!");
            } catch (CheckoutTimeoutRangeException e) {
                throw checkoutFailed(e, "The timeout \"" + testPrep.getTimeoutSeconds() + "\" is not valid for resource \""
                        + resourceId + "\" in the \"" + getName() + "\" test case!");
            } catch (SystemUnderTestException e) {
                throw checkoutFailed(e, "The \"" + resourceId + "\" resource could not be checked-out by the \""
                        + getName() + "\" test case: " + e.getMessage());
            }
        }
    }

    private FatalTestException checkoutFailed(SystemUnderTestException cause, String message) {
        setStatus(TestStatus.FATAL);
        setMessage(message);
        LOG.warn("Test case {} aborted: {}", getName(), message);
        return new FatalTestException(getName(), message, cause);
    }

    private void updateResourceTimeouts(long timeoutSeconds) throws FatalTestException {
        for (Map.Entry<String, TestPrep> entry : testPreps.entrySet()) {
            String resourceId = entry.getKey();
            try {
                entry.getValue().getSut().updateLockTimeout(timeoutSeconds);
            } catch (ResourceNotCheckedOutException e) {
                throw new FatalTestException(resourceId, "The \"" + resourceId + "\" resource is not currently checked out by the \""
                        + getName() + "\" test case!", e);
            } catch (CheckoutTimeoutRangeException e) {
                throw new FatalTestException(resourceId, "The timeout \"" + timeoutSeconds + "\" is not valid for resource \""
                        + resourceId + "\" in the \"" + getName() + "\" test case!", e);
            } catch (SystemUnderTestException e) {
                throw new FatalTestException(resourceId, e.getMessage(), e);
            }
        }
    }

    /** Checks in every registered resource; a failure to release one is logged and the rest are still released. */
    private void checkinResources() {
        for (Map.Entry<String, TestPrep> entry : testPreps.entrySet()) {
            try {
                entry.getValue().getSut().checkin();
            } catch (SystemUnderTestException | RuntimeException e) {
                LOG.warn("Failed to check in resource " + entry.getKey() + " of test case " + getName(), e);
            }
        }
    }

    /** The execution queue, in order. */
    public List<TestUnit> getTestUnits() {
        return ImmutableList.copyOf(queue);
    }

    public Map<String, TestPrep> getTestPreps() {
        return ImmutableMap.copyOf(testPreps);
    }

    @Nullable
    public SystemUnderTest getResource(String resourceId) {
        TestPrep testPrep = testPreps.get(resourceId);
        return testPrep == null ? null : testPrep.getSut();
    }
}
