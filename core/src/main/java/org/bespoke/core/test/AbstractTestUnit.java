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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import org.bespoke.api.agent.HostUnreachableException;
import org.bespoke.api.agent.RemoteAgent;
import org.bespoke.api.agent.RemoteAgentException;
import org.bespoke.api.agent.RemoteAgentHandle;
import org.bespoke.api.test.FatalTestException;
import org.bespoke.api.test.TestFailureException;
import org.bespoke.api.test.TestStatus;
import org.bespoke.api.test.TestUnit;
import org.bespoke.core.config.BespokeSettings;
import org.bespoke.core.resource.SystemUnderTest;
import org.bespoke.core.resource.SystemUnderTestException;
import org.bespoke.util.exceptions.Exceptions;
import org.bespoke.util.repeat.Repeater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;

/**
 * Template for test units: moves the unit to {@link TestStatus#RUNNING}, opens a remote agent handle,
 * runs {@link #run()}, and always closes the handle before reporting the outcome.
 * <p>
 * Failures of {@link #run()} end the unit in the {@link TestUnitKind#getFailureStatus() failure status}
 * of its kind and are rethrown as {@link TestFailureException} or {@link FatalTestException}. Failing to
 * open or close the handle is always fatal.
 */
public abstract class AbstractTestUnit implements TestUnit {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractTestUnit.class);

    protected final String name;
    protected final SystemUnderTest sut;
    protected final BespokeSettings settings;
    private final RemoteAgent agent;

    private volatile TestStatus status = TestStatus.NOT_RAN;
    private volatile String message = "";
    private RemoteAgentHandle handle;

    protected AbstractTestUnit(String name, SystemUnderTest sut, BespokeSettings settings, RemoteAgent agent) {
        this.name = checkNotNull(name, "name");
        this.sut = checkNotNull(sut, "sut");
        this.settings = checkNotNull(settings, "settings");
        this.agent = checkNotNull(agent, "agent");
    }

    public abstract TestUnitKind getKind();

    /**
     * Performs the unit's work with {@link #handle()} available.
     */
    protected abstract void run() throws TestActionException, SystemUnderTestException, RemoteAgentException;

    @Override
    public final void execute() throws TestFailureException, FatalTestException {
        status = TestStatus.RUNNING;
        message = "";
        LOG.debug("Executing {} {} on {}", new Object[] {getKind(), name, sut.getAlias()});

        try {
            handle = agent.open();
        } catch (RemoteAgentException e) {
            throw fatal("Error registering with the remote agent: " + e.getMessage(), e);
        }

        String failure = null;
        Throwable cause = null;
        try {
            run();
        } catch (TestActionException | SystemUnderTestException | RemoteAgentException e) {
            failure = e.getMessage();
            cause = e;
        } catch (RuntimeException e) {
            Exceptions.propagateIfFatal(e);
            failure = Exceptions.collapseText(e);
            cause = e;
            LOG.warn("Unexpected error executing " + name, e);
        } finally {
            RemoteAgentHandle toClose = handle;
            handle = null;
            try {
                toClose.close();
            } catch (RemoteAgentException e) {
                throw fatal("Error unregistering with the remote agent: " + e.getMessage(), e);
            }
        }

        if (failure == null) {
            status = TestStatus.PASS;
            LOG.debug("{} {} passed", getKind(), name);
            return;
        }
        TestStatus failureStatus = getKind().getFailureStatus();
        if (failureStatus == TestStatus.FAIL && !(cause instanceof RuntimeException)) {
            status = TestStatus.FAIL;
            message = failure;
            LOG.debug("{} {} failed: {}", new Object[] {getKind(), name, failure});
            throw new TestFailureException(name, failure);
        }
        throw fatal(failure, cause);
    }

    private FatalTestException fatal(String failure, Throwable cause) {
        status = TestStatus.FATAL;
        message = failure;
        LOG.debug("{} {} encountered a fatal error: {}", new Object[] {getKind(), name, failure});
        return new FatalTestException(name, failure, cause);
    }

    /** The remote agent handle; only available while {@link #run()} executes. */
    protected RemoteAgentHandle handle() {
        checkState(handle != null, "%s is not executing", name);
        return handle;
    }

    /** Network address of the system under test. */
    protected String host() throws TestActionException {
        String address = sut.getNetworkAddress();
        if (address == null) {
            throw new TestActionException("The system under test \"" + sut.getAlias() + "\" has no network address!");
        }
        return address;
    }

    /**
     * Pings the system under test, retrying while the host is unreachable.
     */
    protected void ping() throws TestActionException, RemoteAgentException {
        final String host = host();
        try {
            Repeater.create("ping " + host)
                    .every(settings.getPingRetryDelaySeconds())
                    .limitIterationsTo(settings.getPingRetryCount())
                    .retryOn(HostUnreachableException.class)
                    .sleeper(settings.getSleeper())
                    .run(() -> {
                        handle().ping(host);
                        return null;
                    });
        } catch (RemoteAgentException e) {
            throw e;
        } catch (Exception e) {
            throw Exceptions.propagate(e);
        }
    }

    protected void createRemoteDirectory(String path) throws TestActionException, RemoteAgentException {
        handle().createDirectory(host(), path);
    }

    protected void sleep(long seconds) {
        settings.getSleeper().sleepSeconds(seconds);
    }

    @Override
    public String getName() {
        return name;
    }

    public SystemUnderTest getSut() {
        return sut;
    }

    @Override
    public TestStatus getStatus() {
        return status;
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("sut", sut.getAlias())
                .add("status", status)
                .toString();
    }
}
