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

import org.bespoke.api.agent.RemoteAgent;
import org.bespoke.api.agent.RemoteAgentException;
import org.bespoke.core.config.BespokeSettings;
import org.bespoke.core.resource.SystemUnderTest;
import org.bespoke.core.tool.Tool;

/**
 * Installs a tool or build from the local tools directory onto a system under test. Any failure is fatal.
 */
public abstract class Installer extends AbstractResultsTestUnit {

    protected final Tool tool;
    private final long timeoutSeconds;

    protected Installer(Tool tool, SystemUnderTest sut, long timeoutSeconds, BespokeSettings settings, RemoteAgent agent) {
        super(checkNotNull(tool, "tool").getName() + "_Installer", sut, settings, agent);
        this.tool = tool;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public TestUnitKind getKind() {
        return TestUnitKind.INSTALLER;
    }

    /** Copies what the install step needs onto the system under test. */
    protected abstract void stage() throws TestActionException, RemoteAgentException;

    protected abstract void install() throws TestActionException, RemoteAgentException;

    @Override
    protected void run() throws TestActionException, RemoteAgentException {
        setupResults();
        stage();
        install();
        retrieveResults();
    }

    protected TestActionException missingSource(String path) {
        return new TestActionException("Failed to stage tool \"" + tool.getName() + "\" on remote machine! The file/directory \""
                + path + "\" does not exist!");
    }

    public Tool getTool() {
        return tool;
    }

    @Override
    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
