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

import org.bespoke.api.test.FatalTestException;
import org.bespoke.api.test.TestContainer;
import org.bespoke.api.test.TestFailureException;
import org.bespoke.api.test.TestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;

/**
 * Status and message bookkeeping shared by test cases, plans and runs, plus the aggregation rule used by
 * plans and runs: a failed child is recorded and its siblings still run; a fatal child marks this
 * container as failed and is rethrown.
 */
public abstract class AbstractTestContainer implements TestContainer {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractTestContainer.class);

    private final String name;
    private volatile TestStatus status = TestStatus.NOT_RAN;
    private volatile String message = "";

    protected AbstractTestContainer(String name) {
        this.name = checkNotNull(name, "name");
    }

    /** "test case", "test plan" or "test run", for messages. */
    protected abstract String getContainerType();

    protected void executeChildren(Iterable<? extends TestContainer> children) throws TestFailureException, FatalTestException {
        setStatus(TestStatus.RUNNING);
        setMessage("");
        for (TestContainer child : children) {
            String childType = child instanceof AbstractTestContainer ? ((AbstractTestContainer) child).getContainerType() : "child";
            try {
                child.execute();
            } catch (TestFailureException e) {
                setStatus(TestStatus.FAIL);
                setMessage(String.format("The \"%s\" %s in the %s \"%s\" failed with the message: \"%s\"",
                        child.getName(), childType, getContainerType(), name, e.getMessage()));
                LOG.info("{} {} continuing after failure of {}", new Object[] {getContainerType(), name, child.getName()});
            } catch (FatalTestException e) {
                setStatus(TestStatus.FAIL);
                setMessage(String.format("The \"%s\" %s in the %s \"%s\" encountered the fatal error: \"%s\"",
                        child.getName(), childType, getContainerType(), name, e.getMessage()));
                LOG.warn("{} {} aborted: {}", new Object[] {getContainerType(), name, getMessage()});
                throw new FatalTestException(name, getMessage(), e);
            }
        }
        finish();
    }

    /** Ends a run of children: rethrows the recorded failure, or marks the container as passed. */
    protected void finish() throws TestFailureException {
        if (getStatus() == TestStatus.FAIL) {
            LOG.info("{} {} failed: {}", new Object[] {getContainerType(), name, getMessage()});
            throw new TestFailureException(name, getMessage());
        }
        setStatus(TestStatus.PASS);
        LOG.info("{} {} passed", getContainerType(), name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public TestStatus getStatus() {
        return status;
    }

    protected void setStatus(TestStatus status) {
        this.status = status;
    }

    @Override
    public String getMessage() {
        return message;
    }

    protected void setMessage(String message) {
        this.message = message;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("status", status)
                .toString();
    }
}
