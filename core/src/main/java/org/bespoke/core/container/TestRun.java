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

import java.util.List;

import org.bespoke.api.test.FatalTestException;
import org.bespoke.api.test.TestFailureException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/** The top-level container: test plans executed in order. */
public class TestRun extends AbstractTestContainer {

    private final List<TestPlan> testPlans = Lists.newArrayList();

    public TestRun(String name) {
        super(name);
    }

    public TestRun addTestPlan(TestPlan testPlan) {
        testPlans.add(testPlan);
        return this;
    }

    public List<TestPlan> getTestPlans() {
        return ImmutableList.copyOf(testPlans);
    }

    @Override
    protected String getContainerType() {
        return "test run";
    }

    @Override
    public void execute() throws TestFailureException, FatalTestException {
        executeChildren(testPlans);
    }
}
