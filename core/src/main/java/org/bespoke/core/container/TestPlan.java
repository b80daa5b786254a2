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

import java.util.Map;

import org.bespoke.api.test.FatalTestException;
import org.bespoke.api.test.TestFailureException;
import org.bespoke.core.config.ValidationException;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/** Test cases executed strictly in the order they were added. */
public class TestPlan extends AbstractTestContainer {

    private final Map<String, TestCase> testCases = Maps.newLinkedHashMap();

    public TestPlan(String name) {
        super(name);
    }

    /**
     * @throws ValidationException if a test case with this name was already added
     */
    public TestPlan addTestCase(TestCase testCase) {
        if (testCases.containsKey(testCase.getName())) {
            throw new ValidationException("Duplicate test case name \"" + testCase.getName()
                    + "\" was discovered in the \"" + getName() + "\" test plan!");
        }
        testCases.put(testCase.getName(), testCase);
        return this;
    }

    public Map<String, TestCase> getTestCases() {
        return ImmutableMap.copyOf(testCases);
    }

    @Override
    protected String getContainerType() {
        return "test plan";
    }

    @Override
    public void execute() throws TestFailureException, FatalTestException {
        executeChildren(testCases.values());
    }
}
