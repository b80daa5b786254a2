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

public class TestPlanDefinition {

    private final String name;
    private final String sourceName;
    private final List<TestCaseDefinition> testCases;

    public TestPlanDefinition(String name, List<TestCaseDefinition> testCases) {
        this(name, null, testCases);
    }

    /** @param sourceName the file the plan was read from, reported in errors */
    public TestPlanDefinition(String name, @Nullable String sourceName, List<TestCaseDefinition> testCases) {
        this.name = checkNotNull(name, "name");
        this.sourceName = sourceName;
        this.testCases = ImmutableList.copyOf(testCases);
    }

    public String getName() {
        return name;
    }

    /** The source file, or the plan name when unknown. */
    public String getSourceName() {
        return sourceName == null ? name : sourceName;
    }

    public List<TestCaseDefinition> getTestCases() {
        return testCases;
    }
}
