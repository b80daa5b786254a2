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

import java.util.Map;
import java.util.Set;

import org.bespoke.api.agent.RemoteAgent;
import org.bespoke.core.config.BespokeSettings;
import org.bespoke.core.config.ValidationException;
import org.bespoke.core.container.TestCase;
import org.bespoke.core.container.TestPlan;
import org.bespoke.core.container.TestRun;
import org.bespoke.core.resource.ResourceRegistry;
import org.bespoke.core.resource.SystemUnderTest;
import org.bespoke.core.test.TestStep;
import org.bespoke.core.tool.Build;
import org.bespoke.core.tool.Tool;
import org.bespoke.core.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * Turns test run definitions into executable {@link TestRun} containers, resolving machine aliases,
 * tools and builds against the registries.
 * <p>
 * Every configuration problem is reported as a {@link TestRunAssemblyException} naming the test plan
 * source it came from; nothing is executed here.
 */
public class TestRunAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(TestRunAssembler.class);

    private final BespokeSettings settings;
    private final RemoteAgent agent;
    private final ResourceRegistry resources;
    private final ToolRegistry<Tool> tools;
    private final ToolRegistry<Build> builds;

    private final Set<Tool> referenced = Sets.newLinkedHashSet();

    public TestRunAssembler(BespokeSettings settings, RemoteAgent agent, ResourceRegistry resources,
            ToolRegistry<Tool> tools, ToolRegistry<Build> builds) {
        this.settings = checkNotNull(settings, "settings");
        this.agent = checkNotNull(agent, "agent");
        this.resources = checkNotNull(resources, "resources");
        this.tools = checkNotNull(tools, "tools");
        this.builds = checkNotNull(builds, "builds");
    }

    public TestRun assemble(TestRunDefinition definition) {
        TestRun testRun = new TestRun(definition.getName());
        for (TestPlanDefinition plan : definition.getTestPlans()) {
            testRun.addTestPlan(assemblePlan(plan));
        }
        LOG.debug("Assembled test run {} with {} test plans", definition.getName(), testRun.getTestPlans().size());
        return testRun;
    }

    /**
     * @throws TestRunAssemblyException if any test case of the plan is invalid
     */
    public TestPlan assemblePlan(TestPlanDefinition definition) {
        TestPlan testPlan = new TestPlan(definition.getName());
        for (TestCaseDefinition testCase : definition.getTestCases()) {
            try {
                testPlan.addTestCase(assembleCase(testCase));
            } catch (ValidationException e) {
                throw new TestRunAssemblyException("The test plan \"" + definition.getName()
                        + "\" is invalid: " + e.getMessage(), definition.getSourceName(), e);
            }
        }
        return testPlan;
    }

    private TestCase assembleCase(TestCaseDefinition definition) {
        TestCase testCase = new TestCase(definition.getName(), settings, agent);
        Set<String> usedTools = Sets.newHashSet();
        Set<String> usedBuilds = Sets.newHashSet();

        for (ResourceDefinition resource : definition.getResources()) {
            SystemUnderTest sut = lookupResource(definition, resource.getVirtualMachine());
            testCase.addTestPrep(resource.getResourceId(), sut, resource.getCheckpoint(), resource.getPostWaitSeconds(),
                    resource.getTimeoutSeconds(), resource.isRestart(), resource.isRestartWait());
            for (String name : resource.getTools()) {
                testCase.addTool(sut, lookup(tools, "tool", name, usedTools, definition), resource.getTimeoutSeconds());
            }
            for (String name : resource.getBuilds()) {
                testCase.addBuild(sut, lookup(builds, "build", name, usedBuilds, definition), resource.getTimeoutSeconds());
            }
        }

        for (StepEntry entry : definition.getSteps()) {
            if (entry instanceof StepDefinition) {
                StepDefinition step = (StepDefinition) entry;
                testCase.addTestStep(step.getDescription(), step.getResourceId(), step.getDirectory(), step.getInterpreter(),
                        step.getExecutable(), escape(step.getParams()), step.getTimeoutSeconds(), step.getPostWaitSeconds(),
                        step.isRestart(), step.isRestartWait());
            } else if (entry instanceof RefreshDefinition) {
                testCase.addResourceRefresh(entry.getResourceId(), entry.isRestart(), entry.isRestartWait());
            } else {
                throw new ValidationException("Unsupported step type " + entry.getClass().getSimpleName()
                        + " in the \"" + definition.getName() + "\" test case!");
            }
        }
        return testCase;
    }

    private SystemUnderTest lookupResource(TestCaseDefinition definition, String alias) {
        if (!resources.contains(alias)) {
            throw new ValidationException("The VirtualMachine \"" + alias + "\" specified in the \""
                    + definition.getName() + "\" test case is not defined in any resource registry!");
        }
        return resources.get(alias);
    }

    private <T extends Tool> T lookup(ToolRegistry<T> registry, String kind, String name, Set<String> used,
            TestCaseDefinition definition) {
        if (!used.add(name)) {
            throw new ValidationException("The " + kind + " \"" + name + "\" used more than once in the \""
                    + definition.getName() + "\" test case!");
        }
        T result = registry.find(name);
        if (result == null) {
            throw new ValidationException("The " + kind + " \"" + name + "\" specified in the \""
                    + definition.getName() + "\" test case is not defined in any registry!");
        }
        referenced.add(result);
        return result;
    }

    private static Map<String, String> escape(Map<String, String> params) {
        Map<String, String> result = Maps.newLinkedHashMap();
        for (Map.Entry<String, String> param : params.entrySet()) {
            result.put(param.getKey(), TestStep.escapeParameterValue(param.getValue()));
        }
        return result;
    }

    /** The tools and builds referenced by everything assembled so far, in first-use order. */
    public Set<Tool> getReferencedTools() {
        return ImmutableSet.copyOf(referenced);
    }
}
