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

import org.bespoke.api.test.FatalTestException;
import org.bespoke.api.test.TestFailureException;
import org.bespoke.core.container.TestRun;
import org.bespoke.core.tool.CopyException;
import org.bespoke.core.tool.Tool;
import org.bespoke.core.tool.ToolStager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stages the tools and builds an assembled run needs into the local tools directory, then executes the run.
 */
public class TestRunExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(TestRunExecutor.class);

    private final TestRunAssembler assembler;
    private final ToolStager stager;

    public TestRunExecutor(TestRunAssembler assembler, ToolStager stager) {
        this.assembler = checkNotNull(assembler, "assembler");
        this.stager = checkNotNull(stager, "stager");
    }

    /**
     * Assembles, stages and executes the run, returning it so its status and message can be inspected.
     *
     * @throws TestRunAssemblyException if the definition is invalid; nothing has been staged or executed then
     * @throws TestFailureException if some test failed but the run completed
     * @throws FatalTestException if staging failed or a test aborted the run
     */
    public TestRun execute(TestRunDefinition definition) throws TestFailureException, FatalTestException {
        TestRun testRun = assembler.assemble(definition);
        stageTools(testRun);
        LOG.info("Executing test run {}", testRun.getName());
        testRun.execute();
        return testRun;
    }

    private void stageTools(TestRun testRun) throws FatalTestException {
        for (Tool tool : assembler.getReferencedTools()) {
            try {
                stager.stage(tool);
            } catch (CopyException e) {
                String message = "Failed to stage the " + tool.getKind() + " \"" + tool.getName() + "\": " + e.getMessage();
                LOG.warn("Test run {} aborted: {}", testRun.getName(), message);
                throw new FatalTestException(testRun.getName(), message, e);
            }
        }
    }
}
