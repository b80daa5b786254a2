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
package org.bespoke.core.tool;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Set;

import org.bespoke.core.config.BespokeSettings;
import org.bespoke.core.config.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Brings tools and builds into the local tools directory before a test run, where installers pick
 * them up. Tools marked copy-once are staged at most once per stager.
 */
public class ToolStager {

    private static final Logger LOG = LoggerFactory.getLogger(ToolStager.class);

    private final BespokeSettings settings;
    private final Set<String> staged = Sets.newLinkedHashSet();

    public ToolStager(BespokeSettings settings) {
        this.settings = checkNotNull(settings, "settings");
    }

    /**
     * @return true if something was copied
     * @throws ValidationException for source types that cannot be staged
     * @throws CopyException if the copy failed
     */
    public boolean stage(Tool tool) throws CopyException {
        if (tool.isSourceCopyOnce() && staged.contains(tool.getName())) {
            LOG.debug("{} {} already staged; skipping", tool.getKind(), tool.getName());
            return false;
        }
        SourceType sourceType = SourceType.fromValue(tool.getSourceType());
        switch (sourceType) {
            case NO_COPY:
                staged.add(tool.getName());
                return false;
            case BASIC_COPY:
                String destination = settings.getToolsPath()
                        .resolve(tool.getSourceProperties().get(ToolProperties.TARGET_PATH)).toString();
                CopySourcer sourcer = newBasicSourcer(tool.getSourceProperties().get(ToolProperties.SOURCE_PATH), destination);
                LOG.debug("Staging {} {} from {} to {}", new Object[] {tool.getKind(), tool.getName(), sourcer.getSource(), destination});
                sourcer.copy();
                staged.add(tool.getName());
                return true;
            default:
                throw new ValidationException("The source type \"" + sourceType + "\" of " + tool.getKind()
                        + " \"" + tool.getName() + "\" is not supported for staging!");
        }
    }

    protected CopySourcer newBasicSourcer(String source, String destination) {
        return new BasicCopySourcer(source, destination);
    }

    public Set<String> getStaged() {
        return ImmutableSet.copyOf(staged);
    }
}
