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

import java.util.Arrays;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import org.bespoke.core.config.ValidationException;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/** Validated tools or builds keyed by name. */
public class ToolRegistry<T extends Tool> {

    private final Map<String, T> tools = Maps.newLinkedHashMap();
    private final String sourceName;

    public ToolRegistry() {
        this(null);
    }

    public ToolRegistry(@Nullable String sourceName) {
        this.sourceName = sourceName;
    }

    @SafeVarargs
    public static <T extends Tool> ToolRegistry<T> merge(ToolRegistry<T>... registries) {
        return merge(Arrays.asList(registries));
    }

    /**
     * @throws ValidationException if a name is defined in more than one registry
     */
    public static <T extends Tool> ToolRegistry<T> merge(Iterable<ToolRegistry<T>> registries) {
        Set<String> duplicates = Sets.newTreeSet();
        Set<String> seen = Sets.newHashSet();
        for (ToolRegistry<T> registry : registries) {
            for (String name : registry.tools.keySet()) {
                if (!seen.add(name)) duplicates.add(name);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new ValidationException("Duplicate names detected in configuration files: [" + Joiner.on(", ").join(duplicates) + "]");
        }
        ToolRegistry<T> result = new ToolRegistry<T>();
        for (ToolRegistry<T> registry : registries) {
            result.tools.putAll(registry.tools);
        }
        return result;
    }

    /**
     * Validates and registers the tool.
     *
     * @throws ValidationException if the tool is invalid or its name is already registered
     */
    public ToolRegistry<T> add(T tool) {
        checkNotNull(tool, "tool");
        if (tools.containsKey(tool.getName())) {
            throw new ValidationException("Duplicate " + tool.getKind() + " name '" + tool.getName()
                    + "' specified, " + tool.getKind() + " names must be unique!", sourceName);
        }
        try {
            ToolValidator.validate(tool);
        } catch (ValidationException e) {
            throw new ValidationException(e.getMessage(), sourceName, e);
        }
        tools.put(tool.getName(), tool);
        return this;
    }

    @Nullable
    public T find(String name) {
        return tools.get(name);
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    public Set<String> getNames() {
        return ImmutableSet.copyOf(tools.keySet());
    }

}
