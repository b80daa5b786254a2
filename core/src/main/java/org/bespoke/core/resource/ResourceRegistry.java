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
package org.bespoke.core.resource;

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

/**
 * Systems under test keyed by alias.
 * <p>
 * {@link #get(String)} returns the registered instance for static machines, so all test cases share
 * its lock, and a fresh {@link SystemUnderTest#copy() copy} for template machines.
 */
public class ResourceRegistry {

    private final Map<String, SystemUnderTest> resources = Maps.newLinkedHashMap();
    private final String sourceName;

    public ResourceRegistry() {
        this(null);
    }

    /** @param sourceName where the resources were defined, used in error messages */
    public ResourceRegistry(@Nullable String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Merges registries, failing if an alias is defined by more than one of them.
     */
    public static ResourceRegistry merge(ResourceRegistry... registries) {
        return merge(Arrays.asList(registries));
    }

    public static ResourceRegistry merge(Iterable<ResourceRegistry> registries) {
        Set<String> duplicates = Sets.newTreeSet();
        Set<String> seen = Sets.newHashSet();
        for (ResourceRegistry registry : registries) {
            for (String alias : registry.resources.keySet()) {
                if (!seen.add(alias)) duplicates.add(alias);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new ValidationException("The resource configurations have duplicate aliases! [" + Joiner.on(", ").join(duplicates) + "]");
        }
        ResourceRegistry result = new ResourceRegistry();
        for (ResourceRegistry registry : registries) {
            result.resources.putAll(registry.resources);
        }
        return result;
    }

    public ResourceRegistry add(SystemUnderTest sut) {
        checkNotNull(sut, "sut");
        if (resources.containsKey(sut.getAlias())) {
            throw new ValidationException("The alias \"" + sut.getAlias() + "\" is already defined!", sourceName);
        }
        resources.put(sut.getAlias(), sut);
        return this;
    }

    /**
     * @throws ValidationException if the alias is not registered
     */
    public SystemUnderTest get(String alias) {
        SystemUnderTest sut = resources.get(alias);
        if (sut == null) {
            throw new ValidationException("The system under test alias \"" + alias + "\" is not defined!", sourceName);
        }
        return sut.getMachineType() == MachineType.TEMPLATE ? sut.copy() : sut;
    }

    public boolean contains(String alias) {
        return resources.containsKey(alias);
    }

    public Set<String> getAliases() {
        return ImmutableSet.copyOf(resources.keySet());
    }

    public int size() {
        return resources.size();
    }

}
