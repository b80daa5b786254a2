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

import java.util.List;

import org.bespoke.core.config.ValidationException;

import com.google.common.collect.ImmutableList;

/** How a tool is installed onto a system under test. */
public enum InstallType {
    NO_INSTALL("no_install"),
    BASIC_INSTALL("basic_install", ToolProperties.SOURCE_PATH, ToolProperties.TARGET_PATH),
    MSI_INSTALL("msi_install", ToolProperties.SOURCE_FILE);

    private final String value;
    private final List<String> requiredProperties;

    InstallType(String value, String... requiredProperties) {
        this.value = value;
        this.requiredProperties = ImmutableList.copyOf(requiredProperties);
    }

    public String getValue() {
        return value;
    }

    public List<String> getRequiredProperties() {
        return requiredProperties;
    }

    public static InstallType fromValue(String value) {
        for (InstallType type : values()) {
            if (type.value.equals(value)) return type;
        }
        throw new ValidationException("type '" + value + "' is not a valid install type!");
    }

    @Override
    public String toString() {
        return value;
    }
}
