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
import java.util.Map;

import org.bespoke.core.config.ValidationException;

import com.google.common.base.Strings;

/**
 * Checks that a tool's source and install types are known and that each carries the properties it needs.
 */
public class ToolValidator {

    private ToolValidator() {}

    /**
     * @throws ValidationException naming the tool and the offending element
     */
    public static void validate(Tool tool) {
        try {
            SourceType sourceType = SourceType.fromValue(tool.getSourceType());
            checkProperties(sourceType.getValue(), sourceType.getRequiredProperties(), tool.getSourceProperties());
            if (sourceType.isRemote()) {
                checkPort(sourceType.getValue(), tool.getSourceProperties().get(ToolProperties.SOURCE_SERVER_PORT));
            }
        } catch (ValidationException e) {
            throw new ValidationException("The " + tool.getKind() + " '" + tool.getName()
                    + "' has an error in the Source element: " + e.getMessage());
        }
        try {
            InstallType installType = InstallType.fromValue(tool.getInstallType());
            checkProperties(installType.getValue(), installType.getRequiredProperties(), tool.getInstallProperties());
        } catch (ValidationException e) {
            throw new ValidationException("The " + tool.getKind() + " '" + tool.getName()
                    + "' has an error in the InstallMethod element: " + e.getMessage());
        }
    }

    private static void checkProperties(String type, List<String> required, Map<String, String> properties) {
        if (required.isEmpty()) {
            if (!properties.isEmpty()) {
                throw new ValidationException("type '" + type + "' cannot have properties!");
            }
            return;
        }
        for (String key : required) {
            if (!properties.containsKey(key)) {
                throw new ValidationException("type '" + type + "' is missing the '" + key + "' property!");
            }
        }
        for (String key : required) {
            if (key.endsWith("_path") || key.endsWith("_file")) {
                if (Strings.isNullOrEmpty(properties.get(key)) || properties.get(key).trim().isEmpty()) {
                    throw new ValidationException("type '" + type + "' has a bad path for the '" + key + "' property!");
                }
            }
        }
    }

    private static void checkPort(String type, String port) {
        int value;
        try {
            value = Integer.parseInt(port.trim());
        } catch (NumberFormatException e) {
            value = -1;
        }
        if (value < 1 || value > 65535) {
            throw new ValidationException("type '" + type + "' has a bad port number for the '"
                    + ToolProperties.SOURCE_SERVER_PORT + "' property!");
        }
    }
}
