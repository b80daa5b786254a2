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

/** How a tool reaches the local tools directory of the Bespoke server. */
public enum SourceType {
    NO_COPY("no_copy"),
    BASIC_COPY("basic_copy", ToolProperties.SOURCE_PATH, ToolProperties.TARGET_PATH),
    FTP_COPY("ftp_copy", ToolProperties.REMOTE_SOURCE_PROPERTIES),
    HTTP_COPY("http_copy", ToolProperties.REMOTE_SOURCE_PROPERTIES);

    private final String value;
    private final List<String> requiredProperties;

    SourceType(String value, String... requiredProperties) {
        this(value, ImmutableList.copyOf(requiredProperties));
    }

    SourceType(String value, List<String> requiredProperties) {
        this.value = value;
        this.requiredProperties = requiredProperties;
    }

    public String getValue() {
        return value;
    }

    /** Properties that must be present; a type with none accepts no properties at all. */
    public List<String> getRequiredProperties() {
        return requiredProperties;
    }

    public boolean isRemote() {
        return this == FTP_COPY || this == HTTP_COPY;
    }

    public static SourceType fromValue(String value) {
        for (SourceType type : values()) {
            if (type.value.equals(value)) return type;
        }
        throw new ValidationException("type '" + value + "' is not a valid source type!");
    }

    @Override
    public String toString() {
        return value;
    }
}
