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

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * Describes a tool that can be staged on the Bespoke server and installed onto a system under test.
 * <p>
 * Source and install types are kept as configured; {@link ToolValidator} checks them and their
 * properties when the tool is registered.
 */
public class Tool {

    private final String name;
    private final String osType;
    private final String osArch;
    private final String version;
    private final String sourceType;
    private final boolean sourceCopyOnce;
    private final String installType;
    private final Map<String, String> sourceProperties;
    private final Map<String, String> installProperties;

    protected Tool(Builder<?> builder) {
        this.name = checkNotNull(builder.name, "name");
        this.osType = Strings.nullToEmpty(builder.osType);
        this.osArch = Strings.nullToEmpty(builder.osArch);
        this.version = Strings.nullToEmpty(builder.version);
        this.sourceType = Strings.nullToEmpty(builder.sourceType);
        this.sourceCopyOnce = builder.sourceCopyOnce;
        this.installType = Strings.nullToEmpty(builder.installType);
        this.sourceProperties = ImmutableMap.copyOf(builder.sourceProperties);
        this.installProperties = ImmutableMap.copyOf(builder.installProperties);
    }

    public static Builder<Tool> builder() {
        return new Builder<Tool>() {
            @Override
            public Tool build() {
                return new Tool(this);
            }
        };
    }

    /** "Tool" or "Build", for messages. */
    public String getKind() {
        return "Tool";
    }

    public String getName() {
        return name;
    }

    public String getOsType() {
        return osType;
    }

    public String getOsArch() {
        return osArch;
    }

    public String getVersion() {
        return version;
    }

    public String getSourceType() {
        return sourceType;
    }

    /** Stage the tool only if it has not been staged already. */
    public boolean isSourceCopyOnce() {
        return sourceCopyOnce;
    }

    public String getInstallType() {
        return installType;
    }

    public Map<String, String> getSourceProperties() {
        return sourceProperties;
    }

    public Map<String, String> getInstallProperties() {
        return installProperties;
    }

    @Nullable
    public String getInstallProperty(String key) {
        return installProperties.get(key);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(getKind())
                .add("name", name)
                .add("version", version)
                .add("sourceType", sourceType)
                .add("installType", installType)
                .toString();
    }

    public abstract static class Builder<T extends Tool> {
        private String name;
        private String osType;
        private String osArch;
        private String version;
        private String sourceType;
        private boolean sourceCopyOnce;
        private String installType;
        private Map<String, String> sourceProperties = ImmutableMap.of();
        private Map<String, String> installProperties = ImmutableMap.of();

        public Builder<T> name(String val) {
            this.name = val;
            return this;
        }

        public Builder<T> osType(String val) {
            this.osType = val;
            return this;
        }

        public Builder<T> osArch(String val) {
            this.osArch = val;
            return this;
        }

        public Builder<T> version(String val) {
            this.version = val;
            return this;
        }

        public Builder<T> sourceType(String val) {
            this.sourceType = val;
            return this;
        }

        public Builder<T> sourceCopyOnce(boolean val) {
            this.sourceCopyOnce = val;
            return this;
        }

        public Builder<T> installType(String val) {
            this.installType = val;
            return this;
        }

        public Builder<T> sourceProperties(Map<String, String> val) {
            this.sourceProperties = checkNotNull(val, "sourceProperties");
            return this;
        }

        public Builder<T> installProperties(Map<String, String> val) {
            this.installProperties = checkNotNull(val, "installProperties");
            return this;
        }

        public abstract T build();
    }
}
