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
package org.bespoke.core.config;

import javax.annotation.Nullable;

/**
 * Indicates that configuration handed to the core is inconsistent, for instance a duplicate
 * resource id or an unsupported install type. Only raised while objects are being built, never
 * while tests execute.
 */
public class ValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = -2462431035282906578L;

    private final String sourceName;

    public ValidationException(String message) {
        this(message, (String) null);
    }

    public ValidationException(String message, @Nullable String sourceName) {
        super(message);
        this.sourceName = sourceName;
    }

    public ValidationException(String message, @Nullable String sourceName, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    /** The configuration file or definition the problem was found in, if known. */
    @Nullable
    public String getSourceName() {
        return sourceName;
    }

    @Override
    public String toString() {
        return sourceName == null ? super.toString() : super.toString() + " (in " + sourceName + ")";
    }
}
