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

import javax.annotation.Nullable;

/**
 * A failure reported by a {@link SystemUnderTest}, either a lock contract violation or a wrapped
 * hypervisor error. {@link #isFatal()} tells whether the machine should be considered lost for the
 * rest of the test case.
 */
public class SystemUnderTestException extends Exception {

    private static final long serialVersionUID = 1153839410564209373L;

    private final String alias;
    private final boolean fatal;

    public SystemUnderTestException(String alias, String message, boolean fatal) {
        this(alias, message, fatal, null);
    }

    public SystemUnderTestException(String alias, String message, boolean fatal, @Nullable Throwable cause) {
        super(message, cause);
        this.alias = alias;
        this.fatal = fatal;
    }

    /** Alias of the system under test that reported the failure. */
    public String getAlias() {
        return alias;
    }

    public boolean isFatal() {
        return fatal;
    }

}
