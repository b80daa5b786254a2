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
package org.bespoke.api.machine;

import javax.annotation.Nullable;

/** A failure reported by the hypervisor for a given machine. */
public class VirtualMachineException extends Exception {

    private static final long serialVersionUID = 4430286577245010395L;

    private final String host;
    private final String vmName;

    public VirtualMachineException(String message, @Nullable String host, @Nullable String vmName) {
        super(message);
        this.host = host;
        this.vmName = vmName;
    }

    public VirtualMachineException(String message, @Nullable String host, @Nullable String vmName, Throwable cause) {
        super(message, cause);
        this.host = host;
        this.vmName = vmName;
    }

    @Nullable
    public String getHost() {
        return host;
    }

    @Nullable
    public String getVmName() {
        return vmName;
    }

    /** The message followed by the host and machine it applies to. */
    public String getDetailedMessage() {
        return getMessage() + " Host: " + host + ", Virtual Machine: " + vmName;
    }

}
