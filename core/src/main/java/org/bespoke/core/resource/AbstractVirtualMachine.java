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

import org.bespoke.api.machine.NotSupportedException;
import org.bespoke.api.machine.VirtualMachineException;
import org.bespoke.api.machine.VirtualMachineHandle;

import com.google.common.base.MoreObjects;

/**
 * Base for hypervisor drivers: keeps the hypervisor host and machine name, treats
 * {@link #setup()} and {@link #tearDown()} as no-ops (the static machine behaviour) and refuses
 * {@link #destroy()}.
 */
public abstract class AbstractVirtualMachine implements VirtualMachineHandle {

    private final String host;
    private final String name;

    protected AbstractVirtualMachine(String host, String name) {
        this.host = checkNotNull(host, "host");
        this.name = checkNotNull(name, "name");
    }

    public String getHost() {
        return host;
    }

    public String getName() {
        return name;
    }

    @Override
    public void setup() throws VirtualMachineException {
    }

    @Override
    public void tearDown() throws VirtualMachineException {
    }

    @Override
    public void destroy() throws VirtualMachineException {
        throw new NotSupportedException("Destroy is not supported for this virtual machine!", host, name);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("host", host)
                .add("name", name)
                .toString();
    }

}
