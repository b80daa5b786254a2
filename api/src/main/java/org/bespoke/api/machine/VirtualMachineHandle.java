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

/**
 * A hypervisor-controlled machine.
 * <p>
 * Implementations for template machines provision a fresh instance in {@link #setup()} and release it in
 * {@link #tearDown()}; static machines treat both as no-ops.
 */
public interface VirtualMachineHandle {

    MachineState currentState() throws VirtualMachineException;

    /** Prepares the machine for a checkout. Must be idempotent. */
    void setup() throws VirtualMachineException;

    /** Releases whatever {@link #setup()} acquired. */
    void tearDown() throws VirtualMachineException;

    void start() throws VirtualMachineException;

    /** Hard power-off. */
    void stop() throws VirtualMachineException;

    /** Guest shutdown; when {@code wait} is true, blocks until the machine reports it is stopped. */
    void shutdown(boolean wait) throws VirtualMachineException;

    void restart() throws VirtualMachineException;

    void applySnapshot(String name) throws VirtualMachineException;

    /**
     * Deletes the machine from the hypervisor.
     *
     * @throws NotSupportedException for machines which cannot be destroyed
     */
    void destroy() throws VirtualMachineException;

    /**
     * Returns an independent handle to the same machine definition, sharing no mutable state with this one.
     * Used to hand every test case its own copy of a template machine.
     */
    VirtualMachineHandle copy();

}
