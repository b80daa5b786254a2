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
package org.bespoke.api.agent;

/**
 * Entry point to the remote execution transport used to drive a system under test.
 * <p>
 * Each test unit opens one {@link RemoteAgentHandle} for the duration of its execution and closes it on
 * every exit path.
 */
public interface RemoteAgent {

    /**
     * Registers a new handle with the transport.
     *
     * @throws RemoteAgentException if the transport refuses the registration
     */
    RemoteAgentHandle open() throws RemoteAgentException;

}
