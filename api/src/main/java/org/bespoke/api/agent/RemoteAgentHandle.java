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

import java.util.List;
import java.util.Map;

/**
 * A registered session with the remote execution transport.
 * <p>
 * Hosts are network addresses; {@link #LOCAL} names the machine running the orchestrator.
 * Paths are passed through as given; the transport is responsible for any path-style conversion.
 */
public interface RemoteAgentHandle extends AutoCloseable {

    String LOCAL = "local";

    /**
     * Checks that the host is reachable through the transport.
     *
     * @throws HostUnreachableException if there is no path to the host; callers may retry
     * @throws RemoteAgentException for any other transport failure
     */
    void ping(String host) throws RemoteAgentException;

    /** Creates the directory, including missing parents, failing if it already exists. */
    void createDirectory(String host, String path) throws RemoteAgentException;

    /** Recursively deletes the directory; a missing directory is reported rather than failing. */
    DeleteOutcome deleteDirectory(String host, String path) throws RemoteAgentException;

    /**
     * Copies a file from the local machine to the host, creating the parent directory of
     * {@code remotePath} first.
     */
    void copyFile(String localPath, String remotePath, String host, boolean overwrite, boolean textMode) throws RemoteAgentException;

    /** Recursively copies a directory between two hosts, keeping empty directories. */
    void copyDirectory(String sourceHost, String sourcePath, String targetHost, String targetPath) throws RemoteAgentException;

    /**
     * Runs a shell command on the host, giving up after {@code timeoutSeconds}.
     * Standard error is merged into the returned output.
     *
     * @throws RemoteAgentException if the command could not be started or waited for;
     *         a non-zero exit code is returned, not thrown
     */
    CommandResult runCommand(String host, String command, String workDir, long timeoutSeconds,
            List<String> params, Map<String, String> env) throws RemoteAgentException;

    /** Unregisters the handle. */
    @Override
    void close() throws RemoteAgentException;

}
