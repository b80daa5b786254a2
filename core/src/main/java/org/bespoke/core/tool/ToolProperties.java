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

import com.google.common.collect.ImmutableList;

/** Names of source and install properties. */
public final class ToolProperties {

    public static final String SOURCE_PATH = "source_path";
    public static final String TARGET_PATH = "target_path";
    public static final String SOURCE_FILE = "source_file";
    public static final String SOURCE_SERVER = "source_server";
    public static final String SOURCE_SERVER_PORT = "source_server_port";
    public static final String SOURCE_SERVER_USER = "source_server_user";
    public static final String SOURCE_SERVER_PASSWORD = "source_server_password";

    static final List<String> REMOTE_SOURCE_PROPERTIES = ImmutableList.of(
            SOURCE_SERVER, SOURCE_SERVER_PORT, SOURCE_SERVER_USER, SOURCE_SERVER_PASSWORD, SOURCE_PATH, TARGET_PATH);

    private ToolProperties() {}

}
