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
package org.bespoke.core.testing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.annotation.Nullable;

import org.bespoke.core.config.BespokeSettings;
import org.bespoke.core.resource.MachineType;
import org.bespoke.core.resource.SystemUnderTest;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

/** Shared builders for settings and systems under test. */
public final class Fixtures {

    public static final String INSTALL_ROOT = "C:/bespoke";
    public static final String SERVER = "bespoke-server";

    private Fixtures() {}

    /** Settings rooted in {@code root}, with {@code results}, {@code tools} and {@code tests} subdirectories created. */
    public static BespokeSettings settings(Path root, ManualClock clock, RecordingSleeper sleeper) throws IOException {
        return BespokeSettings.builder()
                .resultsPath(Files.createDirectories(root.resolve("results")))
                .toolsPath(Files.createDirectories(root.resolve("tools")))
                .testScriptsPath(Files.createDirectories(root.resolve("tests")))
                .serverHostname(SERVER)
                .clock(clock)
                .sleeper(sleeper)
                .build();
    }

    public static SystemUnderTest.Builder sut(String alias, RecordingVirtualMachine machine, BespokeSettings settings) {
        return SystemUnderTest.builder()
                .alias(alias)
                .machine(machine)
                .installRoot(INSTALL_ROOT)
                .networkAddress(alias + ".lab")
                .os("Windows")
                .machineType(MachineType.STATIC)
                .settings(settings);
    }

    public static SystemUnderTest windowsSut(String alias, BespokeSettings settings) {
        return sut(alias, new RecordingVirtualMachine("hypervisor", alias + "-vm"), settings).build();
    }

    public static void deleteRecursively(@Nullable Path dir) throws IOException {
        if (dir != null && Files.exists(dir)) {
            MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
        }
    }
}
