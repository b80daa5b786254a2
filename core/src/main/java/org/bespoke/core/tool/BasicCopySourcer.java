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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.stream.Stream;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

/**
 * Copies a file or directory reachable through the file system (local or a mounted share).
 * An existing destination directory is replaced; parent directories of a destination file are created.
 */
public class BasicCopySourcer extends CopySourcer {

    public BasicCopySourcer(String source, String destination) {
        super(source, destination);
    }

    @Override
    protected void doCopy() throws CopyException {
        Path src = Paths.get(source);
        Path dst = Paths.get(destination);
        try {
            if (Files.isDirectory(src)) {
                if (Files.isDirectory(dst)) {
                    MoreFiles.deleteRecursively(dst, RecursiveDeleteOption.ALLOW_INSECURE);
                }
                copyTree(src, dst);
            } else if (Files.isRegularFile(src)) {
                Path parent = dst.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.copy(src, dst, StandardCopyOption.REPLACE_EXISTING);
            } else {
                throw new CopyException("Could not determine the type of object at given path '" + source + "'!");
            }
        } catch (IOException e) {
            throw new CopyException("Could not copy files/directories from '" + source + "' to '" + destination + "'!", e);
        }
    }

    private static void copyTree(Path src, Path dst) throws IOException {
        try (Stream<Path> paths = Files.walk(src)) {
            for (Path path : (Iterable<Path>) paths::iterator) {
                Path target = dst.resolve(src.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(target);
                } else {
                    Files.copy(path, target, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }
}
