/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.rotlog.rotation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Mutating file system calls used by rotation. Abstracted to allow
 * deterministic fault injection in tests.
 */
public interface FileOperations {

    /** Renames {@code source} to {@code target}; fails if {@code target} exists. */
    void move(Path source, Path target) throws IOException;

    void delete(Path path) throws IOException;

    boolean exists(Path path);

    /** Implementation backed by {@link Files}. */
    static FileOperations nio() {
        return new FileOperations() {
            @Override
            public void move(Path source, Path target) throws IOException {
                Files.move(source, target);
            }

            @Override
            public void delete(Path path) throws IOException {
                Files.delete(path);
            }

            @Override
            public boolean exists(Path path) {
                return Files.exists(path);
            }
        };
    }
}
