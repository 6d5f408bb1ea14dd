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

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * What a single {@link RotationExecutor#rotate} pass did.
 *
 * @param archivedTo     where the target was moved, empty if archiving failed
 * @param renumbered     archives renamed to a new generation number
 * @param removed        archives deleted by eviction, oldest first
 * @param reopened       whether a fresh target file is open
 * @param failedSteps    operations that failed and were skipped
 */
public record RotationResult(
        Optional<Path> archivedTo,
        int renumbered,
        List<Path> removed,
        boolean reopened,
        int failedSteps
) {

    public RotationResult {
        removed = List.copyOf(removed);
    }

    /** True if every step succeeded. */
    public boolean isClean() {
        return failedSteps == 0 && archivedTo.isPresent() && reopened;
    }
}
