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

/**
 * Receives rotation events from a {@link FileRotationLogger}.
 * <p>
 * Callbacks run on the logger's executor thread, between rotation steps.
 * They should return quickly. Exceptions thrown from a callback are logged
 * and do not affect the rotation. A callback may call
 * {@link FileRotationLogger#close()}; the logger then closes once the current
 * rotation has finished.
 */
public interface RotationListener {

    /** Listener that ignores every event. */
    RotationListener NONE = new RotationListener() {
    };

    /**
     * The target file was moved to an archive.
     *
     * @param oldPath the target path (now absent until reopen)
     * @param newPath the archive path
     */
    default void onArchived(Path oldPath, Path newPath) {
    }

    /**
     * An archive was deleted during eviction.
     */
    default void onArchiveRemoved(Path path) {
    }
}
