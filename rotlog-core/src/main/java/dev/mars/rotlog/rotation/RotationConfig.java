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

import java.util.Objects;

/**
 * Rotation policy for a single target file.
 * <p>
 * {@code maxFileSize} is compared as an unsigned 64-bit quantity, so
 * {@code -1L} means "never rotate". {@code maxArchivedFilesCount} is an
 * unsigned 8-bit quantity; zero is legal and evicts every archive.
 *
 * @param suffixExtension       how archives are named
 * @param maxFileSize           size in bytes above which the target is rotated
 * @param maxArchivedFilesCount how many archives survive eviction
 */
public record RotationConfig(SuffixExtension suffixExtension, long maxFileSize, int maxArchivedFilesCount) {

    public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_ARCHIVED_FILES_COUNT = 5;
    public static final int MAX_ARCHIVED_FILES_LIMIT = 255;

    public RotationConfig {
        Objects.requireNonNull(suffixExtension, "suffixExtension");
        if (maxArchivedFilesCount < 0 || maxArchivedFilesCount > MAX_ARCHIVED_FILES_LIMIT) {
            throw new IllegalArgumentException("maxArchivedFilesCount must be in [0, "
                    + MAX_ARCHIVED_FILES_LIMIT + "]: " + maxArchivedFilesCount);
        }
    }

    /** Numbering policy, 10 MiB, five archives. */
    public static RotationConfig defaults() {
        return new RotationConfig(SuffixExtension.NUMBERING, DEFAULT_MAX_FILE_SIZE, DEFAULT_MAX_ARCHIVED_FILES_COUNT);
    }

    /** Whether a target of {@code size} bytes should be rotated. */
    public boolean exceedsMaxFileSize(long size) {
        return Long.compareUnsigned(size, maxFileSize) > 0;
    }
}
