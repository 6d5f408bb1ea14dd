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
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * File size and modification time lookup.
 * <p>
 * Rotation logic never stats files directly; it goes through this
 * capability so that platform differences and test doubles stay out of it.
 */
public interface FileMetadata {

    long size(Path path) throws IOException;

    FileTime lastModified(Path path) throws IOException;

    /** Implementation backed by {@link Files}. */
    static FileMetadata nio() {
        return NioFileMetadata.INSTANCE;
    }

    /** {@link Files}-backed metadata; symlinks are not followed. */
    final class NioFileMetadata implements FileMetadata {
        private static final NioFileMetadata INSTANCE = new NioFileMetadata();

        private NioFileMetadata() {
        }

        @Override
        public long size(Path path) throws IOException {
            return Files.size(path);
        }

        @Override
        public FileTime lastModified(Path path) throws IOException {
            return Files.getLastModifiedTime(path, LinkOption.NOFOLLOW_LINKS);
        }
    }
}
