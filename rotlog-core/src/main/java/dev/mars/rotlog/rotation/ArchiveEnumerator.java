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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the archives that belong to a target file.
 * <p>
 * An archive is any regular file in the target's directory whose name, with
 * its last extension removed, equals the target's name. The target itself and
 * unrelated siblings are excluded. Results are ordered oldest first by
 * modification time; equal times fall back to the higher generation number
 * first, then to the file name.
 * <p>
 * This class never throws on I/O failure: a directory that cannot be listed
 * or an archive that cannot be stat'ed yields an empty result, so rotation
 * degrades to "no archives found" instead of failing the write path.
 */
public final class ArchiveEnumerator {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveEnumerator.class);

    private static final Comparator<Archive> OLDEST_FIRST = Comparator
            .comparing(Archive::lastModified)
            .thenComparing(Comparator.<Archive>comparingLong(Archive::generation).reversed())
            .thenComparing(archive -> archive.path().getFileName().toString());

    private final FileMetadata metadata;

    public ArchiveEnumerator() {
        this(FileMetadata.nio());
    }

    public ArchiveEnumerator(FileMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    /**
     * Returns the archives of {@code target}, oldest first.
     *
     * @param target the target file path
     * @return the archive paths, or an empty list if the directory cannot be read
     */
    public List<Path> listArchives(Path target) {
        Path normalizedTarget = target.toAbsolutePath().normalize();
        Path directory = normalizedTarget.getParent();
        if (directory == null) {
            LOG.warn("Target {} has no parent directory, no archives listed", target);
            return List.of();
        }

        List<Path> candidates;
        try (Stream<Path> stream = Files.list(directory)) {
            candidates = stream
                    .filter(path -> !path.equals(normalizedTarget))
                    .filter(path -> ArchiveNamer.baseOf(path).equals(normalizedTarget))
                    .filter(path -> Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS))
                    .collect(Collectors.toList());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to list archives of {}: {}", target, e.getMessage(), e);
            return List.of();
        }

        List<Archive> archives = new ArrayList<>(candidates.size());
        for (Path candidate : candidates) {
            try {
                archives.add(new Archive(candidate,
                        metadata.lastModified(candidate),
                        ArchiveNamer.generationOf(candidate).orElse(0L)));
            } catch (IOException e) {
                LOG.warn("Failed to read modification time of {}: {}", candidate, e.getMessage(), e);
                return List.of();
            }
        }
        archives.sort(OLDEST_FIRST);

        List<Path> result = archives.stream().map(Archive::path).collect(Collectors.toList());
        LOG.trace("Archives of {} (oldest first): {}", target, result);
        return result;
    }

    private record Archive(Path path, FileTime lastModified, long generation) {
    }
}
