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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rotates a target file: renumber, archive, evict, reopen.
 * <p>
 * <b>Steps:</b>
 * <ol>
 *   <li><b>Renumber</b> ({@link SuffixExtension#NUMBERING} only): archives are
 *       visited oldest first and the archive at index {@code i} of {@code n}
 *       becomes generation {@code n + 1 - i}, which vacates {@code .1}. A rename
 *       whose destination already exists is skipped, never overwritten.</li>
 *   <li><b>Archive</b>: the target is moved to {@link ArchiveNamer#nameFor}.</li>
 *   <li><b>Evict</b>: archives beyond {@code maxArchivedFilesCount} are deleted,
 *       oldest first.</li>
 *   <li><b>Reopen</b>: a fresh target is created at the original path.</li>
 * </ol>
 * Every step catches and logs its own failures; later steps still run. No
 * step is retried and nothing is thrown to the caller.
 * <p>
 * <b>Thread Safety:</b> stateless apart from its collaborators; callers
 * serialize rotations of one target.
 */
public final class RotationExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(RotationExecutor.class);

    /**
     * Creates the fresh target file after the old one has been archived.
     */
    @FunctionalInterface
    public interface ReopenAction {
        void reopen() throws IOException;
    }

    private final RotationConfig config;
    private final ArchiveNamer namer;
    private final ArchiveEnumerator enumerator;
    private final FileOperations files;
    private final RotationListener listener;

    public RotationExecutor(RotationConfig config,
                            ArchiveNamer namer,
                            ArchiveEnumerator enumerator,
                            FileOperations files,
                            RotationListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.namer = Objects.requireNonNull(namer, "namer");
        this.enumerator = Objects.requireNonNull(enumerator, "enumerator");
        this.files = Objects.requireNonNull(files, "files");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Runs all four steps against {@code target}.
     * The caller must have released any handle it holds on the target.
     */
    public RotationResult rotate(Path target, ReopenAction reopen) {
        LOG.info("Rotating {} (policy={}, maxArchivedFilesCount={})",
                target, config.suffixExtension().configName(), config.maxArchivedFilesCount());
        Failures failures = new Failures();

        int renumbered = renumberArchives(target, failures);
        Optional<Path> archivedTo = archiveTarget(target, failures);
        List<Path> removed = evictExcessArchives(target, failures);

        boolean reopened;
        try {
            reopen.reopen();
            reopened = true;
            LOG.debug("Reopened target {}", target);
        } catch (IOException | RuntimeException e) {
            reopened = false;
            failures.count++;
            LOG.error("Failed to reopen {} after rotation: {}", target, e.getMessage(), e);
        }

        RotationResult result = new RotationResult(archivedTo, renumbered, removed, reopened, failures.count);
        LOG.info("Rotation of {} complete: archivedTo={}, renumbered={}, removed={}, failedSteps={}",
                target, archivedTo.orElse(null), renumbered, removed.size(), failures.count);
        return result;
    }

    /** Step 1. Returns the number of archives renamed. */
    int renumberArchives(Path target, Failures failures) {
        if (config.suffixExtension() != SuffixExtension.NUMBERING) {
            return 0;
        }

        List<Path> archives = enumerator.listArchives(target);
        int count = archives.size();
        int renamed = 0;
        for (int index = 0; index < count; index++) {
            Path archive = archives.get(index);
            long generation = count + 1L - index;
            Path renumbered = ArchiveNamer.withGeneration(ArchiveNamer.baseOf(archive), generation);
            if (renumbered.equals(archive)) {
                continue;
            }
            if (files.exists(renumbered)) {
                LOG.debug("Skipping renumber of {}: {} already exists", archive, renumbered);
                continue;
            }
            try {
                files.move(archive, renumbered);
                renamed++;
                LOG.debug("Renumbered {} -> {} (generation {})", archive, renumbered, generation);
            } catch (IOException | RuntimeException e) {
                failures.count++;
                LOG.warn("Failed to renumber {} -> {}: {}", archive, renumbered, e.getMessage(), e);
            }
        }
        return renamed;
    }

    /** Step 2. Returns the archive path if the move succeeded. */
    Optional<Path> archiveTarget(Path target, Failures failures) {
        Path archive = namer.nameFor(target, config.suffixExtension());
        try {
            files.move(target, archive);
        } catch (IOException | RuntimeException e) {
            failures.count++;
            LOG.warn("Failed to archive {} -> {}: {}", target, archive, e.getMessage(), e);
            return Optional.empty();
        }
        LOG.info("Archived {} -> {}", target, archive);
        notifyListener(() -> listener.onArchived(target, archive), "onArchived");
        return Optional.of(archive);
    }

    /** Step 3. Returns the archives deleted, oldest first. */
    List<Path> evictExcessArchives(Path target, Failures failures) {
        List<Path> archives = enumerator.listArchives(target);
        int excess = archives.size() - config.maxArchivedFilesCount();
        if (excess <= 0) {
            return List.of();
        }

        LOG.debug("Evicting {} of {} archives of {}", excess, archives.size(), target);
        List<Path> removed = new ArrayList<>(excess);
        for (Path archive : archives.subList(0, excess)) {
            try {
                files.delete(archive);
            } catch (IOException | RuntimeException e) {
                failures.count++;
                LOG.warn("Failed to remove archive {}: {}", archive, e.getMessage(), e);
                continue;
            }
            removed.add(archive);
            LOG.info("Removed archive {}", archive);
            notifyListener(() -> listener.onArchiveRemoved(archive), "onArchiveRemoved");
        }
        return removed;
    }

    private static void notifyListener(Runnable callback, String name) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("Rotation listener {} threw: {}", name, e.getMessage(), e);
        }
    }

    /** Mutable failure tally shared by the steps of one rotation. */
    static final class Failures {
        int count;
    }
}
