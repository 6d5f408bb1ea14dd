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
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Computes archive file names for a target file.
 * <p>
 * An archive name is always the target name plus one extra extension:
 * <pre>
 * app.log                                               // target
 * app.log.1                                             // NUMBERING, most recent
 * app.log.20260101T120000Z_0b7c4e3a-...-9f1d2c3b4a5e    // DATE_UUID
 * </pre>
 * The extension never contains a dot, so {@link #baseOf(Path)} recovers the
 * target path from any archive path.
 */
public final class ArchiveNamer {

    /** Fixed-width UTC timestamp; {@code XXXXX} renders the zero offset as {@code Z}. */
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("yyyyMMdd'T'HHmmssXXXXX", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    /** Generation number the executor always archives the target into. */
    static final long FIRST_GENERATION = 1;

    private final Clock clock;
    private final Supplier<UUID> uuidSupplier;

    public ArchiveNamer() {
        this(Clock.systemUTC(), UUID::randomUUID);
    }

    public ArchiveNamer(Clock clock, Supplier<UUID> uuidSupplier) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.uuidSupplier = Objects.requireNonNull(uuidSupplier, "uuidSupplier");
    }

    /**
     * Returns the path the target is archived to under {@code policy}.
     * <p>
     * For {@link SuffixExtension#NUMBERING} this is always generation 1; the
     * caller is expected to have renumbered existing archives first.
     */
    public Path nameFor(Path target, SuffixExtension policy) {
        switch (policy) {
            case NUMBERING:
                return withGeneration(target, FIRST_GENERATION);
            case DATE_UUID:
                String stamp = TIMESTAMP_FORMAT.format(clock.instant());
                String id = uuidSupplier.get().toString().toLowerCase(Locale.ROOT);
                return appendExtension(target, stamp + "_" + id);
            default:
                throw new IllegalArgumentException("Unsupported suffix extension: " + policy);
        }
    }

    /** {@code target} with {@code .generation} appended. */
    public static Path withGeneration(Path target, long generation) {
        return appendExtension(target, Long.toString(generation));
    }

    /**
     * Strips the last extension from the file name.
     * A name without a dot (or with only a leading dot) is returned unchanged.
     */
    public static Path baseOf(Path path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return path;
        }
        return path.resolveSibling(name.substring(0, dot));
    }

    /** The numeric extension of an archive, if it has one. */
    public static OptionalLong generationOf(Path archive) {
        String name = fileName(archive);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return OptionalLong.empty();
        }
        String suffix = name.substring(dot + 1);
        for (int i = 0; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) {
                return OptionalLong.empty();
            }
        }
        try {
            return OptionalLong.of(Long.parseLong(suffix));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static Path appendExtension(Path target, String extension) {
        return target.resolveSibling(fileName(target) + "." + extension);
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            throw new IllegalArgumentException("Path has no file name: " + path);
        }
        return name.toString();
    }
}
