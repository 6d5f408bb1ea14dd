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
package dev.mars.rotlog.demo;

import dev.mars.rotlog.rotation.ArchiveEnumerator;
import dev.mars.rotlog.rotation.FileRotationLogger;
import dev.mars.rotlog.rotation.FileRotationLoggerConfig;
import dev.mars.rotlog.rotation.LogLevel;
import dev.mars.rotlog.rotation.RotationListener;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Demo entry point for the rotating file log sink.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code basic} - writes numbered lines into a log with a tiny size limit
 *       and prints every archive and eviction</li>
 *   <li>{@code stress} - several threads write concurrently into one logger,
 *       then the resulting archive set is printed</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Unless overridden by the demo, settings come from {@link FileRotationLoggerConfig}:
 * <ol>
 *   <li>Command-line argument (target file only)</li>
 *   <li>System properties: {@code -Drotlog.maxArchivedFilesCount=3 -Drotlog.suffixExtension=date_uuid ...}</li>
 *   <li>Environment variables: {@code ROTLOG_MAX_ARCHIVED_FILES_COUNT, ROTLOG_SUFFIX_EXTENSION, ...}</li>
 *   <li>Properties file: {@code rotlog.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl rotlog-demo -am
 *
 * # Basic rotation walk-through
 * java -cp "rotlog-demo/target/*:..." dev.mars.rotlog.demo.RotationDemo basic data/demo/app.log
 *
 * # Concurrent writers
 * java -cp "rotlog-demo/target/*:..." dev.mars.rotlog.demo.RotationDemo stress data/demo/app.log
 * </pre>
 *
 * @see FileRotationLoggerConfig
 */
public class RotationDemo {

    private static final Path DEFAULT_FILE = Path.of("data", "demo", "app.log");

    private static final long DEMO_MAX_FILE_SIZE = 256;

    public static void main(String[] args) throws Exception {
        String mode = args.length > 0 ? args[0] : "basic";
        Path file = args.length > 1 && !args[1].isBlank() ? Path.of(args[1]) : DEFAULT_FILE;

        System.out.println("+---------------------------------------+");
        System.out.println("|        Rotating Log Sink Demo         |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        switch (mode) {
            case "basic":
                runBasic(file);
                break;
            case "stress":
                runStress(file);
                break;
            default:
                System.err.println("Unknown mode: " + mode + " (expected basic or stress)");
                System.exit(2);
        }
    }

    private static void runBasic(Path file) throws Exception {
        FileRotationLoggerConfig config = FileRotationLoggerConfig.builder()
                .file(file)
                .maxFileSize(DEMO_MAX_FILE_SIZE)
                .rotationCheckFrequency(1)
                .flushThreshold(10)
                .build();
        System.out.println("Configuration: " + config);
        System.out.println();

        RotationListener printer = new RotationListener() {
            @Override
            public void onArchived(Path oldPath, Path newPath) {
                System.out.println("  [ARCHIVED] " + oldPath.getFileName() + " -> " + newPath.getFileName());
            }

            @Override
            public void onArchiveRemoved(Path path) {
                System.out.println("  [REMOVED]  " + path.getFileName());
            }
        };

        try (FileRotationLogger logger = new FileRotationLogger(config, printer,
                (level, message) -> "[" + level + "] " + message)) {
            System.out.println("[OK] Logger opened at: " + logger.file());

            CompletableFuture<Void> last = CompletableFuture.completedFuture(null);
            for (int i = 1; i <= 60; i++) {
                LogLevel level = i % 10 == 0 ? LogLevel.WARNING : LogLevel.INFO;
                last = logger.log(level, "demo line " + i + " - the quick brown fox jumps over the lazy dog");
            }
            last.join();
            logger.flush().join();
            System.out.println("\n[OK] Wrote 60 lines");

            printArchives(logger.file());
        }

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  Rotation demo complete!              |");
        System.out.println("|  Run again to see archives shift.     |");
        System.out.println("+---------------------------------------+");
    }

    private static void runStress(Path file) throws Exception {
        int writers = 8;
        int linesPerWriter = 5_000;

        FileRotationLoggerConfig config = FileRotationLoggerConfig.builder()
                .file(file)
                .maxFileSize(64 * 1024)
                .rotationCheckFrequency(500)
                .build();
        System.out.println("Configuration: " + config);

        AtomicInteger archived = new AtomicInteger();
        AtomicInteger removed = new AtomicInteger();
        RotationListener counter = new RotationListener() {
            @Override
            public void onArchived(Path oldPath, Path newPath) {
                archived.incrementAndGet();
            }

            @Override
            public void onArchiveRemoved(Path path) {
                removed.incrementAndGet();
            }
        };

        long start = System.nanoTime();
        try (FileRotationLogger logger = new FileRotationLogger(config, counter)) {
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            List<CompletableFuture<Void>> tails = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                CompletableFuture<Void> tail = new CompletableFuture<>();
                tails.add(tail);
                pool.execute(() -> {
                    CompletableFuture<Void> last = CompletableFuture.completedFuture(null);
                    for (int i = 0; i < linesPerWriter; i++) {
                        last = logger.log(LogLevel.INFO, "writer-" + writer + " line-" + i);
                    }
                    last.whenComplete((v, e) -> tail.complete(null));
                });
            }
            CompletableFuture.allOf(tails.toArray(new CompletableFuture[0])).join();
            pool.shutdown();
            pool.awaitTermination(10, TimeUnit.SECONDS);
            logger.flush().join();

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            System.out.printf("[OK] %d lines from %d writers in %d ms%n", writers * linesPerWriter, writers, elapsedMs);
            System.out.printf("[OK] %d rotations, %d archives evicted%n", archived.get(), removed.get());
            printArchives(logger.file());
        }
    }

    private static void printArchives(Path target) throws Exception {
        System.out.println("\n  Target: " + target.getFileName() + " (" + Files.size(target) + " bytes)");
        System.out.println("  Archives (oldest first):");
        for (Path archive : new ArchiveEnumerator().listArchives(target)) {
            System.out.printf("    %-60s %6d bytes%n", archive.getFileName(), Files.size(archive));
        }
    }
}
