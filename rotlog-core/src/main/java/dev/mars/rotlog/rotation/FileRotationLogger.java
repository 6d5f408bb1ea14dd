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

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Appends log lines to a single file and rotates it when it grows too large.
 * <p>
 * <b>Files:</b>
 * <pre>
 * logs/
 *  ├─ app.log      // target, receives appended lines
 *  ├─ app.log.1    // most recent archive (NUMBERING)
 *  └─ app.log.2
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * {@link #log} may be called from any thread. Every append, flush and
 * rotation runs on one single-threaded executor owned by this instance, so
 * writes and rotations of one file are totally ordered and the mutable
 * counters and file handle are never shared.
 * <p>
 * <b>Per log call:</b>
 * <ol>
 *   <li>append the formatted line</li>
 *   <li>count it in the {@link WriteBuffer}, fsync if the threshold is reached</li>
 *   <li>unless rotation is paused, ask the {@link RotationThrottle} whether to check the size</li>
 *   <li>if the target exceeds {@link RotationConfig#maxFileSize()}, run the {@link RotationExecutor}</li>
 * </ol>
 * <p>
 * <b>Failures:</b> an invalid path or permission string fails construction
 * with {@link LogFileException}. After construction nothing is thrown: I/O
 * errors are logged through SLF4J and the step is skipped. If the target
 * cannot be reopened after a rotation, the logger is degraded; each later
 * append first tries to reopen the target and drops its line if that fails.
 *
 * @see FileRotationLoggerConfig
 */
public final class FileRotationLogger implements Closeable {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileRotationLogger.class);

    // ========================================================================
    // Constants
    // ========================================================================

    private static final Pattern OCTAL_PERMISSION = Pattern.compile("[0-7]{3}");

    private static final String LINE_SEPARATOR = "\n";

    private static final long CLOSE_TIMEOUT_SECONDS = 10;

    // ========================================================================
    // State
    // ========================================================================

    /**
     * Single-threaded executor for all file operations of this logger.
     * <p>
     * <b>INVARIANT:</b> {@link #channel}, {@link #throttle} and
     * {@link #writeBuffer} are only touched from this executor after
     * construction.
     */
    private final ExecutorService logExecutor;
    private final FileRotationLoggerConfig config;
    private final Path file;
    private final Set<PosixFilePermission> permissions;
    private final RotationConfig rotationConfig;
    private final LogLevel minLevel;
    private final boolean syncEnabled;
    private final LineFormatter formatter;
    private final FileMetadata metadata;
    private final RotationThrottle throttle;
    private final WriteBuffer writeBuffer;
    private final RotationExecutor rotationExecutor;

    private FileChannel channel;
    private volatile Thread executorThread;
    private volatile boolean rotationPaused = false;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a logger for {@code file}. Settings not given here (throttle,
     * flush threshold, sync) come from {@link FileRotationLoggerConfig#builder()}.
     *
     * @param file           the target file
     * @param filePermission octal permission bits for created files, e.g. {@code "640"}
     * @param rotationConfig archive naming, size limit and archive count
     * @param listener       receives archive and eviction events
     * @throws LogFileException if the path or permission is null or invalid, or the file cannot be opened
     */
    public FileRotationLogger(Path file, String filePermission, RotationConfig rotationConfig,
                              RotationListener listener) {
        this(FileRotationLoggerConfig.builder()
                        .file(requireArgument(file, "Log file path is null"))
                        .filePermission(requireArgument(filePermission, "File permission is null"))
                        .rotationConfig(Objects.requireNonNull(rotationConfig, "rotationConfig"))
                        .build(),
                listener);
    }

    /**
     * Creates a logger with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     */
    public FileRotationLogger() {
        this(FileRotationLoggerConfig.load());
    }

    public FileRotationLogger(FileRotationLoggerConfig config) {
        this(config, RotationListener.NONE);
    }

    public FileRotationLogger(FileRotationLoggerConfig config, RotationListener listener) {
        this(config, listener, LineFormatter.plain());
    }

    public FileRotationLogger(FileRotationLoggerConfig config, RotationListener listener, LineFormatter formatter) {
        this(config, listener, formatter, Clock.systemUTC(), UUID::randomUUID,
                FileMetadata.nio(), FileOperations.nio());
    }

    FileRotationLogger(FileRotationLoggerConfig config,
                       RotationListener listener,
                       LineFormatter formatter,
                       Clock clock,
                       Supplier<UUID> uuidSupplier,
                       FileMetadata metadata,
                       FileOperations files) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(listener, "listener");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.metadata = Objects.requireNonNull(metadata, "metadata");

        this.file = validateFile(config.file());
        this.permissions = validateFilePermission(config.filePermission());
        this.rotationConfig = config.rotationConfig();
        this.minLevel = config.minLevel();
        this.syncEnabled = config.syncEnabled();

        this.throttle = new RotationThrottle(config.rotationCheckFrequency(), config.rotationCheckInterval(), clock);
        this.writeBuffer = new WriteBuffer(config.flushThreshold(), this::syncTarget);
        this.rotationExecutor = new RotationExecutor(rotationConfig,
                new ArchiveNamer(clock, uuidSupplier),
                new ArchiveEnumerator(metadata),
                files,
                listener);

        try {
            openTarget();
        } catch (IOException | UnsupportedOperationException e) {
            LOG.error("Failed to open log file {}: {}", file, e.getMessage(), e);
            throw new LogFileException("Failed to open log file " + file, e);
        }

        String threadName = "rotlog-" + file.getFileName();
        this.logExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            executorThread = t;
            return t;
        });

        LOG.info("FileRotationLogger initialized: {}", config);
        if (!syncEnabled) {
            LOG.warn("FileRotationLogger created with fsync DISABLED for {}. Lines may be lost on crash.", file);
        }
    }

    /** The absolute target path. */
    public Path file() {
        return file;
    }

    /** Returns the configuration used by this logger. */
    public FileRotationLoggerConfig config() {
        return config;
    }

    public boolean isRotationPaused() {
        return rotationPaused;
    }

    // ========================================================================
    // Write API
    // ========================================================================

    /**
     * Queues a line for the target file.
     * <p>
     * The returned future completes once the line has been appended and any
     * resulting flush or rotation has finished. It never completes
     * exceptionally; failures are logged.
     */
    public CompletableFuture<Void> log(LogLevel level, String message) {
        Objects.requireNonNull(level, "level");
        if (!level.isAtLeast(minLevel)) {
            return CompletableFuture.completedFuture(null);
        }
        return submit(() -> handleLog(level, message == null ? "null" : message));
    }

    /**
     * Forces pending writes to stable storage, bypassing the flush threshold.
     */
    public CompletableFuture<Void> flush() {
        return submit(() -> writeBuffer.flushIfNeeded(true));
    }

    /**
     * Stops size checks and forces a flush, e.g. when the host application
     * is being suspended. Appends continue; the throttle is not consulted
     * until {@link #resumeRotation()}.
     * <p>
     * The flush is queued behind lines already submitted, so it covers them too.
     */
    public CompletableFuture<Void> pauseRotation() {
        rotationPaused = true;
        LOG.info("Rotation paused for {}", file);
        return flush();
    }

    /** Re-enables size checks after {@link #pauseRotation()}. */
    public void resumeRotation() {
        rotationPaused = false;
        LOG.info("Rotation resumed for {}", file);
    }

    /**
     * Flushes, closes the target file and stops the executor. Idempotent.
     * <p>
     * When called from a {@link RotationListener} callback the flush and close
     * run after the current rotation finishes and this method returns without
     * waiting for them.
     */
    @Override
    public void close() {
        if (closed) {
            LOG.debug("Logger already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing FileRotationLogger for {}", file);

        logExecutor.execute(() -> {
            writeBuffer.flushIfNeeded(true);
            closeTarget();
        });
        logExecutor.shutdown();
        if (Thread.currentThread() == executorThread) {
            LOG.debug("close() called on the log executor for {}, not waiting for termination", file);
            return;
        }
        try {
            if (!logExecutor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Log executor for {} did not terminate within {} s", file, CLOSE_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while closing logger for {}", file);
        }
        LOG.info("FileRotationLogger closed for {}", file);
    }

    // ========================================================================
    // Executor-side operations
    // ========================================================================

    private CompletableFuture<Void> submit(Runnable task) {
        if (closed) {
            LOG.debug("Logger for {} is closed, dropping request", file);
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.runAsync(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOG.error("Unexpected failure in logger for {}: {}", file, e.getMessage(), e);
                }
            }, logExecutor);
        } catch (RejectedExecutionException e) {
            LOG.debug("Logger for {} is shutting down, dropping request", file);
            return CompletableFuture.completedFuture(null);
        }
    }

    private void handleLog(LogLevel level, String message) {
        if (!append(level, message)) {
            return;
        }
        writeBuffer.recordWrite();
        writeBuffer.flushIfNeeded(false);
        rotateIfNeeded();
    }

    /**
     * Writes one formatted line. Returns false if the line was dropped.
     */
    private boolean append(LogLevel level, String message) {
        if (channel == null) {
            LOG.warn("Target {} is not open, attempting to reopen before append", file);
            try {
                openTarget();
                LOG.info("Reopened target {}", file);
            } catch (IOException | RuntimeException e) {
                LOG.error("Dropping log line: target {} cannot be reopened: {}", file, e.getMessage());
                return false;
            }
        }

        ByteBuffer buf = StandardCharsets.UTF_8.encode(formatter.format(level, message) + LINE_SEPARATOR);
        try {
            while (buf.hasRemaining()) {
                channel.write(buf);
            }
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to append to {}: {}", file, e.getMessage(), e);
            return false;
        }
    }

    private void rotateIfNeeded() {
        if (rotationPaused) {
            LOG.trace("Rotation paused, skipping size check for {}", file);
            return;
        }
        if (!throttle.recordCall()) {
            return;
        }

        long size;
        try {
            size = metadata.size(file);
        } catch (IOException e) {
            LOG.warn("Failed to read size of {}: {}", file, e.getMessage());
            return;
        }
        if (!rotationConfig.exceedsMaxFileSize(size)) {
            LOG.trace("Size check: {} is {} bytes, no rotation", file, size);
            return;
        }

        LOG.debug("{} is {} bytes (max {}), rotating", file, size, Long.toUnsignedString(rotationConfig.maxFileSize()));
        writeBuffer.flushIfNeeded(true);
        closeTarget();
        rotationExecutor.rotate(file, this::openTarget);
    }

    private void syncTarget() throws IOException {
        if (!syncEnabled) {
            LOG.trace("flush requested but fsync is disabled");
            return;
        }
        if (channel != null) {
            channel.force(false);
        }
    }

    /**
     * Opens (creating if needed) the target in append mode. On failure the
     * channel stays {@code null}.
     */
    private void openTarget() throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        boolean created = !Files.exists(file);
        FileChannel opened = FileChannel.open(file,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND);
        if (created && permissions != null) {
            try {
                Files.setPosixFilePermissions(file, permissions);
            } catch (IOException e) {
                opened.close();
                throw e;
            }
        }
        channel = opened;
        LOG.debug("Opened target {} (created={})", file, created);
    }

    private void closeTarget() {
        FileChannel current = channel;
        channel = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
            LOG.trace("Target channel closed: {}", file);
        } catch (IOException e) {
            LOG.warn("Error closing {}: {}", file, e.getMessage());
        }
    }

    // ========================================================================
    // Validation
    // ========================================================================

    private static <T> T requireArgument(T value, String message) {
        if (value == null) {
            throw new LogFileException(message);
        }
        return value;
    }

    private static Path validateFile(Path file) {
        requireArgument(file, "Log file path is null");
        Path normalized = file.toAbsolutePath().normalize();
        if (normalized.getFileName() == null) {
            throw new LogFileException("Log file path has no file name: " + file);
        }
        if (Files.isDirectory(normalized)) {
            throw new LogFileException("Log file path is a directory: " + file);
        }
        return normalized;
    }

    /**
     * Parses an octal permission string such as {@code "640"}.
     *
     * @return the POSIX permission set, or {@code null} on non-POSIX file systems
     */
    private static Set<PosixFilePermission> validateFilePermission(String filePermission) {
        if (filePermission == null || !OCTAL_PERMISSION.matcher(filePermission).matches()) {
            throw new LogFileException("Invalid file permission: " + filePermission
                    + " (expected three octal digits, e.g. 640)");
        }
        if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            LOG.debug("POSIX permissions unsupported, ignoring filePermission={}", filePermission);
            return null;
        }
        return PosixFilePermissions.fromString(toSymbolic(filePermission));
    }

    /** {@code "640"} to {@code "rw-r-----"}. */
    static String toSymbolic(String octal) {
        StringBuilder sb = new StringBuilder(9);
        for (int i = 0; i < octal.length(); i++) {
            int digit = octal.charAt(i) - '0';
            sb.append((digit & 4) != 0 ? 'r' : '-');
            sb.append((digit & 2) != 0 ? 'w' : '-');
            sb.append((digit & 1) != 0 ? 'x' : '-');
        }
        return sb.toString();
    }

    // ========================================================================
    // Exception
    // ========================================================================

    /**
     * Thrown when a logger cannot be created: invalid path, invalid
     * permission string, or a target file that cannot be opened.
     */
    public static class LogFileException extends RuntimeException {
        public LogFileException(String message) {
            super(message);
        }

        public LogFileException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
