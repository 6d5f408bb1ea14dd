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
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Configuration for a {@link FileRotationLogger}.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Drotlog.file=/var/log/app.log})</li>
 *   <li>Environment variables (e.g., {@code ROTLOG_FILE})</li>
 *   <li>Properties file ({@code rotlog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>file</td><td>rotlog.file</td><td>ROTLOG_FILE</td><td>~/.rotlog/app.log</td></tr>
 *   <tr><td>filePermission</td><td>rotlog.filePermission</td><td>ROTLOG_FILE_PERMISSION</td><td>640</td></tr>
 *   <tr><td>suffixExtension</td><td>rotlog.suffixExtension</td><td>ROTLOG_SUFFIX_EXTENSION</td><td>numbering</td></tr>
 *   <tr><td>maxFileSize</td><td>rotlog.maxFileSize</td><td>ROTLOG_MAX_FILE_SIZE</td><td>10485760</td></tr>
 *   <tr><td>maxArchivedFilesCount</td><td>rotlog.maxArchivedFilesCount</td><td>ROTLOG_MAX_ARCHIVED_FILES_COUNT</td><td>5</td></tr>
 *   <tr><td>rotationCheckFrequency</td><td>rotlog.rotationCheckFrequency</td><td>ROTLOG_ROTATION_CHECK_FREQUENCY</td><td>50000</td></tr>
 *   <tr><td>rotationCheckIntervalSeconds</td><td>rotlog.rotationCheckIntervalSeconds</td><td>ROTLOG_ROTATION_CHECK_INTERVAL_SECONDS</td><td>480</td></tr>
 *   <tr><td>flushThreshold</td><td>rotlog.flushThreshold</td><td>ROTLOG_FLUSH_THRESHOLD</td><td>200</td></tr>
 *   <tr><td>syncEnabled</td><td>rotlog.syncEnabled</td><td>ROTLOG_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>minLevel</td><td>rotlog.minLevel</td><td>ROTLOG_MIN_LEVEL</td><td>trace</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # rotlog.properties
 * rotlog.file=/var/log/myapp/app.log
 * rotlog.suffixExtension=date_uuid
 * rotlog.maxFileSize=52428800
 * rotlog.maxArchivedFilesCount=10
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * FileRotationLoggerConfig config = FileRotationLoggerConfig.builder()
 *     .file(Path.of("/var/log/myapp/app.log"))
 *     .maxFileSize(50L * 1024 * 1024)
 *     .build();
 *
 * try (FileRotationLogger logger = new FileRotationLogger(config)) {
 *     logger.log(LogLevel.INFO, "started");
 * }
 * </pre>
 */
public final class FileRotationLoggerConfig {

    private static final String PROPERTIES_FILE = "rotlog.properties";

    // Property keys
    private static final String PROP_FILE = "rotlog.file";
    private static final String PROP_FILE_PERMISSION = "rotlog.filePermission";
    private static final String PROP_SUFFIX_EXTENSION = "rotlog.suffixExtension";
    private static final String PROP_MAX_FILE_SIZE = "rotlog.maxFileSize";
    private static final String PROP_MAX_ARCHIVED_FILES_COUNT = "rotlog.maxArchivedFilesCount";
    private static final String PROP_CHECK_FREQUENCY = "rotlog.rotationCheckFrequency";
    private static final String PROP_CHECK_INTERVAL_SECONDS = "rotlog.rotationCheckIntervalSeconds";
    private static final String PROP_FLUSH_THRESHOLD = "rotlog.flushThreshold";
    private static final String PROP_SYNC_ENABLED = "rotlog.syncEnabled";
    private static final String PROP_MIN_LEVEL = "rotlog.minLevel";

    // Environment variable keys
    private static final String ENV_FILE = "ROTLOG_FILE";
    private static final String ENV_FILE_PERMISSION = "ROTLOG_FILE_PERMISSION";
    private static final String ENV_SUFFIX_EXTENSION = "ROTLOG_SUFFIX_EXTENSION";
    private static final String ENV_MAX_FILE_SIZE = "ROTLOG_MAX_FILE_SIZE";
    private static final String ENV_MAX_ARCHIVED_FILES_COUNT = "ROTLOG_MAX_ARCHIVED_FILES_COUNT";
    private static final String ENV_CHECK_FREQUENCY = "ROTLOG_ROTATION_CHECK_FREQUENCY";
    private static final String ENV_CHECK_INTERVAL_SECONDS = "ROTLOG_ROTATION_CHECK_INTERVAL_SECONDS";
    private static final String ENV_FLUSH_THRESHOLD = "ROTLOG_FLUSH_THRESHOLD";
    private static final String ENV_SYNC_ENABLED = "ROTLOG_SYNC_ENABLED";
    private static final String ENV_MIN_LEVEL = "ROTLOG_MIN_LEVEL";

    // Defaults
    private static final Path DEFAULT_FILE = Path.of(System.getProperty("user.home"), ".rotlog", "app.log");
    private static final String DEFAULT_FILE_PERMISSION = "640";
    private static final SuffixExtension DEFAULT_SUFFIX_EXTENSION = SuffixExtension.NUMBERING;
    private static final long DEFAULT_MAX_FILE_SIZE = RotationConfig.DEFAULT_MAX_FILE_SIZE;
    private static final int DEFAULT_MAX_ARCHIVED_FILES_COUNT = RotationConfig.DEFAULT_MAX_ARCHIVED_FILES_COUNT;
    private static final long DEFAULT_CHECK_FREQUENCY = RotationThrottle.DEFAULT_CHECK_FREQUENCY;
    private static final long DEFAULT_CHECK_INTERVAL_SECONDS = RotationThrottle.DEFAULT_CHECK_INTERVAL.getSeconds();
    private static final int DEFAULT_FLUSH_THRESHOLD = WriteBuffer.DEFAULT_FLUSH_THRESHOLD;
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final LogLevel DEFAULT_MIN_LEVEL = LogLevel.TRACE;

    private final Path file;
    private final String filePermission;
    private final RotationConfig rotationConfig;
    private final long rotationCheckFrequency;
    private final Duration rotationCheckInterval;
    private final int flushThreshold;
    private final boolean syncEnabled;
    private final LogLevel minLevel;

    private FileRotationLoggerConfig(Builder builder) {
        this.file = builder.file;
        this.filePermission = builder.filePermission;
        this.rotationConfig = new RotationConfig(
                builder.suffixExtension, builder.maxFileSize, builder.maxArchivedFilesCount);
        this.rotationCheckFrequency = builder.rotationCheckFrequency;
        this.rotationCheckInterval = builder.rotationCheckInterval;
        this.flushThreshold = builder.flushThreshold;
        this.syncEnabled = builder.syncEnabled;
        this.minLevel = builder.minLevel;
    }

    /** Target log file. */
    public Path file() {
        return file;
    }

    /** Octal permission bits for newly created target files, e.g. {@code "640"}. */
    public String filePermission() {
        return filePermission;
    }

    /** Archive naming, size limit and archive count. */
    public RotationConfig rotationConfig() {
        return rotationConfig;
    }

    /** Log calls between forced size checks. */
    public long rotationCheckFrequency() {
        return rotationCheckFrequency;
    }

    /** Maximum time between size checks. */
    public Duration rotationCheckInterval() {
        return rotationCheckInterval;
    }

    /** Writes between fsyncs. */
    public int flushThreshold() {
        return flushThreshold;
    }

    /** Whether flushes reach stable storage (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Lines below this level are dropped. */
    public LogLevel minLevel() {
        return minLevel;
    }

    @Override
    public String toString() {
        return "FileRotationLoggerConfig{" +
                "file=" + file +
                ", filePermission=" + filePermission +
                ", suffixExtension=" + rotationConfig.suffixExtension().configName() +
                ", maxFileSize=" + Long.toUnsignedString(rotationConfig.maxFileSize()) +
                ", maxArchivedFilesCount=" + rotationConfig.maxArchivedFilesCount() +
                ", rotationCheckFrequency=" + rotationCheckFrequency +
                ", rotationCheckInterval=" + rotationCheckInterval +
                ", flushThreshold=" + flushThreshold +
                ", syncEnabled=" + syncEnabled +
                ", minLevel=" + minLevel +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code FileRotationLoggerConfig.builder().build()}.
     */
    public static FileRotationLoggerConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link FileRotationLoggerConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path file;
        private String filePermission;
        private SuffixExtension suffixExtension;
        private Long maxFileSize;
        private Integer maxArchivedFilesCount;
        private Long rotationCheckFrequency;
        private Duration rotationCheckInterval;
        private Integer flushThreshold;
        private Boolean syncEnabled;
        private LogLevel minLevel;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the target file. */
        public Builder file(Path file) {
            this.file = file;
            return this;
        }

        /** Sets the target file from a string path. */
        public Builder file(String file) {
            this.file = Path.of(file);
            return this;
        }

        /** Sets the octal permission string (default: 640). */
        public Builder filePermission(String filePermission) {
            this.filePermission = filePermission;
            return this;
        }

        /** Sets the archive naming policy (default: numbering). */
        public Builder suffixExtension(SuffixExtension suffixExtension) {
            this.suffixExtension = suffixExtension;
            return this;
        }

        /** Sets the rotation size in bytes, unsigned (default: 10 MiB). */
        public Builder maxFileSize(long maxFileSize) {
            this.maxFileSize = maxFileSize;
            return this;
        }

        /** Sets how many archives to keep, 0..255 (default: 5). */
        public Builder maxArchivedFilesCount(int maxArchivedFilesCount) {
            this.maxArchivedFilesCount = maxArchivedFilesCount;
            return this;
        }

        /** Copies all three fields of a {@link RotationConfig}. */
        public Builder rotationConfig(RotationConfig rotationConfig) {
            this.suffixExtension = rotationConfig.suffixExtension();
            this.maxFileSize = rotationConfig.maxFileSize();
            this.maxArchivedFilesCount = rotationConfig.maxArchivedFilesCount();
            return this;
        }

        /** Sets the number of log calls between size checks (default: 50000). */
        public Builder rotationCheckFrequency(long rotationCheckFrequency) {
            this.rotationCheckFrequency = rotationCheckFrequency;
            return this;
        }

        /** Sets the maximum time between size checks (default: 8 minutes). */
        public Builder rotationCheckInterval(Duration rotationCheckInterval) {
            this.rotationCheckInterval = rotationCheckInterval;
            return this;
        }

        /** Sets the number of writes between fsyncs (default: 200). */
        public Builder flushThreshold(int flushThreshold) {
            this.flushThreshold = flushThreshold;
            return this;
        }

        /** Enables or disables fsync on flush (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets the minimum level written (default: trace). */
        public Builder minLevel(LogLevel minLevel) {
            this.minLevel = minLevel;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         * <p>
         * Out-of-range values from properties, environment or file fall back to
         * the default; out-of-range programmatic values are rejected.
         *
         * @throws IllegalArgumentException if a programmatic archive count is outside 0..255
         */
        public FileRotationLoggerConfig build() {
            // Resolve each value with priority: programmatic > sysprop > env > file > default
            if (file == null) {
                String value = resolve(PROP_FILE, ENV_FILE);
                file = value != null ? Path.of(value) : DEFAULT_FILE;
            }
            if (filePermission == null) {
                String value = resolve(PROP_FILE_PERMISSION, ENV_FILE_PERMISSION);
                filePermission = value != null ? value.trim() : DEFAULT_FILE_PERMISSION;
            }
            if (suffixExtension == null) {
                suffixExtension = resolveSuffixExtension();
            }
            if (maxFileSize == null) {
                maxFileSize = resolveLong(PROP_MAX_FILE_SIZE, ENV_MAX_FILE_SIZE, DEFAULT_MAX_FILE_SIZE);
            }
            if (maxArchivedFilesCount == null) {
                maxArchivedFilesCount = resolveInt(PROP_MAX_ARCHIVED_FILES_COUNT, ENV_MAX_ARCHIVED_FILES_COUNT,
                        DEFAULT_MAX_ARCHIVED_FILES_COUNT, 0, RotationConfig.MAX_ARCHIVED_FILES_LIMIT);
            }
            if (rotationCheckFrequency == null) {
                rotationCheckFrequency = resolveLong(PROP_CHECK_FREQUENCY, ENV_CHECK_FREQUENCY,
                        DEFAULT_CHECK_FREQUENCY, 1, Long.MAX_VALUE);
            }
            if (rotationCheckInterval == null) {
                rotationCheckInterval = Duration.ofSeconds(resolveLong(PROP_CHECK_INTERVAL_SECONDS,
                        ENV_CHECK_INTERVAL_SECONDS, DEFAULT_CHECK_INTERVAL_SECONDS, 0, Long.MAX_VALUE));
            }
            if (flushThreshold == null) {
                flushThreshold = resolveInt(PROP_FLUSH_THRESHOLD, ENV_FLUSH_THRESHOLD, DEFAULT_FLUSH_THRESHOLD,
                        1, Integer.MAX_VALUE);
            }
            if (syncEnabled == null) {
                String value = resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED);
                syncEnabled = value != null ? Boolean.parseBoolean(value.trim()) : DEFAULT_SYNC_ENABLED;
            }
            if (minLevel == null) {
                minLevel = resolveMinLevel();
            }

            return new FileRotationLoggerConfig(this);
        }

        /** First non-blank value from system property, environment, then properties file. */
        private String resolve(String sysProp, String envVar) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            return null;
        }

        private long resolveLong(String sysProp, String envVar, long defaultValue) {
            return resolveLong(sysProp, envVar, defaultValue, Long.MIN_VALUE, Long.MAX_VALUE);
        }

        /** Unparseable values and values outside {@code [min, max]} resolve to the default. */
        private long resolveLong(String sysProp, String envVar, long defaultValue, long min, long max) {
            String value = resolve(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                long parsed = Long.parseLong(value.trim());
                return parsed >= min && parsed <= max ? parsed : defaultValue;
            } catch (NumberFormatException ignored) {
                return defaultValue;
            }
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue, int min, int max) {
            String value = resolve(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                int parsed = Integer.parseInt(value.trim());
                return parsed >= min && parsed <= max ? parsed : defaultValue;
            } catch (NumberFormatException ignored) {
                return defaultValue;
            }
        }

        private SuffixExtension resolveSuffixExtension() {
            String value = resolve(PROP_SUFFIX_EXTENSION, ENV_SUFFIX_EXTENSION);
            if (value == null) {
                return DEFAULT_SUFFIX_EXTENSION;
            }
            try {
                return SuffixExtension.fromConfigName(value);
            } catch (IllegalArgumentException ignored) {
                return DEFAULT_SUFFIX_EXTENSION;
            }
        }

        private LogLevel resolveMinLevel() {
            String value = resolve(PROP_MIN_LEVEL, ENV_MIN_LEVEL);
            if (value == null) {
                return DEFAULT_MIN_LEVEL;
            }
            try {
                return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ignored) {
                return DEFAULT_MIN_LEVEL;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = FileRotationLoggerConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException ignored) {}

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException ignored) {}
            }

            return props;
        }
    }
}
