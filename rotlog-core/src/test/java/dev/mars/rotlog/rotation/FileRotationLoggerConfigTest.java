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

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileRotationLoggerConfig resolution and RotationConfig values.
 * <p>
 * Tests system properties, default values, and configuration building.
 */
class FileRotationLoggerConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("rotlog.file");
        System.clearProperty("rotlog.filePermission");
        System.clearProperty("rotlog.suffixExtension");
        System.clearProperty("rotlog.maxFileSize");
        System.clearProperty("rotlog.maxArchivedFilesCount");
        System.clearProperty("rotlog.rotationCheckFrequency");
        System.clearProperty("rotlog.rotationCheckIntervalSeconds");
        System.clearProperty("rotlog.flushThreshold");
        System.clearProperty("rotlog.syncEnabled");
        System.clearProperty("rotlog.minLevel");
    }

    // ========================================================================
    // System Property Resolution Tests
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property file is respected")
        void testFileSystemProperty() {
            Path custom = tempDir.resolve("custom.log");
            System.setProperty("rotlog.file", custom.toString());

            assertEquals(custom, FileRotationLoggerConfig.builder().build().file());
        }

        @Test
        @DisplayName("System property suffixExtension=date_uuid is respected")
        void testSuffixExtension() {
            System.setProperty("rotlog.suffixExtension", "DATE_UUID");

            FileRotationLoggerConfig config = FileRotationLoggerConfig.builder().build();
            assertEquals(SuffixExtension.DATE_UUID, config.rotationConfig().suffixExtension());
        }

        @Test
        @DisplayName("Numeric system properties are respected")
        void testNumericProperties() {
            System.setProperty("rotlog.maxFileSize", "2048");
            System.setProperty("rotlog.maxArchivedFilesCount", "9");
            System.setProperty("rotlog.rotationCheckFrequency", "10");
            System.setProperty("rotlog.rotationCheckIntervalSeconds", "30");
            System.setProperty("rotlog.flushThreshold", " 50 ");

            FileRotationLoggerConfig config = FileRotationLoggerConfig.builder().build();
            assertEquals(2048, config.rotationConfig().maxFileSize());
            assertEquals(9, config.rotationConfig().maxArchivedFilesCount());
            assertEquals(10, config.rotationCheckFrequency());
            assertEquals(Duration.ofSeconds(30), config.rotationCheckInterval());
            assertEquals(50, config.flushThreshold());
        }

        @Test
        @DisplayName("System property syncEnabled=false and minLevel are respected")
        void testSyncAndLevel() {
            System.setProperty("rotlog.syncEnabled", "false");
            System.setProperty("rotlog.minLevel", "warning");

            FileRotationLoggerConfig config = FileRotationLoggerConfig.builder().build();
            assertFalse(config.syncEnabled());
            assertEquals(LogLevel.WARNING, config.minLevel());
        }

        @Test
        @DisplayName("Invalid values fall back to defaults")
        void testInvalidValues() {
            System.setProperty("rotlog.maxFileSize", "ten megabytes");
            System.setProperty("rotlog.flushThreshold", "1.5");
            System.setProperty("rotlog.suffixExtension", "roman_numerals");
            System.setProperty("rotlog.minLevel", "loud");

            FileRotationLoggerConfig config = FileRotationLoggerConfig.builder().build();
            assertEquals(RotationConfig.DEFAULT_MAX_FILE_SIZE, config.rotationConfig().maxFileSize());
            assertEquals(WriteBuffer.DEFAULT_FLUSH_THRESHOLD, config.flushThreshold());
            assertEquals(SuffixExtension.NUMBERING, config.rotationConfig().suffixExtension());
            assertEquals(LogLevel.TRACE, config.minLevel());
        }

        @Test
        @DisplayName("Blank system property falls back to default")
        void testBlankProperty() {
            System.setProperty("rotlog.filePermission", "   ");

            assertEquals("640", FileRotationLoggerConfig.builder().build().filePermission());
        }

        @ParameterizedTest
        @ValueSource(strings = {"-1", "256", "300"})
        @DisplayName("Archive count outside 0..255 falls back to default")
        void testArchiveCountOutOfRange(String value) {
            System.setProperty("rotlog.maxArchivedFilesCount", value);

            assertEquals(RotationConfig.DEFAULT_MAX_ARCHIVED_FILES_COUNT,
                    FileRotationLoggerConfig.builder().build().rotationConfig().maxArchivedFilesCount());
        }

        @Test
        @DisplayName("Archive count bounds 0 and 255 are accepted")
        void testArchiveCountBounds() {
            System.setProperty("rotlog.maxArchivedFilesCount", "0");
            assertEquals(0, FileRotationLoggerConfig.builder().build().rotationConfig().maxArchivedFilesCount());

            System.setProperty("rotlog.maxArchivedFilesCount", "255");
            assertEquals(255, FileRotationLoggerConfig.builder().build().rotationConfig().maxArchivedFilesCount());
        }

        @ParameterizedTest
        @ValueSource(strings = {"0", "-5"})
        @DisplayName("Non-positive check frequency falls back to default")
        void testCheckFrequencyOutOfRange(String value) {
            System.setProperty("rotlog.rotationCheckFrequency", value);

            assertEquals(RotationThrottle.DEFAULT_CHECK_FREQUENCY,
                    FileRotationLoggerConfig.builder().build().rotationCheckFrequency());
        }

        @Test
        @DisplayName("Negative check interval falls back to default")
        void testCheckIntervalOutOfRange() {
            System.setProperty("rotlog.rotationCheckIntervalSeconds", "-1");

            assertEquals(RotationThrottle.DEFAULT_CHECK_INTERVAL,
                    FileRotationLoggerConfig.builder().build().rotationCheckInterval());
        }

        @Test
        @DisplayName("Zero check interval is accepted")
        void testZeroCheckInterval() {
            System.setProperty("rotlog.rotationCheckIntervalSeconds", "0");

            assertEquals(Duration.ZERO, FileRotationLoggerConfig.builder().build().rotationCheckInterval());
        }

        @ParameterizedTest
        @ValueSource(strings = {"0", "-200"})
        @DisplayName("Non-positive flush threshold falls back to default")
        void testFlushThresholdOutOfRange(String value) {
            System.setProperty("rotlog.flushThreshold", value);

            assertEquals(WriteBuffer.DEFAULT_FLUSH_THRESHOLD,
                    FileRotationLoggerConfig.builder().build().flushThreshold());
        }

        @Test
        @DisplayName("Logger still opens when every numeric property is out of range")
        void testLoggerOpensWithOutOfRangeProperties() throws Exception {
            System.setProperty("rotlog.file", tempDir.resolve("fallback.log").toString());
            System.setProperty("rotlog.flushThreshold", "0");
            System.setProperty("rotlog.rotationCheckFrequency", "-5");
            System.setProperty("rotlog.maxArchivedFilesCount", "300");
            System.setProperty("rotlog.rotationCheckIntervalSeconds", "-1");

            try (FileRotationLogger logger = new FileRotationLogger()) {
                FileRotationLoggerConfig config = logger.config();
                assertEquals(WriteBuffer.DEFAULT_FLUSH_THRESHOLD, config.flushThreshold());
                assertEquals(RotationThrottle.DEFAULT_CHECK_FREQUENCY, config.rotationCheckFrequency());
                assertEquals(RotationConfig.DEFAULT_MAX_ARCHIVED_FILES_COUNT,
                        config.rotationConfig().maxArchivedFilesCount());
                assertEquals(RotationThrottle.DEFAULT_CHECK_INTERVAL, config.rotationCheckInterval());
                logger.log(LogLevel.INFO, "opened").get(5, TimeUnit.SECONDS);
            }
            assertEquals("opened\n", Files.readString(tempDir.resolve("fallback.log")));
        }
    }

    // ========================================================================
    // Programmatic Override Tests
    // ========================================================================

    @Nested
    @DisplayName("Programmatic Override")
    class ProgrammaticOverrideTests {

        @Test
        @DisplayName("Programmatic values override system properties")
        void testProgrammaticWins() {
            System.setProperty("rotlog.maxFileSize", "1");
            System.setProperty("rotlog.syncEnabled", "false");

            FileRotationLoggerConfig config = FileRotationLoggerConfig.builder()
                    .maxFileSize(4096)
                    .syncEnabled(true)
                    .build();
            assertEquals(4096, config.rotationConfig().maxFileSize());
            assertTrue(config.syncEnabled());
        }

        @Test
        @DisplayName("Programmatic archive count outside 0..255 is rejected")
        void testProgrammaticArchiveCountRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> FileRotationLoggerConfig.builder().maxArchivedFilesCount(256).build());
        }

        @Test
        @DisplayName("rotationConfig copies all three fields")
        void testRotationConfigCopy() {
            RotationConfig rotation = new RotationConfig(SuffixExtension.DATE_UUID, 77, 0);

            FileRotationLoggerConfig config = FileRotationLoggerConfig.builder()
                    .rotationConfig(rotation)
                    .build();
            assertEquals(rotation, config.rotationConfig());
        }

        @Test
        @DisplayName("file String overload works correctly")
        void testFileStringOverload() {
            Path custom = tempDir.resolve("string.log");

            assertEquals(custom, FileRotationLoggerConfig.builder().file(custom.toString()).build().file());
        }
    }

    // ========================================================================
    // Default Values
    // ========================================================================

    @Nested
    @DisplayName("Default Values")
    class DefaultValueTests {

        @Test
        @DisplayName("Default config values are correct")
        void testDefaults() {
            FileRotationLoggerConfig config = FileRotationLoggerConfig.load();

            assertEquals(Path.of(System.getProperty("user.home"), ".rotlog", "app.log"), config.file());
            assertEquals("640", config.filePermission());
            assertEquals(RotationConfig.defaults(), config.rotationConfig());
            assertEquals(50_000, config.rotationCheckFrequency());
            assertEquals(Duration.ofMinutes(8), config.rotationCheckInterval());
            assertEquals(200, config.flushThreshold());
            assertTrue(config.syncEnabled());
            assertEquals(LogLevel.TRACE, config.minLevel());
        }

        @Test
        @DisplayName("toString names every setting")
        void testToString() {
            String text = FileRotationLoggerConfig.load().toString();

            assertTrue(text.contains("suffixExtension=numbering"));
            assertTrue(text.contains("maxArchivedFilesCount=5"));
            assertTrue(text.contains("flushThreshold=200"));
        }
    }

    // ========================================================================
    // RotationConfig
    // ========================================================================

    @Nested
    @DisplayName("RotationConfig")
    class RotationConfigTests {

        @Test
        @DisplayName("Size comparison is unsigned")
        void testUnsignedMaxFileSize() {
            RotationConfig never = new RotationConfig(SuffixExtension.NUMBERING, -1L, 5);
            assertFalse(never.exceedsMaxFileSize(Long.MAX_VALUE));

            RotationConfig small = new RotationConfig(SuffixExtension.NUMBERING, 10, 5);
            assertFalse(small.exceedsMaxFileSize(10));
            assertTrue(small.exceedsMaxFileSize(11));
        }

        @Test
        @DisplayName("Zero archives is legal, 256 is not")
        void testArchiveCountBounds() {
            assertEquals(0, new RotationConfig(SuffixExtension.NUMBERING, 1, 0).maxArchivedFilesCount());
            assertEquals(255, new RotationConfig(SuffixExtension.NUMBERING, 1, 255).maxArchivedFilesCount());
            assertThrows(IllegalArgumentException.class, () -> new RotationConfig(SuffixExtension.NUMBERING, 1, 256));
            assertThrows(IllegalArgumentException.class, () -> new RotationConfig(SuffixExtension.NUMBERING, 1, -1));
        }

        @Test
        @DisplayName("Suffix extension parses config names")
        void testSuffixExtensionParsing() {
            assertEquals(SuffixExtension.NUMBERING, SuffixExtension.fromConfigName("numbering"));
            assertEquals(SuffixExtension.DATE_UUID, SuffixExtension.fromConfigName(" Date_UUID "));
            assertThrows(IllegalArgumentException.class, () -> SuffixExtension.fromConfigName("weekly"));
        }
    }

    // ========================================================================
    // Integration
    // ========================================================================

    @Test
    @DisplayName("FileRotationLogger picks up system property configuration")
    void testLoggerUsesResolvedConfig() throws Exception {
        Path file = tempDir.resolve("from-props.log");
        System.setProperty("rotlog.file", file.toString());
        System.setProperty("rotlog.maxFileSize", "5");

        try (FileRotationLogger logger = new FileRotationLogger()) {
            assertEquals(file, logger.file());
            logger.log(LogLevel.INFO, "longer than five").get(5, TimeUnit.SECONDS);
        }

        assertTrue(Files.exists(tempDir.resolve("from-props.log.1")));
        assertEquals(0, Files.size(file));
    }
}
