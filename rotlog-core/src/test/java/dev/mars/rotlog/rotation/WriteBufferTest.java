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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WriteBuffer}.
 */
class WriteBufferTest {

    private AtomicInteger flushes;
    private WriteBuffer buffer;

    @BeforeEach
    void setUp() {
        flushes = new AtomicInteger();
        buffer = new WriteBuffer(5, flushes::incrementAndGet);
    }

    @Test
    @DisplayName("No flush below the threshold")
    void testNoFlushBelowThreshold() {
        for (int i = 0; i < 4; i++) {
            buffer.recordWrite();
            assertFalse(buffer.flushIfNeeded(false));
        }
        assertEquals(0, flushes.get());
        assertEquals(4, buffer.unsyncedWrites());
    }

    @Test
    @DisplayName("Flush at the threshold resets the counter")
    void testFlushAtThreshold() {
        for (int i = 0; i < 5; i++) {
            buffer.recordWrite();
            buffer.flushIfNeeded(false);
        }
        assertEquals(1, flushes.get());
        assertEquals(0, buffer.unsyncedWrites());
    }

    @Test
    @DisplayName("Forced flush with pending writes flushes below the threshold")
    void testForcedFlush() {
        buffer.recordWrite();
        buffer.recordWrite();

        assertTrue(buffer.flushIfNeeded(true));
        assertEquals(1, flushes.get());
        assertEquals(0, buffer.unsyncedWrites());
    }

    @Test
    @DisplayName("Forced flush with nothing pending is a no-op")
    void testForcedFlushNothingPending() {
        assertFalse(buffer.flushIfNeeded(true));
        assertEquals(0, flushes.get());
    }

    @Test
    @DisplayName("Never more than threshold writes pending across many writes")
    void testBoundedPending() {
        for (int i = 0; i < 1_003; i++) {
            buffer.recordWrite();
            buffer.flushIfNeeded(false);
            assertTrue(buffer.unsyncedWrites() < 5);
        }
        assertEquals(200, flushes.get());
        assertEquals(3, buffer.unsyncedWrites());
    }

    @Test
    @DisplayName("Failed flush is swallowed and still resets the counter")
    void testFailedFlush() {
        WriteBuffer failing = new WriteBuffer(2, () -> {
            throw new IOException("disk gone");
        });
        failing.recordWrite();
        failing.recordWrite();

        assertTrue(failing.flushIfNeeded(false));
        assertEquals(0, failing.unsyncedWrites());
    }

    @Test
    @DisplayName("Threshold must be positive")
    void testInvalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new WriteBuffer(0, () -> { }));
    }
}
