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
import java.util.Objects;

/**
 * Counts writes that have not been forced to stable storage and flushes
 * them in batches.
 * <p>
 * At most {@code flushThreshold} writes are ever unflushed, except between a
 * threshold crossing and an explicit forced flush. A crash can therefore lose
 * at most that many lines.
 * <p>
 * <b>Thread Safety:</b> not thread-safe; owned by the logger's executor thread.
 */
public final class WriteBuffer {

    private static final Logger LOG = LoggerFactory.getLogger(WriteBuffer.class);

    public static final int DEFAULT_FLUSH_THRESHOLD = 200;

    /**
     * Forces buffered writes to stable storage.
     */
    @FunctionalInterface
    public interface FlushAction {
        void flush() throws IOException;
    }

    private final int flushThreshold;
    private final FlushAction flushAction;

    private long unsyncedWrites;

    public WriteBuffer(int flushThreshold, FlushAction flushAction) {
        if (flushThreshold <= 0) {
            throw new IllegalArgumentException("flushThreshold must be > 0: " + flushThreshold);
        }
        this.flushThreshold = flushThreshold;
        this.flushAction = Objects.requireNonNull(flushAction, "flushAction");
    }

    /** Records one write that has reached the file but not stable storage. */
    public void recordWrite() {
        unsyncedWrites++;
    }

    /**
     * Flushes if the threshold is reached, or if {@code force} is set and
     * anything is pending.
     * <p>
     * A failed flush is logged and the counter is reset anyway; the data is
     * already in the OS page cache and retrying every call would not help.
     *
     * @return whether a flush was attempted
     */
    public boolean flushIfNeeded(boolean force) {
        if (!((force && unsyncedWrites > 0) || unsyncedWrites >= flushThreshold)) {
            return false;
        }

        long pending = unsyncedWrites;
        try {
            long startNanos = System.nanoTime();
            flushAction.flush();
            LOG.debug("Flushed {} writes in {} us (forced={})",
                    pending, (System.nanoTime() - startNanos) / 1000, force);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to flush {} pending writes: {}", pending, e.getMessage(), e);
        }
        unsyncedWrites = 0;
        return true;
    }

    /** Writes since the last flush. */
    public long unsyncedWrites() {
        return unsyncedWrites;
    }

    public int flushThreshold() {
        return flushThreshold;
    }
}
