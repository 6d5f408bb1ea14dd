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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides when a log call should pay for a file size check.
 * <p>
 * Stat-ing the target on every write is too expensive at high volume, so a
 * check is only due once {@code checkFrequency} calls have been counted or
 * {@code checkInterval} has elapsed since the previous check, whichever comes
 * first. The first call after construction is always due.
 * <p>
 * <b>Thread Safety:</b> not thread-safe; owned by the logger's executor thread.
 */
public final class RotationThrottle {

    private static final Logger LOG = LoggerFactory.getLogger(RotationThrottle.class);

    public static final long DEFAULT_CHECK_FREQUENCY = 50_000;
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofMinutes(8);

    private final long checkFrequency;
    private final Duration checkInterval;
    private final Clock clock;

    private long callCount;
    private Instant lastCheck;

    public RotationThrottle() {
        this(DEFAULT_CHECK_FREQUENCY, DEFAULT_CHECK_INTERVAL, Clock.systemUTC());
    }

    public RotationThrottle(long checkFrequency, Duration checkInterval, Clock clock) {
        if (checkFrequency <= 0) {
            throw new IllegalArgumentException("checkFrequency must be > 0: " + checkFrequency);
        }
        Objects.requireNonNull(checkInterval, "checkInterval");
        if (checkInterval.isNegative()) {
            throw new IllegalArgumentException("checkInterval must not be negative: " + checkInterval);
        }
        this.checkFrequency = checkFrequency;
        this.checkInterval = checkInterval;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Pure decision: is a check due after {@code callCount} calls and
     * {@code elapsedSinceLastCheck} time? A count of zero is always due.
     */
    public boolean shouldCheck(long callCount, Duration elapsedSinceLastCheck) {
        return callCount == 0
                || callCount >= checkFrequency
                || elapsedSinceLastCheck.compareTo(checkInterval) >= 0;
    }

    /**
     * Counts one log call and reports whether a size check is due now.
     * When it fires, both the call counter and the last-check instant reset,
     * whatever the caller then does with the check.
     */
    public boolean recordCall() {
        Instant now = clock.instant();
        if (lastCheck == null) {
            reset(now);
            LOG.trace("First call, size check due");
            return true;
        }

        callCount++;
        Duration elapsed = Duration.between(lastCheck, now);
        if (!shouldCheck(callCount, elapsed)) {
            return false;
        }

        LOG.trace("Size check due: calls={}, elapsed={}", callCount, elapsed);
        reset(now);
        return true;
    }

    /** Calls counted since the last check. */
    public long callCount() {
        return callCount;
    }

    /** Instant of the last check, or {@code null} before the first call. */
    public Instant lastCheck() {
        return lastCheck;
    }

    public long checkFrequency() {
        return checkFrequency;
    }

    public Duration checkInterval() {
        return checkInterval;
    }

    private void reset(Instant now) {
        callCount = 0;
        lastCheck = now;
    }
}
