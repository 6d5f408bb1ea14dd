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

import java.util.Locale;

/**
 * Naming policy for archived files.
 * <ul>
 *   <li>{@link #NUMBERING}: {@code app.log.1}, {@code app.log.2}, ... where 1 is the most recent</li>
 *   <li>{@link #DATE_UUID}: {@code app.log.20260101T120000Z_<uuid>}, never renamed once written</li>
 * </ul>
 */
public enum SuffixExtension {
    NUMBERING("numbering"),
    DATE_UUID("date_uuid");

    private final String configName;

    SuffixExtension(String configName) {
        this.configName = configName;
    }

    /** The name used in properties files and environment variables. */
    public String configName() {
        return configName;
    }

    /**
     * Parses a configuration value ({@code numbering} or {@code date_uuid}, case-insensitive).
     *
     * @throws IllegalArgumentException if the value names no policy
     */
    public static SuffixExtension fromConfigName(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SuffixExtension candidate : values()) {
            if (candidate.configName.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown suffix extension: " + value);
    }
}
