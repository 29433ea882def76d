/*
 * Copyright © 2022-2024 StreamNative Inc.
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
package io.locationflex.perf.writer;

import static java.util.Objects.requireNonNull;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Canned import sizes. */
@Getter
@RequiredArgsConstructor
public enum ImportPreset {
    QUICK(400, 4),
    HIGH(800, 8),
    PRODUCTION(60_000_000, 30);

    private final long keys;
    private final int workers;

    public static ImportPreset fromString(String preset) {
        requireNonNull(preset);
        for (ImportPreset value : values()) {
            if (value.name().equalsIgnoreCase(preset.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("unknown preset: " + preset);
    }
}
