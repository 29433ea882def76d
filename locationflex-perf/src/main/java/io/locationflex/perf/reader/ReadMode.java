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
package io.locationflex.perf.reader;

import static java.util.Objects.requireNonNull;

import java.util.Locale;
import lombok.Getter;

public enum ReadMode {
    /** Individual lookups issued by several threads. */
    SEQUENTIAL("sequential"),
    /** Pipelined batches issued by a single thread. */
    PIPELINED("pipelined"),
    /** Pipelined batches issued by several threads, each owning a slice of the ids. */
    MULTI_THREADED_PIPELINED("multi-pipelined");

    @Getter private final String alias;

    ReadMode(String alias) {
        this.alias = alias;
    }

    public static ReadMode fromString(String mode) {
        requireNonNull(mode);
        String normalized = mode.trim().toLowerCase(Locale.ROOT);
        for (ReadMode value : values()) {
            if (value.alias.equals(normalized)
                    || value.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("unknown read mode: " + mode);
    }
}
