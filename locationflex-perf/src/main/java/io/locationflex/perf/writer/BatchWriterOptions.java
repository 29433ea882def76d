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

import static java.time.Duration.ZERO;

import com.google.common.base.Strings;
import io.locationflex.api.KeyValueStore;
import io.locationflex.api.VersionedKey;
import java.time.Duration;
import lombok.NonNull;

/**
 * Settings of one {@link BatchWriter}.
 *
 * @param prefix Key prefix.
 * @param version Version namespace written to.
 * @param startOffset First id written.
 * @param maxDailyKeys Upper bound of the cursor, exclusive. The writer never writes an id at or past
 *     it.
 * @param ttlSeconds Expiry applied to every key.
 * @param batchSize Ids per pipelined request.
 * @param skipProbability Probability of skipping an id, zero disables the miss simulation.
 * @param progressInterval How often progress is logged.
 */
public record BatchWriterOptions(
        @NonNull String prefix,
        @NonNull String version,
        long startOffset,
        long maxDailyKeys,
        long ttlSeconds,
        int batchSize,
        double skipProbability,
        @NonNull Duration progressInterval) {

    public static final int DefaultBatchSize = 1000;
    public static final Duration DefaultProgressInterval = Duration.ofSeconds(5);

    public BatchWriterOptions {
        if (Strings.isNullOrEmpty(prefix) || Strings.isNullOrEmpty(version)) {
            throw new IllegalArgumentException("prefix and version must not be null or empty");
        }
        if (startOffset < 0 || maxDailyKeys < startOffset) {
            throw new IllegalArgumentException(
                    "invalid cursor bounds [" + startOffset + ", " + maxDailyKeys + ")");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be greater than zero: " + ttlSeconds);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be greater than zero: " + batchSize);
        }
        if (skipProbability < 0.0 || skipProbability >= 1.0) {
            throw new IllegalArgumentException(
                    "skipProbability must be in [0, 1): " + skipProbability);
        }
        if (progressInterval.isNegative() || progressInterval.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "progressInterval must be greater than zero: " + progressInterval);
        }
    }

    /** Options writing {@code [start, end)} of {@code version} with the default settings. */
    public static @NonNull BatchWriterOptions forRange(
            @NonNull String version, long start, long end) {
        return new BatchWriterOptions(
                VersionedKey.DEFAULT_PREFIX,
                version,
                start,
                end,
                KeyValueStore.DEFAULT_TTL_SECONDS,
                DefaultBatchSize,
                0.0,
                DefaultProgressInterval);
    }
}
