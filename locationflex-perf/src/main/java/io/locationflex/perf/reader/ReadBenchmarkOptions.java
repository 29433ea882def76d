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

import static java.time.Duration.ZERO;

import com.google.common.base.Strings;
import io.locationflex.api.VersionedKey;
import java.time.Duration;
import javax.annotation.Nullable;
import lombok.NonNull;

/**
 * Settings of a {@link ReadBenchmark}.
 *
 * @param mode Strategy to run.
 * @param totalReads Number of lookups.
 * @param numThreads Worker threads, ignored by {@link ReadMode#PIPELINED}.
 * @param batchSize Ids per pipelined request.
 * @param maxKeys Ids are drawn uniformly from {@code [0, maxKeys)}.
 * @param prefix Key prefix.
 * @param primaryVersion Version looked up first.
 * @param secondaryVersion Version looked up on a primary miss.
 * @param progressInterval How often progress is logged.
 * @param seed Seed of the id generator, {@code null} for a random one.
 */
public record ReadBenchmarkOptions(
        @NonNull ReadMode mode,
        int totalReads,
        int numThreads,
        int batchSize,
        long maxKeys,
        @NonNull String prefix,
        @NonNull String primaryVersion,
        @NonNull String secondaryVersion,
        @NonNull Duration progressInterval,
        @Nullable Long seed) {

    public static final int DefaultBatchSize = 100;
    public static final Duration DefaultProgressInterval = Duration.ofSeconds(5);

    public ReadBenchmarkOptions {
        if (totalReads <= 0) {
            throw new IllegalArgumentException("totalReads must be greater than zero: " + totalReads);
        }
        if (numThreads <= 0) {
            throw new IllegalArgumentException("numThreads must be greater than zero: " + numThreads);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be greater than zero: " + batchSize);
        }
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("maxKeys must be greater than zero: " + maxKeys);
        }
        if (Strings.isNullOrEmpty(prefix)
                || Strings.isNullOrEmpty(primaryVersion)
                || Strings.isNullOrEmpty(secondaryVersion)) {
            throw new IllegalArgumentException("prefix and versions must not be null or empty");
        }
        if (progressInterval.isNegative() || progressInterval.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "progressInterval must be greater than zero: " + progressInterval);
        }
    }

    public static @NonNull ReadBenchmarkOptions of(
            @NonNull ReadMode mode,
            int totalReads,
            int numThreads,
            long maxKeys,
            @NonNull String primaryVersion,
            @NonNull String secondaryVersion) {
        return new ReadBenchmarkOptions(
                mode,
                totalReads,
                numThreads,
                DefaultBatchSize,
                maxKeys,
                VersionedKey.DEFAULT_PREFIX,
                primaryVersion,
                secondaryVersion,
                DefaultProgressInterval,
                null);
    }
}
