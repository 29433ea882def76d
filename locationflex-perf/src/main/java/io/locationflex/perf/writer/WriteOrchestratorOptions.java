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
import javax.annotation.Nullable;
import lombok.NonNull;

/**
 * Settings of a {@link WriteOrchestrator}.
 *
 * @param numWorkers Number of parallel writers.
 * @param batchSize Ids per pipelined request.
 * @param ttlSeconds Expiry applied to every key.
 * @param prefix Key prefix.
 * @param skipProbability Probability of skipping an id.
 * @param pauseBetweenVersions Pause between two versions of a multi-version import.
 * @param projectionKeys Key count to project the duration of, {@code null} to skip the projection.
 * @param progressInterval How often writers log their progress.
 */
public record WriteOrchestratorOptions(
        int numWorkers,
        int batchSize,
        long ttlSeconds,
        @NonNull String prefix,
        double skipProbability,
        @NonNull Duration pauseBetweenVersions,
        @Nullable Long projectionKeys,
        @NonNull Duration progressInterval) {

    public static final Duration DefaultPauseBetweenVersions = Duration.ofSeconds(2);

    public WriteOrchestratorOptions {
        if (numWorkers <= 0) {
            throw new IllegalArgumentException("numWorkers must be greater than zero: " + numWorkers);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be greater than zero: " + batchSize);
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be greater than zero: " + ttlSeconds);
        }
        if (Strings.isNullOrEmpty(prefix)) {
            throw new IllegalArgumentException("prefix must not be null or empty");
        }
        if (skipProbability < 0.0 || skipProbability >= 1.0) {
            throw new IllegalArgumentException(
                    "skipProbability must be in [0, 1): " + skipProbability);
        }
        if (pauseBetweenVersions.isNegative()) {
            throw new IllegalArgumentException(
                    "pauseBetweenVersions must not be negative: " + pauseBetweenVersions);
        }
        if (projectionKeys != null && projectionKeys <= 0) {
            throw new IllegalArgumentException(
                    "projectionKeys must be greater than zero: " + projectionKeys);
        }
        if (progressInterval.isNegative() || progressInterval.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "progressInterval must be greater than zero: " + progressInterval);
        }
    }

    public static @NonNull WriteOrchestratorOptions withWorkers(int numWorkers) {
        return new WriteOrchestratorOptions(
                numWorkers,
                BatchWriterOptions.DefaultBatchSize,
                KeyValueStore.DEFAULT_TTL_SECONDS,
                VersionedKey.DEFAULT_PREFIX,
                0.0,
                DefaultPauseBetweenVersions,
                null,
                BatchWriterOptions.DefaultProgressInterval);
    }

    /** Options of the writer that owns {@code range} of {@code version}. */
    @NonNull
    BatchWriterOptions writerOptions(@NonNull String version, @NonNull KeyRange range) {
        return new BatchWriterOptions(
                prefix,
                version,
                range.start(),
                range.end(),
                ttlSeconds,
                batchSize,
                skipProbability,
                progressInterval);
    }
}
