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
package io.locationflex.client.config;

/**
 * Settings of the import.
 *
 * @param workers Number of parallel writers.
 * @param batchSize Number of keys written per pipelined request.
 * @param keyTtlSeconds Time to live applied to every written key.
 * @param pipelineBatchSize Read from existing configuration files, not used by the batch writers.
 * @param writeChunkSize Read from existing configuration files, not used by the batch writers.
 * @param skipProbability Probability in {@code [0, 1)} of skipping an id to simulate cache misses.
 */
public record WriterSettings(
        int workers,
        int batchSize,
        long keyTtlSeconds,
        int pipelineBatchSize,
        int writeChunkSize,
        double skipProbability) {

    public static final int DefaultBatchSize = 1000;
    public static final long DefaultKeyTtlSeconds = 259_200L;
    public static final int DefaultPipelineBatchSize = 50;
    public static final int DefaultWriteChunkSize = 100;

    public WriterSettings {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be greater than zero: " + workers);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be greater than zero: " + batchSize);
        }
        if (keyTtlSeconds <= 0) {
            throw new IllegalArgumentException(
                    "keyTtlSeconds must be greater than zero: " + keyTtlSeconds);
        }
        if (pipelineBatchSize <= 0 || writeChunkSize <= 0) {
            throw new IllegalArgumentException("chunk sizes must be greater than zero");
        }
        if (skipProbability < 0.0 || skipProbability >= 1.0) {
            throw new IllegalArgumentException(
                    "skipProbability must be in [0, 1): " + skipProbability);
        }
    }

    public static WriterSettings defaults() {
        return new WriterSettings(
                1,
                DefaultBatchSize,
                DefaultKeyTtlSeconds,
                DefaultPipelineBatchSize,
                DefaultWriteChunkSize,
                0.0);
    }
}
