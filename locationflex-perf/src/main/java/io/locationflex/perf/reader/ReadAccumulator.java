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

import java.util.concurrent.TimeUnit;
import lombok.Getter;
import org.HdrHistogram.Histogram;

/**
 * Counters and latency histogram of one read worker. An accumulator is owned by a single thread;
 * accumulators are combined with {@link #merge(ReadAccumulator)} once their worker is done.
 */
@Getter
public final class ReadAccumulator {
    static final long HIGHEST_TRACKABLE_MICROS = TimeUnit.MINUTES.toMicros(10);

    private long totalReads;
    private long successfulReads;
    private long cacheMisses;
    private long primaryHits;
    private long secondaryHits;
    private long totalBytes;
    private long fallbackBatches;
    private final Histogram latency = new Histogram(HIGHEST_TRACKABLE_MICROS, 3);

    public void record(ReadResult result) {
        totalReads++;
        if (!result.success()) {
            cacheMisses++;
            return;
        }
        successfulReads++;
        if (result.tier() == Tier.PRIMARY) {
            primaryHits++;
        } else {
            secondaryHits++;
        }
        totalBytes += result.sizeBytes();
        latency.recordValue(Math.min(Math.max(result.latencyMicros(), 0), HIGHEST_TRACKABLE_MICROS));
    }

    public void recordFallbackBatch() {
        fallbackBatches++;
    }

    public ReadAccumulator merge(ReadAccumulator other) {
        totalReads += other.totalReads;
        successfulReads += other.successfulReads;
        cacheMisses += other.cacheMisses;
        primaryHits += other.primaryHits;
        secondaryHits += other.secondaryHits;
        totalBytes += other.totalBytes;
        fallbackBatches += other.fallbackBatches;
        latency.add(other.latency);
        return this;
    }
}
