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

import static io.locationflex.perf.output.Doubles.format2Scale;
import static io.locationflex.perf.output.Doubles.ratio;

/**
 * Aggregate of a read benchmark. {@code successfulReads + cacheMisses == totalReads} and {@code
 * primaryHits + secondaryHits == successfulReads}; latencies only cover successful reads.
 *
 * @param mode Strategy used.
 * @param primaryVersion Version looked up first.
 * @param secondaryVersion Version looked up on a primary miss.
 * @param requestedReads Reads asked for.
 * @param totalReads Reads performed, lower than requested when the run was stopped.
 * @param successfulReads Reads resolved by either version.
 * @param cacheMisses Reads resolved by neither version.
 * @param primaryHits Reads resolved by the primary version.
 * @param secondaryHits Reads resolved by the secondary version.
 * @param fallbackBatches Pipelined batches replayed as individual lookups.
 * @param totalBytes Bytes of the values read.
 * @param megabytesRead {@code totalBytes} in megabytes.
 * @param durationSeconds Wall-clock duration of the run.
 * @param readsPerSecond Throughput.
 * @param megabytesPerSecond Data throughput.
 * @param hitRate Percentage of successful reads.
 * @param latency Latency percentiles of successful reads, in milliseconds.
 * @param interrupted Whether the run was stopped early.
 * @param degraded Whether a reader failed; its reads up to the failure are included.
 */
public record ReadStatistics(
        ReadMode mode,
        String primaryVersion,
        String secondaryVersion,
        long requestedReads,
        long totalReads,
        long successfulReads,
        long cacheMisses,
        long primaryHits,
        long secondaryHits,
        long fallbackBatches,
        long totalBytes,
        double megabytesRead,
        double durationSeconds,
        double readsPerSecond,
        double megabytesPerSecond,
        double hitRate,
        LatencySnapshot latency,
        boolean interrupted,
        boolean degraded) {

    private static final double MEGABYTE = 1024.0 * 1024.0;

    public static ReadStatistics of(
            ReadBenchmarkOptions options,
            ReadAccumulator accumulator,
            double durationSeconds,
            boolean interrupted,
            boolean degraded) {
        double megabytes = accumulator.getTotalBytes() / MEGABYTE;
        return new ReadStatistics(
                options.mode(),
                options.primaryVersion(),
                options.secondaryVersion(),
                options.totalReads(),
                accumulator.getTotalReads(),
                accumulator.getSuccessfulReads(),
                accumulator.getCacheMisses(),
                accumulator.getPrimaryHits(),
                accumulator.getSecondaryHits(),
                accumulator.getFallbackBatches(),
                accumulator.getTotalBytes(),
                format2Scale(megabytes),
                format2Scale(durationSeconds),
                format2Scale(ratio(accumulator.getTotalReads(), durationSeconds)),
                format2Scale(ratio(megabytes, durationSeconds)),
                format2Scale(100.0 * ratio(accumulator.getSuccessfulReads(), accumulator.getTotalReads())),
                LatencySnapshot.fromHistogram(accumulator.getLatency()),
                interrupted,
                degraded);
    }
}
