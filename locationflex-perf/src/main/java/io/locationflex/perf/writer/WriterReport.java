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

/**
 * Final counters of one batch writer.
 *
 * @param workerId Index of the worker.
 * @param version Version namespace written to.
 * @param rangeStart First id of the assigned range.
 * @param rangeEnd End of the assigned range, exclusive.
 * @param written Keys acknowledged by the store.
 * @param skipped Ids skipped by the miss simulation.
 * @param failed Keys that could not be written.
 * @param batches Number of batches sent.
 * @param fallbackBatches Batches replayed key by key after a pipeline failure.
 * @param elapsedSeconds Wall-clock time of the writer.
 * @param rate Written keys per second.
 * @param estimatedMegabytes Estimated volume written.
 * @param interrupted Whether the writer stopped on a stop signal.
 * @param degraded Whether the writer stopped on an unexpected error before covering its range.
 */
public record WriterReport(
        int workerId,
        String version,
        long rangeStart,
        long rangeEnd,
        long written,
        long skipped,
        long failed,
        long batches,
        long fallbackBatches,
        double elapsedSeconds,
        double rate,
        double estimatedMegabytes,
        boolean interrupted,
        boolean degraded) {

    public long attempted() {
        return written + skipped + failed;
    }
}
