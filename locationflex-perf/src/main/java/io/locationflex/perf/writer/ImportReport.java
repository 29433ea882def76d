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

import java.util.List;

/**
 * Aggregate of one partitioned import.
 *
 * @param version Version namespace written to.
 * @param workers Per-worker reports, ordered by worker id.
 * @param totalWritten Sum of the written keys of every worker.
 * @param totalSkipped Sum of the skipped ids of every worker.
 * @param totalFailed Sum of the failed keys of every worker.
 * @param durationSeconds Wall-clock time of the parallel phase.
 * @param combinedRate {@code totalWritten / durationSeconds}.
 * @param workersReported Number of workers that returned a report without failing.
 * @param estimatedMegabytes Estimated volume written.
 * @param interrupted Whether the import was stopped before completion.
 * @param degraded Whether a worker failed, in which case its counters cover only the batches it
 *     finished.
 */
public record ImportReport(
        String version,
        List<WriterReport> workers,
        long totalWritten,
        long totalSkipped,
        long totalFailed,
        double durationSeconds,
        double combinedRate,
        int workersReported,
        double estimatedMegabytes,
        boolean interrupted,
        boolean degraded) {

    public ImportReport {
        workers = List.copyOf(workers);
    }
}
