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

import static io.locationflex.perf.output.Doubles.format2Scale;
import static io.locationflex.perf.output.Doubles.ratio;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import io.locationflex.api.KeyValueStore;
import io.locationflex.api.RecordSource;
import io.locationflex.perf.BenchmarkMetrics;
import io.locationflex.perf.StopSignal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one {@link BatchWriter} per partition of the key space on a fixed pool of threads and merges
 * their reports once every worker is done.
 */
@Slf4j
@RequiredArgsConstructor
public final class WriteOrchestrator {
    @NonNull private final KeyValueStore store;
    @NonNull private final RecordSource source;
    @NonNull private final WriteOrchestratorOptions options;
    @NonNull private final StopSignal stopSignal;
    @NonNull private final BenchmarkMetrics metrics;

    /** Writes ids {@code [0, targetKeys)} of {@code version}, split across the workers. */
    public @NonNull ImportReport runImport(@NonNull String version, long targetKeys) {
        List<KeyRange> ranges = KeySpace.partition(targetKeys, options.numWorkers());
        log.info(
                "Importing {} keys into version {} with {} workers", targetKeys, version, ranges.size());

        ExecutorService executor =
                Executors.newFixedThreadPool(
                        ranges.size(),
                        new ThreadFactoryBuilder().setNameFormat("writer-" + version + "-%d").build());
        Stopwatch stopwatch = Stopwatch.createStarted();
        var writers = new ArrayList<BatchWriter>(ranges.size());
        var futures = new ArrayList<Future<WriterReport>>(ranges.size());
        try {
            for (KeyRange range : ranges) {
                var writer =
                        new BatchWriter(
                                range.workerId(),
                                store,
                                source,
                                options.writerOptions(version, range),
                                stopSignal,
                                metrics);
                writers.add(writer);
                futures.add(executor.submit(() -> writer.runUntil(range.size(), null)));
            }

            var reports = new ArrayList<WriterReport>(ranges.size());
            int reported = 0;
            for (int i = 0; i < ranges.size(); i++) {
                try {
                    WriterReport report = Uninterruptibles.getUninterruptibly(futures.get(i));
                    reports.add(report);
                    if (!report.degraded()) {
                        reported++;
                    }
                } catch (ExecutionException e) {
                    log.error("Writer {} failed", ranges.get(i), e.getCause());
                    BatchWriter writer = writers.get(i);
                    writer.markFailed();
                    reports.add(
                            writer.report(
                                    stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1e9,
                                    stopSignal.isRaised()));
                }
            }
            double durationSeconds = stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1e9;
            return merge(version, reports, reported, durationSeconds);
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Runs {@link #runImport(String, long)} once per version, sequentially, pausing between two
     * versions.
     */
    public @NonNull MultiVersionImportReport runMultiVersionImport(
            @NonNull List<String> versions, long targetKeysEach) {
        if (versions.isEmpty()) {
            throw new IllegalArgumentException("versions must not be empty");
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        var imports = new ArrayList<ImportReport>(versions.size());
        for (int i = 0; i < versions.size(); i++) {
            if (stopSignal.isRaised()) {
                break;
            }
            imports.add(runImport(versions.get(i), targetKeysEach));
            if (i < versions.size() - 1 && !options.pauseBetweenVersions().isZero()) {
                log.info("Pausing {} before the next version", options.pauseBetweenVersions());
                stopSignal.await(options.pauseBetweenVersions());
            }
        }
        double durationSeconds = stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1e9;

        long written = imports.stream().mapToLong(ImportReport::totalWritten).sum();
        long skipped = imports.stream().mapToLong(ImportReport::totalSkipped).sum();
        double combinedRate = ratio(written, durationSeconds);
        MultiVersionImportReport.Projection projection = null;
        if (options.projectionKeys() != null) {
            projection =
                    new MultiVersionImportReport.Projection(
                            options.projectionKeys(),
                            format2Scale(ratio(options.projectionKeys(), combinedRate)));
        }
        boolean interrupted =
                imports.size() < versions.size()
                        || imports.stream().anyMatch(ImportReport::interrupted);
        boolean degraded = imports.stream().anyMatch(ImportReport::degraded);
        log.info(
                "Imported {} versions: {} keys in {}s ({} keys/s)",
                imports.size(),
                written,
                format2Scale(durationSeconds),
                format2Scale(combinedRate));
        return new MultiVersionImportReport(
                imports,
                written,
                skipped,
                format2Scale(durationSeconds),
                format2Scale(combinedRate),
                projection,
                interrupted,
                degraded);
    }

    private ImportReport merge(
            String version, List<WriterReport> reports, int reported, double durationSeconds) {
        long written = 0;
        long skipped = 0;
        long failed = 0;
        double megabytes = 0;
        boolean interrupted = stopSignal.isRaised();
        boolean degraded = false;
        for (WriterReport report : reports) {
            written += report.written();
            skipped += report.skipped();
            failed += report.failed();
            megabytes += report.estimatedMegabytes();
            interrupted |= report.interrupted();
            degraded |= report.degraded();
        }
        var report =
                new ImportReport(
                        version,
                        reports,
                        written,
                        skipped,
                        failed,
                        format2Scale(durationSeconds),
                        format2Scale(ratio(written, durationSeconds)),
                        reported,
                        format2Scale(megabytes),
                        interrupted,
                        degraded);
        if (degraded) {
            log.warn(
                    "Version {} import is incomplete: {} of {} workers finished their range",
                    version,
                    reported,
                    reports.size());
        }
        log.info(
                "Version {} imported: written={} skipped={} failed={} in {}s ({} keys/s)",
                version,
                written,
                skipped,
                failed,
                report.durationSeconds(),
                report.combinedRate());
        return report;
    }
}
