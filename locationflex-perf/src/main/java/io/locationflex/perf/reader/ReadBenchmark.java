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

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import io.locationflex.api.KeyValueStore;
import io.locationflex.perf.BenchmarkMetrics;
import io.locationflex.perf.StopSignal;
import io.locationflex.perf.writer.KeyRange;
import io.locationflex.perf.writer.KeySpace;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Benchmarks versioned lookups against the store. Every worker owns its {@link ReadAccumulator};
 * the accumulators are merged once the run is over, so partial statistics are produced even when
 * the run is stopped or a worker fails.
 */
@Slf4j
public final class ReadBenchmark {
    private final ReadBenchmarkOptions options;
    private final StopSignal stopSignal;
    private final BenchmarkMetrics metrics;
    private final VersionedReader reader;

    public ReadBenchmark(
            @NonNull KeyValueStore store,
            @NonNull ReadBenchmarkOptions options,
            @NonNull StopSignal stopSignal,
            @NonNull BenchmarkMetrics metrics) {
        this.options = options;
        this.stopSignal = stopSignal;
        this.metrics = metrics;
        this.reader =
                new VersionedReader(
                        store, options.prefix(), options.primaryVersion(), options.secondaryVersion());
    }

    public @NonNull ReadStatistics run() {
        log.info(
                "Starting {} read benchmark: {} reads, {} -> {} over {} keys",
                options.mode(),
                options.totalReads(),
                options.primaryVersion(),
                options.secondaryVersion(),
                options.maxKeys());
        ReadStatistics statistics =
                switch (options.mode()) {
                    case SEQUENTIAL -> runSequential();
                    case PIPELINED -> runPipelined(1);
                    case MULTI_THREADED_PIPELINED -> runPipelined(options.numThreads());
                };
        log.info(
                "Read benchmark done: {} reads, {} hits ({} primary, {} secondary), {} misses, {} reads/s",
                statistics.totalReads(),
                statistics.successfulReads(),
                statistics.primaryHits(),
                statistics.secondaryHits(),
                statistics.cacheMisses(),
                statistics.readsPerSecond());
        return statistics;
    }

    /** Each thread draws its own random ids; the remainder goes one each to the earliest threads. */
    private ReadStatistics runSequential() {
        int threads = options.numThreads();
        int perThread = options.totalReads() / threads;
        int remainder = options.totalReads() % threads;
        SplittableRandom root = newRandom();

        var tasks = new ArrayList<ReadTask>(threads);
        try (var progress = new ProgressReporter(options.totalReads(), options.progressInterval())) {
            for (int t = 0; t < threads; t++) {
                int count = perThread + (t < remainder ? 1 : 0);
                SplittableRandom random = root.split();
                tasks.add(
                        accumulator -> {
                            for (int i = 0; i < count && !stopSignal.isRaised(); i++) {
                                ReadResult result = reader.read(random.nextLong(options.maxKeys()));
                                accumulator.record(result);
                                metrics.recordRead(result.tier(), result.latencyMicros());
                                progress.add(1);
                            }
                        });
            }
            return execute(tasks);
        }
    }

    /** Ids are generated upfront and split into contiguous slices, one per thread. */
    private ReadStatistics runPipelined(int requestedThreads) {
        long[] ids = generateIds();
        int threads = Math.min(requestedThreads, ids.length);
        List<KeyRange> slices = KeySpace.partition(ids.length, threads);

        var tasks = new ArrayList<ReadTask>(threads);
        try (var progress = new ProgressReporter(options.totalReads(), options.progressInterval())) {
            for (KeyRange slice : slices) {
                tasks.add(
                        accumulator -> {
                            int end = (int) slice.end();
                            for (int from = (int) slice.start(); from < end; from += options.batchSize()) {
                                if (stopSignal.isRaised()) {
                                    break;
                                }
                                int to = Math.min(from + options.batchSize(), end);
                                VersionedReader.Batch batch = reader.readPipelined(ids, from, to);
                                if (batch.fallback()) {
                                    accumulator.recordFallbackBatch();
                                }
                                for (ReadResult result : batch.results()) {
                                    accumulator.record(result);
                                    metrics.recordRead(result.tier(), result.latencyMicros());
                                }
                                progress.add(to - from);
                            }
                        });
            }
            return execute(tasks);
        }
    }

    private ReadStatistics execute(List<ReadTask> tasks) {
        ExecutorService executor =
                Executors.newFixedThreadPool(
                        tasks.size(), new ThreadFactoryBuilder().setNameFormat("reader-%d").build());
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            var accumulators = new ArrayList<ReadAccumulator>(tasks.size());
            var futures = new ArrayList<Future<?>>(tasks.size());
            for (ReadTask task : tasks) {
                var accumulator = new ReadAccumulator();
                accumulators.add(accumulator);
                futures.add(executor.submit(() -> task.run(accumulator)));
            }
            var merged = new ReadAccumulator();
            boolean degraded = false;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    Uninterruptibles.getUninterruptibly(futures.get(i));
                } catch (ExecutionException e) {
                    log.error(
                            "Reader {} failed after {} reads",
                            i,
                            accumulators.get(i).getTotalReads(),
                            e.getCause());
                    degraded = true;
                }
                // The reads recorded before a failure still count.
                merged.merge(accumulators.get(i));
            }
            double durationSeconds = stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1e9;
            return ReadStatistics.of(
                    options, merged, durationSeconds, stopSignal.isRaised(), degraded);
        } finally {
            executor.shutdown();
        }
    }

    /** The work of one reader thread, recording into an accumulator it owns until it returns. */
    @FunctionalInterface
    private interface ReadTask {
        void run(ReadAccumulator accumulator);
    }

    long[] generateIds() {
        SplittableRandom random = newRandom();
        long[] ids = new long[options.totalReads()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = random.nextLong(options.maxKeys());
        }
        return ids;
    }

    private SplittableRandom newRandom() {
        return options.seed() != null ? new SplittableRandom(options.seed()) : new SplittableRandom();
    }
}
