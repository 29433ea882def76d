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
import io.locationflex.api.KeyValueStore;
import io.locationflex.api.RecordSource;
import io.locationflex.api.Reply;
import io.locationflex.api.StorePipeline;
import io.locationflex.api.VersionedKey;
import io.locationflex.api.exceptions.StoreException;
import io.locationflex.perf.BenchmarkMetrics;
import io.locationflex.perf.StopSignal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes consecutive ids of one version namespace in pipelined batches. The cursor only moves
 * forward and never passes {@link BatchWriterOptions#maxDailyKeys()}: every id is attempted at most
 * once. A writer is owned by a single thread.
 */
@Slf4j
public final class BatchWriter {
    private static final double MEGABYTE = 1024.0 * 1024.0;

    private final int workerId;
    private final KeyValueStore store;
    private final RecordSource source;
    private final BatchWriterOptions options;
    private final StopSignal stopSignal;
    private final BenchmarkMetrics metrics;
    private final SplittableRandom random = new SplittableRandom();

    @Getter private long cursor;
    private WriteOutcome totals = WriteOutcome.EMPTY;
    private long batches;
    private long fallbackBatches;
    private boolean degraded;

    public BatchWriter(
            int workerId,
            @NonNull KeyValueStore store,
            @NonNull RecordSource source,
            @NonNull BatchWriterOptions options,
            @NonNull StopSignal stopSignal,
            @NonNull BenchmarkMetrics metrics) {
        this.workerId = workerId;
        this.store = store;
        this.source = source;
        this.options = options;
        this.stopSignal = stopSignal;
        this.metrics = metrics;
        this.cursor = options.startOffset();
    }

    /** @return True once the cursor reached the upper bound. */
    public boolean isExhausted() {
        return cursor >= options.maxDailyKeys();
    }

    /**
     * Attempts up to {@code count} ids in batches of {@code batchSize}, stopping early at the
     * cursor bound or when the stop signal is raised.
     */
    public @NonNull WriteOutcome write(long count, int batchSize) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be greater than zero: " + batchSize);
        }
        WriteOutcome outcome = WriteOutcome.EMPTY;
        while (outcome.attempted() < count && !isExhausted() && !stopSignal.isRaised()) {
            int size = (int) Math.min(batchSize, count - outcome.attempted());
            outcome = outcome.plus(writeBatch(size));
        }
        return outcome;
    }

    /**
     * Writes batches until the target number of attempted ids is reached, the duration elapses, the
     * cursor reaches its bound or the stop signal is raised. A {@code null} target or duration means
     * no limit of that kind.
     */
    public @NonNull WriterReport runUntil(@Nullable Long targetKeys, @Nullable Duration duration) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        long lastProgress = 0;
        long progressNanos = options.progressInterval().toNanos();
        long attempted = 0;
        boolean interrupted = false;

        log.info(
                "Writer {} starting on {}[{}, {})",
                workerId,
                options.version(),
                cursor,
                options.maxDailyKeys());
        while (true) {
            if (stopSignal.isRaised()) {
                interrupted = true;
                break;
            }
            if (targetKeys != null && attempted >= targetKeys) {
                break;
            }
            if (duration != null && stopwatch.elapsed().compareTo(duration) >= 0) {
                break;
            }
            if (isExhausted()) {
                break;
            }
            long size = options.batchSize();
            if (targetKeys != null) {
                size = Math.min(size, targetKeys - attempted);
            }
            long batchStart = cursor;
            try {
                attempted += writeBatch((int) size).attempted();
            } catch (RuntimeException e) {
                log.error("Writer {} aborted at id {}", workerId, batchStart, e);
                attempted += abandonBatch(batchStart, (int) size);
                break;
            }

            long elapsedNanos = stopwatch.elapsed(TimeUnit.NANOSECONDS);
            if (elapsedNanos - lastProgress >= progressNanos) {
                lastProgress = elapsedNanos;
                log.info(
                        "Writer {} progress: written={} skipped={} failed={} rate={} keys/s",
                        workerId,
                        totals.written(),
                        totals.skipped(),
                        totals.failed(),
                        format2Scale(ratio(totals.written(), elapsedNanos / 1e9)));
            }
        }

        var report = report(stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1e9, interrupted);
        log.info(
                "Writer {} finished: {} keys written in {}s ({} keys/s)",
                workerId,
                report.written(),
                report.elapsedSeconds(),
                report.rate());
        return report;
    }

    /**
     * The counters accumulated so far. After an unexpected failure the report is flagged as
     * degraded.
     */
    @NonNull
    WriterReport report(double elapsedSeconds, boolean interrupted) {
        return new WriterReport(
                workerId,
                options.version(),
                options.startOffset(),
                options.maxDailyKeys(),
                totals.written(),
                totals.skipped(),
                totals.failed(),
                batches,
                fallbackBatches,
                format2Scale(elapsedSeconds),
                format2Scale(ratio(totals.written(), elapsedSeconds)),
                format2Scale(totals.written() * source.averagePayloadSize() / MEGABYTE),
                interrupted,
                degraded);
    }

    /** Flags the writer as failed outside of a batch. */
    void markFailed() {
        degraded = true;
    }

    private long abandonBatch(long batchStart, int size) {
        degraded = true;
        long end = Math.min(batchStart + size, options.maxDailyKeys());
        if (cursor > batchStart) {
            // The ids were consumed before the failure, only the outcome is unknown.
            end = cursor;
        }
        int lost = (int) (end - batchStart);
        cursor = end;
        batches++;
        var result = new BatchResult(BatchResult.Status.ABORTED, lost, 0, 0, lost);
        totals = totals.plus(result);
        metrics.recordBatch(options.version(), result);
        return lost;
    }

    /** Consumes the next {@code size} ids, bounded by the cursor limit. */
    @NonNull
    BatchResult writeBatch(int size) {
        long end = Math.min(cursor + size, options.maxDailyKeys());
        Map<String, byte[]> batch = new LinkedHashMap<>();
        int skipped = 0;
        for (long id = cursor; id < end; id++) {
            if (options.skipProbability() > 0 && random.nextDouble() < options.skipProbability()) {
                skipped++;
                continue;
            }
            batch.put(VersionedKey.toStoreKey(options.prefix(), options.version(), id), source.generate(id));
        }
        int attempted = (int) (end - cursor);
        cursor = end;

        BatchResult result;
        if (batch.isEmpty()) {
            result = new BatchResult(BatchResult.Status.PIPELINED, attempted, 0, skipped, 0);
        } else {
            result = sendPipelined(batch, attempted, skipped);
        }
        batches++;
        if (result.status() == BatchResult.Status.FALLBACK) {
            fallbackBatches++;
        }
        totals = totals.plus(result);
        metrics.recordBatch(options.version(), result);
        return result;
    }

    private BatchResult sendPipelined(Map<String, byte[]> batch, int attempted, int skipped) {
        List<Reply> replies;
        try (StorePipeline pipeline = store.pipeline()) {
            for (Map.Entry<String, byte[]> entry : batch.entrySet()) {
                pipeline.set(entry.getKey(), entry.getValue(), options.ttlSeconds());
            }
            replies = pipeline.execute();
        } catch (StoreException e) {
            log.warn(
                    "Writer {} pipeline of {} keys failed, falling back to individual writes: {}",
                    workerId,
                    batch.size(),
                    e.getMessage());
            return sendIndividually(batch, attempted, skipped);
        }
        int failed = 0;
        for (Reply reply : replies) {
            if (!reply.ok()) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Writer {} batch had {} rejected writes", workerId, failed);
        }
        return new BatchResult(
                BatchResult.Status.PIPELINED, attempted, batch.size() - failed, skipped, failed);
    }

    private BatchResult sendIndividually(Map<String, byte[]> batch, int attempted, int skipped) {
        int written = 0;
        int failed = 0;
        for (Map.Entry<String, byte[]> entry : batch.entrySet()) {
            try {
                if (store.set(entry.getKey(), entry.getValue(), options.ttlSeconds())) {
                    written++;
                } else {
                    failed++;
                }
            } catch (StoreException e) {
                failed++;
                log.debug("Writer {} failed to write {}: {}", workerId, entry.getKey(), e.getMessage());
            }
        }
        return new BatchResult(BatchResult.Status.FALLBACK, attempted, written, skipped, failed);
    }
}
