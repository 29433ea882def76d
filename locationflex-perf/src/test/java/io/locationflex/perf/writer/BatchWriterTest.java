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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.locationflex.api.VersionedKey;
import io.locationflex.client.records.SampleRecordSource;
import io.locationflex.perf.BenchmarkMetrics;
import io.locationflex.perf.InMemoryKeyValueStore;
import io.locationflex.perf.StopSignal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BatchWriterTest {
    private static final SampleRecordSource source = new SampleRecordSource(10);

    private InMemoryKeyValueStore store;
    private StopSignal stopSignal;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        stopSignal = new StopSignal();
    }

    private BatchWriter writer(long start, long end, int batchSize, double skipProbability) {
        var options =
                new BatchWriterOptions(
                        VersionedKey.DEFAULT_PREFIX,
                        "v23",
                        start,
                        end,
                        3600,
                        batchSize,
                        skipProbability,
                        Duration.ofSeconds(5));
        return new BatchWriter(0, store, source, options, stopSignal, BenchmarkMetrics.noop());
    }

    @Test
    void writesWholeRange() {
        var writer = writer(0, 100, 1000, 0.0);

        WriterReport report = writer.runUntil(null, null);

        assertThat(report.written()).isEqualTo(100);
        assertThat(report.skipped()).isZero();
        assertThat(report.failed()).isZero();
        assertThat(report.batches()).isEqualTo(1);
        assertThat(report.interrupted()).isFalse();
        assertThat(report.degraded()).isFalse();
        assertThat(writer.getCursor()).isEqualTo(100);
        assertThat(writer.isExhausted()).isTrue();
        assertThat(store.size()).isEqualTo(100);
        assertThat(store.contains("ip:v23:0")).isTrue();
        assertThat(store.contains("ip:v23:99")).isTrue();
        assertThat(store.ttl("ip:v23:42")).isEqualTo(3600);
        assertThat(store.getPipelineExecutions()).hasValue(1);
    }

    @Test
    void cursorNeverPassesBound() {
        var writer = writer(10, 20, 3, 0.0);

        WriteOutcome outcome = writer.write(50, 3);

        assertThat(outcome.attempted()).isEqualTo(10);
        assertThat(outcome.written()).isEqualTo(10);
        assertThat(writer.getCursor()).isEqualTo(20);
        assertThat(store.contains("ip:v23:9")).isFalse();
        assertThat(store.contains("ip:v23:10")).isTrue();
        assertThat(store.contains("ip:v23:19")).isTrue();
        assertThat(store.contains("ip:v23:20")).isFalse();

        assertThat(writer.write(5, 3)).isEqualTo(WriteOutcome.EMPTY);
    }

    @Test
    void stopsAtTarget() {
        var writer = writer(0, 1000, 10, 0.0);

        WriterReport report = writer.runUntil(25L, null);

        assertThat(report.written()).isEqualTo(25);
        assertThat(report.batches()).isEqualTo(3);
        assertThat(writer.getCursor()).isEqualTo(25);
        assertThat(writer.isExhausted()).isFalse();
    }

    @Test
    void stopsAfterDuration() {
        var writer = writer(0, 1000, 10, 0.0);

        WriterReport report = writer.runUntil(null, Duration.ZERO);

        assertThat(report.attempted()).isZero();
        assertThat(report.interrupted()).isFalse();
    }

    @Test
    void unexpectedFailureKeepsEarlierBatches() {
        store.setCrashAfterPipelines(2);
        var writer = writer(0, 1000, 100, 0.0);

        WriterReport report = writer.runUntil(null, null);

        assertThat(report.degraded()).isTrue();
        assertThat(report.interrupted()).isFalse();
        assertThat(report.written()).isEqualTo(200);
        assertThat(report.failed()).isEqualTo(100);
        assertThat(report.attempted()).isEqualTo(300);
        assertThat(report.batches()).isEqualTo(3);
        assertThat(writer.getCursor()).isEqualTo(300);
        assertThat(store.size()).isEqualTo(200);
    }

    @Test
    void unavailablePipelineFallsBack() {
        store.setFailPipelineCreation(true);
        var writer = writer(0, 5, 10, 0.0);

        BatchResult result = writer.writeBatch(10);

        assertThat(result.status()).isEqualTo(BatchResult.Status.FALLBACK);
        assertThat(result.written()).isEqualTo(5);
        assertThat(store.getIndividualSets()).hasValue(5);
    }

    @Test
    void fallsBackToIndividualWrites() {
        store.setFailPipelines(true);
        var writer = writer(0, 5, 10, 0.0);

        BatchResult result = writer.writeBatch(10);

        assertThat(result)
                .isEqualTo(new BatchResult(BatchResult.Status.FALLBACK, 5, 5, 0, 0));
        assertThat(store.getIndividualSets()).hasValue(5);
        assertThat(store.size()).isEqualTo(5);

        WriterReport report = writer.runUntil(null, null);
        assertThat(report.fallbackBatches()).isEqualTo(1);
        assertThat(report.written()).isEqualTo(5);
    }

    @Test
    void fallbackCountsFailedKeys() {
        store.setFailPipelines(true);
        store.setFailingKeys("ip:v23:3"::equals);
        var writer = writer(0, 5, 10, 0.0);

        BatchResult result = writer.writeBatch(5);

        assertThat(result).isEqualTo(new BatchResult(BatchResult.Status.FALLBACK, 5, 4, 0, 1));
        // Each key is tried once on its own, never again.
        assertThat(store.getIndividualSets()).hasValue(5);
        assertThat(store.getPipelineExecutions()).hasValue(1);
    }

    @Test
    void rejectedRepliesCountAsFailed() {
        store.setFailingKeys("ip:v23:3"::equals);
        var writer = writer(0, 5, 10, 0.0);

        BatchResult result = writer.writeBatch(5);

        assertThat(result).isEqualTo(new BatchResult(BatchResult.Status.PIPELINED, 5, 4, 0, 1));
        assertThat(store.getIndividualSets()).hasValue(0);
        assertThat(store.contains("ip:v23:3")).isFalse();
    }

    @Test
    void skippedIdsConsumeTheCursor() {
        var writer = writer(0, 1000, 100, 0.5);

        WriterReport report = writer.runUntil(null, null);

        assertThat(report.written() + report.skipped()).isEqualTo(1000);
        assertThat(report.skipped()).isPositive();
        assertThat(report.written()).isPositive();
        assertThat(store.size()).isEqualTo((int) report.written());
        assertThat(writer.getCursor()).isEqualTo(1000);
    }

    @Test
    void stopSignalInterruptsRun() {
        stopSignal.raise();
        var writer = writer(0, 1000, 10, 0.0);

        WriterReport report = writer.runUntil(null, null);

        assertThat(report.interrupted()).isTrue();
        assertThat(report.attempted()).isZero();
        assertThat(store.size()).isZero();
    }

    @Test
    void invalidArguments() {
        var writer = writer(0, 10, 10, 0.0);
        assertThatThrownBy(() -> writer.write(-1, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> writer.write(1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BatchWriterOptions.forRange("v1", 10, 5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
