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

import io.locationflex.api.KeyValueStore;
import io.locationflex.api.RecordSource;
import io.locationflex.api.VersionedKey;
import io.locationflex.client.records.SampleRecordSource;
import io.locationflex.perf.BenchmarkMetrics;
import io.locationflex.perf.InMemoryKeyValueStore;
import io.locationflex.perf.StopSignal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WriteOrchestratorTest {
    private static final SampleRecordSource source = new SampleRecordSource(10);

    private InMemoryKeyValueStore store;
    private StopSignal stopSignal;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        stopSignal = new StopSignal();
    }

    private static WriteOrchestratorOptions options(int workers, Long projectionKeys) {
        return new WriteOrchestratorOptions(
                workers,
                100,
                KeyValueStore.DEFAULT_TTL_SECONDS,
                VersionedKey.DEFAULT_PREFIX,
                0.0,
                Duration.ZERO,
                projectionKeys,
                Duration.ofSeconds(5));
    }

    private WriteOrchestrator orchestrator(WriteOrchestratorOptions options, RecordSource source) {
        return new WriteOrchestrator(store, source, options, stopSignal, BenchmarkMetrics.noop());
    }

    @Test
    void importPartitionsKeys() {
        ImportReport report = orchestrator(options(4, null), source).runImport("v23", 1000);

        assertThat(report.version()).isEqualTo("v23");
        assertThat(report.totalWritten()).isEqualTo(1000);
        assertThat(report.totalSkipped()).isZero();
        assertThat(report.totalFailed()).isZero();
        assertThat(report.workersReported()).isEqualTo(4);
        assertThat(report.interrupted()).isFalse();
        assertThat(report.degraded()).isFalse();
        assertThat(report.workers())
                .extracting(WriterReport::written)
                .containsExactly(250L, 250L, 250L, 250L);
        assertThat(report.workers())
                .extracting(WriterReport::rangeStart)
                .containsExactly(0L, 250L, 500L, 750L);
        assertThat(store.size()).isEqualTo(1000);
        assertThat(store.keys("ip:v23:*")).hasSize(1000);
    }

    @Test
    void defaultOptionsImport() {
        ImportReport report =
                orchestrator(WriteOrchestratorOptions.withWorkers(3), source).runImport("v1", 10);

        assertThat(report.workers())
                .extracting(WriterReport::written)
                .containsExactly(3L, 3L, 4L);
    }

    @Test
    void workersMustNotExceedKeys() {
        assertThatThrownBy(() -> orchestrator(options(4, null), source).runImport("v23", 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static RecordSource failingFrom(long firstMissingId) {
        return new RecordSource() {
            @Override
            public byte[] generate(long id) {
                if (id >= firstMissingId) {
                    throw new IllegalStateException("no record for " + id);
                }
                return source.generate(id);
            }

            @Override
            public byte[] generate(String identifier) {
                return source.generate(identifier);
            }

            @Override
            public int cycle() {
                return source.cycle();
            }

            @Override
            public double averagePayloadSize() {
                return source.averagePayloadSize();
            }
        };
    }

    @Test
    void failedWorkerKeepsBatchesWrittenBeforeTheFailure() {
        ImportReport report =
                orchestrator(options(4, null), failingFrom(900)).runImport("v23", 1000);

        assertThat(report.workers()).hasSize(4);
        assertThat(report.workersReported()).isEqualTo(3);
        assertThat(report.degraded()).isTrue();
        assertThat(report.interrupted()).isFalse();
        assertThat(report.totalWritten()).isEqualTo(850);
        assertThat(report.totalFailed()).isEqualTo(100);

        WriterReport failed = report.workers().get(3);
        assertThat(failed.degraded()).isTrue();
        assertThat(failed.written()).isEqualTo(100);
        assertThat(failed.failed()).isEqualTo(100);
        assertThat(failed.batches()).isEqualTo(2);
        assertThat(report.workers().subList(0, 3)).noneMatch(WriterReport::degraded);
        assertThat(store.keys("ip:v23:*")).hasSize(850);
    }

    @Test
    void degradedVersionMarksMultiVersionImport() {
        MultiVersionImportReport report =
                orchestrator(options(2, null), failingFrom(80))
                        .runMultiVersionImport(List.of("v22", "v23"), 100);

        assertThat(report.imports()).hasSize(2).allMatch(ImportReport::degraded);
        assertThat(report.degraded()).isTrue();
        assertThat(report.totalWritten()).isEqualTo(100);
    }

    @Test
    void unavailablePipelinesFallBackToIndividualWrites() {
        store.setFailPipelineCreation(true);

        ImportReport report = orchestrator(options(2, null), source).runImport("v1", 100);

        assertThat(report.totalWritten()).isEqualTo(100);
        assertThat(report.workersReported()).isEqualTo(2);
        assertThat(report.degraded()).isFalse();
        assertThat(report.workers()).extracting(WriterReport::fallbackBatches).containsExactly(1L, 1L);
        assertThat(store.getIndividualSets()).hasValue(100);
    }

    @Test
    void multiVersionImport() {
        MultiVersionImportReport report =
                orchestrator(options(2, null), source).runMultiVersionImport(List.of("v22", "v23"), 100);

        assertThat(report.imports()).extracting(ImportReport::version).containsExactly("v22", "v23");
        assertThat(report.totalWritten()).isEqualTo(200);
        assertThat(report.totalSkipped()).isZero();
        assertThat(report.projection()).isNull();
        assertThat(report.interrupted()).isFalse();
        assertThat(store.keys("ip:v22:*")).hasSize(100);
        assertThat(store.keys("ip:v23:*")).hasSize(100);
    }

    @Test
    void projection() {
        MultiVersionImportReport report =
                orchestrator(options(2, 1_000_000L), source)
                        .runMultiVersionImport(List.of("v22", "v23"), 100);

        assertThat(report.projection()).isNotNull();
        assertThat(report.projection().hypotheticalKeys()).isEqualTo(1_000_000L);
        assertThat(report.projection().projectedSeconds()).isPositive();
        assertThat(report.combinedRate()).isPositive();
    }

    @Test
    void stoppedRunReportsInterrupted() {
        stopSignal.raise();

        ImportReport single = orchestrator(options(2, null), source).runImport("v23", 100);
        assertThat(single.interrupted()).isTrue();
        assertThat(single.totalWritten()).isZero();
        assertThat(single.workersReported()).isEqualTo(2);

        MultiVersionImportReport multi =
                orchestrator(options(2, null), source).runMultiVersionImport(List.of("v22", "v23"), 100);
        assertThat(multi.imports()).isEmpty();
        assertThat(multi.interrupted()).isTrue();
        assertThat(store.size()).isZero();
    }

    @Test
    void emptyVersionList() {
        assertThatThrownBy(
                        () -> orchestrator(options(2, null), source).runMultiVersionImport(List.of(), 100))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
