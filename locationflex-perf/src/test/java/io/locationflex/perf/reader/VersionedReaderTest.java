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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.locationflex.api.Reply;
import io.locationflex.perf.InMemoryKeyValueStore;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VersionedReaderTest {
    private InMemoryKeyValueStore store;
    private VersionedReader reader;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        // 0 in both versions, 1 only in the primary, 2 only in the secondary, 3 nowhere
        store.put("ip:v23:0", "primary-0");
        store.put("ip:v22:0", "secondary-zero");
        store.put("ip:v23:1", "primary-1");
        store.put("ip:v22:2", "secondary-2");
        reader = new VersionedReader(store, "ip", "v23", "v22");
    }

    @Test
    void primaryTakesPrecedence() {
        ReadResult both = reader.read(0);
        assertThat(both.tier()).isEqualTo(Tier.PRIMARY);
        assertThat(both.sizeBytes()).isEqualTo(9);
        assertThat(both.success()).isTrue();
        assertThat(reader.read(1).tier()).isEqualTo(Tier.PRIMARY);
        assertThat(reader.read(2).tier()).isEqualTo(Tier.SECONDARY);
        assertThat(reader.read(2).sizeBytes()).isEqualTo(11);
        assertThat(reader.read(3).tier()).isEqualTo(Tier.NONE);
        assertThat(reader.read(3).sizeBytes()).isZero();
        assertThat(reader.read(3).success()).isFalse();
    }

    @Test
    void secondaryIsOnlyQueriedOnPrimaryMiss() {
        reader.read(0);
        assertThat(store.getIndividualGets()).hasValue(1);
        reader.read(3);
        assertThat(store.getIndividualGets()).hasValue(3);
    }

    @Test
    void failedLookupCountsAsAbsent() {
        store.setFailingKeys("ip:v23:0"::equals);
        ReadResult result = reader.read(0);
        assertThat(result.tier()).isEqualTo(Tier.SECONDARY);
        assertThat(result.sizeBytes()).isEqualTo("secondary-zero".length());
    }

    @Test
    void pipelinedMatchesIndividualReads() {
        long[] ids = LongStream.range(0, 5).toArray();

        VersionedReader.Batch batch = reader.readPipelined(ids, 0, ids.length);

        assertThat(batch.fallback()).isFalse();
        assertThat(batch.results()).hasSize(5);
        for (ReadResult result : batch.results()) {
            ReadResult individual = reader.read(result.id());
            assertThat(result.tier()).isEqualTo(individual.tier());
            assertThat(result.sizeBytes()).isEqualTo(individual.sizeBytes());
        }
        assertThat(store.getPipelineExecutions()).hasValue(1);
    }

    @Test
    void pipelinedResultsShareBatchLatency() {
        long[] ids = {0, 1, 2, 3};

        VersionedReader.Batch batch = reader.readPipelined(ids, 1, 3);

        assertThat(batch.results()).extracting(ReadResult::id).containsExactly(1L, 2L);
        assertThat(batch.results())
                .extracting(ReadResult::latencyMicros)
                .containsOnly(batch.results().get(0).latencyMicros());
    }

    @Test
    void readsAreIdempotent() {
        long[] ids = {0, 1, 2, 3, 0, 2};
        VersionedReader.Batch first = reader.readPipelined(ids, 0, ids.length);
        VersionedReader.Batch second = reader.readPipelined(ids, 0, ids.length);
        assertThat(second.results())
                .extracting(ReadResult::tier)
                .containsExactlyElementsOf(
                        first.results().stream().map(ReadResult::tier).toList());
    }

    @Test
    void pipelineFailureFallsBackToIndividualReads() {
        store.setFailPipelines(true);
        long[] ids = {0, 2, 3};

        VersionedReader.Batch batch = reader.readPipelined(ids, 0, ids.length);

        assertThat(batch.fallback()).isTrue();
        assertThat(batch.results())
                .extracting(ReadResult::tier)
                .containsExactly(Tier.PRIMARY, Tier.SECONDARY, Tier.NONE);
    }

    @Test
    void invalidSlice() {
        long[] ids = {0, 1};
        assertThatThrownBy(() -> reader.readPipelined(ids, 1, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> reader.readPipelined(ids, 2, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void classify() {
        Reply a = Reply.value("a".getBytes());
        Reply b = Reply.value("b".getBytes());
        assertThat(VersionedReader.classify(a, b)).isEqualTo(Tier.PRIMARY);
        assertThat(VersionedReader.classify(a, null)).isEqualTo(Tier.PRIMARY);
        assertThat(VersionedReader.classify(Reply.value(null), b)).isEqualTo(Tier.SECONDARY);
        assertThat(VersionedReader.classify(Reply.value(new byte[0]), b)).isEqualTo(Tier.SECONDARY);
        assertThat(VersionedReader.classify(Reply.failed("boom"), b)).isEqualTo(Tier.SECONDARY);
        assertThat(VersionedReader.classify(Reply.failed("boom"), Reply.failed("boom")))
                .isEqualTo(Tier.NONE);
        assertThat(VersionedReader.classify(null, null)).isEqualTo(Tier.NONE);
    }
}
