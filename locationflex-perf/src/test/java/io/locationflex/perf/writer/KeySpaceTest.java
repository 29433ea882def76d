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

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class KeySpaceTest {

    @Test
    void evenSplit() {
        assertThat(KeySpace.partition(1000, 4))
                .containsExactly(
                        new KeyRange(0, 0, 250),
                        new KeyRange(1, 250, 500),
                        new KeyRange(2, 500, 750),
                        new KeyRange(3, 750, 1000));
    }

    @Test
    void lastRangeTakesRemainder() {
        assertThat(KeySpace.partition(10, 3))
                .containsExactly(new KeyRange(0, 0, 3), new KeyRange(1, 3, 6), new KeyRange(2, 6, 10));
    }

    @ParameterizedTest
    @CsvSource({"1,1", "7,7", "100,3", "1001,4", "60000000,30", "12345,17"})
    void rangesCoverKeySpace(long totalKeys, int numWorkers) {
        List<KeyRange> ranges = KeySpace.partition(totalKeys, numWorkers);
        assertThat(ranges).hasSize(numWorkers);
        assertThat(ranges.get(0).start()).isZero();
        assertThat(ranges.get(numWorkers - 1).end()).isEqualTo(totalKeys);
        long covered = 0;
        for (int i = 0; i < ranges.size(); i++) {
            KeyRange range = ranges.get(i);
            assertThat(range.workerId()).isEqualTo(i);
            assertThat(range.size()).isGreaterThanOrEqualTo(totalKeys / numWorkers);
            if (i > 0) {
                assertThat(range.start()).isEqualTo(ranges.get(i - 1).end());
            }
            covered += range.size();
        }
        assertThat(covered).isEqualTo(totalKeys);
    }

    @ParameterizedTest
    @CsvSource({"0,1", "-5,1", "10,0", "10,-1", "3,4"})
    void invalidArguments(long totalKeys, int numWorkers) {
        assertThatThrownBy(() -> KeySpace.partition(totalKeys, numWorkers))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rangeContains() {
        var range = new KeyRange(2, 500, 750);
        assertThat(range.contains(500)).isTrue();
        assertThat(range.contains(749)).isTrue();
        assertThat(range.contains(750)).isFalse();
        assertThat(range.contains(499)).isFalse();
        assertThat(range).hasToString("worker-2[500, 750)");
    }
}
