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

import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

@UtilityClass
public class KeySpace {

    /**
     * Splits {@code [0, totalKeys)} into contiguous, non-overlapping ranges, one per worker. Every
     * worker gets {@code totalKeys / numWorkers} ids and the last one also takes the remainder.
     *
     * @throws IllegalArgumentException {@code totalKeys < 1}, {@code numWorkers < 1} or {@code
     *     numWorkers > totalKeys}.
     */
    public static @NonNull List<KeyRange> partition(long totalKeys, int numWorkers) {
        if (totalKeys < 1) {
            throw new IllegalArgumentException("totalKeys must be greater than zero: " + totalKeys);
        }
        if (numWorkers < 1) {
            throw new IllegalArgumentException("numWorkers must be greater than zero: " + numWorkers);
        }
        if (numWorkers > totalKeys) {
            throw new IllegalArgumentException(
                    "numWorkers (" + numWorkers + ") must not exceed totalKeys (" + totalKeys + ")");
        }
        long perWorker = totalKeys / numWorkers;
        long remainder = totalKeys % numWorkers;
        var ranges = new ArrayList<KeyRange>(numWorkers);
        for (int i = 0; i < numWorkers; i++) {
            long start = i * perWorker;
            long end = start + perWorker;
            if (i == numWorkers - 1) {
                end += remainder;
            }
            ranges.add(new KeyRange(i, start, end));
        }
        return ranges;
    }
}
