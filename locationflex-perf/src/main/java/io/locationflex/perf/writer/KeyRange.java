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
 * The ids {@code [start, end)} assigned to one worker.
 *
 * @param workerId Zero-based worker index.
 * @param start First id of the range, inclusive.
 * @param end Last id of the range, exclusive.
 */
public record KeyRange(int workerId, long start, long end) {

    public KeyRange {
        if (workerId < 0) {
            throw new IllegalArgumentException("workerId must not be negative: " + workerId);
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + end + ")");
        }
    }

    public long size() {
        return end - start;
    }

    public boolean contains(long id) {
        return id >= start && id < end;
    }

    @Override
    public String toString() {
        return "worker-" + workerId + "[" + start + ", " + end + ")";
    }
}
