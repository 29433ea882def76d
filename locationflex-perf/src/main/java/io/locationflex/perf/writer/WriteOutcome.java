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

public record WriteOutcome(long written, long skipped, long failed) {

    public static final WriteOutcome EMPTY = new WriteOutcome(0, 0, 0);

    public long attempted() {
        return written + skipped + failed;
    }

    public WriteOutcome plus(BatchResult batch) {
        return new WriteOutcome(
                written + batch.written(), skipped + batch.skipped(), failed + batch.failed());
    }
}
