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
 * The outcome of one batch of writes.
 *
 * @param status Whether the batch went through the pipeline or had to be replayed key by key.
 * @param attempted Ids consumed by the batch.
 * @param written Keys acknowledged by the store.
 * @param skipped Ids skipped by the miss simulation.
 * @param failed Keys that could not be written.
 */
public record BatchResult(Status status, int attempted, int written, int skipped, int failed) {

    public enum Status {
        /** The pipelined request succeeded. */
        PIPELINED,
        /** The pipelined request failed as a whole and every key was retried once on its own. */
        FALLBACK,
        /** The writer failed unexpectedly; every id of the batch is counted as failed. */
        ABORTED
    }

    public BatchResult {
        if (written + skipped + failed != attempted) {
            throw new IllegalArgumentException(
                    "written + skipped + failed must equal attempted: " + written + " + " + skipped
                            + " + " + failed + " != " + attempted);
        }
    }
}
