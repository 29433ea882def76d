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

/**
 * The outcome of one versioned lookup.
 *
 * @param id The id looked up.
 * @param tier The version the value was found in.
 * @param sizeBytes Size of the value found, zero on a miss.
 * @param latencyMicros Time spent resolving the lookup.
 */
public record ReadResult(long id, Tier tier, int sizeBytes, long latencyMicros) {

    public boolean success() {
        return tier != Tier.NONE;
    }
}
