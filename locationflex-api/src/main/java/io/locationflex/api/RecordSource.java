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
package io.locationflex.api;

import lombok.NonNull;

/**
 * Produces synthetic record payloads. Implementations are pure functions of their input: the same
 * identifier always yields the same bytes.
 */
public interface RecordSource {

    /**
     * Returns the payload stored under a sequence id. Ids are cycled over a fixed set of samples, so
     * many ids share the same content.
     *
     * @param id The sequence id, never negative.
     * @return The serialized payload.
     */
    byte @NonNull [] generate(long id);

    /**
     * Returns the payload describing an arbitrary identifier, for example an IPv4 address.
     *
     * @param identifier The identifier the record is derived from.
     * @return The serialized payload.
     */
    byte @NonNull [] generate(@NonNull String identifier);

    /** @return The number of distinct samples that sequence ids cycle over. */
    int cycle();

    /** @return The mean size in bytes of the payloads returned by {@link #generate(long)}. */
    double averagePayloadSize();
}
