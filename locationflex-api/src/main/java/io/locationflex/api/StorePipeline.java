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

import io.locationflex.api.exceptions.StoreException;
import java.util.List;
import lombok.NonNull;

/**
 * A batch of independent commands sent to the store in one round trip. The pipeline is not
 * transactional: no atomicity is guaranteed across the queued commands, which makes it usable
 * against a cluster. A pipeline is owned by a single thread and must be closed after use.
 */
public interface StorePipeline extends AutoCloseable {

    /**
     * Queues a write of a value that expires after the supplied number of seconds.
     *
     * @param key The key with which the value should be associated.
     * @param value The value to associate with the key.
     * @param ttlSeconds The time to live of the record.
     * @return This pipeline.
     */
    @NonNull
    StorePipeline set(@NonNull String key, byte @NonNull [] value, long ttlSeconds);

    /**
     * Queues a lookup.
     *
     * @param key The key associated with the value to be fetched.
     * @return This pipeline.
     */
    @NonNull
    StorePipeline get(@NonNull String key);

    /** @return The number of commands queued so far. */
    int size();

    /**
     * Sends every queued command and blocks until all the replies are received.
     *
     * @return One reply per queued command, in the order the commands were queued.
     * @throws StoreException The pipeline as a whole failed, either while the commands were queued
     *     or while they were sent.
     */
    @NonNull
    List<Reply> execute() throws StoreException;

    @Override
    void close();
}
