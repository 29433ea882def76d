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
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.NonNull;

/**
 * Blocking client for a remote key-value store that supports TTL based expiry and non-transactional
 * command pipelines. Implementations must be safe for use by multiple threads.
 */
public interface KeyValueStore extends AutoCloseable {

    /** Default time to live applied to loaded records: three days. */
    long DEFAULT_TTL_SECONDS = 259_200L;

    /**
     * Checks that the store answers.
     *
     * @return True if the store replied to the ping.
     * @throws StoreException The store could not be reached.
     */
    boolean ping() throws StoreException;

    /**
     * Returns the value associated with the specified key.
     *
     * @param key The key associated with the value to be fetched.
     * @return The value, or {@link Optional#empty()} if the key does not exist.
     * @throws StoreException The lookup failed.
     */
    @NonNull
    Optional<byte[]> get(@NonNull String key) throws StoreException;

    /**
     * Associates a value with a key, expiring it after the supplied number of seconds.
     *
     * @param key The key with which the value should be associated.
     * @param value The value to associate with the key.
     * @param ttlSeconds The time to live of the record, must be greater than zero.
     * @return True if the store acknowledged the write.
     * @throws StoreException The write failed.
     */
    boolean set(@NonNull String key, byte @NonNull [] value, long ttlSeconds) throws StoreException;

    /**
     * Opens a new non-transactional pipeline. Commands queued on the pipeline are sent in a single
     * round trip when {@link StorePipeline#execute()} is called.
     *
     * @return A new, empty pipeline.
     * @throws StoreException No connection could be obtained for the pipeline.
     */
    @NonNull
    StorePipeline pipeline() throws StoreException;

    /**
     * Lists the keys matching a glob-style pattern.
     *
     * @param pattern The pattern, for example {@code ip:v22:*}.
     * @return The matching keys, or an empty set if there were none.
     * @throws StoreException The listing failed.
     */
    @NonNull
    Set<String> keys(@NonNull String pattern) throws StoreException;

    /**
     * Removes every key of every database of the store.
     *
     * @throws StoreException The flush failed.
     */
    void flushAll() throws StoreException;

    /**
     * Returns the remaining time to live of a key.
     *
     * @param key The key to inspect.
     * @return The remaining seconds, {@code -1} if the key has no expiry, {@code -2} if the key does
     *     not exist.
     * @throws StoreException The lookup failed.
     */
    long ttl(@NonNull String key) throws StoreException;

    /**
     * Returns the server information section as reported by the store.
     *
     * @return The parsed {@code name -> value} pairs.
     * @throws StoreException The request failed.
     */
    @NonNull
    Map<String, String> info() throws StoreException;
}
