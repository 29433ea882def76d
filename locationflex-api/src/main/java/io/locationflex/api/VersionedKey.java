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
 * The identity of a record in the store: a sequence id inside a version namespace. The same id under
 * two versions designates two distinct keys.
 *
 * @param prefix The fixed key prefix.
 * @param version The version tag of the namespace, for example {@code v22}.
 * @param id The sequence id, never negative.
 */
public record VersionedKey(@NonNull String prefix, @NonNull String version, long id) {

    public static final String DEFAULT_PREFIX = "ip";
    public static final char SEPARATOR = ':';

    public VersionedKey {
        if (prefix.isEmpty()) {
            throw new IllegalArgumentException("prefix must not be empty");
        }
        if (version.isEmpty()) {
            throw new IllegalArgumentException("version must not be empty");
        }
        if (id < 0) {
            throw new IllegalArgumentException("id must not be negative: " + id);
        }
    }

    public static @NonNull VersionedKey of(@NonNull String version, long id) {
        return new VersionedKey(DEFAULT_PREFIX, version, id);
    }

    /** @return The key as stored, {@code prefix:version:id}. */
    public @NonNull String toStoreKey() {
        return toStoreKey(prefix, version, id);
    }

    public static @NonNull String toStoreKey(
            @NonNull String prefix, @NonNull String version, long id) {
        return prefix + SEPARATOR + version + SEPARATOR + id;
    }

    /**
     * Parses a key previously produced by {@link #toStoreKey()}.
     *
     * @throws IllegalArgumentException The key does not have the {@code prefix:version:id} shape.
     */
    public static @NonNull VersionedKey parse(@NonNull String storeKey) {
        int last = storeKey.lastIndexOf(SEPARATOR);
        int first = storeKey.indexOf(SEPARATOR);
        if (first <= 0 || last <= first + 1 || last == storeKey.length() - 1) {
            throw new IllegalArgumentException("not a versioned key: " + storeKey);
        }
        try {
            return new VersionedKey(
                    storeKey.substring(0, first),
                    storeKey.substring(first + 1, last),
                    Long.parseLong(storeKey.substring(last + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a versioned key: " + storeKey, e);
        }
    }
}
