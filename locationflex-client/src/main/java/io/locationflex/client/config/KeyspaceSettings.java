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
package io.locationflex.client.config;

import com.google.common.base.Strings;
import io.locationflex.api.VersionedKey;

/**
 * Layout of the versioned key space.
 *
 * @param prefix Prefix of every key.
 * @param maxKeys Size of the id space, ids are drawn from {@code [0, maxKeys)}.
 * @param primaryVersion Version looked up first by readers.
 * @param secondaryVersion Version looked up when the primary one has no value.
 */
public record KeyspaceSettings(
        String prefix, long maxKeys, String primaryVersion, String secondaryVersion) {

    public static final long DefaultMaxKeys = 200_000L;
    public static final String DefaultPrimaryVersion = "v23";
    public static final String DefaultSecondaryVersion = "v22";

    public KeyspaceSettings {
        if (Strings.isNullOrEmpty(prefix)) {
            throw new IllegalArgumentException("prefix must not be null or empty");
        }
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("maxKeys must be greater than zero: " + maxKeys);
        }
        if (Strings.isNullOrEmpty(primaryVersion) || Strings.isNullOrEmpty(secondaryVersion)) {
            throw new IllegalArgumentException("versions must not be null or empty");
        }
    }

    public static KeyspaceSettings defaults() {
        return new KeyspaceSettings(
                VersionedKey.DEFAULT_PREFIX,
                DefaultMaxKeys,
                DefaultPrimaryVersion,
                DefaultSecondaryVersion);
    }
}
