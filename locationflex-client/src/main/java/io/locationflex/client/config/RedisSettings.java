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
import java.util.List;
import javax.annotation.Nullable;

/**
 * Connection settings of the store.
 *
 * @param host Host of the standalone server, or of the first cluster node.
 * @param port Port of the standalone server, or of the first cluster node.
 * @param db Logical database, only honoured by standalone servers.
 * @param password Password, or {@code null} when the server requires no authentication.
 * @param socketTimeoutMs Socket read timeout in milliseconds.
 * @param connectTimeoutMs Connection timeout in milliseconds.
 * @param maxConnections Upper bound of the connection pool.
 * @param cluster Whether the store is a cluster.
 * @param clusterNodes Additional {@code host:port} seeds used in cluster mode.
 */
public record RedisSettings(
        String host,
        int port,
        int db,
        @Nullable String password,
        int socketTimeoutMs,
        int connectTimeoutMs,
        int maxConnections,
        boolean cluster,
        List<String> clusterNodes) {

    public static final String DefaultHost = "localhost";
    public static final int DefaultPort = 6379;
    public static final int DefaultTimeoutMs = 5_000;
    public static final int DefaultMaxConnections = 50;

    public RedisSettings {
        if (Strings.isNullOrEmpty(host)) {
            throw new IllegalArgumentException("host must not be null or empty");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be in [1, 65535]: " + port);
        }
        if (db < 0) {
            throw new IllegalArgumentException("db must not be negative: " + db);
        }
        if (socketTimeoutMs <= 0 || connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("timeouts must be greater than zero");
        }
        if (maxConnections <= 0) {
            throw new IllegalArgumentException(
                    "maxConnections must be greater than zero: " + maxConnections);
        }
        clusterNodes = clusterNodes == null ? List.of() : List.copyOf(clusterNodes);
    }

    public static RedisSettings defaults() {
        return new RedisSettings(
                DefaultHost,
                DefaultPort,
                0,
                null,
                DefaultTimeoutMs,
                DefaultTimeoutMs,
                DefaultMaxConnections,
                false,
                List.of());
    }
}
