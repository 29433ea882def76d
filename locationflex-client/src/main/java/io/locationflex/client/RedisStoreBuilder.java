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
package io.locationflex.client;

import static java.time.Duration.ZERO;

import com.google.common.base.Strings;
import com.google.common.net.HostAndPort;
import io.locationflex.api.KeyValueStore;
import io.locationflex.api.exceptions.StoreConnectionException;
import io.locationflex.api.exceptions.StoreException;
import io.locationflex.client.config.RedisSettings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.ConnectionPoolConfig;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisCluster;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

/** Builds a {@link KeyValueStore} connected to a Redis server or cluster. */
@Slf4j
public class RedisStoreBuilder {

    public static final Duration DefaultTimeout = Duration.ofMillis(RedisSettings.DefaultTimeoutMs);
    public static final int DefaultClusterMaxAttempts = 5;
    public static final String ClientName = "locationflex-loader";

    @NonNull private String host = RedisSettings.DefaultHost;
    private int port = RedisSettings.DefaultPort;
    private int database = 0;
    @Nullable private String password;
    @NonNull private Duration socketTimeout = DefaultTimeout;
    @NonNull private Duration connectTimeout = DefaultTimeout;
    private int maxConnections = RedisSettings.DefaultMaxConnections;
    private boolean cluster;
    private final List<String> clusterNodes = new ArrayList<>();

    public static @NonNull RedisStoreBuilder fromSettings(@NonNull RedisSettings settings) {
        var builder =
                new RedisStoreBuilder()
                        .host(settings.host())
                        .port(settings.port())
                        .database(settings.db())
                        .password(settings.password())
                        .socketTimeout(Duration.ofMillis(settings.socketTimeoutMs()))
                        .connectTimeout(Duration.ofMillis(settings.connectTimeoutMs()))
                        .maxConnections(settings.maxConnections())
                        .cluster(settings.cluster());
        settings.clusterNodes().forEach(builder::addClusterNode);
        return builder;
    }

    public @NonNull RedisStoreBuilder host(@NonNull String host) {
        if (Strings.isNullOrEmpty(host)) {
            throw new IllegalArgumentException("host must not be null or empty.");
        }
        this.host = host;
        return this;
    }

    public @NonNull RedisStoreBuilder port(int port) {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be in [1, 65535]: " + port);
        }
        this.port = port;
        return this;
    }

    public @NonNull RedisStoreBuilder database(int database) {
        if (database < 0) {
            throw new IllegalArgumentException("database must not be negative: " + database);
        }
        this.database = database;
        return this;
    }

    public @NonNull RedisStoreBuilder password(@Nullable String password) {
        this.password = Strings.emptyToNull(password);
        return this;
    }

    public @NonNull RedisStoreBuilder socketTimeout(@NonNull Duration socketTimeout) {
        if (socketTimeout.isNegative() || socketTimeout.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "socketTimeout must be greater than zero: " + socketTimeout);
        }
        this.socketTimeout = socketTimeout;
        return this;
    }

    public @NonNull RedisStoreBuilder connectTimeout(@NonNull Duration connectTimeout) {
        if (connectTimeout.isNegative() || connectTimeout.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "connectTimeout must be greater than zero: " + connectTimeout);
        }
        this.connectTimeout = connectTimeout;
        return this;
    }

    public @NonNull RedisStoreBuilder maxConnections(int maxConnections) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException(
                    "maxConnections must be greater than zero: " + maxConnections);
        }
        this.maxConnections = maxConnections;
        return this;
    }

    public @NonNull RedisStoreBuilder cluster(boolean cluster) {
        this.cluster = cluster;
        return this;
    }

    /** Adds a {@code host:port} seed node, only used in cluster mode. */
    public @NonNull RedisStoreBuilder addClusterNode(@NonNull String node) {
        try {
            HostAndPort.fromString(node).getPort();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IllegalArgumentException("cluster node must be host:port: " + node, e);
        }
        clusterNodes.add(node);
        return this;
    }

    public @NonNull String address() {
        return (cluster ? "redis-cluster://" : "redis://") + host + ":" + port;
    }

    /**
     * Connects to the store and checks that it answers.
     *
     * @throws StoreConnectionException The store cannot be reached.
     */
    public @NonNull KeyValueStore connect() throws StoreException {
        JedisClientConfig clientConfig = clientConfig();
        var poolConfig = new ConnectionPoolConfig();
        poolConfig.setMaxTotal(maxConnections);
        poolConfig.setMaxIdle(maxConnections);

        JedisKeyValueStore store;
        try {
            if (cluster) {
                store =
                        new JedisKeyValueStore(
                                new JedisCluster(
                                        seedNodes(), clientConfig, DefaultClusterMaxAttempts, poolConfig),
                                address());
            } else {
                store =
                        new JedisKeyValueStore(
                                new JedisPooled(
                                        new redis.clients.jedis.HostAndPort(host, port),
                                        clientConfig,
                                        poolConfig),
                                address());
            }
        } catch (JedisException e) {
            throw new StoreConnectionException(address(), e);
        }

        try {
            if (!store.ping()) {
                store.close();
                throw new StoreConnectionException(address(), "unexpected reply to ping");
            }
        } catch (StoreConnectionException e) {
            throw e;
        } catch (StoreException e) {
            store.close();
            throw new StoreConnectionException(address(), e.getCause() != null ? e.getCause() : e);
        }
        log.info("Connected to {}", address());
        return store;
    }

    private JedisClientConfig clientConfig() {
        var builder =
                DefaultJedisClientConfig.builder()
                        .socketTimeoutMillis((int) socketTimeout.toMillis())
                        .connectionTimeoutMillis((int) connectTimeout.toMillis())
                        .clientName(ClientName)
                        .password(password);
        if (!cluster) {
            builder.database(database);
        }
        return builder.build();
    }

    private Set<redis.clients.jedis.HostAndPort> seedNodes() {
        var nodes = new LinkedHashSet<redis.clients.jedis.HostAndPort>();
        nodes.add(new redis.clients.jedis.HostAndPort(host, port));
        for (String node : clusterNodes) {
            HostAndPort parsed = HostAndPort.fromString(node);
            nodes.add(new redis.clients.jedis.HostAndPort(parsed.getHost(), parsed.getPort()));
        }
        return nodes;
    }
}
