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

import io.locationflex.api.KeyValueStore;
import io.locationflex.api.StorePipeline;
import io.locationflex.api.exceptions.StoreException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.ClusterPipeline;
import redis.clients.jedis.Connection;
import redis.clients.jedis.ConnectionPool;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisCluster;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;

/** {@link KeyValueStore} backed by a pooled standalone Jedis client or by a Jedis cluster client. */
@Slf4j
public class JedisKeyValueStore implements KeyValueStore {
    private final UnifiedJedis client;
    private final String address;

    JedisKeyValueStore(@NonNull JedisPooled client, @NonNull String address) {
        this.client = client;
        this.address = address;
    }

    JedisKeyValueStore(@NonNull JedisCluster client, @NonNull String address) {
        this.client = client;
        this.address = address;
    }

    @Override
    public boolean ping() throws StoreException {
        try {
            return "PONG".equalsIgnoreCase(client.ping());
        } catch (JedisException e) {
            throw wrap("ping", e);
        }
    }

    @Override
    public @NonNull Optional<byte[]> get(@NonNull String key) throws StoreException {
        try {
            byte[] value = client.get(bytes(key));
            return value == null || value.length == 0 ? Optional.empty() : Optional.of(value);
        } catch (JedisException e) {
            throw wrap("get " + key, e);
        }
    }

    @Override
    public boolean set(@NonNull String key, byte @NonNull [] value, long ttlSeconds)
            throws StoreException {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be greater than zero: " + ttlSeconds);
        }
        try {
            return "OK".equalsIgnoreCase(client.setex(bytes(key), ttlSeconds, value));
        } catch (JedisException e) {
            throw wrap("set " + key, e);
        }
    }

    @Override
    public @NonNull StorePipeline pipeline() throws StoreException {
        try {
            if (client instanceof JedisCluster cluster) {
                ClusterPipeline pipeline = cluster.pipelined();
                return new JedisStorePipeline(pipeline, pipeline::sync, pipeline::close);
            }
            Pipeline pipeline = ((JedisPooled) client).pipelined();
            return new JedisStorePipeline(pipeline, pipeline::sync, pipeline::close);
        } catch (JedisException e) {
            throw wrap("open pipeline", e);
        }
    }

    @Override
    public @NonNull Set<String> keys(@NonNull String pattern) throws StoreException {
        try {
            if (client instanceof JedisCluster cluster) {
                var keys = new HashSet<String>();
                for (ConnectionPool pool : cluster.getClusterNodes().values()) {
                    try (Connection connection = pool.getResource()) {
                        keys.addAll(new Jedis(connection).keys(pattern));
                    }
                }
                return keys;
            }
            return client.keys(pattern);
        } catch (JedisException e) {
            throw wrap("keys " + pattern, e);
        }
    }

    @Override
    public void flushAll() throws StoreException {
        try {
            client.flushAll();
        } catch (JedisException e) {
            throw wrap("flushall", e);
        }
    }

    @Override
    public long ttl(@NonNull String key) throws StoreException {
        try {
            return client.ttl(key);
        } catch (JedisException e) {
            throw wrap("ttl " + key, e);
        }
    }

    @Override
    public @NonNull Map<String, String> info() throws StoreException {
        try {
            String raw;
            if (client instanceof JedisCluster cluster) {
                ConnectionPool pool = cluster.getClusterNodes().values().iterator().next();
                try (Connection connection = pool.getResource()) {
                    raw = new Jedis(connection).info();
                }
            } else {
                try (Connection connection = ((JedisPooled) client).getPool().getResource()) {
                    raw = new Jedis(connection).info();
                }
            }
            return parseInfo(raw);
        } catch (JedisException e) {
            throw wrap("info", e);
        }
    }

    @Override
    public void close() {
        client.close();
    }

    static Map<String, String> parseInfo(String raw) {
        var info = new LinkedHashMap<String, String>();
        for (String line : raw.split("\r?\n")) {
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            int separator = line.indexOf(':');
            if (separator > 0) {
                info.put(line.substring(0, separator), line.substring(separator + 1).trim());
            }
        }
        return info;
    }

    private StoreException wrap(String operation, JedisException e) {
        log.debug("Operation '{}' failed against {}", operation, address, e);
        return new StoreException(operation + " failed against " + address + ": " + e.getMessage(), e);
    }

    private static byte[] bytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }
}
