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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;
import lombok.Getter;
import lombok.NonNull;

/** The settings that can be overridden through {@code LOCATIONFLEX_*} environment variables. */
public enum ConfigOverride {
    REDIS_HOST("redis.host", ValueType.STRING),
    REDIS_PORT("redis.port", ValueType.INT),
    REDIS_DB("redis.db", ValueType.INT),
    REDIS_PASSWORD("redis.password", ValueType.STRING),
    REDIS_CLUSTER("redis.cluster", ValueType.BOOLEAN),
    WRITER_COUNT("writer.workers", ValueType.INT),
    WRITER_BATCH_SIZE("writer.batchSize", ValueType.INT),
    WRITER_TTL("writer.keyTtlSeconds", ValueType.LONG),
    READER_COUNT("reader.readers", ValueType.INT),
    READER_BATCH_SIZE("reader.batchSize", ValueType.INT),
    MAX_KEYS("keyspace.maxKeys", ValueType.LONG),
    PRIMARY_VERSION("keyspace.primaryVersion", ValueType.STRING),
    SECONDARY_VERSION("keyspace.secondaryVersion", ValueType.STRING),
    VERSION("version", ValueType.STRING),
    LOG_LEVEL("logLevel", ValueType.STRING);

    public static final String EnvPrefix = "LOCATIONFLEX_";

    @Getter private final String path;
    private final ValueType type;

    ConfigOverride(String path, ValueType type) {
        this.path = path;
        this.type = type;
    }

    public @NonNull String envName() {
        return EnvPrefix + name();
    }

    /**
     * Writes the parsed value at this override's location in a configuration tree.
     *
     * @throws IllegalArgumentException The value cannot be parsed as the expected type.
     */
    void apply(@NonNull ObjectNode root, @NonNull String value) {
        String[] segments = path.split("\\.");
        ObjectNode parent = root;
        for (int i = 0; i < segments.length - 1; i++) {
            JsonNode child = parent.get(segments[i]);
            parent = child instanceof ObjectNode section ? section : parent.putObject(segments[i]);
        }
        String field = segments[segments.length - 1];
        String trimmed = value.trim();
        switch (type) {
            case INT -> parent.put(field, Integer.parseInt(trimmed));
            case LONG -> parent.put(field, Long.parseLong(trimmed));
            case BOOLEAN -> parent.put(field, parseBoolean(trimmed));
            case STRING -> parent.put(field, trimmed);
        }
    }

    private static boolean parseBoolean(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException("not a boolean: " + value);
        };
    }

    private enum ValueType {
        STRING,
        INT,
        LONG,
        BOOLEAN
    }
}
