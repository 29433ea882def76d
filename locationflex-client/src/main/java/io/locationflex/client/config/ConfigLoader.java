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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link LoaderConfig} by layering, in order: the built-in defaults, an optional JSON file
 * and the {@code LOCATIONFLEX_*} environment variables listed in {@link ConfigOverride}. Values that
 * cannot be parsed or that fail validation are logged and ignored.
 */
@Slf4j
@UtilityClass
public class ConfigLoader {

    public static final String DefaultConfigFile = "config.json";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static @NonNull LoaderConfig load(@Nullable Path path) {
        return load(path, System.getenv());
    }

    public static @NonNull LoaderConfig load(@Nullable Path path, @NonNull Map<String, String> env) {
        LoaderConfig defaults = LoaderConfig.defaults();
        ObjectNode tree = MAPPER.valueToTree(defaults);

        if (path != null && Files.isRegularFile(path)) {
            ObjectNode merged = tree.deepCopy();
            try {
                JsonNode file = MAPPER.readTree(path.toFile());
                if (file instanceof ObjectNode fileObject) {
                    merge(merged, fileObject);
                    MAPPER.treeToValue(merged, LoaderConfig.class);
                    tree = merged;
                    log.info("Loaded configuration from {}", path);
                } else {
                    log.warn("Ignoring configuration file {}: not a JSON object", path);
                }
            } catch (IOException e) {
                log.warn("Ignoring invalid configuration file {}: {}", path, e.getMessage());
            }
        } else if (path != null) {
            log.debug("Configuration file {} not found, using defaults", path);
        }

        for (ConfigOverride override : ConfigOverride.values()) {
            String value = env.get(override.envName());
            if (value == null) {
                continue;
            }
            ObjectNode candidate = tree.deepCopy();
            try {
                override.apply(candidate, value);
                MAPPER.treeToValue(candidate, LoaderConfig.class);
                tree = candidate;
                log.debug("Applied override {}", override.envName());
            } catch (IllegalArgumentException | JsonProcessingException e) {
                log.warn(
                        "Ignoring invalid value for {}: '{}' ({})",
                        override.envName(),
                        value,
                        e.getMessage());
            }
        }

        try {
            return MAPPER.treeToValue(tree, LoaderConfig.class);
        } catch (JsonProcessingException e) {
            log.warn("Configuration could not be bound, using defaults: {}", e.getMessage());
            return defaults;
        }
    }

    /** Writes the configuration as pretty-printed JSON. */
    public static void save(@NonNull LoaderConfig config, @NonNull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), config);
    }

    private static void merge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject
                    && field.getValue() instanceof ObjectNode sourceObject) {
                merge(existingObject, sourceObject);
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
