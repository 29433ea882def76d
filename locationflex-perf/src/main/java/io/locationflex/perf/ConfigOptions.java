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
package io.locationflex.perf;

import io.locationflex.client.config.ConfigLoader;
import io.locationflex.client.config.LoaderConfig;
import io.locationflex.client.config.RedisSettings;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/** Options shared by every command: where the configuration comes from and where the store is. */
@Slf4j
public final class ConfigOptions {

    @CommandLine.Option(
            names = {"-c", "--config"},
            description = "JSON configuration file")
    Path config = Path.of(ConfigLoader.DefaultConfigFile);

    @CommandLine.Option(
            names = {"--host"},
            description = "Redis host, overrides the configuration")
    String host;

    @CommandLine.Option(
            names = {"--port"},
            description = "Redis port, overrides the configuration")
    Integer port;

    /** Loads the configuration, applies the command line overrides and the configured log level. */
    LoaderConfig load() {
        LoaderConfig loaded = ConfigLoader.load(config);
        if (host != null || port != null) {
            RedisSettings redis = loaded.redis();
            loaded =
                    new LoaderConfig(
                            new RedisSettings(
                                    host != null ? host : redis.host(),
                                    port != null ? port : redis.port(),
                                    redis.db(),
                                    redis.password(),
                                    redis.socketTimeoutMs(),
                                    redis.connectTimeoutMs(),
                                    redis.maxConnections(),
                                    redis.cluster(),
                                    redis.clusterNodes()),
                            loaded.writer(),
                            loaded.reader(),
                            loaded.keyspace(),
                            loaded.version(),
                            loaded.logLevel());
        }
        Configurator.setRootLevel(Level.toLevel(loaded.logLevel(), Level.INFO));
        log.debug(
                "Using store {}:{} (cluster={}), key space {} over {} keys",
                loaded.redis().host(),
                loaded.redis().port(),
                loaded.redis().cluster(),
                loaded.keyspace().prefix(),
                loaded.keyspace().maxKeys());
        return loaded;
    }
}
