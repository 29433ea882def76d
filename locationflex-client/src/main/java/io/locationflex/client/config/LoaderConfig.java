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
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Set;

/**
 * Complete configuration of the loader.
 *
 * @param redis Store connection settings.
 * @param writer Import settings.
 * @param reader Read benchmark settings.
 * @param keyspace Key space layout.
 * @param version Version tag written by a single-version import.
 * @param logLevel Root log level.
 */
public record LoaderConfig(
        RedisSettings redis,
        WriterSettings writer,
        ReaderSettings reader,
        KeyspaceSettings keyspace,
        String version,
        String logLevel) {

    public static final String DefaultLogLevel = "INFO";

    private static final Set<String> LogLevels =
            Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public LoaderConfig {
        if (redis == null || writer == null || reader == null || keyspace == null) {
            throw new IllegalArgumentException("configuration sections must not be null");
        }
        if (Strings.isNullOrEmpty(version)) {
            throw new IllegalArgumentException("version must not be null or empty");
        }
        if (logLevel == null || !LogLevels.contains(logLevel.toUpperCase(Locale.ROOT))) {
            throw new IllegalArgumentException("unknown log level: " + logLevel);
        }
        logLevel = logLevel.toUpperCase(Locale.ROOT);
    }

    public static LoaderConfig defaults() {
        return defaults(Clock.systemDefaultZone());
    }

    public static LoaderConfig defaults(Clock clock) {
        return new LoaderConfig(
                RedisSettings.defaults(),
                WriterSettings.defaults(),
                ReaderSettings.defaults(),
                KeyspaceSettings.defaults(),
                versionOf(LocalDate.now(clock)),
                DefaultLogLevel);
    }

    /** @return The version tag of a day, {@code v<day-of-month>}. */
    public static String versionOf(LocalDate date) {
        return "v" + date.getDayOfMonth();
    }
}
