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

import io.locationflex.client.RedisStoreBuilder;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import picocli.CommandLine;

@CommandLine.Command(
        name = "locationflex",
        mixinStandardHelpOptions = true,
        description = "Bulk loader and read benchmark for versioned Redis key spaces",
        subcommands = {ImportOptions.class, ReadOptions.class, AdminOptions.class})
public final class LocationFlexOptions implements Runnable {

    @CommandLine.Spec CommandLine.Model.CommandSpec spec;

    @Getter(AccessLevel.PACKAGE)
    private final StoreFactory storeFactory;

    @Getter(AccessLevel.PACKAGE)
    private final OpenTelemetry openTelemetry;

    public LocationFlexOptions() {
        this(settings -> RedisStoreBuilder.fromSettings(settings).connect(), GlobalOpenTelemetry.get());
    }

    LocationFlexOptions(@NonNull StoreFactory storeFactory, @NonNull OpenTelemetry openTelemetry) {
        this.storeFactory = storeFactory;
        this.openTelemetry = openTelemetry;
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
