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

import com.google.common.collect.Lists;
import io.locationflex.perf.reader.Tier;
import io.locationflex.perf.writer.BatchResult;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;

/** OpenTelemetry instruments of the loader. Instruments are no-ops unless an SDK is installed. */
public final class BenchmarkMetrics {
    public static final String METER_NAME = "io.locationflex.perf";

    static final AttributeKey<String> VERSION = AttributeKey.stringKey("version");
    static final AttributeKey<String> OUTCOME = AttributeKey.stringKey("outcome");
    static final AttributeKey<String> STATUS = AttributeKey.stringKey("status");
    static final AttributeKey<String> TIER = AttributeKey.stringKey("tier");

    private static final List<Double> LATENCY_BUCKET =
            Lists.newArrayList(
                    .0001, .00025, .0005, .001, .0025, .005, .01, .025, .05, .1, .25, .5, 1.0, 2.5, 5.0);
    private static final double MICROS = TimeUnit.SECONDS.toMicros(1);

    private final LongCounter keyCounter;
    private final LongCounter batchCounter;
    private final LongCounter readCounter;
    private final DoubleHistogram readLatency;
    private final Map<Tier, Attributes> tierAttributes = new EnumMap<>(Tier.class);

    public BenchmarkMetrics(@NonNull OpenTelemetry openTelemetry) {
        Meter meter = openTelemetry.getMeter(METER_NAME);
        this.keyCounter =
                meter
                        .counterBuilder("locationflex.write.keys")
                        .setDescription("keys attempted by the batch writers")
                        .setUnit("{key}")
                        .build();
        this.batchCounter =
                meter
                        .counterBuilder("locationflex.write.batches")
                        .setDescription("pipelined write batches")
                        .setUnit("{batch}")
                        .build();
        this.readCounter =
                meter
                        .counterBuilder("locationflex.read.lookups")
                        .setDescription("versioned lookups by resolved tier")
                        .setUnit("{read}")
                        .build();
        this.readLatency =
                meter
                        .histogramBuilder("locationflex.read.latency")
                        .setDescription("latency of successful versioned lookups")
                        .setUnit("s")
                        .setExplicitBucketBoundariesAdvice(LATENCY_BUCKET)
                        .build();
        for (Tier tier : Tier.values()) {
            tierAttributes.put(tier, Attributes.of(TIER, tier.name().toLowerCase(Locale.ROOT)));
        }
    }

    public static @NonNull BenchmarkMetrics noop() {
        return new BenchmarkMetrics(OpenTelemetry.noop());
    }

    public void recordBatch(@NonNull String version, @NonNull BatchResult result) {
        batchCounter.add(
                1,
                Attributes.of(
                        VERSION, version, STATUS, result.status().name().toLowerCase(Locale.ROOT)));
        if (result.written() > 0) {
            keyCounter.add(result.written(), Attributes.of(VERSION, version, OUTCOME, "written"));
        }
        if (result.skipped() > 0) {
            keyCounter.add(result.skipped(), Attributes.of(VERSION, version, OUTCOME, "skipped"));
        }
        if (result.failed() > 0) {
            keyCounter.add(result.failed(), Attributes.of(VERSION, version, OUTCOME, "failed"));
        }
    }

    public void recordRead(@NonNull Tier tier, long latencyMicros) {
        Attributes attributes = tierAttributes.get(tier);
        readCounter.add(1, attributes);
        if (tier != Tier.NONE) {
            readLatency.record(latencyMicros / MICROS, attributes);
        }
    }
}
