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

import io.locationflex.api.KeyValueStore;
import io.locationflex.api.exceptions.StoreException;
import io.locationflex.client.config.LoaderConfig;
import io.locationflex.perf.output.Output;
import io.locationflex.perf.output.OutputOptions;
import io.locationflex.perf.output.OutputTypes;
import io.locationflex.perf.output.Outputs;
import io.locationflex.perf.reader.ReadBenchmark;
import io.locationflex.perf.reader.ReadBenchmarkOptions;
import io.locationflex.perf.reader.ReadMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

@Slf4j
@CommandLine.Command(
        name = "read",
        mixinStandardHelpOptions = true,
        description = "Benchmark versioned lookups with a primary to secondary fallback")
public final class ReadOptions implements Callable<Integer> {
    static final String DefaultReadResultsFile = "read_benchmark_stats.json";

    @CommandLine.ParentCommand LocationFlexOptions parent;

    @CommandLine.Spec CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin ConfigOptions configOptions;

    @CommandLine.Option(
            names = {"-m", "--mode"},
            description = "Read strategy: sequential, pipelined or multi-pipelined")
    String mode = ReadMode.MULTI_THREADED_PIPELINED.getAlias();

    @CommandLine.Option(
            names = {"-n", "--reads"},
            description = "Number of lookups")
    int reads = 10_000;

    @CommandLine.Option(
            names = {"-t", "--threads"},
            description = "Worker threads, defaults to the configured reader count")
    Integer threads;

    @CommandLine.Option(
            names = {"--batch-size"},
            description = "Ids per pipelined request")
    Integer batchSize;

    @CommandLine.Option(
            names = {"--max-keys"},
            description = "Ids are drawn from [0, max-keys)")
    Long maxKeys;

    @CommandLine.Option(
            names = {"--primary"},
            description = "Version looked up first")
    String primary;

    @CommandLine.Option(
            names = {"--secondary"},
            description = "Version looked up when the primary misses")
    String secondary;

    @CommandLine.Option(
            names = {"--interval-sec"},
            description = "Interval of the progress logs")
    int intervalSec = (int) ReadBenchmarkOptions.DefaultProgressInterval.toSeconds();

    @CommandLine.Option(
            names = {"--seed"},
            description = "Seed of the id generator")
    Long seed;

    @CommandLine.Option(
            names = {"--output"},
            description = "Where results go. supported: log,file")
    String outputType = "log";

    @CommandLine.Option(
            names = {"--output-file"},
            description = "Results file of the file output")
    Path outputFile = Path.of(DefaultReadResultsFile);

    @CommandLine.Option(
            names = {"--pretty"},
            negatable = true,
            description = "Whether the results are indented")
    boolean pretty = true;

    @Override
    public Integer call() {
        LoaderConfig config = configOptions.load();
        ReadBenchmarkOptions options = benchmarkOptions(config);
        OutputTypes type;
        try {
            type = OutputTypes.fromString(outputType);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }

        var stopSignal = new StopSignal();
        try (KeyValueStore store = parent.getStoreFactory().connect(config.redis());
                var hook = new ShutdownHook(stopSignal);
                Output output = Outputs.createOutput(type, new OutputOptions(pretty, outputFile))) {
            var benchmark =
                    new ReadBenchmark(
                            store, options, stopSignal, new BenchmarkMetrics(parent.getOpenTelemetry()));
            output.report(benchmark.run());
            return CommandLine.ExitCode.OK;
        } catch (StoreException e) {
            log.error("Store unavailable: {}", e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new WorkerException("failed to release the store", e);
        }
    }

    ReadBenchmarkOptions benchmarkOptions(LoaderConfig config) {
        try {
            return new ReadBenchmarkOptions(
                    ReadMode.fromString(mode),
                    reads,
                    threads != null ? threads : config.reader().readers(),
                    batchSize != null ? batchSize : config.reader().batchSize(),
                    maxKeys != null ? maxKeys : config.keyspace().maxKeys(),
                    config.keyspace().prefix(),
                    primary != null ? primary : config.keyspace().primaryVersion(),
                    secondary != null ? secondary : config.keyspace().secondaryVersion(),
                    Duration.ofSeconds(intervalSec),
                    seed);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
    }
}
