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
import io.locationflex.client.records.SampleRecordSource;
import io.locationflex.perf.output.Output;
import io.locationflex.perf.output.OutputOptions;
import io.locationflex.perf.output.OutputTypes;
import io.locationflex.perf.output.Outputs;
import io.locationflex.perf.writer.ImportPreset;
import io.locationflex.perf.writer.WriteOrchestrator;
import io.locationflex.perf.writer.WriteOrchestratorOptions;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

@Slf4j
@CommandLine.Command(
        name = "import",
        mixinStandardHelpOptions = true,
        description = "Write synthetic records into one or more version namespaces")
public final class ImportOptions implements Callable<Integer> {

    @CommandLine.ParentCommand LocationFlexOptions parent;

    @CommandLine.Spec CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin ConfigOptions configOptions;

    @CommandLine.Option(
            names = {"--version"},
            description = "Version to write, defaults to the configured one")
    String version;

    @CommandLine.Option(
            names = {"--versions"},
            split = ",",
            description = "Versions to write one after the other, e.g. v22,v23")
    List<String> versions;

    @CommandLine.Option(
            names = {"-k", "--keys"},
            description = "Keys to write per version, defaults to the configured key space size")
    Long keys;

    @CommandLine.Option(
            names = {"-w", "--workers"},
            description = "Parallel writers")
    Integer workers;

    @CommandLine.Option(
            names = {"--batch-size"},
            description = "Keys per pipelined request")
    Integer batchSize;

    @CommandLine.Option(
            names = {"--ttl"},
            description = "Key expiry in seconds")
    Long ttlSeconds;

    @CommandLine.Option(
            names = {"--skip-probability"},
            description = "Probability of skipping an id to simulate cache misses")
    Double skipProbability;

    @CommandLine.Option(
            names = {"--projection-keys"},
            description = "Project the time needed to write this many keys at the measured rate")
    Long projectionKeys;

    @CommandLine.Option(
            names = {"--pause-ms"},
            description = "Pause between two versions")
    long pauseMs = WriteOrchestratorOptions.DefaultPauseBetweenVersions.toMillis();

    @CommandLine.Option(
            names = {"--progress-sec"},
            description = "Interval of the progress logs")
    int progressSec = 5;

    @CommandLine.Option(
            names = {"--preset"},
            description = "Canned size: quick, high or production")
    String preset;

    @CommandLine.Option(
            names = {"--output"},
            description = "Where results go. supported: log,file")
    String outputType = "log";

    @CommandLine.Option(
            names = {"--output-file"},
            description = "Results file of the file output")
    Path outputFile = Path.of(OutputOptions.DefaultResultsFile);

    @CommandLine.Option(
            names = {"--pretty"},
            negatable = true,
            description = "Whether the results are indented")
    boolean pretty = true;

    @Override
    public Integer call() {
        LoaderConfig config = configOptions.load();
        WriteOrchestratorOptions options = orchestratorOptions(config);
        long targetKeys = targetKeys(config);
        if (options.numWorkers() > targetKeys) {
            throw new CommandLine.ParameterException(
                    spec.commandLine(),
                    "workers (" + options.numWorkers() + ") must not exceed keys (" + targetKeys + ")");
        }
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
            var orchestrator =
                    new WriteOrchestrator(
                            store,
                            new SampleRecordSource(),
                            options,
                            stopSignal,
                            new BenchmarkMetrics(parent.getOpenTelemetry()));
            if (versions != null && !versions.isEmpty()) {
                output.report(orchestrator.runMultiVersionImport(versions, targetKeys));
            } else {
                output.report(
                        orchestrator.runImport(version != null ? version : config.version(), targetKeys));
            }
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

    long targetKeys(LoaderConfig config) {
        if (keys != null) {
            return keys;
        }
        if (preset != null) {
            return presetValue().getKeys();
        }
        return config.keyspace().maxKeys();
    }

    WriteOrchestratorOptions orchestratorOptions(LoaderConfig config) {
        int numWorkers;
        if (workers != null) {
            numWorkers = workers;
        } else if (preset != null) {
            numWorkers = presetValue().getWorkers();
        } else {
            numWorkers = config.writer().workers();
        }
        try {
            return new WriteOrchestratorOptions(
                    numWorkers,
                    batchSize != null ? batchSize : config.writer().batchSize(),
                    ttlSeconds != null ? ttlSeconds : config.writer().keyTtlSeconds(),
                    config.keyspace().prefix(),
                    skipProbability != null ? skipProbability : config.writer().skipProbability(),
                    Duration.ofMillis(pauseMs),
                    projectionKeys,
                    Duration.ofSeconds(progressSec));
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
    }

    private ImportPreset presetValue() {
        try {
            return ImportPreset.fromString(preset);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
    }
}
