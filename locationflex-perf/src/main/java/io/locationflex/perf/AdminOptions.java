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
import java.io.PrintWriter;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

/** One-shot maintenance operations against the configured store. */
@Slf4j
@CommandLine.Command(
        name = "admin",
        mixinStandardHelpOptions = true,
        description = "Inspect or reset the store")
public final class AdminOptions implements Callable<Integer> {

    @CommandLine.ParentCommand LocationFlexOptions parent;

    @CommandLine.Spec CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin ConfigOptions configOptions;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    Operation operation;

    @CommandLine.Option(
            names = {"--yes"},
            description = "Confirm a destructive operation")
    boolean confirmed;

    static final class Operation {
        @CommandLine.Option(
                names = {"--ping"},
                description = "Check that the store answers")
        boolean ping;

        @CommandLine.Option(
                names = {"--keys"},
                paramLabel = "PATTERN",
                description = "List the keys matching a glob pattern")
        String keysPattern;

        @CommandLine.Option(
                names = {"--ttl"},
                paramLabel = "KEY",
                description = "Show the remaining time to live of a key")
        String ttlKey;

        @CommandLine.Option(
                names = {"--flush-all"},
                description = "Delete every key, requires --yes")
        boolean flushAll;

        @CommandLine.Option(
                names = {"--info"},
                description = "Show the server statistics")
        boolean info;
    }

    @Override
    public Integer call() {
        if (operation.flushAll && !confirmed) {
            throw new CommandLine.ParameterException(
                    spec.commandLine(), "--flush-all deletes every key and requires --yes");
        }
        LoaderConfig config = configOptions.load();
        PrintWriter out = spec.commandLine().getOut();
        try (KeyValueStore store = parent.getStoreFactory().connect(config.redis())) {
            if (operation.ping) {
                out.println(store.ping() ? "PONG" : "no answer");
            } else if (operation.keysPattern != null) {
                Set<String> keys = new TreeSet<>(store.keys(operation.keysPattern));
                keys.forEach(out::println);
                out.println("(" + keys.size() + " keys)");
            } else if (operation.ttlKey != null) {
                out.println(describeTtl(store.ttl(operation.ttlKey)));
            } else if (operation.flushAll) {
                store.flushAll();
                log.warn("Flushed every key of {}", config.redis().host());
                out.println("OK");
            } else if (operation.info) {
                for (Map.Entry<String, String> entry : store.info().entrySet()) {
                    out.println(entry.getKey() + ": " + entry.getValue());
                }
            }
            out.flush();
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

    /** Renders the TTL reply: {@code -2} for a missing key, {@code -1} for a key without expiry. */
    static String describeTtl(long ttl) {
        if (ttl == -2) {
            return "key does not exist";
        }
        if (ttl == -1) {
            return "no expiry";
        }
        return ttl + "s";
    }
}
