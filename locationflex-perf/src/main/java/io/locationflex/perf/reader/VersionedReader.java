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
package io.locationflex.perf.reader;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import io.locationflex.api.KeyValueStore;
import io.locationflex.api.Reply;
import io.locationflex.api.StorePipeline;
import io.locationflex.api.VersionedKey;
import io.locationflex.api.exceptions.StoreException;
import io.locationflex.perf.WorkerException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves ids through two version namespaces: the primary one first, the secondary one only when
 * the primary has no value. The order is never reversed.
 */
@Slf4j
@RequiredArgsConstructor
public final class VersionedReader {
    @NonNull private final KeyValueStore store;
    @NonNull private final String prefix;
    @NonNull private final String primaryVersion;
    @NonNull private final String secondaryVersion;

    /**
     * The results of one pipelined batch.
     *
     * @param results One result per id, in request order.
     * @param fallback Whether the pipeline failed and the ids were looked up one by one.
     */
    public record Batch(List<ReadResult> results, boolean fallback) {}

    /** Looks up one id with individual requests. A failed lookup counts as an absent value. */
    public @NonNull ReadResult read(long id) {
        long start = System.nanoTime();
        Optional<byte[]> primary = lookup(VersionedKey.toStoreKey(prefix, primaryVersion, id));
        if (primary.isPresent()) {
            return new ReadResult(id, Tier.PRIMARY, primary.get().length, elapsedMicros(start));
        }
        Optional<byte[]> secondary = lookup(VersionedKey.toStoreKey(prefix, secondaryVersion, id));
        if (secondary.isPresent()) {
            return new ReadResult(id, Tier.SECONDARY, secondary.get().length, elapsedMicros(start));
        }
        return new ReadResult(id, Tier.NONE, 0, elapsedMicros(start));
    }

    /**
     * Looks up {@code ids[from, to)} with a single pipelined request holding, per id, the primary
     * lookup immediately followed by the secondary one. Every result of the batch is attributed the
     * round-trip latency of the request. When the pipeline fails the batch falls back to {@link
     * #read(long)}.
     */
    public @NonNull Batch readPipelined(long @NonNull [] ids, int from, int to) {
        if (from < 0 || to > ids.length || from > to) {
            throw new IllegalArgumentException(
                    "invalid slice [" + from + ", " + to + ") of " + ids.length + " ids");
        }
        var results = new ArrayList<ReadResult>(to - from);
        long start = System.nanoTime();
        List<Reply> replies;
        try (StorePipeline pipeline = store.pipeline()) {
            for (int i = from; i < to; i++) {
                pipeline.get(VersionedKey.toStoreKey(prefix, primaryVersion, ids[i]));
                pipeline.get(VersionedKey.toStoreKey(prefix, secondaryVersion, ids[i]));
            }
            replies = pipeline.execute();
        } catch (StoreException e) {
            log.warn(
                    "Pipelined lookup of {} ids failed, falling back to individual lookups: {}",
                    to - from,
                    e.getMessage());
            for (int i = from; i < to; i++) {
                results.add(read(ids[i]));
            }
            return new Batch(results, true);
        }
        long latencyMicros = elapsedMicros(start);
        if (replies.size() != 2 * (to - from)) {
            throw new WorkerException(
                    "expected " + 2 * (to - from) + " replies, got " + replies.size());
        }
        for (int i = from; i < to; i++) {
            int pair = 2 * (i - from);
            Reply primary = replies.get(pair);
            Reply secondary = replies.get(pair + 1);
            Tier tier = classify(primary, secondary);
            results.add(new ReadResult(ids[i], tier, sizeOf(tier, primary, secondary), latencyMicros));
        }
        return new Batch(results, false);
    }

    /** Applies the fixed priority: primary, then secondary, then miss. */
    public static @NonNull Tier classify(@Nullable Reply primary, @Nullable Reply secondary) {
        if (primary != null && primary.hasValue()) {
            return Tier.PRIMARY;
        }
        if (secondary != null && secondary.hasValue()) {
            return Tier.SECONDARY;
        }
        return Tier.NONE;
    }

    private static int sizeOf(Tier tier, Reply primary, Reply secondary) {
        return switch (tier) {
            case PRIMARY -> primary.value().length;
            case SECONDARY -> secondary.value().length;
            case NONE -> 0;
        };
    }

    private Optional<byte[]> lookup(String key) {
        try {
            return store.get(key);
        } catch (StoreException e) {
            log.debug("Lookup of {} failed: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private static long elapsedMicros(long startNanos) {
        return NANOSECONDS.toMicros(System.nanoTime() - startNanos);
    }
}
