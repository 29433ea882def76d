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
package io.locationflex.client;

import io.locationflex.api.Reply;
import io.locationflex.api.StorePipeline;
import io.locationflex.api.exceptions.StoreException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Response;
import redis.clients.jedis.commands.PipelineBinaryCommands;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Adapts a Jedis pipeline, standalone or cluster, to {@link StorePipeline}. The commands are queued
 * client side and flushed by {@link #execute()}.
 *
 * <p>Jedis may write to the socket while commands are still being queued, so a connection failure
 * can surface from {@code setex} or {@code get}. The first such failure is kept and reported by
 * {@link #execute()} as a failure of the whole pipeline.
 */
@Slf4j
@RequiredArgsConstructor
final class JedisStorePipeline implements StorePipeline {
    @NonNull private final PipelineBinaryCommands commands;
    @NonNull private final Runnable sync;
    @NonNull private final Runnable closer;
    private final List<PendingReply> pending = new ArrayList<>();
    private boolean closed;
    private JedisException queueFailure;
    private int discarded;

    @Override
    public @NonNull StorePipeline set(@NonNull String key, byte @NonNull [] value, long ttlSeconds) {
        checkOpen();
        if (queueFailure != null) {
            discarded++;
            return this;
        }
        try {
            pending.add(new PendingReply(commands.setex(bytes(key), ttlSeconds, value), false));
        } catch (JedisException e) {
            failQueue(e);
        }
        return this;
    }

    @Override
    public @NonNull StorePipeline get(@NonNull String key) {
        checkOpen();
        if (queueFailure != null) {
            discarded++;
            return this;
        }
        try {
            pending.add(new PendingReply(commands.get(bytes(key)), true));
        } catch (JedisException e) {
            failQueue(e);
        }
        return this;
    }

    @Override
    public int size() {
        return pending.size() + discarded;
    }

    @Override
    public @NonNull List<Reply> execute() throws StoreException {
        checkOpen();
        if (queueFailure != null) {
            throw failAll(queueFailure);
        }
        try {
            sync.run();
        } catch (JedisException e) {
            throw failAll(e);
        }
        var replies = new ArrayList<Reply>(pending.size());
        for (PendingReply reply : pending) {
            replies.add(reply.resolve());
        }
        pending.clear();
        return replies;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pending.clear();
        try {
            closer.run();
        } catch (JedisException e) {
            log.debug("Failed to close pipeline: {}", e.getMessage());
        }
    }

    private void failQueue(JedisException e) {
        log.debug("Pipeline failed while queueing: {}", e.getMessage());
        queueFailure = e;
        discarded++;
    }

    private StoreException failAll(JedisException cause) {
        int commandCount = size();
        pending.clear();
        discarded = 0;
        queueFailure = null;
        return new StoreException("pipeline of " + commandCount + " commands failed", cause);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("pipeline is closed");
        }
    }

    private static byte[] bytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    private record PendingReply(Response<?> response, boolean lookup) {
        Reply resolve() {
            try {
                Object value = response.get();
                return lookup ? Reply.value((byte[]) value) : Reply.acknowledged();
            } catch (JedisException e) {
                return Reply.failed(e.getMessage());
            }
        }
    }
}
