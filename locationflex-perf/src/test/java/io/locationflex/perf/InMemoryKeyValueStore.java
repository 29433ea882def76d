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
import io.locationflex.api.Reply;
import io.locationflex.api.StorePipeline;
import io.locationflex.api.exceptions.StoreException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;

/** Thread-safe store backed by a map, with switches to inject pipeline and per-key failures. */
public class InMemoryKeyValueStore implements KeyValueStore {
    private final Map<String, byte[]> values = new ConcurrentHashMap<>();
    private final Map<String, Long> ttls = new ConcurrentHashMap<>();

    @Setter private volatile boolean failPipelines;
    @Setter private volatile boolean failPipelineCreation;
    /** Pipeline executions allowed before {@code execute} throws an unchecked error. */
    @Setter private volatile long crashAfterPipelines = Long.MAX_VALUE;
    @Setter private volatile Predicate<String> failingKeys = key -> false;

    @Getter private final AtomicLong pipelineExecutions = new AtomicLong();
    @Getter private final AtomicLong individualSets = new AtomicLong();
    @Getter private final AtomicLong individualGets = new AtomicLong();
    @Getter private volatile boolean closed;

    public void put(String key, String value) {
        values.put(key, value.getBytes(StandardCharsets.UTF_8));
        ttls.put(key, -1L);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public Optional<byte[]> get(@NonNull String key) throws StoreException {
        individualGets.incrementAndGet();
        if (failingKeys.test(key)) {
            throw new StoreException("injected failure reading " + key);
        }
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public boolean set(@NonNull String key, byte @NonNull [] value, long ttlSeconds)
            throws StoreException {
        individualSets.incrementAndGet();
        if (failingKeys.test(key)) {
            throw new StoreException("injected failure writing " + key);
        }
        values.put(key, value);
        ttls.put(key, ttlSeconds);
        return true;
    }

    @Override
    public StorePipeline pipeline() throws StoreException {
        if (failPipelineCreation) {
            throw new StoreException("injected failure opening pipeline");
        }
        return new InMemoryPipeline();
    }

    @Override
    public Set<String> keys(@NonNull String pattern) {
        Pattern regex = Pattern.compile(globToRegex(pattern));
        return values.keySet().stream()
                .filter(key -> regex.matcher(key).matches())
                .collect(Collectors.toSet());
    }

    @Override
    public void flushAll() {
        values.clear();
        ttls.clear();
    }

    @Override
    public long ttl(@NonNull String key) {
        return ttls.getOrDefault(key, -2L);
    }

    @Override
    public Map<String, String> info() {
        return Map.of("redis_version", "in-memory", "db0", "keys=" + values.size());
    }

    @Override
    public void close() {
        closed = true;
    }

    private static String globToRegex(String glob) {
        var regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }

    private final class InMemoryPipeline implements StorePipeline {
        private final List<Command> commands = new ArrayList<>();

        private record Command(String key, byte[] value, long ttlSeconds) {}

        @Override
        public StorePipeline set(@NonNull String key, byte @NonNull [] value, long ttlSeconds) {
            commands.add(new Command(key, value, ttlSeconds));
            return this;
        }

        @Override
        public StorePipeline get(@NonNull String key) {
            commands.add(new Command(key, null, 0));
            return this;
        }

        @Override
        public int size() {
            return commands.size();
        }

        @Override
        public List<Reply> execute() throws StoreException {
            if (pipelineExecutions.incrementAndGet() > crashAfterPipelines) {
                commands.clear();
                throw new IllegalStateException("injected crash");
            }
            if (failPipelines) {
                commands.clear();
                throw new StoreException("injected pipeline failure");
            }
            var replies = new ArrayList<Reply>(commands.size());
            for (Command command : commands) {
                if (failingKeys.test(command.key())) {
                    replies.add(Reply.failed("injected failure on " + command.key()));
                } else if (command.value() == null) {
                    replies.add(Reply.value(values.get(command.key())));
                } else {
                    values.put(command.key(), command.value());
                    ttls.put(command.key(), command.ttlSeconds());
                    replies.add(Reply.acknowledged());
                }
            }
            commands.clear();
            return replies;
        }

        @Override
        public void close() {
            commands.clear();
        }
    }
}
