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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

import io.locationflex.api.KeyValueStore;
import io.locationflex.api.Reply;
import io.locationflex.api.StorePipeline;
import io.locationflex.api.exceptions.StoreException;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers
public class RedisStoreIT {
    @Container private static final RedisContainer redis = new RedisContainer();

    private static KeyValueStore store;

    @BeforeAll
    static void beforeAll() throws StoreException {
        store = redis.storeBuilder().connect();
    }

    @AfterAll
    static void afterAll() throws Exception {
        if (store != null) {
            store.close();
        }
    }

    @BeforeEach
    void flush() throws StoreException {
        store.flushAll();
    }

    @Test
    void setGetAndTtl() throws StoreException {
        assertThat(store.ping()).isTrue();
        assertThat(store.set("ip:v22:1", "one".getBytes(UTF_8), KeyValueStore.DEFAULT_TTL_SECONDS))
                .isTrue();

        assertThat(store.get("ip:v22:1")).hasValueSatisfying(v -> assertThat(v).asString(UTF_8).isEqualTo("one"));
        assertThat(store.get("ip:v22:2")).isEmpty();
        assertThat(store.ttl("ip:v22:1")).isBetween(259_000L, KeyValueStore.DEFAULT_TTL_SECONDS);
        assertThat(store.ttl("ip:v22:2")).isEqualTo(-2L);
    }

    @Test
    void pipeline() throws StoreException {
        List<Reply> replies;
        try (StorePipeline pipeline = store.pipeline()) {
            for (int i = 0; i < 10; i++) {
                pipeline.set("ip:v23:" + i, ("v" + i).getBytes(UTF_8), 60);
            }
            pipeline.get("ip:v23:3").get("ip:v23:42");
            replies = pipeline.execute();
        }

        assertThat(replies).hasSize(12);
        assertThat(replies.subList(0, 10)).allMatch(Reply::ok);
        assertThat(replies.get(10).hasValue()).isTrue();
        assertThat(new String(replies.get(10).value(), UTF_8)).isEqualTo("v3");
        assertThat(replies.get(11).ok()).isTrue();
        assertThat(replies.get(11).hasValue()).isFalse();
        assertThat(store.keys("ip:v23:*")).hasSize(10);
    }

    @Test
    void info() throws StoreException {
        assertThat(store.info()).containsKey("redis_version");
    }
}
