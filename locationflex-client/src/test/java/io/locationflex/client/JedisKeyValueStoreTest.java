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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.locationflex.api.exceptions.StoreException;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisConnectionException;

class JedisKeyValueStoreTest {

    @Test
    void parseInfo() {
        var info =
                JedisKeyValueStore.parseInfo(
                        "# Server\r\nredis_version:7.2.4\r\nredis_mode:standalone\r\n\r\n"
                                + "# Keyspace\r\ndb0:keys=10,expires=10,avg_ttl=259199000\r\n");

        assertThat(info)
                .containsEntry("redis_version", "7.2.4")
                .containsEntry("redis_mode", "standalone")
                .containsEntry("db0", "keys=10,expires=10,avg_ttl=259199000")
                .hasSize(3);
    }

    @Test
    void unavailableConnectionFailsPipelineCreation() {
        JedisPooled client = mock(JedisPooled.class);
        when(client.pipelined())
                .thenThrow(new JedisConnectionException("Could not get a resource from the pool"));
        var store = new JedisKeyValueStore(client, "localhost:6379");

        assertThatThrownBy(store::pipeline)
                .isInstanceOf(StoreException.class)
                .hasCauseInstanceOf(JedisConnectionException.class);
    }
}
