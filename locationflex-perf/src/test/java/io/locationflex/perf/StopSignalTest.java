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

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class StopSignalTest {

    @Test
    void awaitTimesOut() {
        var signal = new StopSignal();
        assertThat(signal.await(Duration.ofMillis(10))).isFalse();
        assertThat(signal.isRaised()).isFalse();
    }

    @Test
    void raiseWakesWaiters() {
        var signal = new StopSignal();
        CompletableFuture<Boolean> waiter =
                CompletableFuture.supplyAsync(() -> signal.await(Duration.ofMinutes(1)));

        signal.raise();

        await().atMost(5, TimeUnit.SECONDS).until(waiter::isDone);
        assertThat(waiter.join()).isTrue();
        assertThat(signal.isRaised()).isTrue();
        assertThat(signal.await(Duration.ZERO)).isTrue();
    }

    @Test
    void shutdownHookCanBeReleased() {
        var signal = new StopSignal();
        try (var hook = new ShutdownHook(signal, Duration.ofSeconds(1))) {
            assertThat(signal.isRaised()).isFalse();
        }
        assertThat(signal.isRaised()).isFalse();
    }
}
