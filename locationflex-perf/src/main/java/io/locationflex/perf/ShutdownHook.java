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

import com.google.common.util.concurrent.Uninterruptibles;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Raises a {@link StopSignal} when the JVM is asked to exit and holds the exit until the run has
 * reported its partial results, or the grace period elapses.
 */
@Slf4j
final class ShutdownHook implements AutoCloseable {
    static final Duration DefaultGracePeriod = Duration.ofSeconds(30);

    private final Thread hook;
    private final CountDownLatch finished = new CountDownLatch(1);

    ShutdownHook(@NonNull StopSignal stopSignal) {
        this(stopSignal, DefaultGracePeriod);
    }

    ShutdownHook(@NonNull StopSignal stopSignal, @NonNull Duration gracePeriod) {
        this.hook =
                new Thread(
                        () -> {
                            log.info("Interrupt received, stopping workers at the next batch boundary");
                            stopSignal.raise();
                            Uninterruptibles.awaitUninterruptibly(finished, gracePeriod);
                        },
                        "locationflex-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
    }

    @Override
    public void close() {
        finished.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown in progress, keeping the hook registered");
        }
    }
}
