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

import static io.locationflex.perf.output.Doubles.format2Scale;
import static io.locationflex.perf.output.Doubles.ratio;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/** Periodically logs the number of completed reads and the instantaneous rate. */
@Slf4j
final class ProgressReporter implements AutoCloseable {
    private final long total;
    private final LongAdder completed = new LongAdder();
    private final ScheduledExecutorService scheduler;
    private long lastCompleted;
    private long lastTime;

    ProgressReporter(long total, @NonNull Duration interval) {
        this.total = total;
        this.scheduler =
                Executors.newSingleThreadScheduledExecutor(
                        new ThreadFactoryBuilder().setNameFormat("read-progress-%d").setDaemon(true).build());
        this.lastTime = System.nanoTime();
        long intervalNanos = interval.toNanos();
        scheduler.scheduleAtFixedRate(this::report, intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
    }

    void add(long reads) {
        completed.add(reads);
    }

    long completed() {
        return completed.sum();
    }

    void report() {
        long now = System.nanoTime();
        long current = completed.sum();
        double rate = ratio(current - lastCompleted, (now - lastTime) / 1e9);
        log.info(
                "Progress: {}/{} ({}%) | {} reads/s",
                current,
                total,
                format2Scale(100.0 * ratio(current, total)),
                format2Scale(rate));
        lastCompleted = current;
        lastTime = now;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
