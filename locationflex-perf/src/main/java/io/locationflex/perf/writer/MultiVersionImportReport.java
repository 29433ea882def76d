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
package io.locationflex.perf.writer;

import java.util.List;
import javax.annotation.Nullable;

/**
 * Aggregate of the same partitioned import run once per version.
 *
 * @param imports One report per version, in execution order.
 * @param totalWritten Keys written across every version.
 * @param totalSkipped Ids skipped across every version.
 * @param durationSeconds Wall-clock time of the whole run, pauses included.
 * @param combinedRate {@code totalWritten / durationSeconds}.
 * @param projection Time to write a larger key count at the combined rate, if requested.
 * @param interrupted Whether the run was stopped before every version was imported.
 * @param degraded Whether a worker of any version failed.
 */
public record MultiVersionImportReport(
        List<ImportReport> imports,
        long totalWritten,
        long totalSkipped,
        double durationSeconds,
        double combinedRate,
        @Nullable Projection projection,
        boolean interrupted,
        boolean degraded) {

    public MultiVersionImportReport {
        imports = List.copyOf(imports);
    }

    /**
     * @param hypotheticalKeys The key count projected.
     * @param projectedSeconds {@code hypotheticalKeys / combinedRate}, zero when nothing was written.
     */
    public record Projection(long hypotheticalKeys, double projectedSeconds) {}
}
