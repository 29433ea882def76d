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
package io.locationflex.perf.output;

import java.nio.file.Path;
import javax.annotation.Nullable;

/**
 * @param pretty Whether the JSON is indented.
 * @param file Target of the {@link OutputTypes#FILE} output.
 */
public record OutputOptions(boolean pretty, @Nullable Path file) {

    public static final String DefaultResultsFile = "parallel_import_stats.json";
}
