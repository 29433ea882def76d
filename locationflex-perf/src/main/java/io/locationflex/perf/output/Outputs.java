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
import lombok.NonNull;
import lombok.experimental.UtilityClass;

@UtilityClass
public class Outputs {

    public static @NonNull Output createOutput(
            @NonNull OutputTypes type, @NonNull OutputOptions options) {
        return switch (type) {
            case LOG -> createLogOutput(options.pretty());
            case FILE ->
                    new FileOutput(
                            options.file() != null
                                    ? options.file()
                                    : Path.of(OutputOptions.DefaultResultsFile),
                            options.pretty());
        };
    }

    public static @NonNull Output createLogOutput(boolean pretty) {
        return new LogOutput(pretty);
    }
}
