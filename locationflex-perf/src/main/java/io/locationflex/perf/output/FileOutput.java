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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/** Writes each report as JSON to a file, replacing the previous content. */
@Slf4j
final class FileOutput implements Output {
    private static final ObjectMapper mapper = new ObjectMapper();
    private final Path file;
    private final ObjectWriter writer;

    FileOutput(@NonNull Path file, boolean pretty) {
        this.file = file;
        this.writer = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    @Override
    public void report(Object report) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer.writeValue(file.toFile(), report);
        } catch (IOException ex) {
            throw new OutputException("failed to write results to " + file, ex);
        }
        log.info("Results saved to {}", file);
    }

    @Override
    public void close() {}
}
