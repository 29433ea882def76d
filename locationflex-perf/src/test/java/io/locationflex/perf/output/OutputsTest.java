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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutputsTest {

    record Sample(String version, long totalWritten, double combinedRate) {}

    @Test
    void outputTypes() {
        assertThat(OutputTypes.fromString("log")).isEqualTo(OutputTypes.LOG);
        assertThat(OutputTypes.fromString("FILE")).isEqualTo(OutputTypes.FILE);
        assertThatThrownBy(() -> OutputTypes.fromString("csv"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fileOutputWritesJson(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("nested").resolve("stats.json");
        try (Output output = Outputs.createOutput(OutputTypes.FILE, new OutputOptions(true, file))) {
            output.report(new Sample("v23", 1000, 12.5));
        }

        JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertThat(json.get("version").asText()).isEqualTo("v23");
        assertThat(json.get("totalWritten").asLong()).isEqualTo(1000);
        assertThat(json.get("combinedRate").asDouble()).isEqualTo(12.5);
    }

    @Test
    void fileOutputReplacesPreviousReport(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("stats.json");
        try (Output output = Outputs.createOutput(OutputTypes.FILE, new OutputOptions(false, file))) {
            output.report(Map.of("run", 1));
            output.report(Map.of("run", 2));
        }
        assertThat(Files.readString(file)).isEqualTo("{\"run\":2}");
    }

    @Test
    void logOutput() {
        try (Output output = Outputs.createLogOutput(false)) {
            output.report(new Sample("v22", 1, 0.0));
        }
    }

    @Test
    void doubles() {
        assertThat(Doubles.format2Scale(1.005)).isEqualTo(1.01);
        assertThat(Doubles.format2Scale(Double.NaN)).isZero();
        assertThat(Doubles.ratio(10, 4)).isEqualTo(2.5);
        assertThat(Doubles.ratio(10, 0)).isZero();
    }
}
