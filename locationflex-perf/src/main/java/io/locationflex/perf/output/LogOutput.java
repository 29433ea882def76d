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
import lombok.extern.slf4j.Slf4j;

@Slf4j
final class LogOutput implements Output {
    private static final ObjectMapper mapper = new ObjectMapper();
    private final ObjectWriter writer;

    LogOutput(boolean pretty) {
        this.writer = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    @Override
    public void report(Object report) {
        final String s;
        try {
            s = writer.writeValueAsString(report);
        } catch (Throwable ex) {
            throw new OutputException(ex.getMessage(), ex);
        }
        log.info(s);
    }

    @Override
    public void close() {}
}
