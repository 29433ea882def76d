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
package io.locationflex.api;

import javax.annotation.Nullable;

/**
 * The reply to a single pipelined command.
 *
 * @param ok Whether the command succeeded. A lookup of an absent key is still successful.
 * @param value The value returned by a lookup, {@code null} for writes and for absent keys.
 * @param error The error reported for this command when {@code ok} is false.
 */
public record Reply(boolean ok, @Nullable byte[] value, @Nullable String error) {

    public static Reply acknowledged() {
        return new Reply(true, null, null);
    }

    public static Reply value(@Nullable byte[] value) {
        return new Reply(true, value, null);
    }

    public static Reply failed(String error) {
        return new Reply(false, null, error);
    }

    /** @return True if the reply carries a non-empty value. */
    public boolean hasValue() {
        return ok && value != null && value.length > 0;
    }
}
