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
package io.locationflex.api.exceptions;

import lombok.Getter;

/** The store could not be reached. */
@Getter
public final class StoreConnectionException extends StoreException {
    private final String address;

    public StoreConnectionException(String address, Throwable cause) {
        super("failed to connect to " + address + ": " + cause.getMessage(), cause);
        this.address = address;
    }

    public StoreConnectionException(String address, String message) {
        super("failed to connect to " + address + ": " + message);
        this.address = address;
    }
}
