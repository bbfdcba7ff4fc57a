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
package io.streamnative.stresser.api;

import java.util.Locale;
import lombok.NonNull;

/** The operation mix a run issues. */
public enum WorkloadMode {
    /** Every iteration downloads a key taken from the manifest. */
    READ,
    /** Every iteration uploads a newly generated key. */
    WRITE,
    /** Every iteration flips a fair coin between {@link #READ} and {@link #WRITE}. */
    MIXED;

    /**
     * Whether this mode downloads existing objects and therefore needs a loaded manifest.
     *
     * @return {@code true} for {@link #READ} and {@link #MIXED}
     */
    public boolean readsKeys() {
        return this != WRITE;
    }

    /**
     * Whether this mode uploads objects and therefore needs a payload size.
     *
     * @return {@code true} for {@link #WRITE} and {@link #MIXED}
     */
    public boolean writesObjects() {
        return this != READ;
    }

    public static WorkloadMode fromString(@NonNull String mode) {
        for (WorkloadMode m : values()) {
            if (m.name().toLowerCase(Locale.ROOT).equals(mode.trim().toLowerCase(Locale.ROOT))) {
                return m;
            }
        }
        throw new IllegalArgumentException(
                "invalid operation type: " + mode + ". Must be 'read', 'write', or 'mixed'");
    }
}
