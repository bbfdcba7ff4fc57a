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

import io.streamnative.stresser.api.exceptions.ManifestException;
import lombok.NonNull;

/**
 * Records the keys created by a write workload.
 *
 * <p>Implementations serialize concurrent appends; entries appear in the order the appends
 * completed.
 */
public interface ManifestSink extends AutoCloseable {

    /**
     * Appends one key.
     *
     * @param key the created key
     * @throws ManifestException if the entry cannot be written
     */
    void append(@NonNull String key) throws ManifestException;

    /**
     * Flushes and releases the sink. Every appended entry is durable once this returns.
     *
     * @throws ManifestException if flushing or closing fails
     */
    @Override
    void close() throws ManifestException;
}
