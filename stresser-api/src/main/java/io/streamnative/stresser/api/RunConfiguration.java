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

import java.time.Duration;
import lombok.NonNull;

/**
 * The parameters of one stress run. Immutable for the lifetime of the run.
 *
 * @param bucket the bucket every operation targets
 * @param duration the time budget during which new operations are issued
 * @param concurrency the number of concurrent workers
 * @param mode the operation mix
 * @param randomizeReads whether GETs pick keys uniformly at random instead of sequentially
 * @param putSizeBytes the size of every uploaded object
 * @param fileCount the number of objects to generate in write mode, {@code 0} to keep writing until
 *     the time budget runs out
 * @param generateManifest whether keys created by successful PUTs are recorded in the manifest
 */
public record RunConfiguration(
        @NonNull String bucket,
        @NonNull Duration duration,
        int concurrency,
        @NonNull WorkloadMode mode,
        boolean randomizeReads,
        int putSizeBytes,
        int fileCount,
        boolean generateManifest) {

    public RunConfiguration {
        if (bucket.isBlank()) {
            throw new IllegalArgumentException("bucket must not be blank");
        }
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration must be greater than zero: " + duration);
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be greater than zero: " + concurrency);
        }
        if (mode.writesObjects() && putSizeBytes <= 0) {
            throw new IllegalArgumentException(
                    "putSizeBytes must be greater than zero for '" + mode + "' mode: " + putSizeBytes);
        }
        if (fileCount < 0) {
            throw new IllegalArgumentException("fileCount must not be negative: " + fileCount);
        }
    }

    /**
     * Whether the run generates a fixed number of objects instead of writing continuously.
     *
     * @return {@code true} in write mode with a positive file count
     */
    public boolean isFixedCountGeneration() {
        return mode == WorkloadMode.WRITE && fileCount > 0;
    }
}
