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
import java.time.Instant;
import lombok.NonNull;

/**
 * The outcome of one attempted operation.
 *
 * <p>Timings that were not measured, either because the operation failed before reaching that
 * stage or because the timing does not apply (TTFB of a PUT), hold {@link #UNMEASURED}. No other
 * negative duration is ever stored.
 *
 * @param timestamp the wall-clock instant at which the operation was issued
 * @param operation the kind of operation
 * @param key the object key the operation targeted
 * @param ttfb time to first byte. For a GET, the time until the store answered with headers
 * @param ttlb time to last byte. For a GET, the time until the body was consumed; for a PUT, the
 *     duration of the whole call
 * @param bytesDownloaded bytes read from a GET body, including bytes read before a body failure
 * @param bytesUploaded bytes sent by a successful PUT
 * @param error the failure description, empty on success
 */
public record OperationResult(
        @NonNull Instant timestamp,
        @NonNull OperationType operation,
        @NonNull String key,
        @NonNull Duration ttfb,
        @NonNull Duration ttlb,
        long bytesDownloaded,
        long bytesUploaded,
        @NonNull String error) {

    /** Sentinel value of a timing that was not measured. */
    public static final Duration UNMEASURED = Duration.ofNanos(-1);

    public OperationResult {
        requireValidTiming("ttfb", ttfb);
        requireValidTiming("ttlb", ttlb);
        if (bytesDownloaded < 0) {
            throw new IllegalArgumentException("bytesDownloaded must not be negative: " + bytesDownloaded);
        }
        if (bytesUploaded < 0) {
            throw new IllegalArgumentException("bytesUploaded must not be negative: " + bytesUploaded);
        }
    }

    /**
     * Checks that a timing is either {@link #UNMEASURED} or a non-negative duration.
     *
     * @param name the name of the timing, used in the error message
     * @param timing the timing to validate
     */
    public static void requireValidTiming(String name, Duration timing) {
        if (timing.isNegative() && !UNMEASURED.equals(timing)) {
            throw new IllegalArgumentException("Invalid " + name + ": " + timing);
        }
    }

    /**
     * Creates the result of an operation that failed before any timing could be taken.
     *
     * @param timestamp the instant at which the operation was issued
     * @param operation the kind of operation
     * @param key the targeted key
     * @param error the failure description
     * @return a result with both timings unmeasured and no transferred bytes
     */
    public static OperationResult failed(
            @NonNull Instant timestamp,
            @NonNull OperationType operation,
            @NonNull String key,
            @NonNull String error) {
        return new OperationResult(timestamp, operation, key, UNMEASURED, UNMEASURED, 0, 0, error);
    }

    public boolean isSuccess() {
        return error.isEmpty();
    }

    public boolean hasTtfb() {
        return !UNMEASURED.equals(ttfb);
    }

    public boolean hasTtlb() {
        return !UNMEASURED.equals(ttlb);
    }
}
