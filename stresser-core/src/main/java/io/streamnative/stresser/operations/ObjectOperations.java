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
package io.streamnative.stresser.operations;

import static io.streamnative.stresser.api.OperationResult.UNMEASURED;

import com.google.common.base.Ticker;
import com.google.common.io.ByteStreams;
import com.google.common.io.CountingInputStream;
import io.streamnative.stresser.api.ObjectStore;
import io.streamnative.stresser.api.OperationResult;
import io.streamnative.stresser.api.OperationType;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Times GET and PUT requests against an {@link ObjectStore}.
 *
 * <p>The GET timing splits at the moment the store call returns: that instant stands in for the
 * arrival of the first byte, the end of the body read marks the last byte. A PUT only has the
 * duration of the whole call, so its TTFB stays {@link OperationResult#UNMEASURED}.
 */
@Slf4j
@RequiredArgsConstructor
public final class ObjectOperations implements Operations {
    static final String BODY_READ_ERROR = "body read error: ";

    @NonNull private final ObjectStore store;
    @NonNull private final String bucket;
    @NonNull private final Clock clock;
    @NonNull private final Ticker ticker;

    @Override
    public OperationResult get(@NonNull String key) {
        final Instant timestamp = clock.instant();
        final long start = ticker.read();
        final InputStream body;
        try {
            body = store.get(bucket, key);
        } catch (Exception ex) {
            log.debug("get {} failed", key, ex);
            return OperationResult.failed(timestamp, OperationType.GET, key, describe(ex));
        }
        final Duration ttfb = elapsedSince(start);

        final CountingInputStream counting = new CountingInputStream(body);
        try (counting) {
            ByteStreams.exhaust(counting);
        } catch (IOException ex) {
            final Duration ttlb = elapsedSince(start);
            log.debug("reading body of {} failed after {} bytes", key, counting.getCount(), ex);
            return new OperationResult(
                    timestamp,
                    OperationType.GET,
                    key,
                    ttfb,
                    ttlb,
                    counting.getCount(),
                    0,
                    BODY_READ_ERROR + describe(ex));
        }
        return new OperationResult(
                timestamp, OperationType.GET, key, ttfb, elapsedSince(start), counting.getCount(), 0, "");
    }

    @Override
    public OperationResult put(@NonNull String key, @NonNull byte[] payload) {
        final Instant timestamp = clock.instant();
        final long start = ticker.read();
        try {
            store.put(bucket, key, payload);
        } catch (Exception ex) {
            log.debug("put {} failed", key, ex);
            return OperationResult.failed(timestamp, OperationType.PUT, key, describe(ex));
        }
        return new OperationResult(
                timestamp, OperationType.PUT, key, UNMEASURED, elapsedSince(start), 0, payload.length, "");
    }

    private Duration elapsedSince(long start) {
        return Duration.ofNanos(Math.max(0, ticker.read() - start));
    }

    static String describe(Throwable ex) {
        final String message = ex.getMessage();
        return message == null || message.isEmpty() ? ex.getClass().getName() : message;
    }
}
