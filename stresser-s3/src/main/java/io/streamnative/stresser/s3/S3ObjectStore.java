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
package io.streamnative.stresser.s3;

import io.streamnative.stresser.api.ObjectStore;
import io.streamnative.stresser.api.exceptions.ObjectStoreException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/** {@link ObjectStore} backed by a synchronous AWS SDK {@link S3Client}. */
@Slf4j
@RequiredArgsConstructor
class S3ObjectStore implements ObjectStore {

    @NonNull private final S3Client client;

    /** Transport owned by this store. The SDK does not close clients it was handed. */
    @Nullable private final SdkHttpClient httpClient;

    private final AtomicBoolean closed = new AtomicBoolean();

    @Override
    public InputStream get(@NonNull String bucket, @NonNull String key) throws ObjectStoreException {
        try {
            return client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (SdkException e) {
            throw new ObjectStoreException(describe(e), e);
        }
    }

    @Override
    public void put(@NonNull String bucket, @NonNull String key, @NonNull byte[] payload)
            throws ObjectStoreException {
        try {
            client.putObject(
                    PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentLength((long) payload.length)
                            .build(),
                    RequestBody.fromBytes(payload));
        } catch (SdkException e) {
            throw new ObjectStoreException(describe(e), e);
        }
    }

    @Override
    public void close() throws ObjectStoreException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            client.close();
            if (httpClient != null) {
                httpClient.close();
            }
        } catch (SdkException e) {
            throw new ObjectStoreException("failed to close S3 client: " + describe(e), e);
        }
        log.debug("S3 client closed");
    }

    private static String describe(SdkException e) {
        final String message = e.getMessage();
        return message == null || message.isEmpty() ? e.getClass().getSimpleName() : message;
    }
}
