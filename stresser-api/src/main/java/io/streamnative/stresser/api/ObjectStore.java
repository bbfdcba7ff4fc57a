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

import io.streamnative.stresser.api.exceptions.ObjectStoreException;
import java.io.InputStream;
import lombok.NonNull;

/**
 * The minimal object-store capability a stress run needs.
 *
 * <p>Implementations must be safe for concurrent use by many workers. How they authenticate,
 * resolve endpoints or configure transport security is up to them.
 */
public interface ObjectStore extends AutoCloseable {

    /**
     * Requests an object. The call returns once the store has answered the request, before the body
     * has been consumed.
     *
     * @param bucket the bucket holding the object
     * @param key the object key
     * @return the object body. The caller consumes and closes it.
     * @throws ObjectStoreException if the store rejects or fails the request
     */
    @NonNull
    InputStream get(@NonNull String bucket, @NonNull String key) throws ObjectStoreException;

    /**
     * Uploads an object, returning once the store has acknowledged it.
     *
     * @param bucket the target bucket
     * @param key the object key
     * @param payload the object content
     * @throws ObjectStoreException if the store rejects or fails the request
     */
    void put(@NonNull String bucket, @NonNull String key, @NonNull byte[] payload)
            throws ObjectStoreException;

    @Override
    void close() throws ObjectStoreException;
}
