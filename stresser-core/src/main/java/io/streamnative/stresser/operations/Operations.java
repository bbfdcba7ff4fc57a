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

import io.streamnative.stresser.api.OperationResult;

/** The timed operations a worker issues. Implementations never throw for store failures. */
public interface Operations {

    /**
     * Downloads an object and consumes its body.
     *
     * @param key the object key
     * @return the measured outcome, an error result if the request or the body read failed
     */
    OperationResult get(String key);

    /**
     * Uploads an object.
     *
     * @param key the object key
     * @param payload the object content
     * @return the measured outcome, an error result if the upload failed
     */
    OperationResult put(String key, byte[] payload);
}
