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

/** Creates the {@link ObjectStore} a run talks to. Invoked once, while the run is set up. */
@FunctionalInterface
public interface ObjectStoreProvider {

    /**
     * Builds a store client.
     *
     * @return a ready-to-use store
     * @throws ObjectStoreException if the client cannot be constructed
     */
    ObjectStore create() throws ObjectStoreException;
}
