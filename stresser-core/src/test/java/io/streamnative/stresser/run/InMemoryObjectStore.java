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
package io.streamnative.stresser.run;

import io.streamnative.stresser.api.ObjectStore;
import io.streamnative.stresser.api.exceptions.ObjectStoreException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/** A map-backed store with an optional fixed latency per request. */
class InMemoryObjectStore implements ObjectStore {
    final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    final AtomicLong gets = new AtomicLong();
    final AtomicLong puts = new AtomicLong();
    final AtomicBoolean closed = new AtomicBoolean();
    private final Duration latency;

    InMemoryObjectStore() {
        this(Duration.ZERO);
    }

    InMemoryObjectStore(Duration latency) {
        this.latency = latency;
    }

    InMemoryObjectStore with(String key, int size) {
        objects.put(key, new byte[size]);
        return this;
    }

    @Override
    public InputStream get(String bucket, String key) throws ObjectStoreException {
        gets.incrementAndGet();
        pause();
        final byte[] object = objects.get(key);
        if (object == null) {
            throw new ObjectStoreException("NoSuchKey: " + key);
        }
        return new ByteArrayInputStream(object);
    }

    @Override
    public void put(String bucket, String key, byte[] payload) throws ObjectStoreException {
        puts.incrementAndGet();
        pause();
        objects.put(key, payload);
    }

    private void pause() throws ObjectStoreException {
        if (latency.isZero()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ObjectStoreException("interrupted", e);
        }
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
