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
package io.streamnative.stresser.generator;

import java.util.Random;

/** Fills a new buffer for every upload so the store cannot deduplicate payloads. */
final class RandomPayloadGenerator implements Generator<byte[]> {
    private final int size;
    private final Random random;

    RandomPayloadGenerator(int size, Random random) {
        this.size = size;
        this.random = random;
    }

    @Override
    public byte[] nextValue() {
        final byte[] payload = new byte[size];
        random.nextBytes(payload);
        return payload;
    }
}
