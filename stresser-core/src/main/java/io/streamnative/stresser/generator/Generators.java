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

import static java.util.Objects.requireNonNull;

import io.streamnative.stresser.api.OperationType;
import io.streamnative.stresser.api.WorkloadMode;
import java.time.Clock;
import java.util.List;
import java.util.Random;

/**
 * Factories for the per-worker generators. Each worker passes its own {@link Random}; generators
 * are never shared between workers and are therefore not thread-safe.
 */
public final class Generators {

    private Generators() {}

    /**
     * Creates the private random source of one worker, seeded from the monotonic clock and the
     * worker identity.
     */
    public static Random createWorkerRandom(int workerId) {
        return new Random(System.nanoTime() + workerId);
    }

    public static Generator<String> createReadKeyGenerator(
            List<String> keys, boolean randomize, int workerId, Random random) {
        requireNonNull(keys);
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("keys can not be empty");
        }
        if (randomize) {
            return new UniformKeyGenerator(keys, requireNonNull(random));
        }
        return new SequentialKeyGenerator(keys, workerId);
    }

    public static Generator<String> createWriteKeyGenerator(String owner, Clock clock, Random random) {
        requireNonNull(owner);
        return new WriteKeyGenerator(owner, requireNonNull(clock), requireNonNull(random));
    }

    public static Generator<OperationType> createOperationGenerator(WorkloadMode mode, Random random) {
        return new OperationGenerator(requireNonNull(mode), requireNonNull(random));
    }

    public static Generator<byte[]> createPayloadGenerator(int size, Random random) {
        if (size <= 0) {
            throw new IllegalArgumentException("size can not lower than or equals to 0");
        }
        return new RandomPayloadGenerator(size, requireNonNull(random));
    }
}
