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

import java.time.Clock;
import java.time.Instant;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Produces {@code stresser/<owner>/<epochNanos>-<suffix>.dat} keys. The owner and the time component
 * keep keys of different workers apart without coordination; the suffix separates keys created
 * within the same clock tick.
 */
final class WriteKeyGenerator implements Generator<String> {
    static final String KEY_PREFIX = "stresser/";
    static final int SUFFIX_LENGTH = 8;
    private static final String LETTERS =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final String owner;
    private final Clock clock;
    private final Random random;

    WriteKeyGenerator(String owner, Clock clock, Random random) {
        this.owner = owner;
        this.clock = clock;
        this.random = random;
    }

    @Override
    public String nextValue() {
        final Instant now = clock.instant();
        final long epochNanos = TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        return KEY_PREFIX + owner + "/" + epochNanos + "-" + randomSuffix() + ".dat";
    }

    private String randomSuffix() {
        final char[] suffix = new char[SUFFIX_LENGTH];
        for (int i = 0; i < suffix.length; i++) {
            suffix[i] = LETTERS.charAt(random.nextInt(LETTERS.length()));
        }
        return new String(suffix);
    }
}
