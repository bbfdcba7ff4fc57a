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

import java.util.List;

/**
 * Walks the key list one position at a time, starting at {@code workerId mod K}.
 *
 * <p>Every worker advances with a stride of one, so cursors of different workers revisit
 * overlapping ranges of the key list. The traversal does not partition the keys between workers.
 */
final class SequentialKeyGenerator implements Generator<String> {
    private final List<String> keys;
    private int index;

    SequentialKeyGenerator(List<String> keys, int workerId) {
        this.keys = keys;
        this.index = Math.floorMod(workerId, keys.size());
    }

    @Override
    public String nextValue() {
        final String key = keys.get(index);
        index = (index + 1) % keys.size();
        return key;
    }
}
