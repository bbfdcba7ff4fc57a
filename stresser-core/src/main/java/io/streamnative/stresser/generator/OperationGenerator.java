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

import io.streamnative.stresser.api.OperationType;
import io.streamnative.stresser.api.WorkloadMode;
import java.util.Random;

final class OperationGenerator implements Generator<OperationType> {
    private final WorkloadMode mode;
    private final Random random;

    OperationGenerator(WorkloadMode mode, Random random) {
        this.mode = mode;
        this.random = random;
    }

    @Override
    public OperationType nextValue() {
        return switch (mode) {
            case READ -> OperationType.GET;
            case WRITE -> OperationType.PUT;
            // re-drawn every iteration, never alternated
            case MIXED -> random.nextInt(2) == 0 ? OperationType.GET : OperationType.PUT;
        };
    }
}
