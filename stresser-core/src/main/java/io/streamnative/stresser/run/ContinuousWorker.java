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

import io.streamnative.stresser.api.ManifestSink;
import io.streamnative.stresser.api.OperationResult;
import io.streamnative.stresser.api.OperationType;
import io.streamnative.stresser.generator.Generator;
import io.streamnative.stresser.operations.Operations;
import java.util.concurrent.atomic.LongAdder;
import javax.annotation.Nullable;

/** Issues one operation after another until the run context is done. */
final class ContinuousWorker extends AbstractWorker {
    private final Generator<OperationType> operationGenerator;
    @Nullable private final Generator<String> readKeyGenerator;
    @Nullable private final Generator<String> writeKeyGenerator;
    @Nullable private final Generator<byte[]> payloadGenerator;

    ContinuousWorker(
            String name,
            RunContext context,
            Operations operations,
            ResultPipeline pipeline,
            @Nullable ManifestSink manifest,
            LongAdder dropped,
            Generator<OperationType> operationGenerator,
            @Nullable Generator<String> readKeyGenerator,
            @Nullable Generator<String> writeKeyGenerator,
            @Nullable Generator<byte[]> payloadGenerator) {
        super(name, context, operations, pipeline, manifest, dropped);
        this.operationGenerator = operationGenerator;
        this.readKeyGenerator = readKeyGenerator;
        this.writeKeyGenerator = writeKeyGenerator;
        this.payloadGenerator = payloadGenerator;
    }

    @Override
    void work() {
        while (!context.isDone()) {
            final OperationResult result =
                    switch (operationGenerator.nextValue()) {
                        case GET -> operations.get(next(readKeyGenerator, "read key"));
                        case PUT -> operations.put(
                                next(writeKeyGenerator, "write key"), next(payloadGenerator, "payload"));
                    };
            if (!complete(result)) {
                return;
            }
        }
    }

    private static <T> T next(@Nullable Generator<T> generator, String what) {
        if (generator == null) {
            throw new WorkerException("no " + what + " generator configured");
        }
        return generator.nextValue();
    }
}
