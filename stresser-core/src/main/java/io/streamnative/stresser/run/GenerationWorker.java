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
import io.streamnative.stresser.generator.Generator;
import io.streamnative.stresser.operations.Operations;
import java.util.Queue;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntFunction;
import javax.annotation.Nullable;

/** Takes job ids from a shared queue and uploads one object per job until the queue is empty. */
final class GenerationWorker extends AbstractWorker {
    private final Queue<Integer> jobs;
    private final IntFunction<Generator<String>> jobKeyGenerators;
    private final Generator<byte[]> payloadGenerator;

    GenerationWorker(
            String name,
            RunContext context,
            Operations operations,
            ResultPipeline pipeline,
            @Nullable ManifestSink manifest,
            LongAdder dropped,
            Queue<Integer> jobs,
            IntFunction<Generator<String>> jobKeyGenerators,
            Generator<byte[]> payloadGenerator) {
        super(name, context, operations, pipeline, manifest, dropped);
        this.jobs = jobs;
        this.jobKeyGenerators = jobKeyGenerators;
        this.payloadGenerator = payloadGenerator;
    }

    @Override
    void work() {
        while (!context.isDone()) {
            final Integer job = jobs.poll();
            if (job == null) {
                return;
            }
            final String key = jobKeyGenerators.apply(job).nextValue();
            if (!complete(operations.put(key, payloadGenerator.nextValue()))) {
                return;
            }
        }
    }
}
