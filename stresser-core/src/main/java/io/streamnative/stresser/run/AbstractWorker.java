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
import io.streamnative.stresser.api.exceptions.ManifestException;
import io.streamnative.stresser.operations.Operations;
import java.util.concurrent.atomic.LongAdder;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/** The parts shared by both worker topologies: recording created keys and emitting results. */
@Slf4j
abstract class AbstractWorker implements Runnable {
    protected final String name;
    protected final RunContext context;
    protected final Operations operations;
    private final ResultPipeline pipeline;
    @Nullable private final ManifestSink manifest;
    private final LongAdder dropped;

    AbstractWorker(
            String name,
            RunContext context,
            Operations operations,
            ResultPipeline pipeline,
            @Nullable ManifestSink manifest,
            LongAdder dropped) {
        this.name = name;
        this.context = context;
        this.operations = operations;
        this.pipeline = pipeline;
        this.manifest = manifest;
        this.dropped = dropped;
    }

    @Override
    public final void run() {
        log.info("{} started", name);
        work();
        log.info("{} stopped: {}", name, context.state());
    }

    abstract void work();

    /**
     * Hands a finished operation on.
     *
     * @return {@code false} if the run has ended and the worker must stop
     */
    final boolean complete(OperationResult result) {
        if (manifest != null && result.operation() == OperationType.PUT && result.isSuccess()) {
            // the object exists in the store even if the run ends now
            try {
                manifest.append(result.key());
            } catch (ManifestException ex) {
                log.warn("{} failed to record {} in the manifest: {}", name, result.key(), ex.getMessage());
            }
        }
        if (context.isDone()) {
            log.debug("{} run ended while completing {}, result discarded", name, result.key());
            return false;
        }
        if (!pipeline.tryEmit(result)) {
            dropped.increment();
            log.warn("{} result pipeline is full, dropping result for key {}", name, result.key());
        }
        return true;
    }
}
