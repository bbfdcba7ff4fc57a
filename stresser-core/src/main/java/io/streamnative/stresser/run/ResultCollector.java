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

import com.google.common.collect.ImmutableList;
import io.streamnative.stresser.api.OperationResult;
import io.streamnative.stresser.stats.StatisticsAggregator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * The single consumer of a run: drains the pipeline into the result log, the aggregator and the
 * listeners. Collection resumes where it stopped if {@link #collect()} is called again after an
 * interrupt.
 */
@Slf4j
@RequiredArgsConstructor
final class ResultCollector {
    private final ResultPipeline pipeline;
    private final StatisticsAggregator aggregator;
    private final List<ResultListener> listeners;
    private final ImmutableList.Builder<OperationResult> results = ImmutableList.builder();
    private long received;

    /**
     * Receives results until the pipeline is closed and empty.
     *
     * @throws InterruptedException if the consuming thread is interrupted while waiting
     */
    void collect() throws InterruptedException {
        Optional<OperationResult> next;
        while ((next = pipeline.next()).isPresent()) {
            if (pipeline.isClosed() && aggregator.phase() == StatisticsAggregator.Phase.COLLECTING) {
                aggregator.startDraining();
                log.debug("all workers finished, draining {} buffered results", pipeline.size() + 1);
            }
            final OperationResult result = next.get();
            results.add(result);
            aggregator.add(result);
            for (ResultListener listener : listeners) {
                listener.onResult(result);
            }
            received++;
        }
        log.info("collected {} total results", received);
    }

    List<OperationResult> results() {
        return results.build();
    }

    long received() {
        return received;
    }
}
