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

import io.streamnative.stresser.api.OperationResult;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;

/**
 * Bounded hand-off between the workers and the single consumer.
 *
 * <p>Producers never block: {@link #tryEmit} drops the result when the buffer is full. The consumer
 * keeps receiving until the pipeline has been closed and every buffered result has been taken.
 */
public final class ResultPipeline {
    private static final long POLL_INTERVAL_MILLIS = 50;

    private final BlockingQueue<OperationResult> queue;
    private volatile boolean closed;

    public ResultPipeline(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be greater than zero: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Offers a result without blocking.
     *
     * @return {@code false} if the buffer is full or the pipeline is closed
     */
    public boolean tryEmit(@NonNull OperationResult result) {
        if (closed) {
            return false;
        }
        return queue.offer(result);
    }

    /** No further results are accepted. Results already buffered stay available to the consumer. */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Waits for the next result.
     *
     * @return the next result, or empty once the pipeline is closed and drained
     * @throws InterruptedException if the consumer is interrupted while waiting
     */
    public Optional<OperationResult> next() throws InterruptedException {
        while (true) {
            final OperationResult result = queue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
            if (result != null) {
                return Optional.of(result);
            }
            if (closed) {
                // a producer may have offered right before close
                return Optional.ofNullable(queue.poll());
            }
        }
    }

    public int size() {
        return queue.size();
    }
}
