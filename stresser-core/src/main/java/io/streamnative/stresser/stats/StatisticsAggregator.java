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
package io.streamnative.stresser.stats;

import com.google.common.collect.ImmutableList;
import io.streamnative.stresser.api.OperationResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;

/**
 * Folds operation results into running counters and latency samples, then freezes them into an
 * {@link AggregateStatistics}.
 *
 * <p>Not thread-safe. A single consumer adds results while the run is collecting and draining,
 * then calls {@link #finish(Duration)} once.
 */
public final class StatisticsAggregator {

    public enum Phase {
        COLLECTING,
        DRAINING,
        FINALIZED
    }

    private final int concurrency;
    private Phase phase = Phase.COLLECTING;

    private long totalRequests;
    private long totalGets;
    private long totalPuts;
    private long getErrors;
    private long putErrors;
    private long bytesDownloaded;
    private long bytesUploaded;
    private final List<Duration> getTtfbs = new ArrayList<>();
    private final List<Duration> getTtlbs = new ArrayList<>();
    private final List<Duration> putTtlbs = new ArrayList<>();

    public StatisticsAggregator(int concurrency) {
        this.concurrency = concurrency;
    }

    public void add(@NonNull OperationResult result) {
        if (phase == Phase.FINALIZED) {
            throw new IllegalStateException("statistics already finalized");
        }
        totalRequests++;
        switch (result.operation()) {
            case GET -> {
                totalGets++;
                if (!result.isSuccess()) {
                    getErrors++;
                    return;
                }
                bytesDownloaded += result.bytesDownloaded();
                getTtfbs.add(result.ttfb());
                getTtlbs.add(result.ttlb());
            }
            case PUT -> {
                totalPuts++;
                if (!result.isSuccess()) {
                    putErrors++;
                    return;
                }
                bytesUploaded += result.bytesUploaded();
                putTtlbs.add(result.ttlb());
            }
        }
    }

    /** Signals that producers are gone; the remaining buffered results are still accepted. */
    public void startDraining() {
        if (phase == Phase.FINALIZED) {
            throw new IllegalStateException("statistics already finalized");
        }
        phase = Phase.DRAINING;
    }

    public Phase phase() {
        return phase;
    }

    /**
     * Sorts the samples and computes the derived figures.
     *
     * @param measured the wall-clock duration of the run
     * @throws IllegalStateException if called more than once
     */
    public AggregateStatistics finish(@NonNull Duration measured) {
        if (phase == Phase.FINALIZED) {
            throw new IllegalStateException("statistics already finalized");
        }
        phase = Phase.FINALIZED;

        final ImmutableList<Duration> sortedGetTtfbs = ImmutableList.sortedCopyOf(getTtfbs);
        final ImmutableList<Duration> sortedGetTtlbs = ImmutableList.sortedCopyOf(getTtlbs);
        final ImmutableList<Duration> sortedPutTtlbs = ImmutableList.sortedCopyOf(putTtlbs);
        return new AggregateStatistics(
                concurrency,
                measured,
                totalRequests,
                totalGets,
                totalPuts,
                getErrors + putErrors,
                getErrors,
                putErrors,
                bytesDownloaded,
                bytesUploaded,
                sortedGetTtfbs,
                sortedGetTtlbs,
                sortedPutTtlbs,
                LatencySummary.of(sortedGetTtfbs),
                LatencySummary.of(sortedGetTtlbs),
                LatencySummary.of(sortedPutTtlbs));
    }
}
