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

import java.time.Duration;
import java.util.List;

/**
 * Order statistics of one latency sample set. All values are zero when the set is empty.
 *
 * @param count the number of samples
 * @param min the smallest sample
 * @param avg the arithmetic mean
 * @param p50 the nearest-rank median
 * @param p90 the nearest-rank 90th percentile
 * @param p99 the nearest-rank 99th percentile
 * @param max the largest sample
 */
public record LatencySummary(
        int count, Duration min, Duration avg, Duration p50, Duration p90, Duration p99, Duration max) {

    public static final LatencySummary EMPTY =
            new LatencySummary(
                    0, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO);

    /**
     * Summarizes a sample set.
     *
     * @param sorted samples in ascending order
     */
    static LatencySummary of(List<Duration> sorted) {
        if (sorted.isEmpty()) {
            return EMPTY;
        }
        return new LatencySummary(
                sorted.size(),
                sorted.get(0),
                Percentiles.average(sorted),
                Percentiles.percentile(sorted, 50),
                Percentiles.percentile(sorted, 90),
                Percentiles.percentile(sorted, 99),
                sorted.get(sorted.size() - 1));
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
