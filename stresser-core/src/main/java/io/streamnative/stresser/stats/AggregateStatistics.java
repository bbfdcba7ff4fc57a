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
 * The frozen summary of one run. Latency sample lists hold successful operations only and are
 * sorted ascending; byte totals likewise only count successful operations.
 */
public record AggregateStatistics(
        int concurrency,
        Duration duration,
        long totalRequests,
        long totalGets,
        long totalPuts,
        long totalErrors,
        long getErrors,
        long putErrors,
        long totalBytesDownloaded,
        long totalBytesUploaded,
        List<Duration> getTtfbSamples,
        List<Duration> getTtlbSamples,
        List<Duration> putTtlbSamples,
        LatencySummary getTtfb,
        LatencySummary getTtlb,
        LatencySummary putTtlb) {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    public long successes() {
        return totalRequests - totalErrors;
    }

    public long successfulGets() {
        return totalGets - getErrors;
    }

    public long successfulPuts() {
        return totalPuts - putErrors;
    }

    public double requestsPerSecond() {
        return perSecond(totalRequests);
    }

    /** Bytes per second received by successful GETs over the measured duration. */
    public double downloadThroughput() {
        return perSecond(totalBytesDownloaded);
    }

    /** Bytes per second sent by successful PUTs over the measured duration. */
    public double uploadThroughput() {
        return perSecond(totalBytesUploaded);
    }

    public double averageUploadSize() {
        final long puts = successfulPuts();
        return puts == 0 ? 0 : (double) totalBytesUploaded / puts;
    }

    private double perSecond(long amount) {
        if (duration.isNegative() || duration.isZero()) {
            return 0;
        }
        return amount / (duration.toNanos() / NANOS_PER_SECOND);
    }
}
