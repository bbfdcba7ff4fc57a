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
package io.streamnative.stresser.cli.output;

import io.streamnative.stresser.output.Doubles;
import io.streamnative.stresser.run.RunOutcome;
import io.streamnative.stresser.stats.AggregateStatistics;
import io.streamnative.stresser.stats.LatencySummary;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import javax.annotation.Nullable;
import lombok.Data;

/** Machine-readable summary of a run, rendered by {@link LogOutput}. */
@Data
public final class SummarySnapshot {
    private static final double MIB = 1024 * 1024;

    private final Instant finishedAt;
    private final String termination;
    private final double durationSec;
    private final int concurrency;
    private final long totalRequests;
    private final long totalSuccess;
    private final long totalErrors;
    private final long droppedResults;
    private final double requestsPerSec;
    private final OperationSnapshot get;
    private final OperationSnapshot put;

    @Data
    public static final class OperationSnapshot {
        private final long total;
        private final long success;
        private final long errors;
        private final long bytes;
        private final double throughputMiBps;
        @Nullable private final LatencySnapshot ttfb;
        @Nullable private final LatencySnapshot ttlb;
    }

    /** Latencies in milliseconds, rounded to two decimals. */
    @Data
    public static final class LatencySnapshot {
        private final long count;
        private final double min;
        private final double avg;
        private final double p50;
        private final double p90;
        private final double p99;
        private final double max;

        @Nullable
        static LatencySnapshot of(LatencySummary summary) {
            if (summary.isEmpty()) {
                return null;
            }
            return new LatencySnapshot(
                    summary.count(),
                    ms(summary.min()),
                    ms(summary.avg()),
                    ms(summary.p50()),
                    ms(summary.p90()),
                    ms(summary.p99()),
                    ms(summary.max()));
        }

        private static double ms(Duration d) {
            return Doubles.format2Scale(SummaryOutput.toMillis(d));
        }
    }

    public static SummarySnapshot of(RunOutcome outcome, Instant finishedAt) {
        final AggregateStatistics stats = outcome.statistics();
        return new SummarySnapshot(
                finishedAt,
                outcome.termination().name().toLowerCase(Locale.ROOT),
                Doubles.format2Scale(stats.duration().toNanos() / 1e9),
                stats.concurrency(),
                stats.totalRequests(),
                stats.successes(),
                stats.totalErrors(),
                outcome.droppedResults(),
                Doubles.format2Scale(stats.requestsPerSecond()),
                new OperationSnapshot(
                        stats.totalGets(),
                        stats.successfulGets(),
                        stats.getErrors(),
                        stats.totalBytesDownloaded(),
                        Doubles.format2Scale(stats.downloadThroughput() / MIB),
                        LatencySnapshot.of(stats.getTtfb()),
                        LatencySnapshot.of(stats.getTtlb())),
                new OperationSnapshot(
                        stats.totalPuts(),
                        stats.successfulPuts(),
                        stats.putErrors(),
                        stats.totalBytesUploaded(),
                        Doubles.format2Scale(stats.uploadThroughput() / MIB),
                        null,
                        LatencySnapshot.of(stats.putTtlb())));
    }
}
