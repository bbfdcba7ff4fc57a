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

import io.streamnative.stresser.run.RunOutcome;
import io.streamnative.stresser.stats.AggregateStatistics;
import io.streamnative.stresser.stats.LatencySummary;
import io.streamnative.stresser.util.Durations;
import java.io.PrintWriter;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/** Renders the human-readable summary of a run. */
@RequiredArgsConstructor
public final class SummaryOutput {
    private static final double MIB = 1024 * 1024;
    private static final String LATENCY_HEADER =
            "  Latency (ms): |   Min  |   Avg  |   P50  |   P90  |   P99  |   Max  ";
    private static final String LATENCY_RULE =
            "  --------------|--------|--------|--------|--------|--------|--------";

    private final PaddingDecimalFormat millis = new PaddingDecimalFormat("0.00", 7);

    @NonNull private final PrintWriter out;

    public void print(@NonNull RunOutcome outcome) {
        final AggregateStatistics stats = outcome.statistics();
        final double seconds = stats.duration().toNanos() / 1e9;

        out.println();
        out.printf(
                "--- Stress Test Summary --- (%s) ---%n",
                Durations.format(stats.duration().truncatedTo(ChronoUnit.MILLIS)));
        out.println("Overall:");
        out.printf("  Stopped:        %s%n", describe(outcome.termination()));
        out.printf("  Concurrency:    %d%n", stats.concurrency());
        out.printf(
                Locale.ROOT,
                "  Total Requests: %d (%.2f req/s)%n",
                stats.totalRequests(),
                stats.requestsPerSecond());
        out.printf("  Total Success:  %d%n", stats.successes());
        out.printf("  Total Errors:   %d%n", stats.totalErrors());
        if (outcome.droppedResults() > 0) {
            out.printf("  Dropped:        %d (not included above)%n", outcome.droppedResults());
        }

        out.println();
        out.printf("GET Operations (%d total):%n", stats.totalGets());
        out.printf("  Success:        %d%n", stats.successfulGets());
        out.printf(
                Locale.ROOT,
                "  Bytes D/L:      %d (%.2f MiB)%n",
                stats.totalBytesDownloaded(),
                stats.totalBytesDownloaded() / MIB);
        out.printf(
                Locale.ROOT, "  Avg Throughput: %.2f MiB/s%n", seconds > 0 ? stats.downloadThroughput() / MIB : 0);
        if (stats.successfulGets() > 0) {
            out.println(LATENCY_HEADER);
            out.println(LATENCY_RULE);
            out.println(row("  TTFB (proxy)  |", stats.getTtfb()));
            out.println(row("  TTLB (body)   |", stats.getTtlb()));
        } else {
            out.println("  No successful GETs to calculate latency.");
        }

        out.println();
        out.printf("PUT Operations (%d total):%n", stats.totalPuts());
        out.printf("  Success:        %d%n", stats.successfulPuts());
        out.printf(
                Locale.ROOT,
                "  Bytes U/L:      %d (%.2f MiB)%n",
                stats.totalBytesUploaded(),
                stats.totalBytesUploaded() / MIB);
        if (stats.successfulPuts() > 0) {
            out.printf(Locale.ROOT, "  Object Size:    %.2f KiB%n", stats.averageUploadSize() / 1024);
        }
        out.printf(
                Locale.ROOT, "  Avg Throughput: %.2f MiB/s%n", seconds > 0 ? stats.uploadThroughput() / MIB : 0);
        if (stats.successfulPuts() > 0) {
            out.println(LATENCY_HEADER);
            out.println(LATENCY_RULE);
            out.println(row("  TTLB (total)  |", stats.putTtlb()));
        } else {
            out.println("  No successful PUTs to calculate latency.");
        }
        out.println("----------------------------------------");
        out.flush();
    }

    private String row(String label, LatencySummary summary) {
        final StringJoiner cells = new StringJoiner(" |", label, " ");
        for (Duration d :
                List.of(
                        summary.min(),
                        summary.avg(),
                        summary.p50(),
                        summary.p90(),
                        summary.p99(),
                        summary.max())) {
            cells.add(millis.format(toMillis(d)));
        }
        return cells.toString();
    }

    static double toMillis(Duration d) {
        return d.isNegative() ? 0 : d.toNanos() / 1e6;
    }

    private static String describe(RunOutcome.Termination termination) {
        return switch (termination) {
            case COMPLETED -> "all files generated";
            case DEADLINE_EXCEEDED -> "duration elapsed";
            case CANCELLED -> "interrupted";
            case FAILED -> "failed";
        };
    }
}
