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
package io.streamnative.stresser.output;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.streamnative.stresser.api.OperationResult;
import io.streamnative.stresser.run.ResultListener;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.HdrHistogram.Histogram;
import org.HdrHistogram.Recorder;

/**
 * Logs interval throughput and latency percentiles while a run is in progress.
 *
 * <p>Results are recorded on the consumer thread; the report is produced on a dedicated scheduler
 * thread that swaps the interval histograms.
 */
@Slf4j
public final class ProgressReporter implements ResultListener, AutoCloseable {
    private static final long HIGHEST_TRACKABLE_MICROS = TimeUnit.SECONDS.toMicros(120_000);

    private final Duration interval;
    private final Ticker ticker;
    private final LongAdder getOps = new LongAdder();
    private final LongAdder putOps = new LongAdder();
    private final LongAdder failedOps = new LongAdder();
    private final Recorder getLatency = new Recorder(HIGHEST_TRACKABLE_MICROS, 5);
    private final Recorder putLatency = new Recorder(HIGHEST_TRACKABLE_MICROS, 5);
    private final ScheduledExecutorService scheduler;

    private Histogram getReportHistogram;
    private Histogram putReportHistogram;
    private long lastReportNanos;

    public ProgressReporter(@NonNull Duration interval) {
        this(interval, Ticker.systemTicker());
    }

    ProgressReporter(@NonNull Duration interval, @NonNull Ticker ticker) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be greater than zero: " + interval);
        }
        this.interval = interval;
        this.ticker = ticker;
        this.scheduler =
                Executors.newSingleThreadScheduledExecutor(
                        new ThreadFactoryBuilder().setNameFormat("stresser-progress-%d").setDaemon(true).build());
    }

    public void start() {
        lastReportNanos = ticker.read();
        final long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::logReport, millis, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void onResult(@NonNull OperationResult result) {
        if (!result.isSuccess()) {
            failedOps.increment();
            return;
        }
        final long latencyMicros = Math.min(HIGHEST_TRACKABLE_MICROS, result.ttlb().toNanos() / 1_000);
        switch (result.operation()) {
            case GET -> {
                getOps.increment();
                getLatency.recordValue(latencyMicros);
            }
            case PUT -> {
                putOps.increment();
                putLatency.recordValue(latencyMicros);
            }
        }
    }

    private void logReport() {
        try {
            log.info(report().toString());
        } catch (RuntimeException ex) {
            // an exception would cancel the periodic task
            log.warn("failed to produce progress report", ex);
        }
    }

    @VisibleForTesting
    synchronized IntervalReport report() {
        final long now = ticker.read();
        final double elapsed = Math.max(1, now - lastReportNanos) / (double) NANOSECONDS.convert(1, TimeUnit.SECONDS);
        lastReportNanos = now;

        getReportHistogram = getLatency.getIntervalHistogram(getReportHistogram);
        putReportHistogram = putLatency.getIntervalHistogram(putReportHistogram);
        final IntervalReport report =
                new IntervalReport(
                        Doubles.format2Scale(getOps.sumThenReset() / elapsed),
                        Doubles.format2Scale(putOps.sumThenReset() / elapsed),
                        Doubles.format2Scale(failedOps.sumThenReset() / elapsed),
                        HistogramSnapshot.fromHistogram(getReportHistogram),
                        HistogramSnapshot.fromHistogram(putReportHistogram));
        getReportHistogram.reset();
        putReportHistogram.reset();
        return report;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    /** Rates in operations per second and latencies in milliseconds over one interval. */
    record IntervalReport(
            double getsPerSecond,
            double putsPerSecond,
            double failuresPerSecond,
            HistogramSnapshot getLatencyMs,
            HistogramSnapshot putLatencyMs) {

        private static final Function<Double, String> DEC_FORMAT = d -> String.format("%7.1f", d);
        private static final Function<Double, String> INT_FORMAT = d -> String.format("%7.0f", d);

        @Override
        public String toString() {
            return String.format(
                    "Stats - Total ops: %s ops/s - Failed ops: %s ops/s%n"
                            + "   Get ops %s r/s  Latency ms: 50%% %s - 90%% %s - 99%% %s - max %s%n"
                            + "   Put ops %s w/s  Latency ms: 50%% %s - 90%% %s - 99%% %s - max %s",
                    INT_FORMAT.apply(getsPerSecond + putsPerSecond),
                    INT_FORMAT.apply(failuresPerSecond),
                    INT_FORMAT.apply(getsPerSecond),
                    DEC_FORMAT.apply(getLatencyMs.getP50()),
                    DEC_FORMAT.apply(getLatencyMs.getP90()),
                    DEC_FORMAT.apply(getLatencyMs.getP99()),
                    DEC_FORMAT.apply(getLatencyMs.getMax()),
                    INT_FORMAT.apply(putsPerSecond),
                    DEC_FORMAT.apply(putLatencyMs.getP50()),
                    DEC_FORMAT.apply(putLatencyMs.getP90()),
                    DEC_FORMAT.apply(putLatencyMs.getP99()),
                    DEC_FORMAT.apply(putLatencyMs.getMax()));
        }
    }
}
