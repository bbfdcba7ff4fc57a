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

import java.util.concurrent.TimeUnit;
import lombok.Data;
import org.HdrHistogram.Histogram;

/**
 * Interval latency percentiles in milliseconds, rounded to two decimals. Uses the same percentiles
 * as the end-of-run summary.
 */
@Data
public final class HistogramSnapshot {
    private static final double MICROS_PER_MILLI = TimeUnit.MILLISECONDS.toMicros(1);

    private final long count;
    private final double p50;
    private final double p90;
    private final double p99;
    private final double max;

    /** @param histogram latencies recorded in microseconds */
    public static HistogramSnapshot fromHistogram(Histogram histogram) {
        return new HistogramSnapshot(
                histogram.getTotalCount(),
                millis(histogram.getValueAtPercentile(50)),
                millis(histogram.getValueAtPercentile(90)),
                millis(histogram.getValueAtPercentile(99)),
                millis(histogram.getMaxValue()));
    }

    private static double millis(long micros) {
        return Doubles.format2Scale(micros / MICROS_PER_MILLI);
    }
}
