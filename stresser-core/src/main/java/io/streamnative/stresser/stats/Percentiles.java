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

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import lombok.experimental.UtilityClass;

@UtilityClass
public final class Percentiles {

    /**
     * Nearest-rank percentile of an ascending sample list.
     *
     * <p>One sample is its own percentile. With two samples, percentiles up to the median resolve
     * to the lower sample and the rest to the higher one. Otherwise the sample at index
     * {@code floor(p * N / 100)}, clamped to the list, is returned.
     *
     * @param sorted samples in ascending order
     * @param p the percentile, between 0 and 100
     * @return the selected sample, {@link Duration#ZERO} for an empty list
     */
    public static Duration percentile(List<Duration> sorted, double p) {
        final int n = sorted.size();
        if (n == 0) {
            return Duration.ZERO;
        }
        if (n == 1) {
            return sorted.get(0);
        }
        if (n == 2) {
            return p <= 50 ? sorted.get(0) : sorted.get(1);
        }
        int index = (int) Math.floor(p * n / 100.0);
        if (index < 0) {
            index = 0;
        } else if (index >= n) {
            index = n - 1;
        }
        return sorted.get(index);
    }

    /** Arithmetic mean at nanosecond precision, {@link Duration#ZERO} for an empty list. */
    public static Duration average(List<Duration> samples) {
        if (samples.isEmpty()) {
            return Duration.ZERO;
        }
        BigInteger total = BigInteger.ZERO;
        for (Duration sample : samples) {
            total = total.add(BigInteger.valueOf(sample.toNanos()));
        }
        return Duration.ofNanos(total.divide(BigInteger.valueOf(samples.size())).longValueExact());
    }
}
