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
package io.streamnative.stresser.util;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import io.streamnative.stresser.api.exceptions.ConfigurationException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;

/**
 * Parses run durations written as a sequence of decimal numbers with unit suffixes, such as
 * {@code 30s}, {@code 1m30s}, {@code 1.5h} or {@code 250ms}. ISO-8601 durations ({@code PT5M}) are
 * accepted as well.
 */
@UtilityClass
public final class Durations {

    private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|s|m|h)");

    private static final Map<String, Long> UNIT_NANOS =
            ImmutableMap.<String, Long>builder()
                    .put("ns", 1L)
                    .put("us", 1_000L)
                    .put("µs", 1_000L)
                    .put("ms", 1_000_000L)
                    .put("s", 1_000_000_000L)
                    .put("m", 60_000_000_000L)
                    .put("h", 3_600_000_000_000L)
                    .build();

    public static Duration parse(String text) throws ConfigurationException {
        if (Strings.isNullOrEmpty(text) || text.isBlank()) {
            throw new ConfigurationException("duration must not be empty");
        }
        final String value = text.trim();
        if (value.charAt(0) == 'P' || value.charAt(0) == 'p') {
            try {
                return Duration.parse(value);
            } catch (DateTimeParseException e) {
                throw new ConfigurationException("invalid duration format \"" + text + "\"", e);
            }
        }
        if (value.equals("0")) {
            return Duration.ZERO;
        }

        final Matcher matcher = COMPONENT.matcher(value);
        BigDecimal nanos = BigDecimal.ZERO;
        int position = 0;
        while (position < value.length()) {
            if (!matcher.find(position) || matcher.start() != position) {
                throw new ConfigurationException("invalid duration format \"" + text + "\"");
            }
            final BigDecimal amount = new BigDecimal(matcher.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(UNIT_NANOS.get(matcher.group(2)))));
            position = matcher.end();
        }
        try {
            return Duration.ofNanos(nanos.longValueExact());
        } catch (ArithmeticException e) {
            // fractional nanoseconds are truncated, overflow is rejected
            if (nanos.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
                throw new ConfigurationException("duration out of range \"" + text + "\"", e);
            }
            return Duration.ofNanos(nanos.longValue());
        }
    }

    /** Renders a duration the way {@link #parse} reads it, at millisecond precision. */
    public static String format(Duration duration) {
        final long millis = duration.toMillis();
        if (millis == 0) {
            return "0s";
        }
        final StringBuilder sb = new StringBuilder();
        long remaining = millis;
        final long hours = remaining / 3_600_000L;
        remaining %= 3_600_000L;
        final long minutes = remaining / 60_000L;
        remaining %= 60_000L;
        final long seconds = remaining / 1_000L;
        final long ms = remaining % 1_000L;
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (minutes > 0) {
            sb.append(minutes).append('m');
        }
        if (seconds > 0) {
            sb.append(seconds).append('s');
        }
        if (ms > 0) {
            sb.append(ms).append("ms");
        }
        return sb.toString();
    }
}
