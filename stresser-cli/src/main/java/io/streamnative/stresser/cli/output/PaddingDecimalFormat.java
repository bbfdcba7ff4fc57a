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

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.FieldPosition;
import java.util.Locale;

/** A {@link DecimalFormat} that left-pads every formatted number with spaces to a fixed width. */
@SuppressWarnings("serial")
final class PaddingDecimalFormat extends DecimalFormat {
    private final int width;

    /**
     * @param pattern the decimal pattern, interpreted with locale-neutral symbols
     * @param width the minimum length of a formatted number
     */
    PaddingDecimalFormat(String pattern, int width) {
        super(pattern, DecimalFormatSymbols.getInstance(Locale.ROOT));
        this.width = width;
    }

    @Override
    public StringBuffer format(double number, StringBuffer toAppendTo, FieldPosition pos) {
        final int start = toAppendTo.length();
        return padLeft(super.format(number, toAppendTo, pos), start);
    }

    @Override
    public StringBuffer format(long number, StringBuffer toAppendTo, FieldPosition pos) {
        final int start = toAppendTo.length();
        return padLeft(super.format(number, toAppendTo, pos), start);
    }

    private StringBuffer padLeft(StringBuffer buffer, int start) {
        final int missing = width - (buffer.length() - start);
        if (missing > 0) {
            buffer.insert(start, " ".repeat(missing));
        }
        return buffer;
    }
}
