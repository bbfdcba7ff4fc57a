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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.streamnative.stresser.api.OperationResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/** Writes one CSV row per operation result. */
@Slf4j
@UtilityClass
public class CsvResultsOutput {
    private static final CsvMapper mapper =
            CsvMapper.builder().enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING).build();
    private static final CsvSchema schema = mapper.schemaFor(Row.class).withHeader();
    private static final ObjectWriter writer = mapper.writerFor(Row.class).with(schema);

    /**
     * Writes {@code results} to {@code path}, replacing any existing file. The header is written with
     * the first row.
     *
     * @throws IOException if the file cannot be created or written
     */
    public void write(@NonNull List<OperationResult> results, @NonNull Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, UTF_8);
                SequenceWriter rows = writer.writeValues(out)) {
            for (OperationResult result : results) {
                rows.write(Row.of(result));
            }
        }
        log.info("Detailed results written to {} ({} rows)", path, results.size());
    }

    /** Renders a timing in milliseconds with microsecond precision; unmeasured timings become zero. */
    static String millis(Duration timing) {
        final double ms = timing.isNegative() ? 0 : timing.toNanos() / 1e6;
        return String.format(Locale.ROOT, "%.3f", ms);
    }

    @JsonPropertyOrder({
        "Timestamp",
        "Operation",
        "ObjectKey",
        "TTFB(ms)",
        "TTLB(ms)",
        "BytesDownloaded",
        "BytesUploaded",
        "Error"
    })
    record Row(
            @JsonProperty("Timestamp") String timestamp,
            @JsonProperty("Operation") String operation,
            @JsonProperty("ObjectKey") String objectKey,
            @JsonProperty("TTFB(ms)") String ttfb,
            @JsonProperty("TTLB(ms)") String ttlb,
            @JsonProperty("BytesDownloaded") long bytesDownloaded,
            @JsonProperty("BytesUploaded") long bytesUploaded,
            @JsonProperty("Error") String error) {

        static Row of(OperationResult result) {
            return new Row(
                    DateTimeFormatter.ISO_INSTANT.format(result.timestamp()),
                    result.operation().name(),
                    result.key(),
                    millis(result.ttfb()),
                    millis(result.ttlb()),
                    result.bytesDownloaded(),
                    result.bytesUploaded(),
                    result.error());
        }
    }
}
