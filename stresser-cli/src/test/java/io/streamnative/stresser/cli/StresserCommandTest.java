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
package io.streamnative.stresser.cli;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.streamnative.stresser.api.ObjectStoreProvider;
import io.streamnative.stresser.api.exceptions.ObjectStoreException;
import io.streamnative.stresser.s3.S3Options;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

@Timeout(30)
class StresserCommandTest {
    private static final Map<String, String> ENV =
            Map.of("AWS_ENDPOINT_URL", "http://localhost:9000", "S3_BUCKET", "bench");

    @TempDir Path dir;

    FakeObjectStore store;
    AtomicReference<S3Options> options;
    StringWriter out;
    StringWriter err;

    @BeforeEach
    void setup() {
        store = new FakeObjectStore();
        options = new AtomicReference<>();
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(Map<String, String> env, String... args) {
        Function<S3Options, ObjectStoreProvider> stores =
                o -> {
                    options.set(o);
                    return () -> store;
                };
        return execute(env, stores, args);
    }

    private int execute(
            Map<String, String> env, Function<S3Options, ObjectStoreProvider> stores, String... args) {
        var command =
                new StresserCommand(
                        env, stores, () -> OpenTelemetrySdk.builder().build(), Clock.systemUTC());
        return new CommandLine(command)
                .setOut(new PrintWriter(out))
                .setErr(new PrintWriter(err))
                .execute(args);
    }

    private String[] args(String... extra) {
        var all = new ArrayList<>(List.of("--progress-interval", "0", "-c", "2"));
        all.addAll(List.of(extra));
        return all.toArray(String[]::new);
    }

    @Test
    void readRun() throws Exception {
        var manifest = dir.resolve("keys.txt");
        Files.writeString(manifest, "a\nb\n\nc\n", UTF_8);
        store.with("bench", "a", 10).with("bench", "b", 20).with("bench", "c", 30);
        var csv = dir.resolve("results.csv");

        int exitCode = execute(ENV, args("-d", "300ms", "-r", "-o", csv.toString(), manifest.toString()));

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("--- Stress Test Summary ---")
                .contains("  Stopped:        duration elapsed")
                .contains("  Total Errors:   0");
        var lines = Files.readAllLines(csv, UTF_8);
        assertThat(lines.get(0)).startsWith("Timestamp,Operation,ObjectKey");
        assertThat(lines.subList(1, lines.size())).isNotEmpty().allMatch(l -> l.contains(",GET,"));
        assertThat(options.get().endpoint()).isEqualTo("http://localhost:9000");
        assertThat(options.get().bucket()).isEqualTo("bench");
        assertThat(store.closed).isTrue();
    }

    @Test
    void fixedCountWriteRecordsManifest() throws Exception {
        var manifest = dir.resolve("generated.txt");
        var csv = dir.resolve("results.csv");

        int exitCode =
                execute(
                        ENV,
                        args(
                                "--op", "write", "--files", "5", "--putsize", "1", "-o", csv.toString(),
                                manifest.toString()));

        assertThat(exitCode).isZero();
        var keys = Files.readAllLines(manifest, UTF_8);
        assertThat(keys).hasSize(5).doesNotHaveDuplicates();
        assertThat(store.objects).hasSize(5);
        keys.forEach(k -> assertThat(store.objects).containsKey("bench/" + k));
        assertThat(store.objects.values()).allMatch(v -> v.length == 1024);
        assertThat(Files.readAllLines(csv, UTF_8)).hasSize(6);
        assertThat(out.toString()).contains("  Stopped:        all files generated");
    }

    @Test
    void manifestGenerationCanBeDisabled() throws Exception {
        var manifest = dir.resolve("untouched.txt");
        Files.writeString(manifest, "keep\n", UTF_8);

        int exitCode =
                execute(
                        ENV,
                        args(
                                "--op", "write", "--files", "3", "--putsize", "1", "--genmf=false", "-o",
                                dir.resolve("r.csv").toString(), manifest.toString()));

        assertThat(exitCode).isZero();
        assertThat(Files.readString(manifest, UTF_8)).isEqualTo("keep\n");
    }

    @Test
    void flagsOverrideEnvironment() throws Exception {
        var env = new HashMap<>(ENV);
        env.put("STRESSER_OPERATION_TYPE", "read");
        env.put("STRESSER_PUT_SIZE_KB", "8");
        var manifest = dir.resolve("m.txt");

        int exitCode =
                execute(
                        env,
                        args(
                                "--op", "write", "--files", "2", "--putsize", "2", "-o",
                                dir.resolve("r.csv").toString(), manifest.toString()));

        assertThat(exitCode).isZero();
        assertThat(store.objects.values()).hasSize(2).allMatch(v -> v.length == 2048);
    }

    @Test
    void missingEndpointIsASetupError() {
        int exitCode = execute(Map.of("S3_BUCKET", "bench"), args(dir.resolve("m.txt").toString()));

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Usage:");
        assertThat(options.get()).isNull();
    }

    @Test
    void missingManifestArgumentIsAUsageError() {
        int exitCode = execute(ENV, args());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("<manifest>");
    }

    @Test
    void unreadableManifestIsASetupError() {
        var csv = dir.resolve("results.csv");

        int exitCode =
                execute(ENV, args("-o", csv.toString(), dir.resolve("missing.txt").toString()));

        assertThat(exitCode).isEqualTo(1);
        assertThat(csv).doesNotExist();
    }

    @Test
    void storeConstructionFailureIsASetupError() throws Exception {
        var manifest = dir.resolve("keys.txt");
        Files.writeString(manifest, "a\n", UTF_8);
        var csv = dir.resolve("results.csv");
        Function<S3Options, ObjectStoreProvider> failing =
                o ->
                        () -> {
                            throw new ObjectStoreException("failed to create S3 client");
                        };

        int exitCode = execute(ENV, failing, args("-o", csv.toString(), manifest.toString()));

        assertThat(exitCode).isEqualTo(1);
        assertThat(csv).doesNotExist();
        assertThat(out.toString()).doesNotContain("Stress Test Summary");
    }

    @Test
    void cancelledBeforeStartReportsEmptyRun() throws Exception {
        var manifest = dir.resolve("keys.txt");
        Files.writeString(manifest, "a\n", UTF_8);
        store.with("bench", "a", 1);
        var csv = dir.resolve("results.csv");
        var command =
                new StresserCommand(
                        ENV, o -> () -> store, () -> OpenTelemetrySdk.builder().build(), Clock.systemUTC());
        command.interrupt();

        int exitCode =
                new CommandLine(command)
                        .setOut(new PrintWriter(out))
                        .setErr(new PrintWriter(err))
                        .execute(args("-d", "10m", "-o", csv.toString(), manifest.toString()));

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("  Stopped:        interrupted");
    }

    @Test
    void version() {
        int exitCode = execute(ENV, "--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("stresser ");
    }
}
