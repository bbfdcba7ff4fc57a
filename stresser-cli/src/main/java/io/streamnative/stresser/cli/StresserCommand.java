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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import io.streamnative.stresser.api.ManifestSink;
import io.streamnative.stresser.api.ObjectStoreProvider;
import io.streamnative.stresser.api.RunConfiguration;
import io.streamnative.stresser.api.WorkloadMode;
import io.streamnative.stresser.api.exceptions.ConfigurationException;
import io.streamnative.stresser.api.exceptions.ManifestException;
import io.streamnative.stresser.api.exceptions.StresserException;
import io.streamnative.stresser.cli.config.ConfigLoader;
import io.streamnative.stresser.cli.config.StresserConfig;
import io.streamnative.stresser.cli.output.CsvResultsOutput;
import io.streamnative.stresser.cli.output.LogOutput;
import io.streamnative.stresser.cli.output.SummaryOutput;
import io.streamnative.stresser.cli.output.SummarySnapshot;
import io.streamnative.stresser.manifest.FileKeySource;
import io.streamnative.stresser.manifest.FileManifestSink;
import io.streamnative.stresser.run.RunContext;
import io.streamnative.stresser.run.RunOutcome;
import io.streamnative.stresser.run.StressRunException;
import io.streamnative.stresser.run.StressRunner;
import io.streamnative.stresser.s3.S3ObjectStoreProvider;
import io.streamnative.stresser.s3.S3Options;
import io.streamnative.stresser.util.Durations;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Slf4j
@Command(
        name = "stresser",
        mixinStandardHelpOptions = true,
        versionProvider = StresserCommand.VersionProvider.class,
        sortOptions = false,
        usageHelpAutoWidth = true,
        description = "Object Store Stress Tester: issues concurrent GET/PUT requests against an S3-compatible endpoint and reports latency statistics.",
        footer = {
            "",
            "Configuration Precedence: Flags > Environment Variables > YAML Config File",
            "",
            "Environment Variables:",
            "  AWS_ENDPOINT_URL, AWS_REGION, S3_BUCKET",
            "  AWS_ACCESS_KEY_ID, AWS_SECRET_ACCESS_KEY (or use default credential chain)",
            "  STRESSER_OPERATION_TYPE ('read'|'write'|'mixed')",
            "  STRESSER_PUT_SIZE_KB (integer)",
            "  STRESSER_FILE_COUNT (integer)",
            "  STRESSER_GENERATE_MANIFEST ('true'|'false')",
            "  STRESSER_INSECURE_SKIP_VERIFY ('true'|'false')",
            "  STRESSER_LOG_LEVEL ('debug'|'info'|'warn'|'error')",
            "  OTEL_* (OpenTelemetry SDK autoconfiguration, metrics export is off by default)"
        })
public class StresserCommand implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final Map<String, String> OTEL_DEFAULTS =
            ImmutableMap.of(
                    "otel.service.name", "stresser",
                    "otel.metrics.exporter", "none",
                    "otel.traces.exporter", "none",
                    "otel.logs.exporter", "none");

    @Spec CommandSpec spec;

    @Option(
            names = {"--config"},
            paramLabel = "<file>",
            description = "Path to a YAML configuration file")
    Path configFile;

    @Option(
            names = {"-d", "--duration"},
            defaultValue = "1m",
            description = "Test duration, e.g. 30s, 5m, 1h (default: ${DEFAULT-VALUE})")
    String duration;

    @Option(
            names = {"-c", "--concurrency"},
            defaultValue = "10",
            description = "Number of concurrent workers (default: ${DEFAULT-VALUE})")
    int concurrency;

    @Option(
            names = {"-r", "--randomize"},
            description = "Pick GET keys at random instead of sequentially")
    boolean randomize;

    @Option(
            names = {"--op"},
            paramLabel = "<type>",
            description = "Operation type: read, write or mixed (default: read)")
    String operationType;

    @Option(
            names = {"--putsize"},
            paramLabel = "<KB>",
            description = "Object size in KB for PUT operations (default: 1024)")
    Integer putSizeKb;

    @Option(
            names = {"--files"},
            paramLabel = "<count>",
            description = "Number of objects to generate in write mode, 0 to write until the duration elapses")
    Integer fileCount;

    @Option(
            names = {"--genmf"},
            arity = "0..1",
            fallbackValue = "true",
            paramLabel = "<bool>",
            description = "Record generated keys in the manifest file in write mode (default: true)")
    Boolean generateManifest;

    @Option(
            names = {"-o", "--output"},
            defaultValue = "stress_results.csv",
            paramLabel = "<file>",
            description = "Output CSV file for detailed results (default: ${DEFAULT-VALUE})")
    String outputFile;

    @Option(
            names = {"--log-level"},
            paramLabel = "<level>",
            description = "Log level: debug, info, warn or error (default: info)")
    String logLevel;

    @Option(
            names = {"--progress-interval"},
            defaultValue = "10s",
            paramLabel = "<duration>",
            description = "Interval of the progress log line, 0 disables it (default: ${DEFAULT-VALUE})")
    String progressInterval;

    @Option(
            names = {"--summary-json"},
            description = "Also log the run summary as JSON")
    boolean summaryJson;

    @Parameters(
            index = "0",
            paramLabel = "<manifest>",
            description = {
                "Text file with one object key per line. Read by 'read' and 'mixed' modes;",
                "in 'write' mode the generated keys are written to it."
            })
    Path manifest;

    private final RunContext root = RunContext.background();
    private final Map<String, String> env;
    private final Function<S3Options, ObjectStoreProvider> stores;
    private final Supplier<OpenTelemetrySdk> openTelemetry;
    private final Clock clock;

    public StresserCommand() {
        this(
                System.getenv(),
                S3ObjectStoreProvider::new,
                StresserCommand::autoConfiguredOpenTelemetry,
                Clock.systemUTC());
    }

    @VisibleForTesting
    StresserCommand(
            @NonNull Map<String, String> env,
            @NonNull Function<S3Options, ObjectStoreProvider> stores,
            @NonNull Supplier<OpenTelemetrySdk> openTelemetry,
            @NonNull Clock clock) {
        this.env = env;
        this.stores = stores;
        this.openTelemetry = openTelemetry;
        this.clock = clock;
    }

    /** Stops issuing new operations. The run then reports what it collected so far. */
    public void interrupt() {
        log.info("Interrupt received, stopping the stress test");
        root.cancel();
    }

    @Override
    public Integer call() {
        final StresserConfig config;
        final RunConfiguration runConfig;
        try {
            config = new ConfigLoader(env).load(configFile);
            applyFlags(config);
            LogLevels.apply(config.getLogLevel());
            runConfig = ConfigLoader.validate(config);
        } catch (ConfigurationException e) {
            log.error("Configuration validation failed: {}", e.getMessage());
            spec.commandLine().usage(spec.commandLine().getErr());
            return EXIT_FAILURE;
        }
        log.debug("Effective configuration: {}", config);
        log.info(
                "Starting stress test run. duration={} concurrency={} operation={}",
                Durations.format(runConfig.duration()),
                runConfig.concurrency(),
                config.getOperationType());

        final OpenTelemetrySdk sdk = openTelemetry.get();
        try {
            return execute(config, runConfig, sdk);
        } finally {
            sdk.shutdown().join(10, TimeUnit.SECONDS);
        }
    }

    private void applyFlags(StresserConfig config) {
        config.setDuration(duration);
        config.setConcurrency(concurrency);
        config.setRandomize(randomize);
        config.setManifestPath(manifest == null ? null : manifest.toString());
        config.setOutputFile(outputFile);
        config.setProgressInterval(progressInterval);
        config.setSummaryJson(summaryJson);
        if (operationType != null) {
            config.setOperationType(operationType);
        }
        if (putSizeKb != null) {
            config.setPutObjectSizeKB(putSizeKb);
        }
        if (fileCount != null) {
            config.setFileCount(fileCount);
        }
        if (generateManifest != null) {
            config.setGenerateManifest(generateManifest);
        }
        if (logLevel != null) {
            config.setLogLevel(logLevel);
        }
    }

    private int execute(StresserConfig config, RunConfiguration runConfig, OpenTelemetrySdk sdk) {
        final Path manifestPath = Path.of(config.getManifestPath());
        ManifestSink sink = null;
        try {
            sink = openManifestSink(runConfig, manifestPath);
            final StressRunner runner =
                    StressRunner.builder(stores.apply(config.toS3Options()))
                            .keySource(runConfig.mode().readsKeys() ? new FileKeySource(manifestPath) : null)
                            .manifestSink(sink)
                            .openTelemetry(sdk)
                            .clock(clock)
                            .progressInterval(ConfigLoader.progressInterval(config))
                            .build();

            RunOutcome outcome;
            int exitCode = EXIT_OK;
            try {
                outcome = runner.run(root, runConfig);
            } catch (StressRunException e) {
                log.error("Stress test execution failed: {}", e.getMessage(), e.getCause());
                if (e.getPartialOutcome() == null) {
                    return EXIT_FAILURE;
                }
                outcome = e.getPartialOutcome();
                exitCode = EXIT_FAILURE;
            }
            if (outcome.termination() == RunOutcome.Termination.CANCELLED) {
                log.info("Test run ended early, reporting the results collected so far");
            }
            report(config, outcome);
            if (exitCode == EXIT_OK) {
                log.info("Stress test completed successfully");
            }
            return exitCode;
        } catch (StresserException e) {
            log.error("Error running stress test: {}", e.getMessage(), e.getCause());
            return EXIT_FAILURE;
        } finally {
            closeManifestSink(sink);
        }
    }

    @Nullable
    private static ManifestSink openManifestSink(RunConfiguration runConfig, Path path)
            throws ManifestException {
        if (runConfig.mode() != WorkloadMode.WRITE || !runConfig.generateManifest()) {
            return null;
        }
        final FileManifestSink sink = FileManifestSink.open(path);
        log.info("Recording generated keys in manifest file {}", path);
        return sink;
    }

    private static void closeManifestSink(@Nullable ManifestSink sink) {
        if (sink == null) {
            return;
        }
        try {
            sink.close();
        } catch (ManifestException e) {
            log.error("Failed to close manifest file: {}", e.getMessage(), e);
        }
    }

    private void report(StresserConfig config, RunOutcome outcome) {
        new SummaryOutput(spec.commandLine().getOut()).print(outcome);
        if (config.isSummaryJson()) {
            new LogOutput(true).report(SummarySnapshot.of(outcome, clock.instant()));
        }
        if (outcome.results().isEmpty()) {
            log.warn("No results collected, skipping CSV output");
            return;
        }
        final Path output = Path.of(config.getOutputFile());
        try {
            CsvResultsOutput.write(outcome.results(), output);
        } catch (IOException e) {
            log.error("Error writing results CSV {}: {}", output, e.getMessage(), e);
        }
    }

    static OpenTelemetrySdk autoConfiguredOpenTelemetry() {
        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(() -> OTEL_DEFAULTS)
                .build()
                .getOpenTelemetrySdk();
    }

    static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            final String version =
                    Optional.ofNullable(StresserCommand.class.getPackage().getImplementationVersion())
                            .orElse("dev");
            return new String[] {
                "stresser " + version,
                "JVM: " + Runtime.version()
            };
        }
    }
}
