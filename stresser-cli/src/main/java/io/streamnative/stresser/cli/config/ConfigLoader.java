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
package io.streamnative.stresser.cli.config;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;
import io.streamnative.stresser.api.RunConfiguration;
import io.streamnative.stresser.api.WorkloadMode;
import io.streamnative.stresser.api.exceptions.ConfigurationException;
import io.streamnative.stresser.util.Durations;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link StresserConfig} from defaults, an optional YAML file and the environment, and
 * validates the result once the command line has been applied on top.
 */
@Slf4j
@RequiredArgsConstructor
public class ConfigLoader {
    public static final String ENV_ENDPOINT = "AWS_ENDPOINT_URL";
    public static final String ENV_REGION = "AWS_REGION";
    public static final String ENV_BUCKET = "S3_BUCKET";
    public static final String ENV_ACCESS_KEY = "AWS_ACCESS_KEY_ID";
    public static final String ENV_SECRET_KEY = "AWS_SECRET_ACCESS_KEY";
    public static final String ENV_INSECURE_SKIP_VERIFY = "STRESSER_INSECURE_SKIP_VERIFY";
    public static final String ENV_OPERATION_TYPE = "STRESSER_OPERATION_TYPE";
    public static final String ENV_PUT_SIZE_KB = "STRESSER_PUT_SIZE_KB";
    public static final String ENV_FILE_COUNT = "STRESSER_FILE_COUNT";
    public static final String ENV_GENERATE_MANIFEST = "STRESSER_GENERATE_MANIFEST";
    public static final String ENV_LOG_LEVEL = "STRESSER_LOG_LEVEL";

    static final Set<String> LOG_LEVELS = ImmutableSet.of("debug", "info", "warn", "error");

    private static final ObjectMapper yaml =
            new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @NonNull private final Map<String, String> env;

    /**
     * Loads the defaults, overlays the YAML file when one is given, then the environment.
     *
     * @param configFile the YAML file, or {@code null}
     * @throws ConfigurationException if the file cannot be read or parsed
     */
    public StresserConfig load(@Nullable Path configFile) throws ConfigurationException {
        final StresserConfig config = new StresserConfig();
        if (configFile != null) {
            readYaml(configFile, config);
        }
        applyEnvironment(config);
        return config;
    }

    private static void readYaml(Path configFile, StresserConfig config)
            throws ConfigurationException {
        final String content;
        try {
            content = Files.readString(configFile, UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException(
                    "failed to read config file " + configFile + ": " + e.getMessage(), e);
        }
        if (content.isBlank()) {
            return;
        }
        try {
            yaml.readerForUpdating(config).readValue(content);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(
                    "failed to parse config file " + configFile + ": " + e.getOriginalMessage(), e);
        }
        log.debug("loaded config file {}", configFile);
    }

    @VisibleForTesting
    void applyEnvironment(StresserConfig config) {
        env(ENV_ENDPOINT).ifPresent(config::setEndpoint);
        env(ENV_REGION).ifPresent(config::setRegion);
        env(ENV_BUCKET).ifPresent(config::setBucket);
        env(ENV_ACCESS_KEY).ifPresent(config::setAccessKey);
        env(ENV_SECRET_KEY).ifPresent(config::setSecretKey);
        env(ENV_OPERATION_TYPE).ifPresent(config::setOperationType);

        // only the exact literals switch a flag, anything else leaves it unchanged
        env(ENV_INSECURE_SKIP_VERIFY)
                .ifPresent(v -> applyBoolean(v, config::setInsecureSkipVerify));
        env(ENV_GENERATE_MANIFEST).ifPresent(v -> applyBoolean(v, config::setGenerateManifest));

        env(ENV_PUT_SIZE_KB)
                .ifPresent(
                        v -> {
                            final Integer size = Ints.tryParse(v.trim());
                            if (size != null && size > 0) {
                                config.setPutObjectSizeKB(size);
                            } else {
                                log.warn(
                                        "Invalid {} value '{}', keeping {} KB",
                                        ENV_PUT_SIZE_KB,
                                        v,
                                        config.getPutObjectSizeKB());
                            }
                        });
        env(ENV_FILE_COUNT)
                .ifPresent(
                        v -> {
                            final Integer count = Ints.tryParse(v.trim());
                            if (count != null && count > 0) {
                                config.setFileCount(count);
                            } else {
                                log.warn(
                                        "Invalid {} value '{}', keeping {}",
                                        ENV_FILE_COUNT,
                                        v,
                                        config.getFileCount());
                            }
                        });
        env(ENV_LOG_LEVEL)
                .ifPresent(
                        v -> {
                            final String level = v.trim().toLowerCase(Locale.ROOT);
                            if (LOG_LEVELS.contains(level)) {
                                config.setLogLevel(level);
                            } else {
                                log.warn(
                                        "Invalid {} value '{}', keeping '{}'",
                                        ENV_LOG_LEVEL,
                                        v,
                                        config.getLogLevel());
                            }
                        });
    }

    private Optional<String> env(String name) {
        return Optional.ofNullable(Strings.emptyToNull(env.get(name)));
    }

    private static void applyBoolean(String value, Consumer<Boolean> setter) {
        if ("true".equals(value)) {
            setter.accept(true);
        } else if ("false".equals(value)) {
            setter.accept(false);
        }
    }

    /**
     * Checks the merged configuration and derives the run parameters from it. The operation type
     * and log level are normalized to lower case.
     *
     * @throws ConfigurationException naming the first invalid setting
     */
    public static RunConfiguration validate(@NonNull StresserConfig config)
            throws ConfigurationException {
        if (Strings.isNullOrEmpty(config.getEndpoint())) {
            throw new ConfigurationException(
                    "endpoint URL is required (set via --config file, " + ENV_ENDPOINT + " env var)");
        }
        if (Strings.isNullOrEmpty(config.getBucket())) {
            throw new ConfigurationException(
                    "bucket name is required (set via --config file, " + ENV_BUCKET + " env var)");
        }
        if (Strings.isNullOrEmpty(config.getDuration())) {
            throw new ConfigurationException("duration (-d) is required");
        }
        final Duration duration = Durations.parse(config.getDuration());
        if (duration.isZero() || duration.isNegative()) {
            throw new ConfigurationException(
                    "duration (-d) must be greater than 0: " + config.getDuration());
        }
        if (config.getConcurrency() <= 0) {
            throw new ConfigurationException("concurrency (-c) must be greater than 0");
        }
        if (Strings.isNullOrEmpty(config.getManifestPath())) {
            throw new ConfigurationException("manifest file path argument is required");
        }
        if (Strings.isNullOrEmpty(config.getOutputFile())) {
            throw new ConfigurationException("output csv file path (-o) is required");
        }

        final WorkloadMode mode;
        try {
            mode = WorkloadMode.fromString(Strings.nullToEmpty(config.getOperationType()));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    "invalid operation type (--op): "
                            + config.getOperationType()
                            + ". Must be 'read', 'write', or 'mixed'");
        }
        config.setOperationType(mode.name().toLowerCase(Locale.ROOT));

        final String level = Strings.nullToEmpty(config.getLogLevel()).toLowerCase(Locale.ROOT);
        if (!LOG_LEVELS.contains(level)) {
            throw new ConfigurationException(
                    "invalid log level: "
                            + config.getLogLevel()
                            + ". Must be 'debug', 'info', 'warn', or 'error'");
        }
        config.setLogLevel(level);

        if (mode.writesObjects() && config.getPutObjectSizeKB() <= 0) {
            throw new ConfigurationException(
                    "put object size (--putsize) must be greater than 0 KB for 'write' or 'mixed' mode");
        }
        if (config.getFileCount() < 0) {
            throw new ConfigurationException("file count (--files) must not be negative");
        }
        final int putSizeBytes;
        try {
            putSizeBytes = Math.multiplyExact(Math.max(config.getPutObjectSizeKB(), 0), 1024);
        } catch (ArithmeticException e) {
            throw new ConfigurationException(
                    "put object size (--putsize) is too large: " + config.getPutObjectSizeKB() + " KB");
        }
        progressInterval(config);

        return new RunConfiguration(
                config.getBucket(),
                duration,
                config.getConcurrency(),
                mode,
                config.isRandomize(),
                putSizeBytes,
                config.getFileCount(),
                config.isGenerateManifest());
    }

    /**
     * The interval of the periodic progress line. {@link Duration#ZERO} disables it.
     *
     * @throws ConfigurationException if the interval cannot be parsed
     */
    public static Duration progressInterval(@NonNull StresserConfig config)
            throws ConfigurationException {
        if (Strings.isNullOrEmpty(config.getProgressInterval())) {
            return Duration.ZERO;
        }
        final Duration interval = Durations.parse(config.getProgressInterval());
        if (interval.isNegative()) {
            throw new ConfigurationException(
                    "progress interval must not be negative: " + config.getProgressInterval());
        }
        return interval;
    }
}
