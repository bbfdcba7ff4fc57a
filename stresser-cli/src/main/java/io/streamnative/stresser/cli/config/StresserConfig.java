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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.streamnative.stresser.s3.S3Options;
import lombok.Data;

/**
 * The merged settings of one invocation. The YAML file binds the properties below by name; the
 * invocation-only settings (duration, concurrency, paths) are only ever set from the command line.
 */
@Data
public class StresserConfig {
    public static final String DEFAULT_OPERATION_TYPE = "read";
    public static final int DEFAULT_PUT_SIZE_KB = 1024;
    public static final int DEFAULT_FILE_COUNT = 0;
    public static final String DEFAULT_LOG_LEVEL = "info";

    /* S3 connection */
    private String endpoint;
    private String region = S3Options.DEFAULT_REGION;
    private String bucket;
    private String accessKey;
    private String secretKey;
    private boolean insecureSkipVerify;

    /* Workload */
    private String operationType = DEFAULT_OPERATION_TYPE;

    @JsonProperty("putObjectSizeKB")
    private int putObjectSizeKB = DEFAULT_PUT_SIZE_KB;

    private int fileCount = DEFAULT_FILE_COUNT;
    private boolean generateManifest = true;
    private String logLevel = DEFAULT_LOG_LEVEL;

    /* Invocation */
    @JsonIgnore private String duration;
    @JsonIgnore private int concurrency;
    @JsonIgnore private boolean randomize;
    @JsonIgnore private String manifestPath;
    @JsonIgnore private String outputFile;
    @JsonIgnore private String progressInterval;
    @JsonIgnore private boolean summaryJson;

    public S3Options toS3Options() {
        return new S3Options(endpoint, region, bucket, accessKey, secretKey, insecureSkipVerify);
    }

    @Override
    public String toString() {
        return "StresserConfig(endpoint="
                + endpoint
                + ", region="
                + region
                + ", bucket="
                + bucket
                + ", insecureSkipVerify="
                + insecureSkipVerify
                + ", operationType="
                + operationType
                + ", putObjectSizeKB="
                + putObjectSizeKB
                + ", fileCount="
                + fileCount
                + ", generateManifest="
                + generateManifest
                + ", logLevel="
                + logLevel
                + ", duration="
                + duration
                + ", concurrency="
                + concurrency
                + ")";
    }
}
