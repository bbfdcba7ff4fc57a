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
package io.streamnative.stresser.s3;

import com.google.common.base.Strings;
import javax.annotation.Nullable;
import lombok.NonNull;

/**
 * Connection settings of an S3-compatible endpoint.
 *
 * @param endpoint the service URL, including its scheme
 * @param region the signing region
 * @param bucket the bucket the run targets, used for logging only
 * @param accessKey static access key, or {@code null} to use the default credentials chain
 * @param secretKey static secret key, or {@code null} to use the default credentials chain
 * @param insecureSkipVerify whether TLS certificates are accepted without verification
 */
public record S3Options(
        @NonNull String endpoint,
        @NonNull String region,
        @NonNull String bucket,
        @Nullable String accessKey,
        @Nullable String secretKey,
        boolean insecureSkipVerify) {

    public static final String DEFAULT_REGION = "us-east-1";

    public boolean hasStaticCredentials() {
        return !Strings.isNullOrEmpty(accessKey) && !Strings.isNullOrEmpty(secretKey);
    }

    @Override
    public String toString() {
        // credentials stay out of logs
        return "S3Options(endpoint="
                + endpoint
                + ", region="
                + region
                + ", bucket="
                + bucket
                + ", staticCredentials="
                + hasStaticCredentials()
                + ", insecureSkipVerify="
                + insecureSkipVerify
                + ")";
    }
}
