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

import io.streamnative.stresser.api.ObjectStore;
import io.streamnative.stresser.api.ObjectStoreProvider;
import io.streamnative.stresser.api.exceptions.ObjectStoreException;
import java.net.URI;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.SdkHttpConfigurationOption;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.utils.AttributeMap;

/** Builds {@link S3ObjectStore}s from {@link S3Options}. Path-style addressing is always used. */
@Slf4j
@RequiredArgsConstructor
public class S3ObjectStoreProvider implements ObjectStoreProvider {

    @NonNull private final S3Options options;

    @Override
    public ObjectStore create() throws ObjectStoreException {
        final SdkHttpClient httpClient = httpClient();
        try {
            final S3Client client =
                    S3Client.builder()
                            .region(Region.of(options.region()))
                            .endpointOverride(URI.create(options.endpoint()))
                            .forcePathStyle(true)
                            .credentialsProvider(credentials())
                            .httpClient(httpClient)
                            .build();
            log.info(
                    "S3 client created. endpoint={} region={} bucket={}",
                    options.endpoint(),
                    options.region(),
                    options.bucket());
            return new S3ObjectStore(client, httpClient);
        } catch (SdkException | IllegalArgumentException e) {
            httpClient.close();
            throw new ObjectStoreException(
                    "failed to create S3 client for endpoint " + options.endpoint() + ": " + e.getMessage(),
                    e);
        }
    }

    private SdkHttpClient httpClient() {
        if (!options.insecureSkipVerify()) {
            return ApacheHttpClient.builder().build();
        }
        log.warn("Disabling TLS certificate verification for {}", options.endpoint());
        return ApacheHttpClient.builder()
                .buildWithDefaults(
                        AttributeMap.builder()
                                .put(SdkHttpConfigurationOption.TRUST_ALL_CERTIFICATES, true)
                                .build());
    }

    private AwsCredentialsProvider credentials() {
        if (options.hasStaticCredentials()) {
            log.info("Using static credentials from configuration");
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(options.accessKey(), options.secretKey()));
        }
        log.info("Using the default AWS credentials provider chain");
        return DefaultCredentialsProvider.create();
    }
}
