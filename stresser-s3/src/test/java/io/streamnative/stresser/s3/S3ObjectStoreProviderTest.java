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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.streamnative.stresser.api.exceptions.ObjectStoreException;
import org.junit.jupiter.api.Test;

class S3ObjectStoreProviderTest {

    @Test
    void createsStoreWithStaticCredentials() throws Exception {
        var options =
                new S3Options("http://localhost:9000", "us-east-1", "bucket", "key", "secret", false);
        assertThat(options.hasStaticCredentials()).isTrue();

        try (var store = new S3ObjectStoreProvider(options).create()) {
            assertThat(store).isInstanceOf(S3ObjectStore.class);
        }
    }

    @Test
    void createsStoreWithDefaultChainAndInsecureTransport() throws Exception {
        var options = new S3Options("https://localhost:9443", "eu-west-1", "bucket", "key", null, true);
        assertThat(options.hasStaticCredentials()).isFalse();

        try (var store = new S3ObjectStoreProvider(options).create()) {
            assertThat(store).isNotNull();
        }
    }

    @Test
    void malformedEndpointIsAConstructionFailure() {
        var options = new S3Options("http://bad host:9000", "us-east-1", "bucket", null, null, false);

        assertThatThrownBy(() -> new S3ObjectStoreProvider(options).create())
                .isInstanceOf(ObjectStoreException.class)
                .hasMessageStartingWith("failed to create S3 client for endpoint http://bad host:9000");
    }

    @Test
    void credentialsAreNotRendered() {
        var options =
                new S3Options("http://localhost:9000", "us-east-1", "bucket", "AKIA", "s3cr3t", false);

        assertThat(options.toString()).doesNotContain("AKIA").doesNotContain("s3cr3t");
    }
}
