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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.streamnative.stresser.api.exceptions.ObjectStoreException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

@ExtendWith(MockitoExtension.class)
class S3ObjectStoreTest {

    @Mock S3Client client;

    @Test
    void getReturnsBody() throws Exception {
        var body =
                new ResponseInputStream<>(
                        GetObjectResponse.builder().contentLength(5L).build(),
                        AbortableInputStream.create(new ByteArrayInputStream("hello".getBytes(UTF_8))));
        when(client.getObject(any(GetObjectRequest.class))).thenReturn(body);

        var store = new S3ObjectStore(client, null);
        try (InputStream in = store.get("bucket", "dir/key")) {
            assertThat(new String(in.readAllBytes(), UTF_8)).isEqualTo("hello");
        }

        var request = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(client).getObject(request.capture());
        assertThat(request.getValue().bucket()).isEqualTo("bucket");
        assertThat(request.getValue().key()).isEqualTo("dir/key");
    }

    @Test
    void getWrapsServiceErrors() {
        when(client.getObject(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("The specified key does not exist.").build());

        var store = new S3ObjectStore(client, null);
        assertThatThrownBy(() -> store.get("bucket", "missing"))
                .isInstanceOf(ObjectStoreException.class)
                .hasMessageContaining("The specified key does not exist.")
                .hasCauseInstanceOf(NoSuchKeyException.class);
    }

    @Test
    void putSendsPayload() throws Exception {
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());

        var store = new S3ObjectStore(client, null);
        store.put("bucket", "k", new byte[] {1, 2, 3});

        var request = ArgumentCaptor.forClass(PutObjectRequest.class);
        var body = ArgumentCaptor.forClass(RequestBody.class);
        verify(client).putObject(request.capture(), body.capture());
        assertThat(request.getValue().bucket()).isEqualTo("bucket");
        assertThat(request.getValue().key()).isEqualTo("k");
        assertThat(request.getValue().contentLength()).isEqualTo(3L);
        assertThat(body.getValue().optionalContentLength()).contains(3L);
    }

    @Test
    void putWrapsClientErrors() {
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        var store = new S3ObjectStore(client, null);
        assertThatThrownBy(() -> store.put("bucket", "k", new byte[1]))
                .isInstanceOf(ObjectStoreException.class)
                .hasMessage("Unable to execute HTTP request");
    }

    @Test
    void closeReleasesClientAndTransportOnce() throws Exception {
        var httpClient = mock(SdkHttpClient.class);
        var store = new S3ObjectStore(client, httpClient);

        store.close();
        store.close();

        verify(client, times(1)).close();
        verify(httpClient, times(1)).close();
    }
}
