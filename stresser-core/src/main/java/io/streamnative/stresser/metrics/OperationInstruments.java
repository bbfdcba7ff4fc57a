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
package io.streamnative.stresser.metrics;

import com.google.common.collect.Lists;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.streamnative.stresser.api.OperationResult;
import io.streamnative.stresser.api.OperationType;
import io.streamnative.stresser.run.ResultListener;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;

/**
 * Publishes operation counts, latencies and transferred bytes through OpenTelemetry. Latencies are
 * recorded in seconds from the TTLB of successful operations.
 */
public final class OperationInstruments implements ResultListener {
    public static final String METER_NAME = "io.streamnative.stresser";
    public static final String OPERATION_COUNTER = "stresser.op";
    public static final String OPERATION_LATENCY = "stresser.op.latency";
    public static final String OPERATION_BYTES = "stresser.op.bytes";

    static final List<Double> LATENCY_BUCKET =
            Lists.newArrayList(
                    .0005, .001, .0025, .005, .01, .025, .05, .1, .25, .5, 1.0, 2.5, 5.0, 10.0, 30.0, 60.0,
                    90.0, 120.0, 240.0);
    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final LongCounter operationCounter;
    private final DoubleHistogram operationLatency;
    private final LongCounter operationBytes;

    private final Attributes getSuccessAttributes;
    private final Attributes getFailedAttributes;
    private final Attributes putSuccessAttributes;
    private final Attributes putFailedAttributes;
    private final Attributes downloadAttributes;
    private final Attributes uploadAttributes;

    public OperationInstruments(@NonNull OpenTelemetry openTelemetry, @NonNull String bucket) {
        final Meter meter = openTelemetry.getMeter(METER_NAME);
        this.operationCounter =
                meter
                        .counterBuilder(OPERATION_COUNTER)
                        .setDescription("object store operations issued by the stresser")
                        .setUnit(Unit.Requests.toString())
                        .build();
        this.operationLatency =
                meter
                        .histogramBuilder(OPERATION_LATENCY)
                        .setDescription("object store operation latency until the last byte")
                        .setUnit(Unit.Seconds.toString())
                        .setExplicitBucketBoundariesAdvice(LATENCY_BUCKET)
                        .build();
        this.operationBytes =
                meter
                        .counterBuilder(OPERATION_BYTES)
                        .setDescription("object payload bytes transferred by successful operations")
                        .setUnit(Unit.Bytes.toString())
                        .build();

        this.getSuccessAttributes = operationAttributes(bucket, "get", "success");
        this.getFailedAttributes = operationAttributes(bucket, "get", "failed");
        this.putSuccessAttributes = operationAttributes(bucket, "put", "success");
        this.putFailedAttributes = operationAttributes(bucket, "put", "failed");
        this.downloadAttributes =
                Attributes.builder().put("bucket", bucket).put("direction", "download").build();
        this.uploadAttributes =
                Attributes.builder().put("bucket", bucket).put("direction", "upload").build();
    }

    private static Attributes operationAttributes(String bucket, String type, String response) {
        return Attributes.builder()
                .put("bucket", bucket)
                .put("type", type)
                .put("response", response)
                .build();
    }

    @Override
    public void onResult(@NonNull OperationResult result) {
        final boolean get = result.operation() == OperationType.GET;
        if (!result.isSuccess()) {
            operationCounter.add(1, get ? getFailedAttributes : putFailedAttributes);
            return;
        }
        final Attributes attributes = get ? getSuccessAttributes : putSuccessAttributes;
        operationCounter.add(1, attributes);
        operationLatency.record(result.ttlb().toNanos() / NANOS_PER_SECOND, attributes);
        if (get) {
            operationBytes.add(result.bytesDownloaded(), downloadAttributes);
        } else {
            operationBytes.add(result.bytesUploaded(), uploadAttributes);
        }
    }
}
