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
package io.streamnative.stresser.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RunConfigurationTest {

    @Test
    void fixedCountGenerationOnlyInWriteMode() {
        var write = new RunConfiguration("b", Duration.ofSeconds(1), 1, WorkloadMode.WRITE, false, 1, 5, true);
        var mixed = new RunConfiguration("b", Duration.ofSeconds(1), 1, WorkloadMode.MIXED, false, 1, 5, true);
        var unbounded =
                new RunConfiguration("b", Duration.ofSeconds(1), 1, WorkloadMode.WRITE, false, 1, 0, true);
        assertThat(write.isFixedCountGeneration()).isTrue();
        assertThat(mixed.isFixedCountGeneration()).isFalse();
        assertThat(unbounded.isFixedCountGeneration()).isFalse();
    }

    @Test
    void readModeDoesNotNeedPutSize() {
        var config = new RunConfiguration("b", Duration.ofSeconds(1), 1, WorkloadMode.READ, true, 0, 0, false);
        assertThat(config.putSizeBytes()).isZero();
    }

    @ParameterizedTest
    @CsvSource({
        "' ', 1000, 1, READ, 1, 0",
        "b, 0, 1, READ, 1, 0",
        "b, 1000, 0, READ, 1, 0",
        "b, 1000, 1, WRITE, 0, 0",
        "b, 1000, 1, MIXED, 0, 0",
        "b, 1000, 1, WRITE, 1, -1"
    })
    void rejectsInvalidValues(
            String bucket, long durationMs, int concurrency, WorkloadMode mode, int putSize, int files) {
        assertThatThrownBy(
                        () ->
                                new RunConfiguration(
                                        bucket,
                                        Duration.ofMillis(durationMs),
                                        concurrency,
                                        mode,
                                        false,
                                        putSize,
                                        files,
                                        false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
