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

import org.junit.jupiter.api.Test;

class WorkloadModeTest {

    @Test
    void fromStringIgnoresCase() {
        assertThat(WorkloadMode.fromString("read")).isEqualTo(WorkloadMode.READ);
        assertThat(WorkloadMode.fromString("WRITE")).isEqualTo(WorkloadMode.WRITE);
        assertThat(WorkloadMode.fromString(" Mixed ")).isEqualTo(WorkloadMode.MIXED);
    }

    @Test
    void fromStringRejectsUnknown() {
        assertThatThrownBy(() -> WorkloadMode.fromString("scan"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scan");
    }

    @Test
    void capabilities() {
        assertThat(WorkloadMode.READ.readsKeys()).isTrue();
        assertThat(WorkloadMode.READ.writesObjects()).isFalse();
        assertThat(WorkloadMode.WRITE.readsKeys()).isFalse();
        assertThat(WorkloadMode.WRITE.writesObjects()).isTrue();
        assertThat(WorkloadMode.MIXED.readsKeys()).isTrue();
        assertThat(WorkloadMode.MIXED.writesObjects()).isTrue();
    }
}
