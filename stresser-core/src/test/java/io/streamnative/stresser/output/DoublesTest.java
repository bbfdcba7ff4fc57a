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
package io.streamnative.stresser.output;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DoublesTest {

    @Test
    void format2Scale() {
        assertThat(Doubles.format2Scale(1.005)).isEqualTo(1.01);
        assertThat(Doubles.format2Scale(2.344)).isEqualTo(2.34);
        assertThat(Doubles.format2Scale(0)).isEqualTo(0.0);
        assertThat(Doubles.format2Scale(Double.NaN)).isNaN();
    }
}
