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
package io.streamnative.stresser.cli;

import java.util.Locale;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

/** Switches the Log4j root level at runtime. */
@UtilityClass
class LogLevels {

    /**
     * Applies one of {@code debug}, {@code info}, {@code warn} or {@code error}. Unknown names fall
     * back to {@code info}.
     */
    void apply(@NonNull String level) {
        Configurator.setRootLevel(toLevel(level));
    }

    Level toLevel(String level) {
        return switch (level.trim().toLowerCase(Locale.ROOT)) {
            case "debug" -> Level.DEBUG;
            case "warn" -> Level.WARN;
            case "error" -> Level.ERROR;
            default -> Level.INFO;
        };
    }
}
