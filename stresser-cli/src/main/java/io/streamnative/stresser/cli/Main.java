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

import com.google.common.util.concurrent.Uninterruptibles;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

@Slf4j
public final class Main {
    private static final long REPORT_GRACE_SECONDS = 60;

    private Main() {}

    public static void main(String[] args) {
        final StresserCommand command = new StresserCommand();
        final CountDownLatch finished = new CountDownLatch(1);
        Runtime.getRuntime()
                .addShutdownHook(
                        new Thread(
                                () -> {
                                    if (finished.getCount() == 0) {
                                        return;
                                    }
                                    command.interrupt();
                                    if (!Uninterruptibles.awaitUninterruptibly(
                                            finished, REPORT_GRACE_SECONDS, TimeUnit.SECONDS)) {
                                        log.warn(
                                                "Results were not reported within {}s, exiting anyway",
                                                REPORT_GRACE_SECONDS);
                                    }
                                },
                                "stresser-shutdown"));

        final int exitCode;
        try {
            exitCode = new CommandLine(command).execute(args);
        } finally {
            finished.countDown();
        }
        System.exit(exitCode);
    }
}
