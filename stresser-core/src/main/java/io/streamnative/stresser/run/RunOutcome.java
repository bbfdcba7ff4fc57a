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
package io.streamnative.stresser.run;

import io.streamnative.stresser.api.OperationResult;
import io.streamnative.stresser.stats.AggregateStatistics;
import java.util.List;

/**
 * What a run produced.
 *
 * @param results every emitted result, in the order the consumer received them
 * @param statistics the frozen aggregate of {@code results}
 * @param termination why the run stopped issuing operations
 * @param droppedResults results lost because the pipeline was full
 */
public record RunOutcome(
        List<OperationResult> results,
        AggregateStatistics statistics,
        Termination termination,
        long droppedResults) {

    public enum Termination {
        /** Every fixed-count job was processed. */
        COMPLETED,
        /** The configured duration elapsed. */
        DEADLINE_EXCEEDED,
        /** The run was cancelled from outside, for example by an operator interrupt. */
        CANCELLED,
        /** A worker or the consumer failed unexpectedly. */
        FAILED;

        static Termination of(RunContext.State state) {
            return switch (state) {
                case ACTIVE -> COMPLETED;
                case DEADLINE_EXCEEDED -> DEADLINE_EXCEEDED;
                case CANCELLED -> CANCELLED;
                case FAILED -> FAILED;
            };
        }
    }
}
