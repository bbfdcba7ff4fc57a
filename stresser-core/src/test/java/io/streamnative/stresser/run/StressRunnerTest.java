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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.google.common.util.concurrent.Uninterruptibles;
import io.streamnative.stresser.api.KeySource;
import io.streamnative.stresser.api.ManifestSink;
import io.streamnative.stresser.api.ObjectStoreProvider;
import io.streamnative.stresser.api.OperationResult;
import io.streamnative.stresser.api.OperationType;
import io.streamnative.stresser.api.RunConfiguration;
import io.streamnative.stresser.api.WorkloadMode;
import io.streamnative.stresser.api.exceptions.ConfigurationException;
import io.streamnative.stresser.api.exceptions.ManifestException;
import io.streamnative.stresser.api.exceptions.ObjectStoreException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@Timeout(30)
class StressRunnerTest {
    static final List<String> KEYS = IntStream.range(0, 10).mapToObj(i -> "data/key-" + i).toList();

    @Mock ObjectStoreProvider mockProvider;

    static RunConfiguration read(Duration duration, int concurrency) {
        return new RunConfiguration(
                "bucket", duration, concurrency, WorkloadMode.READ, false, 0, 0, false);
    }

    static InMemoryObjectStore storeWithKeys(Duration latency) {
        var store = new InMemoryObjectStore(latency);
        KEYS.forEach(key -> store.with(key, 100));
        return store;
    }

    static void assertConsistent(RunOutcome outcome) {
        var stats = outcome.statistics();
        assertThat(stats.totalRequests()).isEqualTo(outcome.results().size());
        assertThat(stats.totalRequests())
                .isEqualTo(stats.totalGets() + stats.totalPuts())
                .isEqualTo(stats.successes() + stats.totalErrors());
        for (OperationResult result : outcome.results()) {
            assertThat(!result.hasTtfb() || !result.ttfb().isNegative()).isTrue();
            assertThat(!result.hasTtlb() || !result.ttlb().isNegative()).isTrue();
        }
    }

    @Test
    void readRunStopsAtDeadline() throws Exception {
        var store = storeWithKeys(Duration.ofMillis(1));
        var runner = StressRunner.builder(() -> store).keySource(() -> KEYS).build();

        var outcome = runner.run(RunContext.background(), read(Duration.ofMillis(300), 4));

        assertThat(outcome.termination()).isEqualTo(RunOutcome.Termination.DEADLINE_EXCEEDED);
        assertThat(outcome.results()).isNotEmpty();
        assertThat(outcome.results()).allSatisfy(r -> {
            assertThat(r.operation()).isEqualTo(OperationType.GET);
            assertThat(r.isSuccess()).isTrue();
            assertThat(KEYS).contains(r.key());
            assertThat(r.bytesDownloaded()).isEqualTo(100);
        });
        var stats = outcome.statistics();
        assertThat(stats.totalErrors()).isZero();
        assertThat(stats.totalBytesDownloaded()).isEqualTo(100L * stats.totalGets());
        assertThat(stats.duration()).isGreaterThanOrEqualTo(Duration.ofMillis(250));
        assertThat(stats.concurrency()).isEqualTo(4);
        assertThat(store.closed).isTrue();
        assertConsistent(outcome);
    }

    @Test
    void cancellationReturnsPromptlyWithPartialResults() throws Exception {
        var store = storeWithKeys(Duration.ofMillis(5));
        var runner = StressRunner.builder(() -> store).keySource(() -> KEYS).build();
        var root = RunContext.background();
        CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS).execute(root::cancel);

        long start = System.nanoTime();
        var outcome = runner.run(root, read(Duration.ofMinutes(10), 4));
        var elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
        assertThat(outcome.termination()).isEqualTo(RunOutcome.Termination.CANCELLED);
        assertThat(outcome.results()).isNotEmpty();
        assertThat(outcome.statistics().totalRequests()).isEqualTo(outcome.results().size());
        assertConsistent(outcome);
    }

    @Test
    void fixedCountGenerationIgnoresDuration() throws Exception {
        var store = new InMemoryObjectStore(Duration.ofMillis(2));
        var manifest = new RecordingManifestSink();
        var runner =
                StressRunner.builder(() -> store).manifestSink(manifest).pipelineCapacity(64).build();
        var config =
                new RunConfiguration(
                        "bucket", Duration.ofMillis(1), 4, WorkloadMode.WRITE, false, 512, 25, true);

        var outcome = runner.run(RunContext.background(), config);

        assertThat(outcome.termination()).isEqualTo(RunOutcome.Termination.COMPLETED);
        assertThat(outcome.results()).hasSize(25).allMatch(OperationResult::isSuccess);
        assertThat(store.objects).hasSize(25);
        assertThat(store.objects.keySet()).allMatch(key -> key.matches("stresser/job\\d+/\\d+-[a-zA-Z0-9]{8}\\.dat"));
        assertThat(store.objects.values()).allMatch(payload -> payload.length == 512);
        assertThat(manifest.keys).containsExactlyInAnyOrderElementsOf(store.objects.keySet());
        assertThat(manifest.closed).isFalse();
        assertThat(outcome.statistics().totalBytesUploaded()).isEqualTo(25L * 512);
        assertThat(outcome.statistics().averageUploadSize()).isEqualTo(512.0);
    }

    @Test
    void fixedCountGenerationKeepsEveryResult() throws Exception {
        var store = new InMemoryObjectStore();
        var runner = StressRunner.builder(() -> store).build();
        var config =
                new RunConfiguration(
                        "bucket", Duration.ofMinutes(1), 2, WorkloadMode.WRITE, false, 16, 200, false);

        var outcome = runner.run(RunContext.background(), config);

        assertThat(outcome.termination()).isEqualTo(RunOutcome.Termination.COMPLETED);
        assertThat(store.objects).hasSize(200);
        assertThat(outcome.results()).hasSize(200);
        assertThat(outcome.droppedResults()).isZero();
        assertThat(outcome.statistics().totalPuts()).isEqualTo(200);
        assertConsistent(outcome);
    }

    @Test
    void fullPipelineDropsResults() throws Exception {
        var store = storeWithKeys(Duration.ZERO);
        var runner =
                StressRunner.builder(() -> store)
                        .keySource(() -> KEYS)
                        .pipelineCapacity(1)
                        .listener(result -> Uninterruptibles.sleepUninterruptibly(5, TimeUnit.MILLISECONDS))
                        .build();

        var outcome = runner.run(RunContext.background(), read(Duration.ofMillis(300), 8));

        assertThat(outcome.droppedResults()).isPositive();
        assertThat(outcome.results()).isNotEmpty();
        assertThat(outcome.results().size() + outcome.droppedResults()).isLessThanOrEqualTo(store.gets.get());
        assertConsistent(outcome);
    }

    @Test
    void continuousWritesUseWorkerKeys() throws Exception {
        var store = new InMemoryObjectStore(Duration.ofMillis(1));
        var manifest = new RecordingManifestSink();
        var runner = StressRunner.builder(() -> store).manifestSink(manifest).build();
        var config =
                new RunConfiguration(
                        "bucket", Duration.ofMillis(200), 2, WorkloadMode.WRITE, false, 128, 0, false);

        var outcome = runner.run(RunContext.background(), config);

        assertThat(outcome.termination()).isEqualTo(RunOutcome.Termination.DEADLINE_EXCEEDED);
        assertThat(outcome.results()).isNotEmpty().allSatisfy(r -> {
            assertThat(r.operation()).isEqualTo(OperationType.PUT);
            assertThat(r.key()).matches("stresser/worker[01]/\\d+-[a-zA-Z0-9]{8}\\.dat");
            assertThat(r.hasTtfb()).isFalse();
        });
        // manifest generation disabled
        assertThat(manifest.keys).isEmpty();
        assertConsistent(outcome);
    }

    @Test
    void mixedRunRecordsFailures() throws Exception {
        var store = storeWithKeys(Duration.ofMillis(1));
        var keys = new ArrayList<>(KEYS);
        keys.add("data/missing");
        var runner = StressRunner.builder(() -> store).keySource(() -> keys).build();
        var config =
                new RunConfiguration(
                        "bucket", Duration.ofMillis(400), 3, WorkloadMode.MIXED, true, 64, 0, true);

        var outcome = runner.run(RunContext.background(), config);

        var stats = outcome.statistics();
        assertThat(stats.totalGets()).isPositive();
        assertThat(stats.totalPuts()).isPositive();
        assertThat(stats.getErrors()).isPositive();
        assertThat(stats.putErrors()).isZero();
        assertThat(outcome.results())
                .filteredOn(r -> !r.isSuccess())
                .allSatisfy(r -> {
                    assertThat(r.key()).isEqualTo("data/missing");
                    assertThat(r.error()).contains("NoSuchKey");
                    assertThat(r.hasTtfb()).isFalse();
                    assertThat(r.hasTtlb()).isFalse();
                });
        assertConsistent(outcome);
    }

    @Test
    void listenersSeeEveryResult() throws Exception {
        var store = storeWithKeys(Duration.ofMillis(1));
        var seen = new AtomicInteger();
        var runner =
                StressRunner.builder(() -> store)
                        .keySource(() -> KEYS)
                        .listener(result -> seen.incrementAndGet())
                        .progressInterval(Duration.ofMillis(50))
                        .build();

        var outcome = runner.run(RunContext.background(), read(Duration.ofMillis(200), 2));

        assertThat(seen.get()).isEqualTo(outcome.results().size());
    }

    @Test
    void readModeRequiresKeySource() throws Exception {
        var runner = StressRunner.builder(mockProvider).build();

        assertThatThrownBy(() -> runner.run(RunContext.background(), read(Duration.ofSeconds(1), 1)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("read");
        verify(mockProvider, never()).create();
    }

    @Test
    void keySourceFailureIsSetupError() throws Exception {
        KeySource failing =
                () -> {
                    throw new ManifestException("manifest file m.txt is empty or contains no valid keys");
                };
        var runner = StressRunner.builder(mockProvider).keySource(failing).build();

        assertThatThrownBy(() -> runner.run(RunContext.background(), read(Duration.ofSeconds(1), 1)))
                .isInstanceOf(ManifestException.class)
                .hasMessageContaining("no valid keys");
        verify(mockProvider, never()).create();
    }

    @Test
    void emptyKeySourceIsSetupError() {
        var runner = StressRunner.builder(mockProvider).keySource(List::of).build();

        assertThatThrownBy(() -> runner.run(RunContext.background(), read(Duration.ofSeconds(1), 1)))
                .isInstanceOf(ManifestException.class);
    }

    @Test
    void storeConstructionFailureIsSetupError() {
        ObjectStoreProvider provider =
                () -> {
                    throw new ObjectStoreException("unable to load credentials");
                };
        var runner = StressRunner.builder(provider).keySource(() -> KEYS).build();

        assertThatThrownBy(() -> runner.run(RunContext.background(), read(Duration.ofSeconds(1), 1)))
                .isInstanceOf(ObjectStoreException.class)
                .hasMessage("unable to load credentials");
    }

    @Test
    void workerCrashFailsTheRun() {
        var calls = new AtomicInteger();
        InMemoryObjectStore crashing =
                new InMemoryObjectStore() {
                    @Override
                    public InputStream get(String bucket, String key) throws ObjectStoreException {
                        if (calls.incrementAndGet() > 5) {
                            throw new StoreCrash();
                        }
                        return super.get(bucket, key);
                    }
                };
        KEYS.forEach(key -> crashing.with(key, 10));
        var runner = StressRunner.builder(() -> crashing).keySource(() -> KEYS).build();

        assertThatThrownBy(() -> runner.run(RunContext.background(), read(Duration.ofMinutes(10), 1)))
                .isInstanceOfSatisfying(
                        StressRunException.class,
                        ex -> {
                            assertThat(ex.getCause()).isInstanceOf(StoreCrash.class);
                            var partial = ex.getPartialOutcome();
                            assertThat(partial.termination()).isEqualTo(RunOutcome.Termination.FAILED);
                            assertThat(partial.statistics().totalRequests()).isEqualTo(partial.results().size());
                            assertThat(partial.results()).hasSizeLessThanOrEqualTo(5);
                        });
    }

    @Test
    void builderRejectsInvalidSettings() {
        var builder = StressRunner.builder(mockProvider);
        assertThatThrownBy(() -> builder.pipelineCapacity(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.progressInterval(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static final class StoreCrash extends Error {
        StoreCrash() {
            super("store crashed");
        }
    }

    static final class RecordingManifestSink implements ManifestSink {
        final List<String> keys = Collections.synchronizedList(new ArrayList<>());
        volatile boolean closed;

        @Override
        public void append(String key) {
            keys.add(key);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
