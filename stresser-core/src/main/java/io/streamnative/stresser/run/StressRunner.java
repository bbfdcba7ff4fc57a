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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.opentelemetry.api.OpenTelemetry;
import io.streamnative.stresser.api.KeySource;
import io.streamnative.stresser.api.ManifestSink;
import io.streamnative.stresser.api.ObjectStore;
import io.streamnative.stresser.api.ObjectStoreProvider;
import io.streamnative.stresser.api.RunConfiguration;
import io.streamnative.stresser.api.WorkloadMode;
import io.streamnative.stresser.api.exceptions.ConfigurationException;
import io.streamnative.stresser.api.exceptions.ManifestException;
import io.streamnative.stresser.api.exceptions.ObjectStoreException;
import io.streamnative.stresser.api.exceptions.StresserException;
import io.streamnative.stresser.generator.Generators;
import io.streamnative.stresser.metrics.OperationInstruments;
import io.streamnative.stresser.operations.ObjectOperations;
import io.streamnative.stresser.operations.Operations;
import io.streamnative.stresser.output.ProgressReporter;
import io.streamnative.stresser.stats.AggregateStatistics;
import io.streamnative.stresser.stats.StatisticsAggregator;
import io.streamnative.stresser.util.Durations;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Queue;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.LongAdder;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a time-boxed stress test: fans out the workers, collects their results on the calling
 * thread and freezes the statistics once every worker has stopped.
 *
 * <p>New operations are issued until the configured duration elapses or the caller's context is
 * done, whichever comes first. Operations in flight at that moment complete on their own before
 * their worker stops, so a run can outlast its duration by one operation.
 */
@Slf4j
public final class StressRunner {
    private final ObjectStoreProvider storeProvider;
    @Nullable private final KeySource keySource;
    @Nullable private final ManifestSink manifestSink;
    private final OpenTelemetry openTelemetry;
    private final Clock clock;
    private final Ticker ticker;
    private final int pipelineCapacity;
    private final Duration progressInterval;
    private final List<ResultListener> listeners;

    private StressRunner(Builder builder) {
        this.storeProvider = builder.storeProvider;
        this.keySource = builder.keySource;
        this.manifestSink = builder.manifestSink;
        this.openTelemetry = builder.openTelemetry;
        this.clock = builder.clock;
        this.ticker = builder.ticker;
        this.pipelineCapacity = builder.pipelineCapacity;
        this.progressInterval = builder.progressInterval;
        this.listeners = builder.listeners.build();
    }

    public static Builder builder(@NonNull ObjectStoreProvider storeProvider) {
        return new Builder(storeProvider);
    }

    /**
     * Executes a run.
     *
     * @param parent the caller's context. Cancelling it ends the run early with the results so far.
     * @param config the run parameters
     * @return the results and statistics of a run that expired, was cancelled or, for fixed-count
     *     generation, processed every job
     * @throws ConfigurationException if a read workload has no key source
     * @throws ManifestException if the keys cannot be loaded
     * @throws ObjectStoreException if the store client cannot be created
     * @throws StressRunException if the run failed unexpectedly. The partial outcome is attached.
     */
    public RunOutcome run(@NonNull RunContext parent, @NonNull RunConfiguration config)
            throws StresserException {
        final List<String> keys = loadKeys(config);
        final ObjectStore store = storeProvider.create();
        log.info(
                "starting stress test: concurrency={}, duration={}, operation={}, randomizeReads={}, putSizeBytes={}, fileCount={}",
                config.concurrency(),
                Durations.format(config.duration()),
                config.mode().name().toLowerCase(Locale.ROOT),
                config.randomizeReads(),
                config.putSizeBytes(),
                config.fileCount());
        try {
            return execute(parent, config, keys, store);
        } finally {
            try {
                store.close();
            } catch (ObjectStoreException ex) {
                log.warn("failed to close object store client: {}", ex.getMessage(), ex);
            }
        }
    }

    private List<String> loadKeys(RunConfiguration config) throws StresserException {
        if (!config.mode().readsKeys()) {
            log.info("write-only mode selected, no keys are loaded, new keys will be generated");
            return List.of();
        }
        if (keySource == null) {
            throw new ConfigurationException(
                    "a key source is required for '"
                            + config.mode().name().toLowerCase(Locale.ROOT)
                            + "' mode");
        }
        final List<String> keys = keySource.load();
        if (keys.isEmpty()) {
            throw new ManifestException("the key source yielded no keys");
        }
        log.info("loaded {} object keys", keys.size());
        return keys;
    }

    private RunOutcome execute(
            RunContext parent, RunConfiguration config, List<String> keys, ObjectStore store)
            throws StressRunException {
        // fixed-count generation ends when the jobs run out, not when the duration elapses
        final RunContext context =
                config.isFixedCountGeneration() ? parent.child() : parent.withTimeout(config.duration());
        final ResultPipeline pipeline = new ResultPipeline(pipelineCapacity(config));
        final LongAdder dropped = new LongAdder();
        final Operations operations = new ObjectOperations(store, config.bucket(), clock, ticker);
        final List<AbstractWorker> workers =
                createWorkers(config, keys, context, operations, pipeline, dropped);

        final StatisticsAggregator aggregator = new StatisticsAggregator(config.concurrency());
        final List<ResultListener> resultListeners = new ArrayList<>();
        resultListeners.add(new OperationInstruments(openTelemetry, config.bucket()));
        resultListeners.addAll(listeners);
        final ProgressReporter progress =
                progressInterval.isZero() ? null : new ProgressReporter(progressInterval);
        if (progress != null) {
            resultListeners.add(progress);
        }
        final ResultCollector collector = new ResultCollector(pipeline, aggregator, resultListeners);

        final ExecutorService executor =
                Executors.newFixedThreadPool(
                        config.concurrency(),
                        new ThreadFactoryBuilder().setNameFormat("stresser-worker-%d").setDaemon(true).build());
        final long start = ticker.read();
        try {
            if (progress != null) {
                progress.start();
            }
            final CompletableFuture<?>[] futures =
                    workers.stream()
                            .map(
                                    worker ->
                                            CompletableFuture.runAsync(worker, executor)
                                                    .whenComplete(
                                                            (ignore, ex) -> {
                                                                if (ex != null) {
                                                                    final Throwable cause = unwrap(ex);
                                                                    log.error("{} failed", worker.name, cause);
                                                                    context.fail(cause);
                                                                }
                                                            }))
                            .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(futures)
                    .whenComplete(
                            (ignore, ex) -> {
                                pipeline.close();
                                log.info("all workers finished");
                            });
            collect(collector, context);
        } catch (RuntimeException ex) {
            log.error("result collection failed", ex);
            context.fail(ex);
        } finally {
            executor.shutdown();
            if (progress != null) {
                progress.close();
            }
        }
        final Duration measured = Duration.ofNanos(ticker.read() - start);
        final RunOutcome.Termination termination = RunOutcome.Termination.of(context.state());
        context.cancel();

        final AggregateStatistics statistics = aggregator.finish(measured);
        final RunOutcome outcome =
                new RunOutcome(collector.results(), statistics, termination, dropped.sum());
        if (outcome.droppedResults() > 0) {
            log.warn("{} results were dropped because the result pipeline was full", outcome.droppedResults());
        }
        log.info("stress test ended after {}: {}", Durations.format(measured), termination);
        if (termination == RunOutcome.Termination.FAILED) {
            final Throwable cause = context.cause().orElse(null);
            throw new StressRunException(
                    "stress run ended unexpectedly: " + describe(cause), cause, outcome);
        }
        return outcome;
    }

    /** Fixed-count generation holds one slot per job, so none of its results are ever dropped. */
    private int pipelineCapacity(RunConfiguration config) {
        if (config.isFixedCountGeneration()) {
            return Math.max(config.fileCount(), pipelineCapacity);
        }
        return pipelineCapacity > 0 ? pipelineCapacity : config.concurrency() * 2;
    }

    /** Drains the pipeline. An interrupt cancels the run, the remaining results are still drained. */
    private static void collect(ResultCollector collector, RunContext context) {
        boolean interrupted = false;
        while (true) {
            try {
                collector.collect();
                break;
            } catch (InterruptedException ex) {
                if (!interrupted) {
                    log.warn("interrupted while collecting results, cancelling the run");
                }
                interrupted = true;
                context.cancel();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private List<AbstractWorker> createWorkers(
            RunConfiguration config,
            List<String> keys,
            RunContext context,
            Operations operations,
            ResultPipeline pipeline,
            LongAdder dropped) {
        final ManifestSink manifest =
                config.generateManifest() && config.mode() == WorkloadMode.WRITE ? manifestSink : null;
        final List<AbstractWorker> workers = new ArrayList<>(config.concurrency());
        if (config.isFixedCountGeneration()) {
            final Queue<Integer> jobs = new ConcurrentLinkedQueue<>();
            for (int job = 0; job < config.fileCount(); job++) {
                jobs.add(job);
            }
            log.info("generating {} objects with {} workers", config.fileCount(), config.concurrency());
            for (int id = 0; id < config.concurrency(); id++) {
                final Random random = Generators.createWorkerRandom(id);
                workers.add(
                        new GenerationWorker(
                                "generation-worker-" + id,
                                context,
                                operations,
                                pipeline,
                                manifest,
                                dropped,
                                jobs,
                                job -> Generators.createWriteKeyGenerator("job" + job, clock, random),
                                Generators.createPayloadGenerator(config.putSizeBytes(), random)));
            }
            return workers;
        }
        final WorkloadMode mode = config.mode();
        for (int id = 0; id < config.concurrency(); id++) {
            final Random random = Generators.createWorkerRandom(id);
            workers.add(
                    new ContinuousWorker(
                            "worker-" + id,
                            context,
                            operations,
                            pipeline,
                            manifest,
                            dropped,
                            Generators.createOperationGenerator(mode, random),
                            mode.readsKeys()
                                    ? Generators.createReadKeyGenerator(keys, config.randomizeReads(), id, random)
                                    : null,
                            mode.writesObjects()
                                    ? Generators.createWriteKeyGenerator("worker" + id, clock, random)
                                    : null,
                            mode.writesObjects()
                                    ? Generators.createPayloadGenerator(config.putSizeBytes(), random)
                                    : null));
        }
        return workers;
    }

    private static String describe(@Nullable Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }

    public static final class Builder {
        private final ObjectStoreProvider storeProvider;
        @Nullable private KeySource keySource;
        @Nullable private ManifestSink manifestSink;
        private OpenTelemetry openTelemetry = OpenTelemetry.noop();
        private Clock clock = Clock.systemUTC();
        private Ticker ticker = Ticker.systemTicker();
        private int pipelineCapacity;
        private Duration progressInterval = Duration.ZERO;
        private final ImmutableList.Builder<ResultListener> listeners = ImmutableList.builder();

        private Builder(ObjectStoreProvider storeProvider) {
            this.storeProvider = storeProvider;
        }

        /** The keys read and mixed workloads download. Required for those modes. */
        public Builder keySource(@Nullable KeySource keySource) {
            this.keySource = keySource;
            return this;
        }

        /**
         * Where write workloads record the keys of successful uploads when manifest generation is
         * enabled. The caller closes the sink after the run.
         */
        public Builder manifestSink(@Nullable ManifestSink manifestSink) {
            this.manifestSink = manifestSink;
            return this;
        }

        public Builder openTelemetry(@NonNull OpenTelemetry openTelemetry) {
            this.openTelemetry = openTelemetry;
            return this;
        }

        public Builder clock(@NonNull Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder ticker(@NonNull Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        /** Overrides the result buffer size, which defaults to twice the concurrency. */
        public Builder pipelineCapacity(int pipelineCapacity) {
            if (pipelineCapacity <= 0) {
                throw new IllegalArgumentException(
                        "pipelineCapacity must be greater than zero: " + pipelineCapacity);
            }
            this.pipelineCapacity = pipelineCapacity;
            return this;
        }

        /** Logs interval progress at this period. {@link Duration#ZERO} disables the report. */
        public Builder progressInterval(@NonNull Duration progressInterval) {
            if (progressInterval.isNegative()) {
                throw new IllegalArgumentException("progressInterval must not be negative: " + progressInterval);
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder listener(@NonNull ResultListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public StressRunner build() {
            requireNonNull(storeProvider);
            return new StressRunner(this);
        }
    }
}
