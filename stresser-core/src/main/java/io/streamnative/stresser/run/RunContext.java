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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import lombok.NonNull;

/**
 * Cooperative cancellation signal shared by the workers of a run.
 *
 * <p>A context is done once it is cancelled, once it fails, once its deadline passes, or once its
 * parent is done. The first of these to be observed is recorded and never changes afterwards.
 * Workers poll {@link #isDone()}; nothing is interrupted.
 */
public final class RunContext {

    public enum State {
        ACTIVE,
        CANCELLED,
        DEADLINE_EXCEEDED,
        FAILED
    }

    private record Termination(State state, @Nullable Throwable cause) {}

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    @Nullable private final RunContext parent;
    private final Ticker ticker;
    private final long deadlineNanos;
    private final AtomicReference<Termination> termination = new AtomicReference<>();

    private RunContext(@Nullable RunContext parent, Ticker ticker, long deadlineNanos) {
        this.parent = parent;
        this.ticker = ticker;
        this.deadlineNanos = deadlineNanos;
    }

    /** A root context that is only ever done when cancelled or failed explicitly. */
    public static RunContext background() {
        return new RunContext(null, Ticker.systemTicker(), NO_DEADLINE);
    }

    @VisibleForTesting
    static RunContext background(Ticker ticker) {
        return new RunContext(null, ticker, NO_DEADLINE);
    }

    /** Derives a child context without a deadline of its own. */
    public RunContext child() {
        return new RunContext(this, ticker, NO_DEADLINE);
    }

    /**
     * Derives a child context that is additionally done once {@code timeout} has elapsed. Cancelling
     * the child does not affect this context.
     */
    public RunContext withTimeout(@NonNull Duration timeout) {
        final long now = ticker.read();
        final long deadline;
        try {
            deadline = Math.addExact(now, timeout.toNanos());
        } catch (ArithmeticException e) {
            return new RunContext(this, ticker, NO_DEADLINE);
        }
        return new RunContext(this, ticker, deadline);
    }

    public void cancel() {
        terminate(State.CANCELLED, null);
    }

    /** Marks the context as terminated by an unexpected failure. */
    public void fail(@NonNull Throwable cause) {
        terminate(State.FAILED, cause);
    }

    public boolean isDone() {
        return state() != State.ACTIVE;
    }

    public State state() {
        final Termination t = termination.get();
        if (t != null) {
            return t.state();
        }
        if (parent != null && parent.isDone()) {
            final State inherited = parent.state();
            terminate(inherited, parent.cause().orElse(null));
            return termination.get().state();
        }
        if (deadlineNanos != NO_DEADLINE && ticker.read() - deadlineNanos >= 0) {
            terminate(State.DEADLINE_EXCEEDED, null);
            return termination.get().state();
        }
        return State.ACTIVE;
    }

    public Optional<Throwable> cause() {
        final Termination t = termination.get();
        return t == null ? Optional.empty() : Optional.ofNullable(t.cause());
    }

    /** Time left until the deadline, {@link Duration#ZERO} once done. Empty without a deadline. */
    public Optional<Duration> remaining() {
        if (isDone()) {
            return Optional.of(Duration.ZERO);
        }
        if (deadlineNanos == NO_DEADLINE) {
            return parent == null ? Optional.empty() : parent.remaining();
        }
        final Duration own = Duration.ofNanos(Math.max(0, deadlineNanos - ticker.read()));
        if (parent != null) {
            final Optional<Duration> inherited = parent.remaining();
            if (inherited.isPresent() && inherited.get().compareTo(own) < 0) {
                return inherited;
            }
        }
        return Optional.of(own);
    }

    private void terminate(State state, @Nullable Throwable cause) {
        termination.compareAndSet(null, new Termination(state, cause));
    }

    @Override
    public String toString() {
        return "RunContext(" + state() + ")";
    }
}
