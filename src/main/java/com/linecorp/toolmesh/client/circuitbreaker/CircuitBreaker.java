/*
 * Copyright 2016 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.linecorp.toolmesh.client.circuitbreaker;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.toolmesh.common.Clock;

/**
 * A non-blocking implementation of circuit breaker pattern.
 *
 * <p>A caller asks for a {@link Permit} with {@link #tryAcquirePermit()} before invoking the remote service.
 * If the permit is acquired, the caller must complete it exactly once with {@link Permit#onSuccess()} or
 * {@link Permit#onFailure(Throwable)} when the invocation finishes. A rejected permit tells how long the
 * circuit is going to stay open.
 */
public final class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    static final int MAX_STATE_CHANGES = 10;

    private final String name;

    private final CircuitBreakerConfig config;

    private final AtomicReference<State> current;

    private final Clock clock;

    private final LongAdder totalCalls = new LongAdder();

    private final LongAdder successfulCalls = new LongAdder();

    private final LongAdder failedCalls = new LongAdder();

    private final LongAdder slowCalls = new LongAdder();

    private final LongAdder rejectedCalls = new LongAdder();

    private volatile long lastSuccessMillis = -1;

    private volatile long lastFailureMillis = -1;

    /**
     * The most recent transitions, oldest first. Guarded by itself.
     */
    private final Deque<StateTransition> stateChanges = new ArrayDeque<>(MAX_STATE_CHANGES);

    /**
     * Creates a new {@link CircuitBreaker} with the specified name and {@link CircuitBreakerConfig}.
     */
    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this.name = requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        this.config = requireNonNull(config, "config");
        clock = config.clock();
        current = new AtomicReference<>(new State(CircuitState.CLOSED, 0, 0, 0, 0, -1));
    }

    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    public CircuitState state() {
        return current.get().circuitState;
    }

    /**
     * Decides whether a request should be allowed or refused according to the current circuit state.
     */
    public Permit tryAcquirePermit() {
        totalCalls.increment();
        for (;;) {
            final State state = current.get();
            switch (state.circuitState) {
                case CLOSED:
                    // all requests are allowed during CLOSED
                    return new Permit(state.generation, false);
                case OPEN:
                    final long remainingMillis =
                            state.lastFailureMillis + config.timeout().toMillis() - clock.currentMillis();
                    if (remainingMillis > 0) {
                        return reject(state, Duration.ofMillis(remainingMillis));
                    }
                    // changes to HALF_OPEN if OPEN state has timed out, admitting this request as a trial
                    final State halfOpen = state.toHalfOpen();
                    if (current.compareAndSet(state, halfOpen)) {
                        onTransition(state, halfOpen, "open timeout elapsed");
                        return new Permit(halfOpen.generation, true);
                    }
                    break;
                default:
                    if (state.halfOpenCallsInFlight >= config.halfOpenMaxCalls()) {
                        return reject(state, Duration.ZERO);
                    }
                    final State admitted = state.withCallsInFlight(state.halfOpenCallsInFlight + 1);
                    if (current.compareAndSet(state, admitted)) {
                        return new Permit(state.generation, true);
                    }
            }
        }
    }

    private Permit reject(State state, Duration retryAfter) {
        rejectedCalls.increment();
        if (logger.isDebugEnabled()) {
            logger.debug("name:{} state:{} rejected (retry after {}ms)",
                         name, state.circuitState, retryAfter.toMillis());
        }
        return new Permit(retryAfter);
    }

    private void onSuccess(Permit permit) {
        final long now = clock.currentMillis();
        recordDuration(permit, now);
        successfulCalls.increment();
        lastSuccessMillis = now;

        for (;;) {
            final State state = current.get();
            final State next;
            String reason = null;
            if (state.circuitState == CircuitState.HALF_OPEN) {
                final int successCount = state.successCount + 1;
                if (successCount >= config.successThreshold()) {
                    // changes to CLOSED if enough trial requests succeed in a row
                    next = state.toClosed();
                    reason = successCount + " consecutive trial requests succeeded";
                } else {
                    next = state.withSuccessCount(successCount)
                                .withCallsInFlight(releasedCallsInFlight(state, permit));
                }
            } else if (state.circuitState == CircuitState.CLOSED && state.failureCount > 0) {
                next = state.withFailureCount(0);
            } else {
                return;
            }

            if (current.compareAndSet(state, next)) {
                if (reason != null) {
                    onTransition(state, next, reason);
                }
                return;
            }
        }
    }

    private void onFailure(Permit permit, Throwable cause) {
        final long now = clock.currentMillis();
        recordDuration(permit, now);
        if (cause != null && !config.failureFilter().shouldDealWith(cause)) {
            release(permit);
            return;
        }
        failedCalls.increment();
        lastFailureMillis = now;

        for (;;) {
            final State state = current.get();
            final State next;
            String reason = null;
            switch (state.circuitState) {
                case HALF_OPEN:
                    // returns to OPEN if a trial request fails
                    next = state.toOpen(now);
                    reason = "trial request failed";
                    break;
                case CLOSED:
                    final int failureCount = state.failureCount + 1;
                    if (failureCount >= config.failureThreshold()) {
                        next = state.toOpen(now);
                        reason = "failure threshold reached (" + failureCount + '/' +
                                 config.failureThreshold() + ')';
                    } else {
                        next = state.withFailureCount(failureCount).withLastFailureMillis(now);
                    }
                    break;
                default:
                    // a request admitted before the circuit was tripped
                    next = state.withLastFailureMillis(now);
            }

            if (current.compareAndSet(state, next)) {
                if (reason != null) {
                    onTransition(state, next, reason);
                } else if (next.circuitState == CircuitState.CLOSED && logger.isDebugEnabled()) {
                    logger.debug("name:{} fail:{}/{}", name, next.failureCount, config.failureThreshold());
                }
                return;
            }
        }
    }

    /**
     * Gives back the HALF_OPEN slot held by the specified permit without recording an outcome.
     */
    private void release(Permit permit) {
        for (;;) {
            final State state = current.get();
            final int callsInFlight = releasedCallsInFlight(state, permit);
            if (callsInFlight == state.halfOpenCallsInFlight ||
                current.compareAndSet(state, state.withCallsInFlight(callsInFlight))) {
                return;
            }
        }
    }

    private static int releasedCallsInFlight(State state, Permit permit) {
        // a permit of an earlier HALF_OPEN period does not hold a slot of the current one
        if (permit.trial && state.circuitState == CircuitState.HALF_OPEN &&
            state.generation == permit.generation && state.halfOpenCallsInFlight > 0) {
            return state.halfOpenCallsInFlight - 1;
        }
        return state.halfOpenCallsInFlight;
    }

    private void recordDuration(Permit permit, long now) {
        if (now - permit.startMillis > config.slowCallDurationThreshold().toMillis()) {
            slowCalls.increment();
        }
    }

    /**
     * Forces the circuit into CLOSED state with its failure and success counters cleared.
     */
    public void reset() {
        for (;;) {
            final State state = current.get();
            final State next = state.toClosed();
            if (current.compareAndSet(state, next)) {
                if (state.circuitState != CircuitState.CLOSED) {
                    onTransition(state, next, "manual reset");
                } else {
                    logger.info("name:{} state:{} counters reset", name, CircuitState.CLOSED);
                }
                return;
            }
        }
    }

    /**
     * Returns a snapshot of the current state and the accumulated counters.
     */
    public CircuitBreakerStats stats() {
        final State state = current.get();
        final List<StateTransition> changes;
        synchronized (stateChanges) {
            changes = new ArrayList<>(stateChanges);
        }
        return new CircuitBreakerStats(name, state.circuitState, state.failureCount, state.successCount,
                                       state.halfOpenCallsInFlight, totalCalls.sum(), successfulCalls.sum(),
                                       failedCalls.sum(), slowCalls.sum(), rejectedCalls.sum(),
                                       toInstant(lastFailureMillis), toInstant(lastSuccessMillis), changes);
    }

    private static Instant toInstant(long millis) {
        return millis < 0 ? null : Instant.ofEpochMilli(millis);
    }

    private void onTransition(State from, State to, String reason) {
        final StateTransition transition = new StateTransition(
                from.circuitState, to.circuitState, Instant.ofEpochMilli(clock.currentMillis()), reason);
        synchronized (stateChanges) {
            if (stateChanges.size() == MAX_STATE_CHANGES) {
                stateChanges.removeFirst();
            }
            stateChanges.addLast(transition);
        }
        logStateTransition(from, to, reason);
        try {
            config.listener().onStateChanged(name, transition);
        } catch (Exception e) {
            logger.warn("name:{} unexpected exception from a listener:", name, e);
        }
    }

    private void logStateTransition(State from, State to, String reason) {
        if (logger.isInfoEnabled()) {
            final int capacity = name.length() + reason.length() + 48;
            final StringBuilder builder = new StringBuilder(capacity);
            builder.append("name:");
            builder.append(name);
            builder.append(" state:");
            builder.append(from.circuitState.name());
            builder.append("->");
            builder.append(to.circuitState.name());
            if (to.circuitState == CircuitState.OPEN && from.circuitState == CircuitState.CLOSED) {
                builder.append(" fail:");
                builder.append(from.failureCount + 1);
            } else {
                builder.append(" fail:-");
            }
            builder.append(" reason:");
            builder.append(reason);
            logger.info(builder.toString());
        }
    }

    @Override
    public String toString() {
        return "CircuitBreaker{name='" + name + "', state=" + state() + '}';
    }

    /**
     * The permission to send a request, or the refusal of it, returned by {@link #tryAcquirePermit()}.
     */
    public final class Permit {

        private final boolean acquired;

        private final boolean trial;

        private final long generation;

        private final long startMillis;

        private final Duration retryAfter;

        private final AtomicBoolean completed = new AtomicBoolean();

        private Permit(long generation, boolean trial) {
            acquired = true;
            this.trial = trial;
            this.generation = generation;
            startMillis = clock.currentMillis();
            retryAfter = Duration.ZERO;
        }

        private Permit(Duration retryAfter) {
            acquired = false;
            trial = false;
            generation = -1;
            startMillis = clock.currentMillis();
            this.retryAfter = retryAfter;
        }

        /**
         * Returns {@code true} if the request may be sent to the remote service.
         */
        public boolean isAcquired() {
            return acquired;
        }

        /**
         * Returns {@code true} if this permit was acquired as a trial request in HALF_OPEN state.
         */
        public boolean isTrial() {
            return trial;
        }

        /**
         * Returns the time left until the circuit lets a trial request through, or {@link Duration#ZERO}
         * if the permit is acquired or the circuit is waiting for trial requests in flight.
         */
        public Duration retryAfter() {
            return retryAfter;
        }

        public CircuitBreaker circuitBreaker() {
            return CircuitBreaker.this;
        }

        /**
         * Reports that the request has succeeded. Subsequent completions are ignored.
         */
        public void onSuccess() {
            if (complete()) {
                CircuitBreaker.this.onSuccess(this);
            }
        }

        /**
         * Reports that the request has failed with the specified cause, which may be {@code null} if
         * unknown. Subsequent completions are ignored.
         */
        public void onFailure(Throwable cause) {
            if (complete()) {
                CircuitBreaker.this.onFailure(this, cause);
            }
        }

        /**
         * Returns a {@link FailFastException} describing this refused permit.
         */
        public FailFastException toException() {
            if (acquired) {
                throw new IllegalStateException("permit acquired: " + name);
            }
            return new FailFastException(name, retryAfter);
        }

        private boolean complete() {
            if (!acquired) {
                throw new IllegalStateException("permit not acquired: " + name);
            }
            return completed.compareAndSet(false, true);
        }
    }

    /**
     * A value object that stores the internal state of the circuit breaker.
     */
    private static final class State {
        private final CircuitState circuitState;
        private final long generation;
        private final int failureCount;
        private final int successCount;
        private final int halfOpenCallsInFlight;
        private final long lastFailureMillis;

        /**
         * Creates a new instance.
         *
         * @param circuitState The circuit state
         * @param generation Incremented on every change of the circuit state
         * @param failureCount The consecutive failures counted in CLOSED state
         * @param successCount The consecutive successes counted in HALF_OPEN state
         * @param halfOpenCallsInFlight The trial requests in flight in HALF_OPEN state
         * @param lastFailureMillis The time of the last failure, or {@code -1}
         */
        private State(CircuitState circuitState, long generation, int failureCount, int successCount,
                      int halfOpenCallsInFlight, long lastFailureMillis) {
            this.circuitState = circuitState;
            this.generation = generation;
            this.failureCount = failureCount;
            this.successCount = successCount;
            this.halfOpenCallsInFlight = halfOpenCallsInFlight;
            this.lastFailureMillis = lastFailureMillis;
        }

        private State toOpen(long failureMillis) {
            return new State(CircuitState.OPEN, generation + 1, 0, 0, 0, failureMillis);
        }

        private State toHalfOpen() {
            return new State(CircuitState.HALF_OPEN, generation + 1, 0, 0, 1, lastFailureMillis);
        }

        private State toClosed() {
            return new State(CircuitState.CLOSED, generation + 1, 0, 0, 0, lastFailureMillis);
        }

        private State withFailureCount(int failureCount) {
            return new State(circuitState, generation, failureCount, successCount, halfOpenCallsInFlight,
                             lastFailureMillis);
        }

        private State withSuccessCount(int successCount) {
            return new State(circuitState, generation, failureCount, successCount, halfOpenCallsInFlight,
                             lastFailureMillis);
        }

        private State withCallsInFlight(int halfOpenCallsInFlight) {
            return new State(circuitState, generation, failureCount, successCount, halfOpenCallsInFlight,
                             lastFailureMillis);
        }

        private State withLastFailureMillis(long lastFailureMillis) {
            return new State(circuitState, generation, failureCount, successCount, halfOpenCallsInFlight,
                             lastFailureMillis);
        }
    }
}
