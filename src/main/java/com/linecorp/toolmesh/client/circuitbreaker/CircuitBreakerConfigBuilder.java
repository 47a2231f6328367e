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

import com.linecorp.toolmesh.common.Clock;

/**
 * Builds a {@link CircuitBreakerConfig} instance using builder pattern.
 */
public final class CircuitBreakerConfigBuilder {

    private static final int DEFAULT_FAILURE_THRESHOLD = 5;

    private static final int DEFAULT_SUCCESS_THRESHOLD = 2;

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private static final int DEFAULT_HALF_OPEN_MAX_CALLS = 3;

    private static final Duration DEFAULT_SLOW_CALL_DURATION_THRESHOLD = Duration.ofSeconds(5);

    private static final FailureFilter DEFAULT_FAILURE_FILTER = cause -> true;

    private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;

    private int successThreshold = DEFAULT_SUCCESS_THRESHOLD;

    private Duration timeout = DEFAULT_TIMEOUT;

    private int halfOpenMaxCalls = DEFAULT_HALF_OPEN_MAX_CALLS;

    private Duration slowCallDurationThreshold = DEFAULT_SLOW_CALL_DURATION_THRESHOLD;

    private FailureFilter failureFilter = DEFAULT_FAILURE_FILTER;

    private CircuitBreakerListener listener = CircuitBreakerListener.NOOP;

    private Clock clock = Clock.SYSTEM;

    /**
     * Sets the number of consecutive failures in CLOSED state which trips the circuit.
     */
    public CircuitBreakerConfigBuilder failureThreshold(int failureThreshold) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be greater than zero");
        }
        this.failureThreshold = failureThreshold;
        return this;
    }

    /**
     * Sets the number of consecutive successful trial requests in HALF_OPEN state which closes the
     * circuit.
     */
    public CircuitBreakerConfigBuilder successThreshold(int successThreshold) {
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be greater than zero");
        }
        this.successThreshold = successThreshold;
        return this;
    }

    /**
     * Sets the duration since the last failure after which an OPEN circuit lets a trial request through.
     */
    public CircuitBreakerConfigBuilder timeout(Duration timeout) {
        requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be greater than zero");
        }
        this.timeout = timeout;
        return this;
    }

    /**
     * Sets the maximum number of trial requests in flight during HALF_OPEN state.
     */
    public CircuitBreakerConfigBuilder halfOpenMaxCalls(int halfOpenMaxCalls) {
        if (halfOpenMaxCalls <= 0) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be greater than zero");
        }
        this.halfOpenMaxCalls = halfOpenMaxCalls;
        return this;
    }

    /**
     * Sets the duration above which a call is counted as slow. Slow calls are reported in
     * {@link CircuitBreakerStats} only and never trip the circuit.
     */
    public CircuitBreakerConfigBuilder slowCallDurationThreshold(Duration slowCallDurationThreshold) {
        requireNonNull(slowCallDurationThreshold, "slowCallDurationThreshold");
        if (slowCallDurationThreshold.isNegative() || slowCallDurationThreshold.isZero()) {
            throw new IllegalArgumentException("slowCallDurationThreshold must be greater than zero");
        }
        this.slowCallDurationThreshold = slowCallDurationThreshold;
        return this;
    }

    /**
     * Sets the {@link FailureFilter} that decides whether the circuit breaker should deal with a given error.
     */
    public CircuitBreakerConfigBuilder failureFilter(FailureFilter failureFilter) {
        this.failureFilter = requireNonNull(failureFilter, "failureFilter");
        return this;
    }

    /**
     * Sets the {@link CircuitBreakerListener} notified of every state transition.
     */
    public CircuitBreakerConfigBuilder listener(CircuitBreakerListener listener) {
        this.listener = requireNonNull(listener, "listener");
        return this;
    }

    /**
     * Sets the {@link Clock} to be used inside circuit breaker.
     */
    CircuitBreakerConfigBuilder clock(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
        return this;
    }

    /**
     * Builds a {@link CircuitBreakerConfig} instance.
     */
    public CircuitBreakerConfig build() {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeout, halfOpenMaxCalls,
                                        slowCallDurationThreshold, failureFilter, listener, clock);
    }

}
