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

import java.time.Duration;

import com.linecorp.toolmesh.common.Clock;

/**
 * Stores configurations of circuit breaker.
 */
public final class CircuitBreakerConfig {

    private final int failureThreshold;

    private final int successThreshold;

    private final Duration timeout;

    private final int halfOpenMaxCalls;

    private final Duration slowCallDurationThreshold;

    private final FailureFilter failureFilter;

    private final CircuitBreakerListener listener;

    private final Clock clock;

    CircuitBreakerConfig(int failureThreshold, int successThreshold, Duration timeout, int halfOpenMaxCalls,
                         Duration slowCallDurationThreshold, FailureFilter failureFilter,
                         CircuitBreakerListener listener, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.timeout = timeout;
        this.halfOpenMaxCalls = halfOpenMaxCalls;
        this.slowCallDurationThreshold = slowCallDurationThreshold;
        this.failureFilter = failureFilter;
        this.listener = listener;
        this.clock = clock;
    }

    /**
     * Returns a {@link CircuitBreakerConfig} with the default values.
     */
    public static CircuitBreakerConfig ofDefault() {
        return new CircuitBreakerConfigBuilder().build();
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    public int successThreshold() {
        return successThreshold;
    }

    public Duration timeout() {
        return timeout;
    }

    public int halfOpenMaxCalls() {
        return halfOpenMaxCalls;
    }

    public Duration slowCallDurationThreshold() {
        return slowCallDurationThreshold;
    }

    public FailureFilter failureFilter() {
        return failureFilter;
    }

    public CircuitBreakerListener listener() {
        return listener;
    }

    Clock clock() {
        return clock;
    }

    @Override
    public String toString() {
        return "CircuitBreakerConfig{" +
               "failureThreshold=" + failureThreshold +
               ", successThreshold=" + successThreshold +
               ", timeout=" + timeout +
               ", halfOpenMaxCalls=" + halfOpenMaxCalls +
               ", slowCallDurationThreshold=" + slowCallDurationThreshold +
               '}';
    }

}
