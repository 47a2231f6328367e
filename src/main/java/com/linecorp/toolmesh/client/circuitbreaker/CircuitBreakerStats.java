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

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * A point-in-time snapshot of the state and counters of a {@link CircuitBreaker}.
 */
public final class CircuitBreakerStats {

    private final String name;
    private final CircuitState state;
    private final int failureCount;
    private final int successCount;
    private final int halfOpenCallsInFlight;
    private final long totalCalls;
    private final long successfulCalls;
    private final long failedCalls;
    private final long slowCalls;
    private final long rejectedCalls;
    private final Instant lastFailureTime;
    private final Instant lastSuccessTime;
    private final List<StateTransition> stateChanges;

    CircuitBreakerStats(String name, CircuitState state, int failureCount, int successCount,
                        int halfOpenCallsInFlight, long totalCalls, long successfulCalls, long failedCalls,
                        long slowCalls, long rejectedCalls, Instant lastFailureTime,
                        Instant lastSuccessTime, List<StateTransition> stateChanges) {
        this.name = name;
        this.state = state;
        this.failureCount = failureCount;
        this.successCount = successCount;
        this.halfOpenCallsInFlight = halfOpenCallsInFlight;
        this.totalCalls = totalCalls;
        this.successfulCalls = successfulCalls;
        this.failedCalls = failedCalls;
        this.slowCalls = slowCalls;
        this.rejectedCalls = rejectedCalls;
        this.lastFailureTime = lastFailureTime;
        this.lastSuccessTime = lastSuccessTime;
        this.stateChanges = Collections.unmodifiableList(stateChanges);
    }

    public String name() {
        return name;
    }

    public CircuitState state() {
        return state;
    }

    /**
     * Returns the number of consecutive failures counted in CLOSED state.
     */
    public int failureCount() {
        return failureCount;
    }

    /**
     * Returns the number of consecutive successful trial requests counted in HALF_OPEN state.
     */
    public int successCount() {
        return successCount;
    }

    public int halfOpenCallsInFlight() {
        return halfOpenCallsInFlight;
    }

    /**
     * Returns the number of requests which asked for a permit, including the rejected ones.
     */
    public long totalCalls() {
        return totalCalls;
    }

    public long successfulCalls() {
        return successfulCalls;
    }

    public long failedCalls() {
        return failedCalls;
    }

    public long slowCalls() {
        return slowCalls;
    }

    public long rejectedCalls() {
        return rejectedCalls;
    }

    /**
     * Returns the time of the last failure, or {@code null} if no call has failed yet.
     */
    public Instant lastFailureTime() {
        return lastFailureTime;
    }

    /**
     * Returns the time of the last success, or {@code null} if no call has succeeded yet.
     */
    public Instant lastSuccessTime() {
        return lastSuccessTime;
    }

    /**
     * Returns {@code successfulCalls / totalCalls}, or {@code 0} if no call has been made.
     */
    public double successRate() {
        return totalCalls == 0 ? 0 : successfulCalls / (double) totalCalls;
    }

    /**
     * Returns the most recent state transitions, oldest first.
     */
    public List<StateTransition> stateChanges() {
        return stateChanges;
    }

    @Override
    public String toString() {
        return "CircuitBreakerStats{" +
               "name='" + name + '\'' +
               ", state=" + state +
               ", failureCount=" + failureCount +
               ", successCount=" + successCount +
               ", totalCalls=" + totalCalls +
               ", successfulCalls=" + successfulCalls +
               ", failedCalls=" + failedCalls +
               ", slowCalls=" + slowCalls +
               ", rejectedCalls=" + rejectedCalls +
               '}';
    }
}
