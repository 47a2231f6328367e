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

package com.linecorp.toolmesh.client.resilience;

import java.time.Duration;

/**
 * Stores how many times and how often a failed call is attempted again.
 */
public final class RetryPolicy {

    private static final RetryPolicy NO_RETRY = new RetryPolicyBuilder().maxAttempts(1).build();

    private final int maxAttempts;

    private final Duration backoffMultiplier;

    private final Duration minBackoff;

    private final Duration maxBackoff;

    private final Duration attemptTimeout;

    private final ErrorClassifier errorClassifier;

    RetryPolicy(int maxAttempts, Duration backoffMultiplier, Duration minBackoff, Duration maxBackoff,
                Duration attemptTimeout, ErrorClassifier errorClassifier) {
        this.maxAttempts = maxAttempts;
        this.backoffMultiplier = backoffMultiplier;
        this.minBackoff = minBackoff;
        this.maxBackoff = maxBackoff;
        this.attemptTimeout = attemptTimeout;
        this.errorClassifier = errorClassifier;
    }

    /**
     * Returns a {@link RetryPolicy} with the default values.
     */
    public static RetryPolicy ofDefault() {
        return new RetryPolicyBuilder().build();
    }

    /**
     * Returns a {@link RetryPolicy} which makes a single attempt.
     */
    public static RetryPolicy noRetry() {
        return NO_RETRY;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration backoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration minBackoff() {
        return minBackoff;
    }

    public Duration maxBackoff() {
        return maxBackoff;
    }

    /**
     * Returns the time limit of a single attempt, or {@link Duration#ZERO} if unlimited.
     */
    public Duration attemptTimeout() {
        return attemptTimeout;
    }

    public ErrorClassifier errorClassifier() {
        return errorClassifier;
    }

    /**
     * Returns {@code true} if a call which failed with the specified cause may be attempted again.
     */
    public boolean isRetryable(Throwable cause) {
        return errorClassifier.classify(cause) == ErrorCategory.TRANSIENT;
    }

    /**
     * Returns the delay in milliseconds before the attempt following the {@code attempts}-th one.
     */
    public long backoffMillis(int attempts) {
        if (attempts <= 0) {
            throw new IllegalArgumentException("attempts: " + attempts + " (expected: > 0)");
        }
        long exponential;
        try {
            exponential = Math.multiplyExact(backoffMultiplier.toMillis(), 1L << Math.min(attempts - 1, 30));
        } catch (ArithmeticException e) {
            exponential = Long.MAX_VALUE;
        }
        return Math.max(minBackoff.toMillis(), Math.min(maxBackoff.toMillis(), exponential));
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
               "maxAttempts=" + maxAttempts +
               ", backoffMultiplier=" + backoffMultiplier +
               ", minBackoff=" + minBackoff +
               ", maxBackoff=" + maxBackoff +
               ", attemptTimeout=" + attemptTimeout +
               '}';
    }
}
