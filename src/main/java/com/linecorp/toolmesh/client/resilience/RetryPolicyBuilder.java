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

import static java.util.Objects.requireNonNull;

import java.time.Duration;

/**
 * Builds a {@link RetryPolicy} instance using builder pattern.
 */
public final class RetryPolicyBuilder {

    private static final int DEFAULT_MAX_ATTEMPTS = 3;

    private static final Duration DEFAULT_BACKOFF_MULTIPLIER = Duration.ofSeconds(1);

    private static final Duration DEFAULT_MIN_BACKOFF = Duration.ofSeconds(1);

    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);

    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    private Duration backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;

    private Duration minBackoff = DEFAULT_MIN_BACKOFF;

    private Duration maxBackoff = DEFAULT_MAX_BACKOFF;

    private Duration attemptTimeout = Duration.ZERO;

    private ErrorClassifier errorClassifier = ErrorClassifier.ofDefault();

    /**
     * Sets the maximum number of attempts including the first one.
     */
    public RetryPolicyBuilder maxAttempts(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be greater than zero");
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    /**
     * Sets the base of the exponential backoff. The delay before the {@code n+1}-th attempt is
     * {@code backoffMultiplier * 2^(n-1)}, bounded by {@link #minBackoff(Duration)} and
     * {@link #maxBackoff(Duration)}.
     */
    public RetryPolicyBuilder backoffMultiplier(Duration backoffMultiplier) {
        this.backoffMultiplier = requireNonNegative(backoffMultiplier, "backoffMultiplier");
        return this;
    }

    public RetryPolicyBuilder minBackoff(Duration minBackoff) {
        this.minBackoff = requireNonNegative(minBackoff, "minBackoff");
        return this;
    }

    public RetryPolicyBuilder maxBackoff(Duration maxBackoff) {
        this.maxBackoff = requireNonNegative(maxBackoff, "maxBackoff");
        return this;
    }

    /**
     * Sets the time limit of a single attempt. An attempt which does not complete in time is cancelled and
     * counted as a transient failure. {@link Duration#ZERO} disables the limit.
     */
    public RetryPolicyBuilder attemptTimeout(Duration attemptTimeout) {
        this.attemptTimeout = requireNonNegative(attemptTimeout, "attemptTimeout");
        return this;
    }

    /**
     * Sets the {@link ErrorClassifier} which decides whether a failure is retried.
     */
    public RetryPolicyBuilder errorClassifier(ErrorClassifier errorClassifier) {
        this.errorClassifier = requireNonNull(errorClassifier, "errorClassifier");
        return this;
    }

    private static Duration requireNonNegative(Duration duration, String name) {
        requireNonNull(duration, name);
        if (duration.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return duration;
    }

    /**
     * Builds a {@link RetryPolicy} instance.
     */
    public RetryPolicy build() {
        if (minBackoff.compareTo(maxBackoff) > 0) {
            throw new IllegalArgumentException("minBackoff must not be greater than maxBackoff");
        }
        return new RetryPolicy(maxAttempts, backoffMultiplier, minBackoff, maxBackoff, attemptTimeout,
                               errorClassifier);
    }
}
