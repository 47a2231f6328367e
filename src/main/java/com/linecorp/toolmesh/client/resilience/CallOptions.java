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

import java.util.Collections;
import java.util.List;

/**
 * Stores the options of a single {@link ResilienceManager#execute(String, RemoteCall, CallOptions)} call.
 */
public final class CallOptions {

    private static final CallOptions DEFAULT = new CallOptionsBuilder().build();

    private final List<String> fallbackServiceNames;

    private final RetryPolicy retryPolicy;

    private final boolean dedupe;

    private final List<Object> requestKey;

    CallOptions(List<String> fallbackServiceNames, RetryPolicy retryPolicy, boolean dedupe,
                List<Object> requestKey) {
        this.fallbackServiceNames = Collections.unmodifiableList(fallbackServiceNames);
        this.retryPolicy = retryPolicy;
        this.dedupe = dedupe;
        this.requestKey = Collections.unmodifiableList(requestKey);
    }

    /**
     * Returns the {@link CallOptions} without fallbacks, using the default {@link RetryPolicy} of the
     * {@link ResilienceManager}.
     */
    public static CallOptions of() {
        return DEFAULT;
    }

    public static CallOptionsBuilder builder() {
        return new CallOptionsBuilder();
    }

    /**
     * Returns the services tried in this order after the primary one has failed.
     */
    public List<String> fallbackServiceNames() {
        return fallbackServiceNames;
    }

    /**
     * Returns the {@link RetryPolicy} for this call, or {@code null} to use the default one of the
     * {@link ResilienceManager}.
     */
    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public boolean dedupe() {
        return dedupe;
    }

    /**
     * Returns the arguments identifying the operation. Concurrent calls to the same service with equal
     * request keys share a single execution when {@link #dedupe()} is enabled. An empty list disables
     * deduplication for this call.
     */
    public List<Object> requestKey() {
        return requestKey;
    }

    @Override
    public String toString() {
        return "CallOptions{" +
               "fallbackServiceNames=" + fallbackServiceNames +
               ", retryPolicy=" + retryPolicy +
               ", dedupe=" + dedupe +
               ", requestKey=" + requestKey +
               '}';
    }
}
