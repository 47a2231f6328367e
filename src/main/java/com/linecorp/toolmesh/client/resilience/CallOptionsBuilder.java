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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds a {@link CallOptions} instance using builder pattern.
 */
public final class CallOptionsBuilder {

    private final List<String> fallbackServiceNames = new ArrayList<>();

    private RetryPolicy retryPolicy;

    private boolean dedupe = true;

    private final List<Object> requestKey = new ArrayList<>();

    /**
     * Adds the services tried in the specified order after the primary one has failed.
     */
    public CallOptionsBuilder fallbackServiceNames(String... fallbackServiceNames) {
        requireNonNull(fallbackServiceNames, "fallbackServiceNames");
        return fallbackServiceNames(Arrays.asList(fallbackServiceNames));
    }

    /**
     * Adds the services tried in the iteration order after the primary one has failed.
     */
    public CallOptionsBuilder fallbackServiceNames(Iterable<String> fallbackServiceNames) {
        requireNonNull(fallbackServiceNames, "fallbackServiceNames");
        for (String name : fallbackServiceNames) {
            requireNonNull(name, "fallbackServiceNames contains null.");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("fallbackServiceNames contains an empty name");
            }
            this.fallbackServiceNames.add(name);
        }
        return this;
    }

    public CallOptionsBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = requireNonNull(retryPolicy, "retryPolicy");
        return this;
    }

    /**
     * Sets whether concurrent calls with an equal request key share a single execution. Enabled by default.
     */
    public CallOptionsBuilder dedupe(boolean dedupe) {
        this.dedupe = dedupe;
        return this;
    }

    /**
     * Sets the arguments identifying the operation. They must implement {@link Object#equals(Object)} and
     * {@link Object#hashCode()} by value.
     */
    public CallOptionsBuilder requestKey(Object... requestKey) {
        requireNonNull(requestKey, "requestKey");
        this.requestKey.clear();
        for (Object element : requestKey) {
            this.requestKey.add(requireNonNull(element, "requestKey contains null."));
        }
        return this;
    }

    /**
     * Builds a {@link CallOptions} instance.
     */
    public CallOptions build() {
        return new CallOptions(new ArrayList<>(fallbackServiceNames), retryPolicy, dedupe,
                               new ArrayList<>(requestKey));
    }
}
