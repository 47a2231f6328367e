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

import java.util.HashMap;
import java.util.Map;

import com.linecorp.toolmesh.client.circuitbreaker.CircuitBreakerConfig;

import io.netty.util.concurrent.EventExecutor;

/**
 * Builds a {@link ResilienceManager} instance using builder pattern.
 */
public final class ResilienceManagerBuilder {

    private final EventExecutor executor;

    private CircuitBreakerConfig defaultConfig = CircuitBreakerConfig.ofDefault();

    private final Map<String, CircuitBreakerConfig> configs = new HashMap<>();

    private RetryPolicy retryPolicy = RetryPolicy.ofDefault();

    ResilienceManagerBuilder(EventExecutor executor) {
        this.executor = requireNonNull(executor, "executor");
    }

    /**
     * Sets the {@link CircuitBreakerConfig} of the services without their own configuration.
     */
    public ResilienceManagerBuilder circuitBreakerConfig(CircuitBreakerConfig config) {
        defaultConfig = requireNonNull(config, "config");
        return this;
    }

    /**
     * Sets the {@link CircuitBreakerConfig} of the specified service.
     */
    public ResilienceManagerBuilder circuitBreakerConfig(String serviceName, CircuitBreakerConfig config) {
        configs.put(requireNonNull(serviceName, "serviceName"), requireNonNull(config, "config"));
        return this;
    }

    /**
     * Sets the {@link RetryPolicy} of the calls which do not specify one in their {@link CallOptions}.
     */
    public ResilienceManagerBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = requireNonNull(retryPolicy, "retryPolicy");
        return this;
    }

    /**
     * Builds a {@link ResilienceManager} instance.
     */
    public ResilienceManager build() {
        return new ResilienceManager(executor, defaultConfig, new HashMap<>(configs), retryPolicy);
    }
}
