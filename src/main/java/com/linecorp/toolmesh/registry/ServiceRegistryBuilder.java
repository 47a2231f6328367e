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

package com.linecorp.toolmesh.registry;

import static java.util.Objects.requireNonNull;

import java.time.Duration;

import com.linecorp.toolmesh.common.Clock;

import io.netty.util.concurrent.EventExecutor;

/**
 * Builds a {@link ServiceRegistry} instance using builder pattern.
 */
public final class ServiceRegistryBuilder {

    private static final Duration DEFAULT_HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final EventExecutor executor;

    private CatalogFetcher catalogFetcher;

    private HealthProbe healthProbe;

    private ToolInvoker toolInvoker;

    private Duration healthCheckTimeout = DEFAULT_HEALTH_CHECK_TIMEOUT;

    private Clock clock = Clock.SYSTEM;

    ServiceRegistryBuilder(EventExecutor executor) {
        this.executor = requireNonNull(executor, "executor");
    }

    /**
     * Sets the {@link ServiceTransport} used for fetching catalogs, checking health and invoking tools.
     */
    public ServiceRegistryBuilder transport(ServiceTransport transport) {
        requireNonNull(transport, "transport");
        catalogFetcher = transport;
        healthProbe = transport;
        toolInvoker = transport;
        return this;
    }

    public ServiceRegistryBuilder catalogFetcher(CatalogFetcher catalogFetcher) {
        this.catalogFetcher = requireNonNull(catalogFetcher, "catalogFetcher");
        return this;
    }

    public ServiceRegistryBuilder healthProbe(HealthProbe healthProbe) {
        this.healthProbe = requireNonNull(healthProbe, "healthProbe");
        return this;
    }

    public ServiceRegistryBuilder toolInvoker(ToolInvoker toolInvoker) {
        this.toolInvoker = requireNonNull(toolInvoker, "toolInvoker");
        return this;
    }

    /**
     * Sets the time limit of a single health check. A service which does not respond in time is regarded
     * as unhealthy.
     */
    public ServiceRegistryBuilder healthCheckTimeout(Duration healthCheckTimeout) {
        requireNonNull(healthCheckTimeout, "healthCheckTimeout");
        if (healthCheckTimeout.isNegative() || healthCheckTimeout.isZero()) {
            throw new IllegalArgumentException("healthCheckTimeout must be greater than zero");
        }
        this.healthCheckTimeout = healthCheckTimeout;
        return this;
    }

    public ServiceRegistryBuilder clock(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
        return this;
    }

    /**
     * Builds a {@link ServiceRegistry} instance.
     */
    public ServiceRegistry build() {
        if (catalogFetcher == null || healthProbe == null || toolInvoker == null) {
            throw new IllegalStateException(
                    "catalogFetcher, healthProbe and toolInvoker must be set, or transport instead");
        }
        return new ServiceRegistry(executor, catalogFetcher, healthProbe, toolInvoker, healthCheckTimeout,
                                   clock);
    }
}
