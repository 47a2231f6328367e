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

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.toolmesh.common.Clock;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;

/**
 * Keeps track of remote services, their {@link ToolCatalog}s and their health, and dispatches tool calls
 * to the services which own the tools.
 *
 * <p>A registry is created with {@link #builder(EventExecutor)} and shared by its users explicitly.
 * All asynchronous results are {@link Future}s of the {@link EventExecutor} given to the builder, which also
 * runs the health checks.
 */
public final class ServiceRegistry implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ServiceRegistry.class);

    /**
     * The path of the catalog relative to the base URL of a service.
     */
    public static final String CATALOG_PATH = "/utcp";

    private final EventExecutor executor;

    private final CatalogFetcher catalogFetcher;

    private final HealthProbe healthProbe;

    private final ToolInvoker toolInvoker;

    private final Duration healthCheckTimeout;

    private final Clock clock;

    private final ConcurrentMap<String, ServiceInfo> services = new ConcurrentHashMap<>();

    private final Object monitorLock = new Object();

    // The fields below are guarded by monitorLock.
    private boolean monitoring;
    // incremented on every start and stop so that the cycles of an earlier run never reschedule
    private long monitorGeneration;
    private long monitorIntervalMillis;
    private ScheduledFuture<?> nextCycle;
    private Future<?> currentCycle;

    ServiceRegistry(EventExecutor executor, CatalogFetcher catalogFetcher, HealthProbe healthProbe,
                    ToolInvoker toolInvoker, Duration healthCheckTimeout, Clock clock) {
        this.executor = executor;
        this.catalogFetcher = catalogFetcher;
        this.healthProbe = healthProbe;
        this.toolInvoker = toolInvoker;
        this.healthCheckTimeout = healthCheckTimeout;
        this.clock = clock;
    }

    /**
     * Returns a new {@link ServiceRegistryBuilder} whose registry runs on the specified {@link EventExecutor}.
     */
    public static ServiceRegistryBuilder builder(EventExecutor executor) {
        return new ServiceRegistryBuilder(executor);
    }

    /**
     * Fetches the catalog of the service at {@code baseUrl} and registers the service under the specified
     * name, replacing the service registered under the same name if any. Nothing is registered if the catalog
     * cannot be fetched, in which case the returned {@link Future} fails with a {@link DiscoveryException}.
     */
    public Future<ServiceInfo> register(String name, String baseUrl, Set<String> tags) {
        requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        return register0(name, requireNonNull(baseUrl, "baseUrl"), requireNonNull(tags, "tags"));
    }

    private Future<ServiceInfo> register0(String name, String baseUrl, Set<String> tags) {
        final String normalizedBaseUrl = normalizeBaseUrl(baseUrl);
        final String catalogUrl = normalizedBaseUrl + CATALOG_PATH;
        final Promise<ServiceInfo> promise = executor.newPromise();

        final Future<ToolCatalog> fetch;
        try {
            fetch = requireNonNull(catalogFetcher.fetchCatalog(catalogUrl), "fetchCatalog() returned null.");
        } catch (Exception e) {
            promise.tryFailure(toDiscoveryException(catalogUrl, e));
            return promise;
        }

        fetch.addListener((FutureListener<ToolCatalog>) future -> {
            if (!future.isSuccess()) {
                promise.tryFailure(toDiscoveryException(catalogUrl, future.cause()));
                return;
            }
            final ToolCatalog catalog = future.getNow();
            if (catalog == null) {
                promise.tryFailure(new DiscoveryException(catalogUrl, "empty catalog"));
                return;
            }

            final String serviceName = name != null ? name : serviceName(catalog, normalizedBaseUrl);
            final Set<String> allTags = new LinkedHashSet<>(tags);
            allTags.addAll(catalog.tags());
            final ServiceInfo service = new ServiceInfo(serviceName, normalizedBaseUrl, catalogUrl,
                                                        catalog, allTags);
            final ServiceInfo old = services.put(serviceName, service);
            logger.info("{} a service: {} ({}, tools: {}, tags: {})",
                        old != null ? "Re-registered" : "Registered", serviceName, normalizedBaseUrl,
                        catalog.tools().size(), allTags);
            promise.trySuccess(service);
        });
        return promise;
    }

    private static DiscoveryException toDiscoveryException(String catalogUrl, Throwable cause) {
        if (cause instanceof DiscoveryException) {
            return (DiscoveryException) cause;
        }
        return new DiscoveryException(catalogUrl, cause);
    }

    private static String normalizeBaseUrl(String baseUrl) {
        String normalized = baseUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("baseUrl: " + baseUrl + " (expected: a non-empty URL)");
        }
        return normalized;
    }

    /**
     * Returns the name declared in the catalog, or the host and port of the base URL if not declared.
     */
    static String serviceName(ToolCatalog catalog, String baseUrl) {
        if (catalog.name() != null && !catalog.name().isEmpty()) {
            return catalog.name();
        }
        try {
            final URI uri = URI.create(baseUrl);
            if (uri.getHost() != null) {
                return uri.getPort() > 0 ? uri.getHost() + '-' + uri.getPort() : uri.getHost();
            }
        } catch (IllegalArgumentException e) {
            logger.debug("Failed to parse a base URL: {}", baseUrl, e);
        }
        return baseUrl;
    }

    /**
     * Registers the services at the specified base URLs one by one, naming each after the name declared in
     * its catalog.
     *
     * @param failOnError if {@code true}, the first failure fails the returned {@link Future} and the
     *                    remaining URLs are not tried. Otherwise, the failures are collected in
     *                    {@link DiscoveryResult#errors()}.
     */
    public Future<DiscoveryResult> discover(List<String> baseUrls, boolean failOnError) {
        requireNonNull(baseUrls, "baseUrls");
        final Promise<DiscoveryResult> promise = executor.newPromise();
        discoverNext(new ArrayList<>(baseUrls), 0, failOnError, new ArrayList<>(), new LinkedHashMap<>(),
                     promise);
        return promise;
    }

    /**
     * Registers the services at the specified base URLs, collecting the failures.
     */
    public Future<DiscoveryResult> discover(List<String> baseUrls) {
        return discover(baseUrls, false);
    }

    private void discoverNext(List<String> baseUrls, int index, boolean failOnError,
                              List<ServiceInfo> registered, Map<String, Throwable> errors,
                              Promise<DiscoveryResult> promise) {
        if (index == baseUrls.size()) {
            logger.info("Discovered {} of {} services", registered.size(), baseUrls.size());
            promise.trySuccess(new DiscoveryResult(registered, errors));
            return;
        }

        final String baseUrl = baseUrls.get(index);
        Future<ServiceInfo> future;
        try {
            future = register0(null, requireNonNull(baseUrl, "baseUrls contains null."),
                               Collections.emptySet());
        } catch (Exception e) {
            future = executor.newFailedFuture(e);
        }
        future.addListener((FutureListener<ServiceInfo>) f -> {
            if (f.isSuccess()) {
                registered.add(f.getNow());
            } else {
                logger.warn("Failed to discover a service: {}", baseUrl, f.cause());
                if (failOnError) {
                    promise.tryFailure(f.cause());
                    return;
                }
                errors.put(baseUrl, f.cause());
            }
            discoverNext(baseUrls, index + 1, failOnError, registered, errors, promise);
        });
    }

    /**
     * Removes the specified service. Does nothing if the service is not registered.
     *
     * @return {@code true} if the service was registered
     */
    public boolean unregister(String name) {
        final ServiceInfo removed = services.remove(requireNonNull(name, "name"));
        if (removed != null) {
            logger.info("Unregistered a service: {}", name);
            return true;
        }
        return false;
    }

    /**
     * Returns the specified service, or {@code null} if not registered.
     */
    public ServiceInfo service(String name) {
        return services.get(requireNonNull(name, "name"));
    }

    /**
     * Returns all registered services sorted by name.
     */
    public List<ServiceInfo> services() {
        final List<ServiceInfo> sorted = new ArrayList<>(services.values());
        sorted.sort(Comparator.comparing(ServiceInfo::name));
        return Collections.unmodifiableList(sorted);
    }

    /**
     * Checks the health of the specified service and records the result.
     *
     * @return the {@link Future} which succeeds with {@code true} if the service is healthy, or fails with
     *         a {@link ServiceUnavailableException} if the service is not registered
     */
    public Future<Boolean> healthCheck(String name) {
        final ServiceInfo service = services.get(requireNonNull(name, "name"));
        if (service == null) {
            return executor.newFailedFuture(new ServiceUnavailableException(name, "not registered"));
        }
        return probe(service);
    }

    /**
     * Checks the health of all registered services concurrently and records the results.
     *
     * @return the {@link Future} which succeeds with the health of each service, keyed and sorted by name
     */
    public Future<Map<String, Boolean>> healthCheckAll() {
        final Collection<ServiceInfo> targets = new ArrayList<>(services.values());
        final Promise<Map<String, Boolean>> promise = executor.newPromise();
        if (targets.isEmpty()) {
            promise.trySuccess(Collections.emptyMap());
            return promise;
        }

        final Map<String, Boolean> results = new ConcurrentHashMap<>();
        final AtomicInteger remaining = new AtomicInteger(targets.size());
        for (ServiceInfo service : targets) {
            probe(service).addListener((FutureListener<Boolean>) future -> {
                results.put(service.name(), future.isSuccess() && future.getNow());
                if (remaining.decrementAndGet() == 0) {
                    promise.trySuccess(Collections.unmodifiableMap(new TreeMap<>(results)));
                }
            });
        }
        return promise;
    }

    private Future<Boolean> probe(ServiceInfo service) {
        final Promise<Boolean> promise = executor.newPromise();
        final AtomicBoolean done = new AtomicBoolean();

        final Future<Boolean> probe;
        try {
            probe = requireNonNull(healthProbe.probeHealth(service.baseUrl()), "probeHealth() returned null.");
        } catch (Exception e) {
            completeProbe(service, false, e, done, promise);
            return promise;
        }

        final long timeoutMillis = healthCheckTimeout.toMillis();
        final ScheduledFuture<?> timeout = executor.schedule(() -> {
            final TimeoutException cause = new TimeoutException(
                    "health check timed out after " + timeoutMillis + "ms");
            if (completeProbe(service, false, cause, done, promise)) {
                probe.cancel(false);
            }
        }, timeoutMillis, TimeUnit.MILLISECONDS);

        probe.addListener((FutureListener<Boolean>) future -> {
            timeout.cancel(false);
            if (future.isSuccess()) {
                completeProbe(service, Boolean.TRUE.equals(future.getNow()), null, done, promise);
            } else {
                completeProbe(service, false, future.cause(), done, promise);
            }
        });
        return promise;
    }

    private boolean completeProbe(ServiceInfo service, boolean healthy, Throwable cause, AtomicBoolean done,
                                  Promise<Boolean> promise) {
        if (!done.compareAndSet(false, true)) {
            return false;
        }
        final boolean wasHealthy = service.updateHealth(healthy, clock.currentMillis());
        if (healthy) {
            if (!wasHealthy) {
                logger.info("Service became healthy: {}", service.name());
            }
        } else if (cause != null) {
            logger.warn("Service is unhealthy: {} ({})", service.name(), cause.toString());
        } else {
            logger.warn("Service is unhealthy: {}", service.name());
        }
        promise.trySuccess(healthy);
        return true;
    }

    /**
     * Starts checking the health of all registered services periodically, with the first check right away.
     *
     * @return {@code false} if the health monitoring is running already
     */
    public boolean startHealthMonitoring(Duration interval) {
        requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be greater than zero");
        }
        synchronized (monitorLock) {
            if (monitoring) {
                logger.warn("Health monitoring is running already.");
                return false;
            }
            monitoring = true;
            final long generation = ++monitorGeneration;
            monitorIntervalMillis = interval.toMillis();
            nextCycle = executor.schedule(() -> runHealthCheckCycle(generation), 0, TimeUnit.MILLISECONDS);
        }
        logger.info("Started health monitoring every {}ms", interval.toMillis());
        return true;
    }

    private void runHealthCheckCycle(long generation) {
        final Future<Map<String, Boolean>> cycle;
        synchronized (monitorLock) {
            if (!isMonitoring(generation)) {
                return;
            }
            cycle = healthCheckAll();
            currentCycle = cycle;
        }
        cycle.addListener(future -> {
            synchronized (monitorLock) {
                if (currentCycle == cycle) {
                    currentCycle = null;
                }
                if (isMonitoring(generation)) {
                    nextCycle = executor.schedule(() -> runHealthCheckCycle(generation),
                                                  monitorIntervalMillis, TimeUnit.MILLISECONDS);
                }
            }
        });
    }

    private boolean isMonitoring(long generation) {
        assert Thread.holdsLock(monitorLock);
        return monitoring && monitorGeneration == generation;
    }

    /**
     * Stops the health monitoring, waiting for the health check in progress if any. Must not be invoked from
     * the {@link EventExecutor} of this registry.
     */
    public void stopHealthMonitoring() {
        final Future<?> cycle;
        synchronized (monitorLock) {
            if (!monitoring) {
                return;
            }
            monitoring = false;
            monitorGeneration++;
            if (nextCycle != null) {
                nextCycle.cancel(false);
                nextCycle = null;
            }
            cycle = currentCycle;
        }

        // every probe in a cycle is bounded by healthCheckTimeout
        if (cycle != null &&
            !cycle.awaitUninterruptibly(healthCheckTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
            logger.warn("The last health check did not complete in time.");
        }
        logger.info("Stopped health monitoring");
    }

    /**
     * Returns whether the health monitoring is running.
     */
    public boolean isHealthMonitoring() {
        synchronized (monitorLock) {
            return monitoring;
        }
    }

    /**
     * Returns the tools of all healthy services.
     */
    public List<AvailableTool> listAvailableTools() {
        return listAvailableTools(null, null);
    }

    /**
     * Returns the tools of the healthy services which match the specified filters.
     *
     * @param serviceName the name of the service, or {@code null} for any service
     * @param tags the tags at least one of which the service must have, or {@code null} or empty for any tags
     */
    public List<AvailableTool> listAvailableTools(String serviceName, Set<String> tags) {
        final List<AvailableTool> tools = new ArrayList<>();
        for (ServiceInfo service : services()) {
            if (!service.isHealthy() || service.catalog() == null) {
                continue;
            }
            if (serviceName != null && !serviceName.equals(service.name())) {
                continue;
            }
            if (tags != null && !tags.isEmpty() && Collections.disjoint(tags, service.tags())) {
                continue;
            }
            for (ToolDefinition tool : service.catalog().tools()) {
                tools.add(new AvailableTool(tool, service));
            }
        }
        return Collections.unmodifiableList(tools);
    }

    /**
     * Invokes the specified tool on the healthy service which owns it. The tool name is either the name in
     * the catalog or the name qualified with the service name, as in {@code "<service>.<tool>"}.
     *
     * @return the {@link Future} which succeeds with the result of the tool, or fails with a
     *         {@link ToolNotFoundException} if no service owns the tool, or a
     *         {@link ServiceUnavailableException} if the service which owns the tool is unhealthy
     */
    public Future<Object> callTool(String toolName, Map<String, Object> args) {
        requireNonNull(toolName, "toolName");
        requireNonNull(args, "args");

        ServiceInfo unhealthyOwner = null;
        for (ServiceInfo service : services()) {
            final ToolDefinition tool = service.tool(toolName);
            if (tool == null) {
                continue;
            }
            if (!service.isHealthy()) {
                unhealthyOwner = service;
                continue;
            }
            logger.debug("Calling {} on {}", tool.name(), service.name());
            try {
                return requireNonNull(toolInvoker.invoke(service, tool.name(), args),
                                      "invoke() returned null.");
            } catch (Exception e) {
                return executor.newFailedFuture(e);
            }
        }

        if (unhealthyOwner != null) {
            return executor.newFailedFuture(new ServiceUnavailableException(
                    unhealthyOwner.name(), "unhealthy; cannot call " + toolName));
        }
        return executor.newFailedFuture(new ToolNotFoundException(toolName));
    }

    /**
     * Stops the health monitoring.
     */
    @Override
    public void close() {
        stopHealthMonitoring();
    }
}
