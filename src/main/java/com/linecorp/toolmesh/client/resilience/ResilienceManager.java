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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.toolmesh.client.circuitbreaker.CircuitBreaker;
import com.linecorp.toolmesh.client.circuitbreaker.CircuitBreaker.Permit;
import com.linecorp.toolmesh.client.circuitbreaker.CircuitBreakerConfig;
import com.linecorp.toolmesh.client.circuitbreaker.CircuitBreakerStats;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;

/**
 * Invokes remote services through per-service {@link CircuitBreaker}s, retrying transient failures and
 * falling back to alternative services in order.
 *
 * <p>One {@link CircuitBreaker} is created for each distinct service name on first use and kept for the
 * lifetime of the manager. Concurrent calls with an equal request key share a single execution.
 */
public final class ResilienceManager {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceManager.class);

    private final EventExecutor executor;

    private final CircuitBreakerConfig defaultConfig;

    private final Map<String, CircuitBreakerConfig> configs;

    private final RetryPolicy defaultRetryPolicy;

    private final ConcurrentMap<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();

    private final ConcurrentMap<RequestKey, Future<?>> inFlight = new ConcurrentHashMap<>();

    ResilienceManager(EventExecutor executor, CircuitBreakerConfig defaultConfig,
                      Map<String, CircuitBreakerConfig> configs, RetryPolicy defaultRetryPolicy) {
        this.executor = executor;
        this.defaultConfig = defaultConfig;
        this.configs = configs;
        this.defaultRetryPolicy = defaultRetryPolicy;
    }

    /**
     * Returns a new {@link ResilienceManagerBuilder} which schedules retries on the specified
     * {@link EventExecutor}.
     */
    public static ResilienceManagerBuilder builder(EventExecutor executor) {
        return new ResilienceManagerBuilder(executor);
    }

    /**
     * Invokes the specified operation against {@code serviceName} with the default {@link CallOptions}.
     */
    public <T> Future<CallOutcome<T>> execute(String serviceName, RemoteCall<T> operation) {
        return execute(serviceName, operation, CallOptions.of());
    }

    /**
     * Invokes the specified operation against {@code serviceName}, and then against each of
     * {@link CallOptions#fallbackServiceNames()} in order until one of them succeeds.
     *
     * <p>The returned {@link Future} always succeeds with a {@link CallOutcome}: the value of the first
     * service which succeeded, or the outcome of the last service tried.
     */
    public <T> Future<CallOutcome<T>> execute(String serviceName, RemoteCall<T> operation,
                                              CallOptions options) {
        requireNonNull(serviceName, "serviceName");
        requireNonNull(operation, "operation");
        requireNonNull(options, "options");
        if (serviceName.isEmpty()) {
            throw new IllegalArgumentException("serviceName must not be empty");
        }

        if (!options.dedupe() || options.requestKey().isEmpty()) {
            final Promise<CallOutcome<T>> promise = executor.newPromise();
            executeChain(serviceName, operation, options, promise);
            return promise;
        }

        final RequestKey key = new RequestKey(serviceName, options.requestKey());
        final Promise<CallOutcome<T>> shared = executor.newPromise();
        final Future<?> existing = inFlight.putIfAbsent(key, shared);
        if (existing != null) {
            logger.debug("Joining an in-flight request: {}", key);
            @SuppressWarnings("unchecked")
            final Future<CallOutcome<T>> cast = (Future<CallOutcome<T>>) existing;
            return newWaiter(cast);
        }

        // later callers must start a new execution once the waiters are notified
        shared.addListener(future -> inFlight.remove(key, shared));
        final Future<CallOutcome<T>> waiter = newWaiter(shared);
        executeChain(serviceName, operation, options, shared);
        return waiter;
    }

    /**
     * Returns a caller-owned promise completed from {@code shared}, so that cancelling it detaches only
     * that caller.
     */
    private <T> Future<CallOutcome<T>> newWaiter(Future<CallOutcome<T>> shared) {
        final Promise<CallOutcome<T>> waiter = executor.newPromise();
        shared.addListener((FutureListener<CallOutcome<T>>) future -> {
            if (future.isSuccess()) {
                waiter.trySuccess(future.getNow());
            } else {
                waiter.tryFailure(future.cause());
            }
        });
        return waiter;
    }

    private <T> void executeChain(String serviceName, RemoteCall<T> operation, CallOptions options,
                                  Promise<CallOutcome<T>> promise) {
        final List<String> targets = new ArrayList<>(1 + options.fallbackServiceNames().size());
        targets.add(serviceName);
        targets.addAll(options.fallbackServiceNames());
        final RetryPolicy retryPolicy = options.retryPolicy() != null ? options.retryPolicy()
                                                                      : defaultRetryPolicy;
        try {
            executeTarget(targets, 0, operation, retryPolicy, promise);
        } catch (Exception e) {
            promise.tryFailure(e);
        }
    }

    private <T> void executeTarget(List<String> targets, int index, RemoteCall<T> operation,
                                   RetryPolicy retryPolicy, Promise<CallOutcome<T>> promise) {
        final String target = targets.get(index);
        final Permit permit = circuitBreaker(target).tryAcquirePermit();
        if (!permit.isAcquired()) {
            onTargetFailed(targets, index, operation, retryPolicy,
                           CallOutcome.circuitOpen(target, permit.retryAfter()), promise);
            return;
        }

        final Promise<T> result = executor.newPromise();
        result.addListener((FutureListener<T>) future -> {
            if (future.isSuccess()) {
                permit.onSuccess();
                promise.trySuccess(CallOutcome.success(target, future.getNow()));
            } else {
                permit.onFailure(future.cause());
                onTargetFailed(targets, index, operation, retryPolicy,
                               CallOutcome.exhausted(target, future.cause()), promise);
            }
        });
        attempt(target, operation, retryPolicy, 1, result);
    }

    private <T> void onTargetFailed(List<String> targets, int index, RemoteCall<T> operation,
                                    RetryPolicy retryPolicy, CallOutcome<T> outcome,
                                    Promise<CallOutcome<T>> promise) {
        final int nextIndex = index + 1;
        if (nextIndex < targets.size()) {
            logger.warn("{} failed ({}); falling back to {}",
                        targets.get(index), describe(outcome), targets.get(nextIndex));
            executeTarget(targets, nextIndex, operation, retryPolicy, promise);
            return;
        }
        if (nextIndex > 1) {
            logger.warn("All of {} failed; the last one with {}", targets, describe(outcome));
        } else {
            logger.warn("{} failed ({})", targets.get(index), describe(outcome));
        }
        promise.trySuccess(outcome);
    }

    private static String describe(CallOutcome<?> outcome) {
        if (outcome.type() == CallOutcome.Type.CIRCUIT_OPEN) {
            return "circuit open, retry after " + outcome.retryAfter().toMillis() + "ms";
        }
        return String.valueOf(outcome.cause());
    }

    private <T> void attempt(String target, RemoteCall<T> operation, RetryPolicy retryPolicy,
                             int attempts, Promise<T> result) {
        final Promise<T> attemptPromise = executor.newPromise();
        attemptPromise.addListener((FutureListener<T>) future -> {
            if (future.isSuccess()) {
                result.trySuccess(future.getNow());
            } else {
                onAttemptFailed(target, operation, retryPolicy, attempts, future.cause(), result);
            }
        });

        final Future<T> future;
        try {
            future = requireNonNull(operation.call(target), "operation.call() returned null.");
        } catch (Exception e) {
            attemptPromise.tryFailure(e);
            return;
        }

        final ScheduledFuture<?> timeout;
        if (retryPolicy.attemptTimeout().isZero()) {
            timeout = null;
        } else {
            final long timeoutMillis = retryPolicy.attemptTimeout().toMillis();
            timeout = executor.schedule(() -> {
                if (attemptPromise.tryFailure(new TimeoutException(
                        target + " did not respond in " + timeoutMillis + "ms"))) {
                    future.cancel(false);
                }
            }, timeoutMillis, TimeUnit.MILLISECONDS);
        }

        future.addListener((FutureListener<T>) f -> {
            if (timeout != null) {
                timeout.cancel(false);
            }
            if (f.isSuccess()) {
                attemptPromise.trySuccess(f.getNow());
            } else {
                attemptPromise.tryFailure(f.cause());
            }
        });
    }

    private <T> void onAttemptFailed(String target, RemoteCall<T> operation, RetryPolicy retryPolicy,
                                     int attempts, Throwable cause, Promise<T> result) {
        if (attempts >= retryPolicy.maxAttempts()) {
            result.tryFailure(cause);
            return;
        }
        if (!retryPolicy.isRetryable(cause)) {
            logger.debug("{} attempt {} failed with a non-retryable error: {}",
                         target, attempts, cause.toString());
            result.tryFailure(cause);
            return;
        }

        final long delayMillis = retryPolicy.backoffMillis(attempts);
        if (logger.isDebugEnabled()) {
            logger.debug("{} attempt {}/{} failed; retrying in {}ms: {}",
                         target, attempts, retryPolicy.maxAttempts(), delayMillis, cause.toString());
        }
        try {
            executor.schedule(() -> attempt(target, operation, retryPolicy, attempts + 1, result),
                              delayMillis, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            e.addSuppressed(cause);
            result.tryFailure(e);
        }
    }

    /**
     * Returns the {@link CircuitBreaker} of the specified service, creating it on first use.
     */
    public CircuitBreaker circuitBreaker(String serviceName) {
        final CircuitBreaker circuitBreaker = circuitBreakers.get(serviceName);
        if (circuitBreaker != null) {
            return circuitBreaker;
        }
        return circuitBreakers.computeIfAbsent(
                serviceName, name -> new CircuitBreaker(name, configs.getOrDefault(name, defaultConfig)));
    }

    /**
     * Returns the snapshots of all {@link CircuitBreaker}s created so far, keyed and sorted by name.
     */
    public Map<String, CircuitBreakerStats> stats() {
        final Map<String, CircuitBreakerStats> stats = new TreeMap<>();
        circuitBreakers.forEach((name, circuitBreaker) -> stats.put(name, circuitBreaker.stats()));
        return Collections.unmodifiableMap(stats);
    }

    /**
     * Returns the snapshot of the {@link CircuitBreaker} of the specified service, or {@code null} if the
     * service has never been called.
     */
    public CircuitBreakerStats stats(String serviceName) {
        final CircuitBreaker circuitBreaker = circuitBreakers.get(requireNonNull(serviceName, "serviceName"));
        return circuitBreaker != null ? circuitBreaker.stats() : null;
    }

    /**
     * Forces the {@link CircuitBreaker} of the specified service into CLOSED state.
     *
     * @return {@code true} if the circuit breaker exists and has been reset
     */
    public boolean resetCircuitBreaker(String serviceName) {
        final CircuitBreaker circuitBreaker = circuitBreakers.get(requireNonNull(serviceName, "serviceName"));
        if (circuitBreaker == null) {
            logger.warn("No circuit breaker to reset: {}", serviceName);
            return false;
        }
        circuitBreaker.reset();
        return true;
    }

    /**
     * Returns the number of deduplicated requests in flight.
     */
    public int inFlightRequests() {
        return inFlight.size();
    }

    /**
     * Identifies a deduplicated request by its service name and arguments.
     */
    private static final class RequestKey {

        private final String serviceName;

        private final Object[] args;

        private final int hashCode;

        RequestKey(String serviceName, List<Object> args) {
            this.serviceName = serviceName;
            this.args = args.toArray();
            hashCode = 31 * serviceName.hashCode() + Arrays.deepHashCode(this.args);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof RequestKey)) {
                return false;
            }
            final RequestKey that = (RequestKey) o;
            return hashCode == that.hashCode &&
                   serviceName.equals(that.serviceName) &&
                   Arrays.deepEquals(args, that.args);
        }

        @Override
        public String toString() {
            return serviceName + Arrays.deepToString(args);
        }
    }
}
