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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.AfterClass;
import org.junit.Before;
import org.junit.Test;

import com.linecorp.toolmesh.client.circuitbreaker.CircuitBreakerConfig;
import com.linecorp.toolmesh.client.circuitbreaker.CircuitBreakerConfigBuilder;
import com.linecorp.toolmesh.client.circuitbreaker.CircuitBreakerStats;
import com.linecorp.toolmesh.client.circuitbreaker.CircuitState;
import com.linecorp.toolmesh.client.circuitbreaker.FailFastException;

import io.netty.channel.DefaultEventLoop;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;

public class ResilienceManagerTest {

    private static final DefaultEventLoop eventLoop = new DefaultEventLoop();

    private static final RetryPolicy fastRetry = new RetryPolicyBuilder()
            .maxAttempts(3)
            .backoffMultiplier(Duration.ofMillis(5))
            .minBackoff(Duration.ofMillis(5))
            .maxBackoff(Duration.ofMillis(20))
            .build();

    private static final CircuitBreakerConfig config = new CircuitBreakerConfigBuilder()
            .failureThreshold(3)
            .timeout(Duration.ofMinutes(1))
            .build();

    private ResilienceManager manager;

    @Before
    public void setUp() {
        manager = ResilienceManager.builder(eventLoop)
                                   .circuitBreakerConfig(config)
                                   .retryPolicy(fastRetry)
                                   .build();
    }

    @AfterClass
    public static void shutdown() {
        eventLoop.shutdownGracefully().syncUninterruptibly();
    }

    private static <T> CallOutcome<T> await(Future<CallOutcome<T>> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    private void tripCircuit(String serviceName) {
        for (int i = 0; i < config.failureThreshold(); i++) {
            manager.circuitBreaker(serviceName).tryAcquirePermit().onFailure(new IOException());
        }
        assertThat(manager.circuitBreaker(serviceName).state(), is(CircuitState.OPEN));
    }

    @Test
    public void testSuccess() throws Exception {
        final CallOutcome<String> outcome = await(
                manager.execute("a", service -> eventLoop.newSucceededFuture("hello from " + service)));

        assertThat(outcome.type(), is(CallOutcome.Type.SUCCESS));
        assertThat(outcome.isSuccess(), is(true));
        assertThat(outcome.serviceName(), is("a"));
        assertThat(outcome.get(), is("hello from a"));
        assertThat(manager.stats("a").successfulCalls(), is(1L));
    }

    @Test
    public void testRetryTransientFailure() throws Exception {
        final AtomicInteger calls = new AtomicInteger();
        final CallOutcome<String> outcome = await(manager.execute("a", service -> {
            if (calls.incrementAndGet() < 3) {
                return eventLoop.newFailedFuture(new TransientCallException("overloaded"));
            }
            return eventLoop.newSucceededFuture("ok");
        }));

        assertThat(outcome.get(), is("ok"));
        assertThat(calls.get(), is(3));
        // the attempts of a call count as a single call of the circuit breaker
        assertThat(manager.stats("a").totalCalls(), is(1L));
        assertThat(manager.stats("a").failedCalls(), is(0L));
    }

    @Test
    public void testRetryExhausted() throws Exception {
        final AtomicInteger calls = new AtomicInteger();
        final CallOutcome<String> outcome = await(manager.execute("a", service -> {
            calls.incrementAndGet();
            throw new IOException("connection refused");
        }));

        assertThat(outcome.type(), is(CallOutcome.Type.EXHAUSTED));
        assertThat(outcome.cause(), is(instanceOf(IOException.class)));
        assertThat(calls.get(), is(fastRetry.maxAttempts()));
        assertThat(manager.stats("a").failedCalls(), is(1L));
    }

    @Test
    public void testNoRetryOnPermanentFailure() throws Exception {
        final AtomicInteger calls = new AtomicInteger();
        final PermanentCallException cause = new PermanentCallException("bad request");
        final CallOutcome<String> outcome = await(manager.execute("a", service -> {
            calls.incrementAndGet();
            return eventLoop.newFailedFuture(cause);
        }));

        assertThat(outcome.type(), is(CallOutcome.Type.EXHAUSTED));
        assertThat(outcome.cause(), is(sameInstance(cause)));
        assertThat(calls.get(), is(1));
        try {
            outcome.get();
            fail();
        } catch (PermanentCallException e) {
            assertThat(e, is(sameInstance(cause)));
        }
    }

    @Test
    public void testAttemptTimeout() throws Exception {
        final RetryPolicy policy = new RetryPolicyBuilder().maxAttempts(1)
                                                           .attemptTimeout(Duration.ofMillis(50))
                                                           .build();
        final Promise<String> pending = eventLoop.newPromise();
        final CallOutcome<String> outcome = await(manager.execute(
                "a", service -> pending, CallOptions.builder().retryPolicy(policy).build()));

        assertThat(outcome.type(), is(CallOutcome.Type.EXHAUSTED));
        assertThat(outcome.cause(), is(instanceOf(TimeoutException.class)));
        assertThat(pending.isCancelled(), is(true));
    }

    @Test
    public void testCircuitOpens() throws Exception {
        final AtomicInteger calls = new AtomicInteger();
        final RemoteCall<String> failing = service -> {
            calls.incrementAndGet();
            return eventLoop.newFailedFuture(new PermanentCallException("broken"));
        };

        for (int i = 0; i < 3; i++) {
            assertThat(await(manager.execute("a", failing)).type(), is(CallOutcome.Type.EXHAUSTED));
        }
        assertThat(manager.circuitBreaker("a").state(), is(CircuitState.OPEN));

        final CallOutcome<String> outcome = await(manager.execute("a", failing));
        assertThat(outcome.type(), is(CallOutcome.Type.CIRCUIT_OPEN));
        assertThat(outcome.retryAfter().isZero(), is(false));
        assertThat(calls.get(), is(3));
        try {
            outcome.get();
            fail();
        } catch (FailFastException e) {
            assertThat(e.getRemoteServiceName(), is("a"));
        }
    }

    @Test
    public void testFallbackOrder() throws Exception {
        tripCircuit("primary");
        tripCircuit("b");

        final List<String> called = Collections.synchronizedList(new ArrayList<>());
        final CallOutcome<String> outcome = await(manager.execute("primary", service -> {
            called.add(service);
            return eventLoop.newSucceededFuture("result of " + service);
        }, CallOptions.builder().fallbackServiceNames("b", "c", "d").build()));

        assertThat(outcome.serviceName(), is("c"));
        assertThat(outcome.get(), is("result of c"));
        assertThat(called, contains("c"));
        assertThat(manager.stats("d"), is(nullValue()));
    }

    @Test
    public void testFallbackAfterFailure() throws Exception {
        final CallOutcome<String> outcome = await(manager.execute("primary", service -> {
            if ("primary".equals(service)) {
                return eventLoop.newFailedFuture(new PermanentCallException("broken"));
            }
            return eventLoop.newSucceededFuture(service);
        }, CallOptions.builder().fallbackServiceNames("b").build()));

        assertThat(outcome.get(), is("b"));
        assertThat(manager.stats("primary").failedCalls(), is(1L));
    }

    @Test
    public void testAllTargetsFail() throws Exception {
        tripCircuit("primary");
        final CallOutcome<String> outcome = await(manager.execute(
                "primary", service -> eventLoop.newFailedFuture(new PermanentCallException(service)),
                CallOptions.builder().fallbackServiceNames("b").build()));

        // the outcome of the last target
        assertThat(outcome.type(), is(CallOutcome.Type.EXHAUSTED));
        assertThat(outcome.serviceName(), is("b"));
        assertThat(outcome.cause().getMessage(), is("b"));
    }

    @Test
    public void testDedupe() throws Exception {
        final AtomicInteger calls = new AtomicInteger();
        final Promise<String> pending = eventLoop.newPromise();
        final RemoteCall<String> operation = service -> {
            calls.incrementAndGet();
            return pending;
        };
        final CallOptions options = CallOptions.builder().requestKey("search", "line").build();

        final List<Future<CallOutcome<String>>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(manager.execute("a", operation, options));
        }
        assertThat(calls.get(), is(1));
        assertThat(manager.inFlightRequests(), is(1));

        pending.setSuccess("found");
        final CallOutcome<String> first = await(futures.get(0));
        for (Future<CallOutcome<String>> future : futures) {
            assertThat(await(future), is(sameInstance(first)));
        }
        assertThat(first.get(), is("found"));
        assertThat(manager.inFlightRequests(), is(0));

        // a completed request is not shared
        await(manager.execute("a", service -> {
            calls.incrementAndGet();
            return eventLoop.newSucceededFuture("again");
        }, options));
        assertThat(calls.get(), is(2));
    }

    @Test
    public void testDedupeCancelDetachesOnlyOneCaller() throws Exception {
        final AtomicInteger calls = new AtomicInteger();
        final Promise<String> pending = eventLoop.newPromise();
        final RemoteCall<String> operation = service -> {
            calls.incrementAndGet();
            return pending;
        };
        final CallOptions options = CallOptions.builder().requestKey("k").build();

        final Future<CallOutcome<String>> first = manager.execute("a", operation, options);
        final Future<CallOutcome<String>> second = manager.execute("a", operation, options);
        assertThat(first.cancel(false), is(true));
        final Future<CallOutcome<String>> third = manager.execute("a", operation, options);

        assertThat(first.isCancelled(), is(true));
        assertThat(second.isCancelled(), is(false));
        assertThat(third.isCancelled(), is(false));
        assertThat(calls.get(), is(1));
        assertThat(manager.inFlightRequests(), is(1));

        pending.setSuccess("done");
        assertThat(await(second).get(), is("done"));
        assertThat(await(third).get(), is("done"));
        assertThat(calls.get(), is(1));
        assertThat(manager.inFlightRequests(), is(0));
    }

    @Test
    public void testDedupeDistinguishesKeys() throws Exception {
        final AtomicInteger calls = new AtomicInteger();
        final Promise<String> pending = eventLoop.newPromise();
        final RemoteCall<String> operation = service -> {
            calls.incrementAndGet();
            return pending;
        };

        manager.execute("a", operation, CallOptions.builder().requestKey("x").build());
        manager.execute("a", operation, CallOptions.builder().requestKey("y").build());
        manager.execute("b", operation, CallOptions.builder().requestKey("x").build());
        manager.execute("a", operation, CallOptions.builder().requestKey("x").dedupe(false).build());
        manager.execute("a", operation);
        assertThat(calls.get(), is(5));

        pending.setSuccess("done");
    }

    @Test
    public void testStatsAndReset() throws Exception {
        assertThat(manager.stats().isEmpty(), is(true));
        assertThat(manager.resetCircuitBreaker("a"), is(false));

        tripCircuit("b");
        await(manager.execute("a", service -> eventLoop.newSucceededFuture("ok")));

        final Map<String, CircuitBreakerStats> stats = manager.stats();
        assertThat(new ArrayList<>(stats.keySet()), contains("a", "b"));
        assertThat(stats.get("b").state(), is(CircuitState.OPEN));
        assertThat(stats.get("b").stateChanges(), is(notNullValue()));

        assertThat(manager.resetCircuitBreaker("b"), is(true));
        assertThat(manager.stats("b").state(), is(CircuitState.CLOSED));
        assertThat(manager.stats("b").failureCount(), is(0));
    }

    @Test
    public void testPerServiceConfig() {
        final CircuitBreakerConfig strict = new CircuitBreakerConfigBuilder().failureThreshold(1).build();
        final ResilienceManager manager = ResilienceManager.builder(eventLoop)
                                                           .circuitBreakerConfig("strict", strict)
                                                           .build();
        assertThat(manager.circuitBreaker("strict").config(), is(sameInstance(strict)));
        assertThat(manager.circuitBreaker("other").config().failureThreshold(), is(5));
        assertThat(manager.circuitBreaker("strict"), is(sameInstance(manager.circuitBreaker("strict"))));
    }

    @Test
    public void testCallOptions() {
        final CallOptions options = CallOptions.of();
        assertThat(options.fallbackServiceNames(), is(empty()));
        assertThat(options.retryPolicy(), is(nullValue()));
        assertThat(options.dedupe(), is(true));
        assertThat(options.requestKey(), is(empty()));
    }
}
