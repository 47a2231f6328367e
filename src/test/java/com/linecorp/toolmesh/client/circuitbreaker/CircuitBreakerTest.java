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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.junit.Before;
import org.junit.Test;

import com.linecorp.toolmesh.client.circuitbreaker.CircuitBreaker.Permit;

public class CircuitBreakerTest {

    private static final String remoteServiceName = "testservice";

    private static final Duration timeout = Duration.ofSeconds(5);

    private static final Exception failure = new IOException("connection refused");

    private TestClock clock;

    @Before
    public void setUp() {
        clock = new TestClock();
    }

    private CircuitBreakerConfigBuilder configBuilder() {
        return new CircuitBreakerConfigBuilder()
                .failureThreshold(3)
                .successThreshold(2)
                .timeout(timeout)
                .halfOpenMaxCalls(2)
                .clock(clock);
    }

    private CircuitBreaker create() {
        return new CircuitBreaker(remoteServiceName, configBuilder().build());
    }

    private static void failCalls(CircuitBreaker cb, int times) {
        for (int i = 0; i < times; i++) {
            final Permit permit = cb.tryAcquirePermit();
            assertThat(permit.isAcquired(), is(true));
            permit.onFailure(failure);
        }
    }

    private static void succeedCalls(CircuitBreaker cb, int times) {
        for (int i = 0; i < times; i++) {
            final Permit permit = cb.tryAcquirePermit();
            assertThat(permit.isAcquired(), is(true));
            permit.onSuccess();
        }
    }

    private CircuitBreaker openState() {
        final CircuitBreaker cb = create();
        failCalls(cb, 3);
        assertThat(cb.state(), is(CircuitState.OPEN));
        return cb;
    }

    private CircuitBreaker halfOpenState() {
        final CircuitBreaker cb = openState();
        clock.forward(timeout);

        assertThat(cb.state(), is(CircuitState.OPEN));
        final Permit trial = cb.tryAcquirePermit();
        assertThat(trial.isAcquired(), is(true)); // the first request is a trial
        assertThat(trial.isTrial(), is(true));
        assertThat(cb.state(), is(CircuitState.HALF_OPEN));
        trial.onSuccess();
        assertThat(cb.stats().successCount(), is(1));
        return cb;
    }

    @Test
    public void testClosed() {
        final CircuitBreaker cb = create();
        assertThat(cb.state(), is(CircuitState.CLOSED));
        final Permit permit = cb.tryAcquirePermit();
        assertThat(permit.isAcquired(), is(true));
        assertThat(permit.isTrial(), is(false));
        assertThat(permit.retryAfter(), is(Duration.ZERO));
    }

    @Test
    public void testFailureThreshold() {
        final CircuitBreaker cb = create();

        failCalls(cb, 2);
        assertThat(cb.state(), is(CircuitState.CLOSED));
        assertThat(cb.stats().failureCount(), is(2));

        failCalls(cb, 1);
        assertThat(cb.state(), is(CircuitState.OPEN));

        final Permit rejected = cb.tryAcquirePermit();
        assertThat(rejected.isAcquired(), is(false));
        assertThat(rejected.retryAfter(), is(timeout));
        assertThat(cb.stats().rejectedCalls(), is(1L));
    }

    @Test
    public void testSuccessResetsFailureCount() {
        final CircuitBreaker cb = create();
        failCalls(cb, 2);
        succeedCalls(cb, 1);
        assertThat(cb.stats().failureCount(), is(0));

        failCalls(cb, 2);
        assertThat(cb.state(), is(CircuitState.CLOSED));
    }

    @Test
    public void testRetryAfterDecreases() {
        final CircuitBreaker cb = openState();
        clock.forward(Duration.ofSeconds(2));
        assertThat(cb.tryAcquirePermit().retryAfter(), is(Duration.ofSeconds(3)));
        clock.forward(Duration.ofMillis(2999));
        assertThat(cb.tryAcquirePermit().retryAfter(), is(Duration.ofMillis(1)));
    }

    @Test
    public void testOpenToHalfOpen() {
        halfOpenState();
    }

    @Test
    public void testHalfOpenToClosed() {
        final CircuitBreaker cb = halfOpenState();

        succeedCalls(cb, 1);

        assertThat(cb.state(), is(CircuitState.CLOSED));
        final CircuitBreakerStats stats = cb.stats();
        assertThat(stats.failureCount(), is(0));
        assertThat(stats.successCount(), is(0));
        assertThat(stats.halfOpenCallsInFlight(), is(0));
    }

    @Test
    public void testHalfOpenToOpen() {
        final CircuitBreaker cb = halfOpenState();

        // a failure reopens the circuit regardless of the success before it
        failCalls(cb, 1);

        assertThat(cb.state(), is(CircuitState.OPEN));
        final Permit rejected = cb.tryAcquirePermit();
        assertThat(rejected.isAcquired(), is(false));
        assertThat(rejected.retryAfter(), is(timeout));
    }

    @Test
    public void testHalfOpenMaxCalls() {
        final CircuitBreaker cb = openState();
        clock.forward(timeout);

        final Permit first = cb.tryAcquirePermit();
        final Permit second = cb.tryAcquirePermit();
        assertThat(first.isAcquired(), is(true));
        assertThat(second.isAcquired(), is(true));
        assertThat(cb.stats().halfOpenCallsInFlight(), is(2));

        final Permit third = cb.tryAcquirePermit();
        assertThat(third.isAcquired(), is(false));
        assertThat(third.retryAfter(), is(Duration.ZERO));

        // a completed trial gives its slot back
        first.onSuccess();
        assertThat(cb.state(), is(CircuitState.HALF_OPEN));
        assertThat(cb.stats().halfOpenCallsInFlight(), is(1));
        assertThat(cb.tryAcquirePermit().isAcquired(), is(true));
    }

    @Test
    public void testConcurrentTrialRequests() throws Exception {
        final CircuitBreaker cb = openState();
        clock.forward(timeout);

        final AtomicInteger acquired = new AtomicInteger();
        runConcurrently(16, () -> {
            if (cb.tryAcquirePermit().isAcquired()) {
                acquired.incrementAndGet();
            }
        });

        assertThat(acquired.get(), is(2));
        assertThat(cb.state(), is(CircuitState.HALF_OPEN));
        assertThat(cb.stats().halfOpenCallsInFlight(), is(2));
        assertThat(cb.stats().rejectedCalls(), is(14L));
        assertThat(transitions(cb), contains("CLOSED->OPEN", "OPEN->HALF_OPEN"));
    }

    @Test
    public void testConcurrentFailures() throws Exception {
        final CircuitBreaker cb = create();
        final int threads = 16;
        final List<Permit> permits = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            permits.add(cb.tryAcquirePermit());
        }

        final AtomicInteger index = new AtomicInteger();
        runConcurrently(threads, () -> permits.get(index.getAndIncrement()).onFailure(failure));

        assertThat(cb.state(), is(CircuitState.OPEN));
        assertThat(cb.stats().failedCalls(), is((long) threads));
        assertThat(transitions(cb), contains("CLOSED->OPEN"));
    }

    private static void runConcurrently(int threads, Runnable task) throws Exception {
        final CyclicBarrier barrier = new CyclicBarrier(threads);
        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            final List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    barrier.await(10, TimeUnit.SECONDS);
                    task.run();
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static List<String> transitions(CircuitBreaker cb) {
        return cb.stats().stateChanges().stream()
                 .map(t -> t.from() + "->" + t.to())
                 .collect(Collectors.toList());
    }

    @Test
    public void testStaleFailureReopens() {
        final CircuitBreaker cb = openState();
        clock.forward(timeout);

        final Permit stale = cb.tryAcquirePermit();
        cb.tryAcquirePermit().onFailure(failure);
        assertThat(cb.state(), is(CircuitState.OPEN));

        clock.forward(timeout);
        assertThat(cb.tryAcquirePermit().isAcquired(), is(true));
        assertThat(cb.stats().halfOpenCallsInFlight(), is(1));

        // any failure in HALF_OPEN reopens the circuit, even from a trial of an earlier period
        stale.onFailure(failure);
        assertThat(cb.state(), is(CircuitState.OPEN));
        assertThat(cb.stats().halfOpenCallsInFlight(), is(0));
    }

    @Test
    public void testStaleSuccessKeepsSlotsOfCurrentPeriod() {
        final CircuitBreaker cb = openState();
        clock.forward(timeout);

        final Permit stale = cb.tryAcquirePermit();
        cb.tryAcquirePermit().onFailure(failure);

        clock.forward(timeout);
        cb.tryAcquirePermit();
        stale.onSuccess();
        assertThat(cb.stats().halfOpenCallsInFlight(), is(1));
    }

    @Test
    public void testScenario() {
        final CircuitBreaker cb = create();
        failCalls(cb, 3);
        assertThat(cb.state(), is(CircuitState.OPEN));

        clock.forward(timeout.minusMillis(100));
        assertThat(cb.tryAcquirePermit().isAcquired(), is(false));

        clock.forward(Duration.ofMillis(100));
        final Permit probe = cb.tryAcquirePermit();
        assertThat(probe.isAcquired(), is(true));
        assertThat(cb.state(), is(CircuitState.HALF_OPEN));
        probe.onSuccess();
        succeedCalls(cb, 1);

        assertThat(cb.state(), is(CircuitState.CLOSED));
        assertThat(cb.stats().failureCount(), is(0));

        final List<String> transitions = cb.stats().stateChanges().stream()
                                           .map(t -> t.from() + "->" + t.to())
                                           .collect(Collectors.toList());
        assertThat(transitions, contains("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"));
    }

    @Test
    public void testStats() {
        final CircuitBreaker cb = create();
        assertThat(cb.stats().successRate(), is(0.0));
        assertThat(cb.stats().lastFailureTime(), is(nullValue()));

        succeedCalls(cb, 1);
        failCalls(cb, 3);
        cb.tryAcquirePermit();

        final CircuitBreakerStats stats = cb.stats();
        assertThat(stats.name(), is(remoteServiceName));
        assertThat(stats.state(), is(CircuitState.OPEN));
        assertThat(stats.totalCalls(), is(5L));
        assertThat(stats.successfulCalls(), is(1L));
        assertThat(stats.failedCalls(), is(3L));
        assertThat(stats.rejectedCalls(), is(1L));
        assertThat(stats.successRate(), is(0.2));
        assertThat(stats.lastFailureTime(), is(notNullValue()));
        assertThat(stats.lastSuccessTime(), is(notNullValue()));
        assertThat(stats.stateChanges(), hasSize(1));
        assertThat(stats.stateChanges().get(0).reason(), startsWith("failure threshold reached (3/3)"));
    }

    @Test
    public void testStateChangesAreCapped() {
        final CircuitBreaker cb = create();
        for (int i = 0; i < 8; i++) {
            failCalls(cb, 3);
            cb.reset();
        }
        final List<StateTransition> changes = cb.stats().stateChanges();
        assertThat(changes, hasSize(CircuitBreaker.MAX_STATE_CHANGES));
        assertThat(changes.get(changes.size() - 1).reason(), is("manual reset"));
    }

    @Test
    public void testReset() {
        final CircuitBreaker cb = openState();
        cb.reset();
        assertThat(cb.state(), is(CircuitState.CLOSED));
        assertThat(cb.tryAcquirePermit().isAcquired(), is(true));
        assertThat(cb.stats().failureCount(), is(0));
    }

    @Test
    public void testSlowCalls() {
        final CircuitBreaker cb = new CircuitBreaker(
                remoteServiceName, configBuilder().slowCallDurationThreshold(Duration.ofSeconds(1)).build());

        final Permit slow = cb.tryAcquirePermit();
        clock.forward(Duration.ofSeconds(2));
        slow.onSuccess();

        final Permit fast = cb.tryAcquirePermit();
        fast.onSuccess();

        final CircuitBreakerStats stats = cb.stats();
        assertThat(stats.slowCalls(), is(1L));
        assertThat(stats.state(), is(CircuitState.CLOSED));
    }

    @Test
    public void testFailureFilter() {
        final CircuitBreaker cb = new CircuitBreaker(
                remoteServiceName,
                configBuilder().failureFilter(cause -> !(cause instanceof IllegalArgumentException)).build());

        for (int i = 0; i < 5; i++) {
            cb.tryAcquirePermit().onFailure(new IllegalArgumentException());
        }
        assertThat(cb.state(), is(CircuitState.CLOSED));
        assertThat(cb.stats().failedCalls(), is(0L));

        failCalls(cb, 3);
        assertThat(cb.state(), is(CircuitState.OPEN));
    }

    @Test
    public void testListener() {
        final CircuitBreakerListener listener = mock(CircuitBreakerListener.class);
        final CircuitBreaker cb = new CircuitBreaker(remoteServiceName,
                                                     configBuilder().listener(listener).build());
        failCalls(cb, 3);
        verify(listener, times(1)).onStateChanged(eq(remoteServiceName), any(StateTransition.class));
    }

    @Test
    public void testListenerFailureIsIgnored() {
        final CircuitBreakerListener listener = mock(CircuitBreakerListener.class);
        doThrow(new IllegalStateException()).when(listener).onStateChanged(any(), any());
        final CircuitBreaker cb = new CircuitBreaker(remoteServiceName,
                                                     configBuilder().listener(listener).build());
        failCalls(cb, 3);
        assertThat(cb.state(), is(CircuitState.OPEN));
    }

    @Test
    public void testCompletingTwiceIsIgnored() {
        final CircuitBreaker cb = create();
        final Permit permit = cb.tryAcquirePermit();
        permit.onFailure(failure);
        permit.onFailure(failure);
        permit.onSuccess();
        assertThat(cb.stats().failureCount(), is(1));
        assertThat(cb.stats().successfulCalls(), is(0L));
    }

    @Test
    public void testRejectedPermit() {
        final CircuitBreaker cb = openState();
        final Permit rejected = cb.tryAcquirePermit();
        try {
            rejected.onSuccess();
            fail();
        } catch (IllegalStateException expected) {
            // expected
        }

        final FailFastException e = rejected.toException();
        assertThat(e.getRemoteServiceName(), is(remoteServiceName));
        assertThat(e.getRetryAfter(), is(timeout));
    }
}
