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

/**
 * Provides a failure detection mechanism based on the
 * <a href="http://martinfowler.com/bliki/CircuitBreaker.html">circuit breaker pattern</a>.
 *
 * <h1>Usage</h1>
 * <pre>{@code
 * CircuitBreakerConfig config = new CircuitBreakerConfigBuilder()
 *                                    .failureThreshold(3)
 *                                    .timeout(Duration.ofSeconds(30))
 *                                    .build();
 * CircuitBreaker circuitBreaker = new CircuitBreaker("inventory", config);
 *
 * CircuitBreaker.Permit permit = circuitBreaker.tryAcquirePermit();
 * if (!permit.isAcquired()) {
 *     // fallback code, or throw permit.toException()
 * }
 * try {
 *     Object result = callInventory();
 *     permit.onSuccess();
 * } catch (Exception e) {
 *     permit.onFailure(e);
 * }
 * }</pre>
 *
 * <h1>Circuit States and Transitions</h1>
 * The circuit breaker provided by this package is implemented as a finite state machine consisting of the
 * following states and transitions.
 *
 * <h3>{@code CLOSED}</h3>
 * The initial state. All requests are sent to the remote service. If {@code failureThreshold} requests fail
 * in a row, the state turns into {@code OPEN}.
 *
 * <h3>{@code OPEN}</h3>
 * All requests fail immediately without calling the remote service. When {@code timeout} has passed since
 * the last failure, the next request is sent as a trial and the state turns into {@code HALF_OPEN}.
 *
 * <h3>{@code HALF_OPEN}</h3>
 * Up to {@code halfOpenMaxCalls} trial requests are sent at a time.
 * <ul>
 *     <li>If {@code successThreshold} of them succeed, the state turns into {@code CLOSED}.</li>
 *     <li>If any of them fails, the state returns to {@code OPEN}.</li>
 * </ul>
 *
 * <h1>Circuit Breaker Configurations</h1>
 * The behavior of a circuit breaker can be modified via
 * {@link com.linecorp.toolmesh.client.circuitbreaker.CircuitBreakerConfigBuilder}.
 *
 * <h3>{@code failureThreshold}</h3>
 * The number of consecutive failures which opens the circuit.
 *
 * <h3>{@code successThreshold}</h3>
 * The number of successful trial requests which closes the circuit.
 *
 * <h3>{@code timeout}</h3>
 * The time to wait after the last failure before sending a trial request.
 *
 * <h3>{@code halfOpenMaxCalls}</h3>
 * The maximum number of trial requests in flight.
 *
 * <h3>{@code slowCallDurationThreshold}</h3>
 * The duration above which a call is counted as slow in the statistics.
 *
 * <h3>{@code failureFilter}</h3>
 * A filter that decides whether a circuit breaker should deal with a given error.
 *
 * <h3>{@code listener}</h3>
 * A {@link com.linecorp.toolmesh.client.circuitbreaker.CircuitBreakerListener} notified of every state
 * transition.
 */
package com.linecorp.toolmesh.client.circuitbreaker;
