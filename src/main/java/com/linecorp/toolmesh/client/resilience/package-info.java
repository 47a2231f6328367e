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
 * Runs remote calls through per-service circuit breakers, with retries, ordered fallback to other services
 * and deduplication of identical calls in flight.
 *
 * <pre>{@code
 * ResilienceManager manager = ResilienceManager.builder(eventLoop)
 *                                              .retryPolicy(RetryPolicy.ofDefault())
 *                                              .build();
 *
 * manager.execute("search-a", service -> searchClient.search(service, query),
 *                 CallOptions.builder()
 *                            .fallbackServiceNames("search-b")
 *                            .requestKey("search", query)
 *                            .build())
 *        .addListener((FutureListener<CallOutcome<Result>>) f -> {
 *            CallOutcome<Result> outcome = f.getNow();
 *            ...
 *        });
 * }</pre>
 */
package com.linecorp.toolmesh.client.resilience;
