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

import static java.util.Objects.requireNonNull;

import java.time.Duration;

/**
 * A {@link RuntimeException} raised when a call is refused by an open circuit, without the remote service
 * being invoked.
 */
public final class FailFastException extends RuntimeException {

    private static final long serialVersionUID = -946827349873835165L;

    private final String remoteServiceName;

    private final Duration retryAfter;

    /**
     * Creates a new instance with the specified remote service name and the time left until the circuit
     * accepts a trial request again.
     */
    public FailFastException(String remoteServiceName, Duration retryAfter) {
        super("circuit breaker is open: " + requireNonNull(remoteServiceName, "remoteServiceName") +
              " (retry after " + requireNonNull(retryAfter, "retryAfter").toMillis() + "ms)");
        this.remoteServiceName = remoteServiceName;
        this.retryAfter = retryAfter;
    }

    public String getRemoteServiceName() {
        return remoteServiceName;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
