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

package com.linecorp.toolmesh.registry.http;

import static java.util.Objects.requireNonNull;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

/**
 * Builds a {@link HttpServiceTransport} instance using builder pattern.
 */
public final class HttpServiceTransportBuilder {

    private static final int DEFAULT_MAX_CONNECTIONS_PER_HOST = 8;
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(3);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private EventLoopGroup eventLoopGroup;

    private int maxConnectionsPerHost = DEFAULT_MAX_CONNECTIONS_PER_HOST;

    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

    private ObjectMapper objectMapper;

    HttpServiceTransportBuilder() {}

    /**
     * Sets the {@link EventLoopGroup} which performs the I/O. The group is not shut down when the transport
     * is closed. If not set, the transport creates its own group and shuts it down on close.
     */
    public HttpServiceTransportBuilder eventLoopGroup(EventLoopGroup eventLoopGroup) {
        this.eventLoopGroup = requireNonNull(eventLoopGroup, "eventLoopGroup");
        return this;
    }

    /**
     * Sets the maximum number of connections to a remote address. Requests beyond it wait for a connection
     * to be released.
     */
    public HttpServiceTransportBuilder maxConnectionsPerHost(int maxConnectionsPerHost) {
        if (maxConnectionsPerHost <= 0) {
            throw new IllegalArgumentException(
                    "maxConnectionsPerHost: " + maxConnectionsPerHost + " (expected: > 0)");
        }
        this.maxConnectionsPerHost = maxConnectionsPerHost;
        return this;
    }

    public HttpServiceTransportBuilder connectTimeout(Duration connectTimeout) {
        this.connectTimeout = validateDuration(connectTimeout, "connectTimeout");
        return this;
    }

    /**
     * Sets the time limit of a request, including the time spent waiting for a connection.
     */
    public HttpServiceTransportBuilder requestTimeout(Duration requestTimeout) {
        this.requestTimeout = validateDuration(requestTimeout, "requestTimeout");
        return this;
    }

    public HttpServiceTransportBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
        return this;
    }

    private static Duration validateDuration(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + ": " + duration + " (expected: > 0)");
        }
        return duration;
    }

    /**
     * Builds a {@link HttpServiceTransport} instance.
     */
    public HttpServiceTransport build() {
        final boolean ownsGroup = eventLoopGroup == null;
        return new HttpServiceTransport(ownsGroup ? new NioEventLoopGroup() : eventLoopGroup, ownsGroup,
                                        maxConnectionsPerHost, connectTimeout, requestTimeout,
                                        objectMapper != null ? objectMapper : new ObjectMapper());
    }
}
