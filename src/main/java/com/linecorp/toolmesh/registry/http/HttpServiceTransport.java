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

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.linecorp.toolmesh.client.resilience.PermanentCallException;
import com.linecorp.toolmesh.client.resilience.TransientCallException;
import com.linecorp.toolmesh.registry.DiscoveryException;
import com.linecorp.toolmesh.registry.ServiceInfo;
import com.linecorp.toolmesh.registry.ServiceTransport;
import com.linecorp.toolmesh.registry.ToolCatalog;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.pool.AbstractChannelPoolHandler;
import io.netty.channel.pool.AbstractChannelPoolMap;
import io.netty.channel.pool.FixedChannelPool;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;

/**
 * A {@link ServiceTransport} which talks JSON over HTTP/1.1 to the remote services.
 *
 * <ul>
 *   <li>A catalog is fetched with {@code GET <catalogUrl>}.</li>
 *   <li>A service is healthy if {@code GET <baseUrl>/health} responds with a {@code 2xx} status.</li>
 *   <li>A tool is invoked with {@code POST <baseUrl>/tools/<toolName>} whose body is the JSON object of
 *       the arguments. A {@code 5xx} or {@code 429} status fails the call with a
 *       {@link TransientCallException}, and other non-{@code 2xx} statuses with a
 *       {@link PermanentCallException}.</li>
 * </ul>
 *
 * <p>Connections are kept alive and pooled per remote address, up to
 * {@link HttpServiceTransportBuilder#maxConnectionsPerHost(int)} connections each.
 * {@link #close()} must not be invoked from an I/O thread of this transport.
 */
public final class HttpServiceTransport implements ServiceTransport, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HttpServiceTransport.class);

    static final String HEALTH_PATH = "/health";
    static final String TOOLS_PATH = "/tools/";

    private static final int MAX_CONTENT_LENGTH = 10 * 1024 * 1024;
    private static final String RESPONSE_HANDLER_NAME = "toolmesh-response";

    /**
     * Returns a new {@link HttpServiceTransportBuilder}.
     */
    public static HttpServiceTransportBuilder builder() {
        return new HttpServiceTransportBuilder();
    }

    /**
     * Returns a new {@link HttpServiceTransport} with the default settings, which owns its I/O threads.
     */
    public static HttpServiceTransport ofDefault() {
        return builder().build();
    }

    private final EventLoopGroup group;
    private final boolean ownsGroup;
    private final long requestTimeoutMillis;
    private final ObjectMapper objectMapper;
    private final AbstractChannelPoolMap<InetSocketAddress, FixedChannelPool> pools;

    HttpServiceTransport(EventLoopGroup group, boolean ownsGroup, int maxConnectionsPerHost,
                         Duration connectTimeout, Duration requestTimeout, ObjectMapper objectMapper) {
        this.group = group;
        this.ownsGroup = ownsGroup;
        requestTimeoutMillis = requestTimeout.toMillis();
        this.objectMapper = objectMapper;

        final Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .option(ChannelOption.SO_KEEPALIVE, true);

        pools = new AbstractChannelPoolMap<InetSocketAddress, FixedChannelPool>() {
            @Override
            protected FixedChannelPool newPool(InetSocketAddress key) {
                logger.debug("Creating a connection pool: {}", key);
                return new FixedChannelPool(bootstrap.clone().remoteAddress(key), new HttpPoolHandler(),
                                            maxConnectionsPerHost);
            }
        };
    }

    @Override
    public Future<ToolCatalog> fetchCatalog(String catalogUrl) {
        requireNonNull(catalogUrl, "catalogUrl");
        final Promise<ToolCatalog> promise = group.next().newPromise();
        execute(HttpMethod.GET, catalogUrl, null).addListener((FutureListener<HttpResult>) future -> {
            if (!future.isSuccess()) {
                promise.tryFailure(future.cause());
                return;
            }
            final HttpResult result = future.getNow();
            if (!result.isSuccess()) {
                promise.tryFailure(new DiscoveryException(catalogUrl, "unexpected status " + result.status));
                return;
            }
            try {
                promise.trySuccess(objectMapper.readValue(result.content, ToolCatalog.class));
            } catch (IOException e) {
                promise.tryFailure(new DiscoveryException(catalogUrl, e));
            }
        });
        return promise;
    }

    @Override
    public Future<Boolean> probeHealth(String baseUrl) {
        requireNonNull(baseUrl, "baseUrl");
        final Promise<Boolean> promise = group.next().newPromise();
        execute(HttpMethod.GET, baseUrl + HEALTH_PATH, null).addListener((FutureListener<HttpResult>) f -> {
            if (f.isSuccess()) {
                promise.trySuccess(f.getNow().isSuccess());
            } else {
                promise.tryFailure(f.cause());
            }
        });
        return promise;
    }

    @Override
    public Future<Object> invoke(ServiceInfo service, String toolName, Map<String, Object> args) {
        requireNonNull(service, "service");
        requireNonNull(toolName, "toolName");
        requireNonNull(args, "args");

        final Promise<Object> promise = group.next().newPromise();
        final byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(args);
        } catch (IOException e) {
            promise.tryFailure(new PermanentCallException("failed to encode the arguments of " + toolName, e));
            return promise;
        }

        final String url = service.baseUrl() + TOOLS_PATH + encodePathSegment(toolName);
        execute(HttpMethod.POST, url, body).addListener((FutureListener<HttpResult>) future -> {
            if (!future.isSuccess()) {
                promise.tryFailure(future.cause());
                return;
            }
            final HttpResult result = future.getNow();
            if (result.isSuccess()) {
                try {
                    promise.trySuccess(result.content.length != 0 ? objectMapper.readValue(result.content,
                                                                                           Object.class)
                                                                  : null);
                } catch (IOException e) {
                    promise.tryFailure(new PermanentCallException("malformed response from " + url, e));
                }
                return;
            }

            final String message = "HTTP " + result.status + " from " + url;
            if (result.status >= 500 || result.status == 429) {
                promise.tryFailure(new TransientCallException(message));
            } else {
                promise.tryFailure(new PermanentCallException(message));
            }
        });
        return promise;
    }

    static String encodePathSegment(String segment) {
        // a path reads a form-encoded space ('+') literally
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private Future<HttpResult> execute(HttpMethod method, String url, byte[] body) {
        final EventExecutor executor = group.next();
        final URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return executor.newFailedFuture(e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) {
            return executor.newFailedFuture(
                    new IllegalArgumentException("url: " + url + " (expected: http://<host>[:<port>]/...)"));
        }

        final int port = uri.getPort() > 0 ? uri.getPort() : 80;
        final FixedChannelPool pool = pools.get(InetSocketAddress.createUnresolved(uri.getHost(), port));
        final Promise<HttpResult> promise = executor.newPromise();

        final ScheduledFuture<?> timeout = executor.schedule(() -> {
            promise.tryFailure(new TimeoutException(
                    method.name() + ' ' + url + " timed out after " + requestTimeoutMillis + "ms"));
        }, requestTimeoutMillis, TimeUnit.MILLISECONDS);
        promise.addListener(f -> timeout.cancel(false));

        pool.acquire().addListener((FutureListener<Channel>) future -> {
            if (!future.isSuccess()) {
                promise.tryFailure(future.cause());
                return;
            }
            final Channel ch = future.getNow();
            if (promise.isDone()) {
                pool.release(ch);
                return;
            }
            send(pool, ch, newRequest(method, uri, body), promise);
        });
        return promise;
    }

    private static FullHttpRequest newRequest(HttpMethod method, URI uri, byte[] body) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (uri.getRawQuery() != null) {
            path += '?' + uri.getRawQuery();
        }

        final FullHttpRequest req = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, method, path,
                body != null ? Unpooled.wrappedBuffer(body) : Unpooled.EMPTY_BUFFER);
        req.headers().set(HttpHeaderNames.HOST, uri.getPort() > 0 ? uri.getHost() + ':' + uri.getPort()
                                                                  : uri.getHost());
        req.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        req.headers().set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON);
        if (body != null) {
            req.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        }
        HttpUtil.setContentLength(req, body != null ? body.length : 0);
        return req;
    }

    private static void send(FixedChannelPool pool, Channel ch, FullHttpRequest req,
                             Promise<HttpResult> promise) {
        final ResponseHandler handler = new ResponseHandler(pool, ch, promise);
        ch.pipeline().addLast(RESPONSE_HANDLER_NAME, handler);

        // a request which failed or timed out leaves the connection in an unknown state
        promise.addListener(f -> {
            if (!f.isSuccess()) {
                ch.eventLoop().execute(() -> handler.release(false));
            }
        });

        ch.writeAndFlush(req).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                promise.tryFailure(future.cause());
            }
        });
    }

    /**
     * Closes all pooled connections, and shuts down the I/O threads if this transport created them.
     */
    @Override
    public void close() {
        pools.close();
        if (ownsGroup) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
    }

    private static final class HttpPoolHandler extends AbstractChannelPoolHandler {
        @Override
        public void channelCreated(Channel ch) {
            ch.pipeline().addLast(new HttpClientCodec(), new HttpObjectAggregator(MAX_CONTENT_LENGTH));
        }
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

        private final FixedChannelPool pool;
        private final Channel ch;
        private final Promise<HttpResult> promise;

        // Accessed only by the I/O thread of the channel.
        private boolean released;

        ResponseHandler(FixedChannelPool pool, Channel ch, Promise<HttpResult> promise) {
            this.pool = pool;
            this.ch = ch;
            this.promise = promise;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse res) {
            final HttpResult result = new HttpResult(res.status().code(), ByteBufUtil.getBytes(res.content()));
            // the connection goes back to the pool before the caller sees the result
            release(HttpUtil.isKeepAlive(res));
            promise.trySuccess(result);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            promise.tryFailure(new ClosedChannelException());
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            promise.tryFailure(cause);
            release(false);
        }

        void release(boolean reusable) {
            if (released) {
                return;
            }
            released = true;
            if (ch.pipeline().context(this) != null) {
                ch.pipeline().remove(this);
            }
            if (reusable && ch.isActive()) {
                pool.release(ch);
            } else {
                ch.close().addListener(unused -> pool.release(ch));
            }
        }
    }

    private static final class HttpResult {
        final int status;
        final byte[] content;

        HttpResult(int status, byte[] content) {
            this.status = status;
            this.content = content;
        }

        boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
