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

import io.netty.util.concurrent.Future;

/**
 * An asynchronous operation against a remote service, invoked once per attempt by {@link ResilienceManager}.
 *
 * @param <T> the type of the result
 */
@FunctionalInterface
public interface RemoteCall<T> {

    /**
     * Starts the operation against the remote service named {@code serviceName}, which is either the primary
     * target or one of the fallbacks.
     */
    Future<T> call(String serviceName) throws Exception;
}
