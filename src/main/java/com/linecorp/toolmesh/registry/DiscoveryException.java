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

/**
 * A {@link RuntimeException} raised when the catalog of a service could not be fetched, so that the service
 * could not be registered.
 */
public final class DiscoveryException extends RuntimeException {

    private static final long serialVersionUID = 4474920733393207741L;

    private final String url;

    public DiscoveryException(String url, String message) {
        super(message + ": " + url);
        this.url = url;
    }

    public DiscoveryException(String url, Throwable cause) {
        super("failed to fetch a catalog: " + url, cause);
        this.url = url;
    }

    /**
     * Returns the URL of the catalog.
     */
    public String getUrl() {
        return url;
    }
}
