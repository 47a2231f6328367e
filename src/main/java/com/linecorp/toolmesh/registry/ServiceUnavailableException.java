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
 * A {@link RuntimeException} raised when a service is not registered or not healthy.
 */
public final class ServiceUnavailableException extends RuntimeException {

    private static final long serialVersionUID = -6135270658451436235L;

    private final String serviceName;

    public ServiceUnavailableException(String serviceName, String message) {
        super(serviceName + ": " + message);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
