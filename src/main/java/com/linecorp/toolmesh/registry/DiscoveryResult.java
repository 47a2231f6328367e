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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The result of {@link ServiceRegistry#discover(List, boolean)}.
 */
public final class DiscoveryResult {

    private final List<ServiceInfo> registered;

    private final Map<String, Throwable> errors;

    DiscoveryResult(List<ServiceInfo> registered, Map<String, Throwable> errors) {
        this.registered = Collections.unmodifiableList(registered);
        this.errors = Collections.unmodifiableMap(errors);
    }

    /**
     * Returns the services registered, in the order of their URLs.
     */
    public List<ServiceInfo> registered() {
        return registered;
    }

    /**
     * Returns the failures keyed by the URL which could not be registered, in the order of the URLs.
     */
    public Map<String, Throwable> errors() {
        return errors;
    }

    @Override
    public String toString() {
        return "DiscoveryResult{registered=" + registered.size() + ", errors=" + errors.keySet() + '}';
    }
}
