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

import static java.util.Objects.requireNonNull;

import java.util.Map;
import java.util.Set;

/**
 * A {@link ToolDefinition} annotated with the service which owns it.
 */
public final class AvailableTool {

    private final ToolDefinition tool;

    private final String serviceName;

    private final String serviceBaseUrl;

    private final Set<String> serviceTags;

    AvailableTool(ToolDefinition tool, ServiceInfo service) {
        this.tool = requireNonNull(tool, "tool");
        serviceName = service.name();
        serviceBaseUrl = service.baseUrl();
        serviceTags = service.tags();
    }

    public ToolDefinition tool() {
        return tool;
    }

    public String name() {
        return tool.name();
    }

    public String description() {
        return tool.description();
    }

    public Map<String, Object> inputSchema() {
        return tool.inputSchema();
    }

    public String serviceName() {
        return serviceName;
    }

    public String serviceBaseUrl() {
        return serviceBaseUrl;
    }

    public Set<String> serviceTags() {
        return serviceTags;
    }

    @Override
    public String toString() {
        return "AvailableTool{" +
               "name='" + tool.name() + '\'' +
               ", serviceName='" + serviceName + '\'' +
               ", serviceBaseUrl='" + serviceBaseUrl + '\'' +
               ", serviceTags=" + serviceTags +
               '}';
    }
}
