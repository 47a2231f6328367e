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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A service known to a {@link ServiceRegistry}: where it is, what it offers, and whether it was healthy at
 * the last health check.
 */
public final class ServiceInfo {

    private final String name;

    private final String baseUrl;

    private final String catalogUrl;

    private final ToolCatalog catalog;

    private final Set<String> tags;

    private volatile boolean healthy = true;

    private volatile long lastHealthCheckMillis = -1;

    ServiceInfo(String name, String baseUrl, String catalogUrl, ToolCatalog catalog, Set<String> tags) {
        this.name = requireNonNull(name, "name");
        this.baseUrl = requireNonNull(baseUrl, "baseUrl");
        this.catalogUrl = requireNonNull(catalogUrl, "catalogUrl");
        this.catalog = catalog;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    public String name() {
        return name;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String catalogUrl() {
        return catalogUrl;
    }

    /**
     * Returns the {@link ToolCatalog} fetched from {@link #catalogUrl()}, or {@code null} if not fetched.
     */
    public ToolCatalog catalog() {
        return catalog;
    }

    public Set<String> tags() {
        return tags;
    }

    /**
     * Returns the metadata declared in the {@link ToolCatalog}.
     */
    public Map<String, Object> metadata() {
        return catalog != null ? catalog.metadata() : Collections.emptyMap();
    }

    /**
     * Returns whether the last health check succeeded. A service is regarded as healthy until it is
     * checked for the first time.
     */
    public boolean isHealthy() {
        return healthy;
    }

    /**
     * Returns when the service was last checked, or {@code null} if never.
     */
    public Instant lastHealthCheck() {
        final long millis = lastHealthCheckMillis;
        return millis < 0 ? null : Instant.ofEpochMilli(millis);
    }

    /**
     * Returns {@code true} if this service owns the specified tool.
     */
    public boolean hasTool(String toolName) {
        return tool(toolName) != null;
    }

    /**
     * Finds the tool named either {@code toolName} or, when {@code toolName} is qualified with this
     * service's name as in {@code "<service>.<tool>"}, the unqualified part of it.
     *
     * @return the {@link ToolDefinition}, or {@code null} if this service does not own such a tool
     */
    public ToolDefinition tool(String toolName) {
        requireNonNull(toolName, "toolName");
        if (catalog == null) {
            return null;
        }
        final String qualifier = name + '.';
        final String unqualified = toolName.startsWith(qualifier) ? toolName.substring(qualifier.length())
                                                                  : null;
        for (ToolDefinition tool : catalog.tools()) {
            if (tool.name().equals(toolName) || tool.name().equals(unqualified)) {
                return tool;
            }
        }
        return null;
    }

    /**
     * Records the result of a health check.
     *
     * @return the health before this update
     */
    boolean updateHealth(boolean healthy, long checkedMillis) {
        final boolean old = this.healthy;
        this.healthy = healthy;
        lastHealthCheckMillis = checkedMillis;
        return old;
    }

    @Override
    public String toString() {
        return "ServiceInfo{" +
               "name='" + name + '\'' +
               ", baseUrl='" + baseUrl + '\'' +
               ", healthy=" + healthy +
               ", tags=" + tags +
               '}';
    }
}
