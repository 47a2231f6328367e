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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The document a service advertises to describe the tools it exposes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToolCatalog {

    private final String name;

    private final String version;

    private final String description;

    private final List<ToolDefinition> tools;

    private final Map<String, Object> metadata;

    private final Set<String> tags;

    @JsonCreator
    public ToolCatalog(@JsonProperty("name") String name,
                       @JsonProperty("version") String version,
                       @JsonProperty("description") String description,
                       @JsonProperty("tools") List<ToolDefinition> tools,
                       @JsonProperty("metadata") Map<String, Object> metadata,
                       @JsonProperty("tags") Set<String> tags) {
        this.name = name;
        this.version = version;
        this.description = description;
        this.tools = tools != null ? Collections.unmodifiableList(new ArrayList<>(tools))
                                   : Collections.emptyList();
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                                         : Collections.emptyMap();
        this.tags = tags != null ? Collections.unmodifiableSet(new LinkedHashSet<>(tags))
                                 : Collections.emptySet();
    }

    /**
     * Returns the name the service declares for itself, or {@code null} if not declared.
     */
    @JsonProperty
    public String name() {
        return name;
    }

    @JsonProperty
    public String version() {
        return version;
    }

    @JsonProperty
    public String description() {
        return description;
    }

    @JsonProperty
    public List<ToolDefinition> tools() {
        return tools;
    }

    @JsonProperty
    public Map<String, Object> metadata() {
        return metadata;
    }

    @JsonProperty
    public Set<String> tags() {
        return tags;
    }

    @Override
    public String toString() {
        return "ToolCatalog{" +
               "name='" + name + '\'' +
               ", version='" + version + '\'' +
               ", tools=" + tools.size() +
               ", tags=" + tags +
               '}';
    }
}
