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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A remote operation advertised in a {@link ToolCatalog}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToolDefinition {

    private final String name;

    private final String description;

    private final Map<String, Object> inputSchema;

    @JsonCreator
    public ToolDefinition(@JsonProperty("name") String name,
                          @JsonProperty("description") String description,
                          @JsonProperty("inputSchema") @JsonAlias({ "inputs", "input_schema" })
                                  Map<String, Object> inputSchema) {
        this.name = requireNonNull(name, "name");
        this.description = description != null ? description : "";
        this.inputSchema = inputSchema != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema))
                                               : Collections.emptyMap();
    }

    @JsonProperty
    public String name() {
        return name;
    }

    @JsonProperty
    public String description() {
        return description;
    }

    /**
     * Returns the JSON schema of the arguments of this tool.
     */
    @JsonProperty
    public Map<String, Object> inputSchema() {
        return inputSchema;
    }

    @Override
    public String toString() {
        return "ToolDefinition{name='" + name + "', description='" + description + "'}";
    }
}
