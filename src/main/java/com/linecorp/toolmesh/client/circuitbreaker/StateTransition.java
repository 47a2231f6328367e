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

package com.linecorp.toolmesh.client.circuitbreaker;

import static java.util.Objects.requireNonNull;

import java.time.Instant;

/**
 * An immutable record of a state change of a {@link CircuitBreaker}.
 */
public final class StateTransition {

    private final CircuitState from;

    private final CircuitState to;

    private final Instant timestamp;

    private final String reason;

    StateTransition(CircuitState from, CircuitState to, Instant timestamp, String reason) {
        this.from = requireNonNull(from, "from");
        this.to = requireNonNull(to, "to");
        this.timestamp = requireNonNull(timestamp, "timestamp");
        this.reason = requireNonNull(reason, "reason");
    }

    public CircuitState from() {
        return from;
    }

    public CircuitState to() {
        return to;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return "StateTransition{" +
               "from=" + from +
               ", to=" + to +
               ", timestamp=" + timestamp +
               ", reason='" + reason + '\'' +
               '}';
    }
}
