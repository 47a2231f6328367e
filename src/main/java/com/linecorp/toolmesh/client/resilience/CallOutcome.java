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

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.concurrent.CompletionException;

import com.linecorp.toolmesh.client.circuitbreaker.FailFastException;

/**
 * The result of {@link ResilienceManager#execute(String, RemoteCall, CallOptions)}: a value, a refusal by
 * an open circuit, or the failure of the last service tried.
 *
 * @param <T> the type of the value
 */
public final class CallOutcome<T> {

    /**
     * The kind of a {@link CallOutcome}.
     */
    public enum Type {
        /**
         * A service returned a value.
         */
        SUCCESS,
        /**
         * The last service tried was not invoked because its circuit is open.
         */
        CIRCUIT_OPEN,
        /**
         * The last service tried was invoked and failed, after its retries if any.
         */
        EXHAUSTED
    }

    private final Type type;

    private final String serviceName;

    private final T value;

    private final Duration retryAfter;

    private final Throwable cause;

    private CallOutcome(Type type, String serviceName, T value, Duration retryAfter, Throwable cause) {
        this.type = type;
        this.serviceName = requireNonNull(serviceName, "serviceName");
        this.value = value;
        this.retryAfter = retryAfter;
        this.cause = cause;
    }

    public static <T> CallOutcome<T> success(String serviceName, T value) {
        return new CallOutcome<>(Type.SUCCESS, serviceName, value, Duration.ZERO, null);
    }

    public static <T> CallOutcome<T> circuitOpen(String serviceName, Duration retryAfter) {
        return new CallOutcome<>(Type.CIRCUIT_OPEN, serviceName, null,
                                 requireNonNull(retryAfter, "retryAfter"), null);
    }

    public static <T> CallOutcome<T> exhausted(String serviceName, Throwable cause) {
        return new CallOutcome<>(Type.EXHAUSTED, serviceName, null, Duration.ZERO,
                                 requireNonNull(cause, "cause"));
    }

    public Type type() {
        return type;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    /**
     * Returns the name of the service which produced this outcome.
     */
    public String serviceName() {
        return serviceName;
    }

    /**
     * Returns the value if {@link Type#SUCCESS}, or {@code null} otherwise.
     */
    public T value() {
        return value;
    }

    /**
     * Returns the time left until the circuit lets a trial request through if {@link Type#CIRCUIT_OPEN},
     * or {@link Duration#ZERO} otherwise.
     */
    public Duration retryAfter() {
        return retryAfter;
    }

    /**
     * Returns the terminal failure if {@link Type#EXHAUSTED}, or {@code null} otherwise.
     */
    public Throwable cause() {
        return cause;
    }

    /**
     * Returns the value, or throws a {@link FailFastException} if the circuit was open, or the terminal
     * failure if the call was exhausted. A checked failure is wrapped in a {@link CompletionException}.
     */
    public T get() {
        switch (type) {
            case SUCCESS:
                return value;
            case CIRCUIT_OPEN:
                throw new FailFastException(serviceName, retryAfter);
            default:
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new CompletionException(cause);
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case SUCCESS:
                return "CallOutcome{SUCCESS, serviceName=" + serviceName + '}';
            case CIRCUIT_OPEN:
                return "CallOutcome{CIRCUIT_OPEN, serviceName=" + serviceName +
                       ", retryAfter=" + retryAfter + '}';
            default:
                return "CallOutcome{EXHAUSTED, serviceName=" + serviceName + ", cause=" + cause + '}';
        }
    }
}
