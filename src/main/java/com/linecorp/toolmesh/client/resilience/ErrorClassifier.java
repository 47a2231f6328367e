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

/**
 * Classifies the cause of a failed call into an {@link ErrorCategory}.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Returns the {@link ErrorClassifier} which regards {@link TransientCallException},
     * {@link java.io.IOException} and timeouts as {@link ErrorCategory#TRANSIENT}, and everything else as
     * {@link ErrorCategory#PERMANENT}.
     */
    static ErrorClassifier ofDefault() {
        return DefaultErrorClassifier.INSTANCE;
    }

    ErrorCategory classify(Throwable cause);
}
