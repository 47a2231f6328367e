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

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

final class DefaultErrorClassifier implements ErrorClassifier {

    static final DefaultErrorClassifier INSTANCE = new DefaultErrorClassifier();

    private DefaultErrorClassifier() {}

    @Override
    public ErrorCategory classify(Throwable cause) {
        final Throwable peeled = peel(cause);
        if (peeled instanceof PermanentCallException) {
            return ErrorCategory.PERMANENT;
        }
        if (peeled instanceof TransientCallException ||
            peeled instanceof IOException ||
            peeled instanceof TimeoutException ||
            peeled instanceof io.netty.handler.timeout.TimeoutException) {
            return ErrorCategory.TRANSIENT;
        }
        return ErrorCategory.PERMANENT;
    }

    /**
     * Strips the wrappers added by {@link java.util.concurrent.Future} implementations.
     */
    static Throwable peel(Throwable cause) {
        Throwable current = cause;
        while ((current instanceof CompletionException || current instanceof ExecutionException) &&
               current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
