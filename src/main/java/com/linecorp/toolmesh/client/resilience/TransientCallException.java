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
 * A {@link RuntimeException} raised when a call failed for a reason which may go away by itself, such as a
 * refused connection or an overloaded remote service. Retried by the default {@link ErrorClassifier}.
 */
public class TransientCallException extends RuntimeException {

    private static final long serialVersionUID = 2716403652360416452L;

    public TransientCallException(String message) {
        super(message);
    }

    public TransientCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
