/**
 * Copyright 2026 The call-limits Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.calllimits;

import java.util.concurrent.CompletableFuture;

/**
 * Contract for wrapping the execution of a request.  A policy decides when, and how many times,
 * the request is handed to the transport and which outcome is returned to the caller.
 *
 * @param <RequestT> Request type.  Some policies inspect the request, i.e. to find its credential.
 */
public interface ExecutionPolicy<RequestT> {
    /**
     * Run the request through the policy.
     *
     * @param request Template of the request.  Every attempt is executed with its own copy.
     * @param executor Executes one attempt
     * @return Future with the result of the attempt that succeeded, or the first failure that is not
     *         retried.  Cancelling it stops any further attempt.
     */
    <T> CompletableFuture<T> run(RequestT request, RequestExecutor<RequestT, T> executor);
}
